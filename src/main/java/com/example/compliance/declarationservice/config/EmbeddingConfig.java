// src/main/java/com/example/compliance/declarationservice/config/EmbeddingConfig.java
package com.example.compliance.declarationservice.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class EmbeddingConfig {

    @Bean
    EmbeddingModel embeddingModel(
            @Value("${openai.apiKey}") String apiKey,
            @Value("${openai.embeddingModel:text-embedding-3-large}") String model,
            @Value("${openai.baseUrl:}") String baseUrl
    ) {
        var builder = OpenAiEmbeddingModel.builder()
                .apiKey(apiKey)
                .modelName(model)
                .timeout(Duration.ofSeconds(60));
        if (!baseUrl.isBlank()) {
            builder.baseUrl(baseUrl);
        }
        return builder.build();
    }
}
