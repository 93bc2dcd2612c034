// src/main/java/com/example/compliance/declarationservice/config/LlmConfig.java
package com.example.compliance.declarationservice.config;

import com.example.compliance.declarationservice.service.LlmGateway;
import com.example.compliance.declarationservice.service.OpenAiLlmGateway;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LlmConfig {

    @Bean
    LlmGateway llmGateway(
            @Value("${openai.apiKey}") String apiKey,
            @Value("${openai.model:gpt-4o}") String model,
            @Value("${openai.baseUrl:}") String baseUrl) {
        // one chat model per (temperature, maxTokens) pair, built lazily by the gateway
        return new OpenAiLlmGateway((temperature, maxTokens) -> {
            var builder = OpenAiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(model)
                    .temperature(temperature)
                    .maxTokens(maxTokens)
                    .timeout(Duration.ofSeconds(120));
            if (!baseUrl.isBlank()) {
                builder.baseUrl(baseUrl);
            }
            return builder.build();
        });
    }
}
