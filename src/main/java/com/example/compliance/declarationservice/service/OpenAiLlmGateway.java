package com.example.compliance.declarationservice.service;

import dev.langchain4j.model.chat.ChatLanguageModel;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class OpenAiLlmGateway implements LlmGateway {

    @FunctionalInterface
    public interface ChatModelFactory {
        ChatLanguageModel create(double temperature, int maxTokens);
    }

    private final ChatModelFactory factory;
    private final Map<String, ChatLanguageModel> models = new ConcurrentHashMap<>();

    public OpenAiLlmGateway(ChatModelFactory factory) {
        this.factory = factory;
    }

    @Override
    public String generate(String prompt, double temperature, int maxTokens) {
        ChatLanguageModel model = models.computeIfAbsent(temperature + "/" + maxTokens,
                key -> factory.create(temperature, maxTokens));
        String text = model.generate(prompt);
        log.debug("Model returned {} char(s)", text == null ? 0 : text.length());
        return text == null ? "" : text;
    }
}
