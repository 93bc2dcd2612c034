package com.example.compliance.declarationservice.service;

/**
 * Single synchronous call into the language model. Implementations may throw
 * any {@link RuntimeException} on transport failure; callers decide the scope
 * the failure is contained in.
 */
public interface LlmGateway {

    String generate(String prompt, double temperature, int maxTokens);
}
