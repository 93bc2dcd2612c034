// src/main/java/com/example/compliance/declarationservice/service/PromptBuilder.java
package com.example.compliance.declarationservice.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Component
public class PromptBuilder {

    static final String ROLE = "You are a data extraction assistant specializing in supplier compliance declarations.";

    static final String NO_CONTEXT = "No relevant documents found in the knowledge base for this query.";

    /**
     * Builds a self-contained prompt for one field. Only {@code chunkTexts}
     * end up in the document section, nothing is shared between fields.
     */
    public String buildFieldPrompt(ExtractionField field, List<String> chunkTexts) {
        return String.format("""
            %s

            Please analyze the following document content and extract the requested information.

            Document Content:
            %s

            Task: Extract %s information
            Query: %s

            Instructions:
            %s
            Return only JSON, with no explanation and no formatting. \
            Please focus on extracting the %s data from the document above.""",
                ROLE, context(chunkTexts), field.key(), field.query(), field.instructions().strip(), field.key());
    }

    static String context(List<String> chunkTexts) {
        String joined = chunkTexts == null ? "" : chunkTexts.stream()
                .filter(Objects::nonNull)
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining("\n\n"));
        return joined.isEmpty() ? NO_CONTEXT : joined;
    }
}
