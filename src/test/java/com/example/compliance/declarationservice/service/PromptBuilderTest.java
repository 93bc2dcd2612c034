package com.example.compliance.declarationservice.service;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    private final PromptBuilder builder = new PromptBuilder();

    @Test
    void noChunks_shouldUseSentinel() {
        String prompt = builder.buildFieldPrompt(ExtractionField.SUPPLIER_NAME, List.of());

        assertThat(prompt).contains("Document Content:\n" + PromptBuilder.NO_CONTEXT);
        assertThat(PromptBuilder.context(Arrays.asList(null, "  "))).isEqualTo(PromptBuilder.NO_CONTEXT);
    }

    @Test
    void prompt_shouldCarryOnlyItsOwnFieldAndChunks() {
        String prompt = builder.buildFieldPrompt(ExtractionField.DECLARATION_DATE, List.of("first chunk", "second chunk"));

        assertThat(prompt)
                .startsWith(PromptBuilder.ROLE)
                .contains("first chunk\n\nsecond chunk")
                .contains("Task: Extract declaration_date information")
                .contains("Query: " + ExtractionField.DECLARATION_DATE.query())
                .doesNotContain("Task: Extract supplier_name")
                .endsWith("Please focus on extracting the declaration_date data from the document above.");
    }
}
