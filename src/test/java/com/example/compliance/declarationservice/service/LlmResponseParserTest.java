package com.example.compliance.declarationservice.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LlmResponseParserTest {

    private final LlmResponseParser parser = new LlmResponseParser();

    @Test
    @DisplayName("Objects embedded in prose are recovered in order")
    void parse_shouldRecoverFragmentsFromNoise() {
        List<Map<String, Object>> result = parser.parse("noise {\"a\":1} more {\"b\":2} end");

        assertThat(result).containsExactly(Map.of("a", 1), Map.of("b", 2));
    }

    @Test
    void parse_shouldKeepOnlyObjectsOfTopLevelArray() {
        List<Map<String, Object>> result = parser.parse("[{\"a\":1}, 5, \"x\", {\"b\":2}]");

        assertThat(result).containsExactly(Map.of("a", 1), Map.of("b", 2));
    }

    @Test
    void parse_shouldWrapSingleObject() {
        List<Map<String, Object>> result = parser.parse("{\"material_id\":\"MAT-1\",\"notes\":null}");

        assertThat(result).hasSize(1);
        assertThat(result.get(0)).containsEntry("material_id", "MAT-1").containsKey("notes");
    }

    @Test
    void parse_shouldKeepNestedStructuresOnWholeTextParse() {
        List<Map<String, Object>> result = parser.parse(
                "{\"material_id\":\"M\",\"regulatory_mentions\":[{\"keyword\":\"PPWR\",\"text\":\"x\"}]}");

        assertThat(result).hasSize(1);
        assertThat(result.get(0).get("regulatory_mentions")).isInstanceOf(List.class);
    }

    @Test
    void parse_shouldStripMarkdownFence() {
        List<Map<String, Object>> result = parser.parse("```json\n[{\"supplier_name\":\"Acme\"}]\n```");

        assertThat(result).containsExactly(Map.of("supplier_name", "Acme"));
    }

    @Test
    void parse_shouldFallBackToFragmentsWhenObjectIsFollowedByProse() {
        List<Map<String, Object>> result = parser.parse("{\"a\":1} hope this helps");

        assertThat(result).containsExactly(Map.of("a", 1));
    }

    @Test
    void parse_shouldReturnEmptyForUnparsableOrEmptyInput() {
        assertThat(parser.parse("I could not find anything relevant.")).isEmpty();
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse("[]")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
        assertThat(parser.parse("42")).isEmpty();
    }
}
