package com.example.compliance.declarationservice.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls JSON objects out of free-form model output. Tries the whole text
 * first, then every flat {@code {...}} fragment; never throws.
 */
@Slf4j
@Component
public class LlmResponseParser {

    private static final Pattern OBJECT_FRAGMENT = Pattern.compile("\\{[^{}]*\\}");
    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*(.*?)\\s*```$", Pattern.DOTALL);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final int PREVIEW_CHARS = 500;

    private final ObjectMapper om;

    public LlmResponseParser() {
        this(new ObjectMapper());
    }

    public LlmResponseParser(ObjectMapper om) {
        // "{...} trailing prose" must not count as a whole-text parse
        this.om = om.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public List<Map<String, Object>> parse(String response) {
        if (response == null) return List.of();
        String text = unfence(response.strip());
        if (text.isEmpty() || text.equals("[]")) return List.of();

        List<Map<String, Object>> whole = parseWhole(text);
        if (whole != null) return whole;

        List<Map<String, Object>> fragments = new ArrayList<>();
        Matcher m = OBJECT_FRAGMENT.matcher(text);
        while (m.find()) {
            JsonNode node = readOrNull(m.group());
            if (node != null && node.isObject()) {
                fragments.add(toMap(node));
            }
        }
        if (!fragments.isEmpty()) return fragments;

        log.warn("Could not parse model response: {}", preview(text));
        return List.of();
    }

    private List<Map<String, Object>> parseWhole(String text) {
        JsonNode root = readOrNull(text);
        if (root == null) return null;
        if (root.isObject()) return List.of(toMap(root));
        if (root.isArray()) {
            List<Map<String, Object>> out = new ArrayList<>();
            for (JsonNode item : root) {
                if (item.isObject()) out.add(toMap(item));
            }
            return out;
        }
        // a bare scalar is not a record, fall through to the fragment scan
        return null;
    }

    private JsonNode readOrNull(String json) {
        try {
            return om.readTree(json);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private Map<String, Object> toMap(JsonNode node) {
        return om.convertValue(node, MAP_TYPE);
    }

    private static String unfence(String text) {
        Matcher m = CODE_FENCE.matcher(text);
        return m.matches() ? m.group(1).strip() : text;
    }

    private static String preview(String text) {
        return text.length() <= PREVIEW_CHARS ? text : text.substring(0, PREVIEW_CHARS) + "...";
    }
}
