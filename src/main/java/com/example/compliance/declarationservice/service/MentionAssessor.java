package com.example.compliance.declarationservice.service;

import com.example.compliance.declarationservice.config.PipelineProperties;
import com.example.compliance.declarationservice.model.Mention;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Second model pass that judges compliance for scanned snippets. Returns an
 * empty list when disabled, when there is nothing to judge, or when the model
 * call or its output fails.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MentionAssessor {

    static final String ASSESSMENT_PROMPT = """
            You are checking packaging regulatory compliance. For each item, decide if the text explicitly \
            states compliance, no intentional addition, or values below limits for the cited keyword. \
            compliant=true if it affirms compliance, absence or below limits; compliant=false if it states \
            non-compliance or exceedance; compliant=null if unclear. Always return the quoted evidence used. \
            Return a JSON list only, each item {"keyword": ..., "evidence": ..., "compliant": ...}.

            Items:""";

    private final LlmGateway llm;
    private final LlmResponseParser parser;
    private final ExtractionNormalizer normalizer;
    private final PipelineProperties properties;
    private final ObjectMapper om = new ObjectMapper();

    public List<Mention> assess(List<Mention> snippets) {
        PipelineProperties.Mentions cfg = properties.getMentions();
        if (!cfg.isAssessWithModel() || snippets == null || snippets.isEmpty()) return List.of();
        try {
            String prompt = ASSESSMENT_PROMPT + om.writeValueAsString(promptItems(snippets));
            String response = llm.generate(prompt, cfg.getTemperature(), cfg.getMaxTokens());
            List<Mention> assessed = normalizer.mentions(new ArrayList<Object>(parser.parse(response)));
            log.info("Model assessed {} of {} snippet(s)", assessed.size(), snippets.size());
            return assessed;
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Mention assessment failed, keeping unassessed snippets: {}", e.getMessage());
            return List.of();
        }
    }

    private static List<Map<String, String>> promptItems(List<Mention> snippets) {
        List<Map<String, String>> items = new ArrayList<>();
        for (Mention s : snippets) {
            Map<String, String> item = new LinkedHashMap<>();
            item.put("keyword", s.keyword());
            item.put("text_window", s.evidenceText());
            items.add(item);
        }
        return items;
    }
}
