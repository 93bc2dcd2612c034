package com.example.compliance.declarationservice.service;

import com.example.compliance.declarationservice.config.PipelineProperties;
import com.example.compliance.declarationservice.dto.RetrievalResult;
import com.example.compliance.declarationservice.model.ExtractionRecord;
import com.example.compliance.declarationservice.model.Mention;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Runs the per-field model extraction for one scope (a material or a single
 * document) and attaches reconciled regulatory evidence to every record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeclarationExtractor {

    private static final int SNIPPET_LOG_CHARS = 200;

    private final DeclarationRetriever retriever;
    private final PromptBuilder promptBuilder;
    private final LlmGateway llm;
    private final LlmResponseParser parser;
    private final ExtractionNormalizer normalizer;
    private final MentionScanner scanner;
    private final MentionAssessor assessor;
    private final MentionReconciler reconciler;
    private final PipelineProperties properties;

    /**
     * @param scope    retrieval filter for the chunks to read
     * @param fullText complete document text for the deterministic scan
     * @param label    name used in logs
     */
    public List<ExtractionRecord> extract(Map<String, String> scope, String fullText, String label) {
        Map<ExtractionField, List<Map<String, Object>>> fieldwise = new EnumMap<>(ExtractionField.class);
        for (ExtractionField field : ExtractionField.values()) {
            fieldwise.put(field, extractField(field, scope, label));
        }
        List<ExtractionRecord> records = normalizer.normalize(consolidate(fieldwise));

        List<Mention> deterministic = scanner.scan(fullText, properties.getMentions().getWindowLines());
        if (records.isEmpty()) {
            if (deterministic.isEmpty()) {
                log.info("No records and no regulatory evidence extracted from {}", label);
                return List.of();
            }
            log.info("Model extracted no record from {}, keeping {} deterministic mention(s) on an empty record",
                    label, deterministic.size());
            records = List.of(normalizer.normalize(Map.of()));
        }

        List<Mention> assessed = assessor.assess(deterministic);
        List<ExtractionRecord> out = new ArrayList<>(records.size());
        for (ExtractionRecord r : records) {
            out.add(r.withMentions(reconciler.reconcile(r.regulatoryMentions(), assessed, deterministic)));
        }
        log.info("Extracted {} record(s) from {}", out.size(), label);
        return out;
    }

    List<Map<String, Object>> extractField(ExtractionField field, Map<String, String> scope, String label) {
        PipelineProperties.Generation gen = properties.getGeneration();
        try {
            RetrievalResult retrieved = retriever.retrieve(field.query(), scope, gen.getMaxResults());
            log.info("Retrieved {} chunk(s) for field '{}' of {}", retrieved.size(), field.key(), label);
            for (RetrievalResult.Hit hit : retrieved.hits()) {
                log.debug("  distance={} metadata={} snippet={}", hit.distance(), hit.chunk().getMetadata(),
                        abbreviate(hit.chunk().getText()));
            }
            String prompt = promptBuilder.buildFieldPrompt(field, retrieved.texts());
            String response = llm.generate(prompt, gen.getTemperature(), gen.getMaxTokens());
            log.debug("Raw model response for {}: {}", field.key(), response);
            return parser.parse(response);
        } catch (RuntimeException e) {
            log.warn("Extraction of field '{}' failed for {}: {}", field.key(), label, e.getMessage());
            return List.of();
        }
    }

    /**
     * Record i is the union of the i-th object returned for every field.
     */
    static List<Map<String, Object>> consolidate(Map<ExtractionField, List<Map<String, Object>>> fieldwise) {
        int maxLen = fieldwise.values().stream().mapToInt(List::size).max().orElse(0);
        List<Map<String, Object>> consolidated = new ArrayList<>();
        for (int i = 0; i < maxLen; i++) {
            Map<String, Object> rec = new LinkedHashMap<>();
            for (List<Map<String, Object>> values : fieldwise.values()) {
                if (i < values.size()) merge(rec, values.get(i));
            }
            if (!rec.isEmpty()) consolidated.add(rec);
        }
        return consolidated;
    }

    // later fields win, but an empty value never replaces a filled one
    private static void merge(Map<String, Object> into, Map<String, Object> from) {
        from.forEach((key, value) -> {
            if (!isBlank(value) || !into.containsKey(key)) into.put(key, value);
        });
    }

    private static boolean isBlank(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }

    private static String abbreviate(String text) {
        if (text == null) return "";
        return text.length() > SNIPPET_LOG_CHARS ? text.substring(0, SNIPPET_LOG_CHARS) + "..." : text;
    }
}
