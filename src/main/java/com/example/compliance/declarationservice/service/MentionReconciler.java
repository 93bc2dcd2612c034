package com.example.compliance.declarationservice.service;

import com.example.compliance.declarationservice.model.Mention;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges model mentions with scanner evidence. Model mentions come first so
 * their compliance judgments win; scanner snippets are appended. Entries are
 * keyed on lower-cased keyword plus the first {@value #EVIDENCE_PREFIX}
 * characters of evidence, and the first entry for a key is kept.
 */
@Slf4j
@Component
public class MentionReconciler {

    static final int EVIDENCE_PREFIX = 50;

    /**
     * @param modelMentions mentions from the extraction record
     * @param assessed      snippets judged by the assessment pass, may be empty
     * @param deterministic scanner snippets, the fallback evidence
     */
    public List<Mention> reconcile(List<Mention> modelMentions, List<Mention> assessed, List<Mention> deterministic) {
        List<Mention> fromModel = new ArrayList<>();
        if (modelMentions != null) fromModel.addAll(modelMentions);
        if (assessed != null) fromModel.addAll(assessed);
        List<Mention> scanned = deterministic == null ? List.of() : deterministic;

        if (fromModel.isEmpty()) {
            if (!scanned.isEmpty()) {
                log.info("Model produced no mentions, falling back to {} deterministic snippet(s)", scanned.size());
            }
            return dedupe(scanned.stream().map(m -> Mention.unassessed(m.keyword(), m.evidenceText())).toList());
        }
        List<Mention> union = new ArrayList<>(fromModel);
        union.addAll(scanned);
        return dedupe(union);
    }

    static List<Mention> dedupe(List<Mention> mentions) {
        Map<String, Mention> kept = new LinkedHashMap<>();
        for (Mention m : mentions) {
            kept.putIfAbsent(m.mergeKey(EVIDENCE_PREFIX), m);
        }
        return new ArrayList<>(kept.values());
    }
}
