package com.example.compliance.declarationservice.service;

import com.example.compliance.declarationservice.model.Mention;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MentionReconcilerTest {

    private final MentionReconciler reconciler = new MentionReconciler();

    @Test
    void noModelMentions_shouldFallBackToScannerWithUnknownCompliance() {
        List<Mention> scanned = List.of(new Mention("Lead (Pb)", "contains lead", true));

        List<Mention> result = reconciler.reconcile(List.of(), List.of(), scanned);

        assertThat(result).containsExactly(Mention.unassessed("Lead (Pb)", "contains lead"));
    }

    @Test
    void sameKeywordAndEvidencePrefix_shouldKeepFirstOccurrence() {
        String evidence = "Packaging complies with the Packaging and Packaging Waste Directive 94/62/EC in full.";
        Mention fromModel = new Mention("PPWD 94/62/EC", evidence, true);
        Mention fromScanner = Mention.unassessed("ppwd 94/62/ec", evidence.substring(0, 60) + " and more text");

        List<Mention> result = reconciler.reconcile(List.of(fromModel), List.of(), List.of(fromScanner));

        assertThat(result).containsExactly(fromModel);
    }

    @Test
    void conflictingJudgments_shouldCollapseToModelRecordFirst() {
        Mention recordMention = new Mention("Lead (Pb)", "contains lead", false);
        Mention assessed = new Mention("Lead (Pb)", "contains lead", true);

        List<Mention> result = reconciler.reconcile(List.of(recordMention), List.of(assessed), List.of());

        assertThat(result).containsExactly(recordMention);
    }

    @Test
    void distinctEvidence_shouldBeUnioned() {
        Mention model = new Mention("PPWR (EU) 2025/40", "meets PPWR", true);
        Mention scanned = Mention.unassessed("Cadmium (Cd)", "Cadmium content 5 ppm");

        List<Mention> result = reconciler.reconcile(List.of(model), null, List.of(scanned));

        assertThat(result).containsExactly(model, scanned);
    }

    @Test
    void nothingAnywhere_shouldYieldEmpty() {
        assertThat(reconciler.reconcile(null, null, null)).isEmpty();
    }
}
