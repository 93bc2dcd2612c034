package com.example.compliance.declarationservice.service;

import com.example.compliance.declarationservice.dto.SkipRecord;
import com.example.compliance.declarationservice.model.ExtractionRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MaterialResolverTest {

    private final MaterialResolver resolver = new MaterialResolver();

    private static ExtractionRecord record(String materialId) {
        return ExtractionRecord.builder().materialId(materialId).build();
    }

    @Test
    void unknownMaterial_withSeveralCandidates_shouldBeSkipped() {
        MaterialResolver.DocumentScope scope = resolver.forDocument(List.of("A1", "a1-X"), "decl.pdf");

        MaterialResolver.Resolution resolution = scope.resolve(record("b2"));

        assertThat(resolution.isResolved()).isFalse();
        assertThat(resolution.skip()).isEqualTo(SkipRecord.forMaterial(SkipRecord.MATERIAL_NOT_IN_BOM, "b2", "decl.pdf"));
    }

    @Test
    void caseInsensitiveMatch_shouldAdoptBomCasing() {
        MaterialResolver.DocumentScope scope = resolver.forDocument(List.of("A1", "a1-X"), "decl.pdf");

        MaterialResolver.Resolution resolution = scope.resolve(record("A1-x"));

        assertThat(resolution.isResolved()).isTrue();
        assertThat(resolution.materialId()).isEqualTo("a1-X");
        assertThat(resolution.record().materialId()).isEqualTo("a1-X");
    }

    @Test
    void singleCandidate_shouldBeUsedWhenUnresolved() {
        MaterialResolver.DocumentScope scope = resolver.forDocument(List.of("A1"), "decl.pdf");

        assertThat(scope.resolve(record(null)).materialId()).isEqualTo("A1");
    }

    @Test
    void secondRecordForSameMaterial_shouldBeSkippedAsDuplicate() {
        MaterialResolver.DocumentScope scope = resolver.forDocument(List.of("A1", "B2"), "decl.pdf");

        MaterialResolver.Resolution first = scope.resolve(record("a1"));
        MaterialResolver.Resolution second = scope.resolve(record("A1"));

        assertThat(first.isResolved()).isTrue();
        assertThat(second.skip().reason()).isEqualTo(SkipRecord.DUPLICATE_MATERIAL_IN_PDF);
        assertThat(second.skip().materialId()).isEqualTo("A1");
    }

    @Test
    void claims_shouldNotLeakAcrossDocuments() {
        resolver.forDocument(List.of("A1"), "one.pdf").resolve(record("A1"));

        assertThat(resolver.forDocument(List.of("A1"), "two.pdf").resolve(record("A1")).isResolved()).isTrue();
    }
}
