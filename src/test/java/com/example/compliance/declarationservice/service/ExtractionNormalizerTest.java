package com.example.compliance.declarationservice.service;

import com.example.compliance.declarationservice.model.ExtractionRecord;
import com.example.compliance.declarationservice.model.Mention;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionNormalizerTest {

    private final ObjectMapper om = new ObjectMapper();
    private final ExtractionNormalizer normalizer = new ExtractionNormalizer(om);

    private static Map<String, Object> item(Object... kv) {
        Map<String, Object> m = new HashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return m;
    }

    @Nested
    @DisplayName("Compliance flag")
    class ComplianceFlag {

        @ParameterizedTest
        @ValueSource(strings = {"YES", "1", "true", " y "})
        void truthyStrings_shouldBeTrue(String raw) {
            assertThat(normalizer.normalize(item("ppwr_compliant", raw)).complianceFlag()).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"no", "0", "false", "unclear"})
        void otherStrings_shouldBeFalse(String raw) {
            assertThat(normalizer.normalize(item("ppwr_compliant", raw)).complianceFlag()).isFalse();
        }

        @Test
        void booleanAndNumber_shouldBeUsedDirectly() {
            assertThat(normalizer.normalize(item("ppwr_compliant", false)).complianceFlag()).isFalse();
            assertThat(normalizer.normalize(item("ppwr_compliant", 1)).complianceFlag()).isTrue();
            assertThat(normalizer.normalize(item("ppwr_compliant", 0)).complianceFlag()).isFalse();
        }

        @Test
        void missingFlag_withoutRestrictedSubstances_shouldInferCompliant() {
            assertThat(normalizer.normalize(item("material_id", "M1")).complianceFlag()).isTrue();
        }

        @Test
        void restrictedSubstances_shouldOverrideExplicitTrue() {
            ExtractionRecord record = normalizer.normalize(
                    item("ppwr_compliant", "yes", "restricted_substances", List.of("Lead")));

            assertThat(record.complianceFlag()).isFalse();
            assertThat(record.restrictedSubstances()).containsExactly("Lead");
        }
    }

    @Nested
    @DisplayName("Field coercion")
    class FieldCoercion {

        @Test
        void commaSeparatedSubstances_shouldBeSplitAndTrimmed() {
            ExtractionRecord record = normalizer.normalize(item("restricted_substances", "Lead, Cadmium ,, none"));

            assertThat(record.restrictedSubstances()).containsExactly("Lead", "Cadmium");
        }

        @Test
        void badPercent_shouldBecomeNullWithoutAffectingOtherFields() {
            ExtractionRecord record = normalizer.normalize(
                    item("recycled_content_percent", "about half", "supplier_name", "Acme"));

            assertThat(record.recycledContentPercent()).isNull();
            assertThat(record.supplierName()).isEqualTo("Acme");
        }

        @Test
        void percentWithSign_shouldParse() {
            assertThat(normalizer.normalize(item("recycled_content_percent", "35%")).recycledContentPercent())
                    .isEqualTo(35.0);
            assertThat(normalizer.normalize(item("recycled_content_percent", 12.5)).recycledContentPercent())
                    .isEqualTo(12.5);
        }

        @Test
        void aliasKeys_shouldBeAccepted() {
            ExtractionRecord record = normalizer.normalize(item("materialId", "M-9", "vendor_name", "Beta"));

            assertThat(record.materialId()).isEqualTo("M-9");
            assertThat(record.supplierName()).isEqualTo("Beta");
        }

        @Test
        void normalize_shouldBeIdempotent() {
            ExtractionRecord first = normalizer.normalize(item(
                    "material_id", "M1",
                    "supplier_name", "Acme",
                    "ppwr_compliant", "no",
                    "recycled_content_percent", "20%",
                    "restricted_substances", "Lead",
                    "regulatory_mentions", List.of(Map.of("keyword", "PPWR (EU) 2025/40", "text", "meets PPWR",
                            "compliant", "yes"))));

            Map<String, Object> asMap = om.convertValue(first, new TypeReference<Map<String, Object>>() {});
            ExtractionRecord second = normalizer.normalize(asMap);

            assertThat(second).isEqualTo(first);
        }

        @Test
        void listOfItems_shouldSkipNullEntries() {
            List<Map<String, Object>> items = new java.util.ArrayList<>();
            items.add(item("material_id", "A"));
            items.add(null);
            items.add(item("material_id", "B"));

            assertThat(normalizer.normalize(items)).extracting(ExtractionRecord::materialId).containsExactly("A", "B");
        }
    }

    @Nested
    @DisplayName("Regulatory mentions")
    class Mentions {

        @Test
        void emptyEntries_shouldBeDroppedAndDuplicatesCollapsed() {
            List<Mention> mentions = normalizer.mentions(List.of(
                    Map.of("keyword", "Lead (Pb)", "text", "contains lead", "compliant", "no"),
                    Map.of("keyword", "", "text", ""),
                    Map.of("keyword", "Lead (Pb)", "text", "contains lead", "compliant", "no")));

            assertThat(mentions).containsExactly(new Mention("Lead (Pb)", "contains lead", false));
        }

        @Test
        void jsonString_shouldBeParsed() {
            List<Mention> mentions = normalizer.mentions("[{\"keyword\":\"PPWD 94/62/EC\",\"evidence\":\"complies\"}]");

            assertThat(mentions).containsExactly(Mention.unassessed("PPWD 94/62/EC", "complies"));
        }

        @Test
        void plainString_shouldBecomeSingleMention() {
            assertThat(normalizer.mentions("mentions cadmium")).containsExactly(Mention.unassessed("", "mentions cadmium"));
        }

        @Test
        void unknownCompliance_shouldBeNull() {
            List<Mention> mentions = normalizer.mentions(List.of(Map.of("keyword", "PPWR", "text", "x", "compliant", "maybe")));

            assertThat(mentions.get(0).compliant()).isNull();
        }
    }
}
