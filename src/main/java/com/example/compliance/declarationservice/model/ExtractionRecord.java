package com.example.compliance.declarationservice.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

/**
 * Canonical shape of one extracted declaration, after coercion. Keys follow
 * the names the model is asked to produce so a record can be fed back through
 * the normalizer unchanged.
 */
@Builder(toBuilder = true)
public record ExtractionRecord(
        @JsonProperty("material_id") String materialId,
        @JsonProperty("supplier_name") String supplierName,
        @JsonProperty("declaration_date") String declarationDate,
        @JsonProperty("ppwr_compliant") Boolean complianceFlag,
        @JsonProperty("packaging_recyclability") String recyclability,
        @JsonProperty("recycled_content_percent") Double recycledContentPercent,
        @JsonProperty("restricted_substances") List<String> restrictedSubstances,
        @JsonProperty("notes") String notes,
        @JsonProperty("regulatory_mentions") List<Mention> regulatoryMentions
) {

    public ExtractionRecord {
        restrictedSubstances = restrictedSubstances == null ? List.of() : List.copyOf(restrictedSubstances);
        regulatoryMentions = regulatoryMentions == null ? List.of() : List.copyOf(regulatoryMentions);
    }

    public boolean hasMaterialId() {
        return materialId != null && !materialId.isBlank();
    }

    public ExtractionRecord withMentions(List<Mention> mentions) {
        return toBuilder().regulatoryMentions(mentions).build();
    }

    public ExtractionRecord withMaterialId(String id) {
        return toBuilder().materialId(id).build();
    }
}
