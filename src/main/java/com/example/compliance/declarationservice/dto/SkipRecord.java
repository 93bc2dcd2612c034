package com.example.compliance.declarationservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SkipRecord(String reason, String materialId, String file) {

    public static final String MATERIAL_NOT_IN_BOM = "material_not_in_bom";
    public static final String DUPLICATE_MATERIAL_IN_PDF = "duplicate_material_in_pdf";
    public static final String NO_RECORDS_EXTRACTED = "no_records_extracted";
    public static final String EMPTY_DOCUMENT = "empty_document";
    public static final String NO_INDEXED_CHUNKS = "no_indexed_chunks";
    public static final String DOCUMENT_FAILED = "document_failed";

    public static SkipRecord forMaterial(String reason, String materialId, String file) {
        return new SkipRecord(reason, materialId, file);
    }

    public static SkipRecord forFile(String reason, String file) {
        return new SkipRecord(reason, null, file);
    }
}
