package com.example.compliance.declarationservice.webdto;

import java.util.Map;

/**
 * Input for indexing one declaration's text.
 *
 * @param materialId       material the declaration belongs to, may be null for document-scoped indexing
 * @param sku              product the material is used in, optional
 * @param sourceDocumentId originating file name
 * @param text             extracted document text
 * @param metadata         descriptive metadata copied onto every chunk
 */
public record IndexRequest(
        String materialId,
        String sku,
        String sourceDocumentId,
        String text,
        Map<String, String> metadata
) {
    static final String DOCUMENT_KEY_PREFIX = "doc:";

    /** Material id, or {@code doc:}-prefixed file name for document-scoped indexing. */
    public String indexKey() {
        if (materialId != null && !materialId.isBlank()) return materialId;
        return (sourceDocumentId == null || sourceDocumentId.isBlank()) ? null : DOCUMENT_KEY_PREFIX + sourceDocumentId;
    }
}
