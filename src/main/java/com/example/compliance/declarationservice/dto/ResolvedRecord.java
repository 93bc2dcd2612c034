package com.example.compliance.declarationservice.dto;

import com.example.compliance.declarationservice.model.ExtractionRecord;

/**
 * An extraction whose material id has been matched to the BOM, ready to persist.
 */
public record ResolvedRecord(String materialId, ExtractionRecord record, String sourcePath) {}
