// src/main/java/com/example/compliance/declarationservice/dto/ConsolidationResult.java
package com.example.compliance.declarationservice.dto;

import java.util.List;

public record ConsolidationResult(
        int inserted,
        int updated,
        int skipped,
        List<SkipRecord> skippedReasons
) {
    public ConsolidationResult {
        skippedReasons = skippedReasons == null ? List.of() : List.copyOf(skippedReasons);
    }
}
