// src/main/java/com/example/compliance/declarationservice/dto/IndexingResult.java
package com.example.compliance.declarationservice.dto;

/**
 * Outcome of indexing one declaration. {@code chunksCreated} may be lower than
 * {@code totalChunks} when embedding failed for some chunks.
 */
public record IndexingResult(
        int chunksCreated,
        int totalChunks,
        String collectionName
) {}
