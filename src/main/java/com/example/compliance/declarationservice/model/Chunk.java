// src/main/java/com/example/compliance/declarationservice/model/Chunk.java
package com.example.compliance.declarationservice.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;
import java.util.Map;

@Document("declaration_chunks")
@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class Chunk {
    @Id
    private String id;                    // {indexKey}_chunk_{i}
    private String materialId;            // null for document-scoped chunks
    private String sourceDocumentId;      // originating file name
    private int sequenceIndex;
    private int totalChunks;
    private String text;                  // chunk content
    private List<Double> embedding;       // vector embedding
    private Map<String, String> metadata; // sku, material name, supplier, etc.

    public static String chunkId(String indexKey, int sequenceIndex) {
        return indexKey + "_chunk_" + sequenceIndex;
    }
}
