// src/main/java/com/example/compliance/declarationservice/service/DeclarationRetriever.java
package com.example.compliance.declarationservice.service;

import com.example.compliance.declarationservice.dto.RetrievalResult;
import com.example.compliance.declarationservice.model.Chunk;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class DeclarationRetriever {

    private final EmbeddingModel embeddingModel;
    private final ChunkStore chunkStore;

    /**
     * Top-k chunks for {@code query} within the given scope. An empty result
     * means nothing is indexed for the scope and is not an error.
     */
    public RetrievalResult retrieve(String query, Map<String, String> where, int maxResults) {
        float[] emb = embeddingModel.embed(query).content().vector();
        RetrievalResult result = chunkStore.query(emb, maxResults, where);
        log.debug("Retrieved {} chunk(s) for '{}' where {}", result.size(), query, where);
        return result;
    }

    /** Every chunk in the scope, in document order. */
    public List<Chunk> fetchAll(Map<String, String> where) {
        return chunkStore.get(where);
    }

    public static Map<String, String> materialScope(String materialId) {
        Map<String, String> where = new LinkedHashMap<>();
        where.put("materialId", materialId);
        return where;
    }

    public static Map<String, String> documentScope(String sourceDocumentId) {
        Map<String, String> where = new LinkedHashMap<>();
        where.put("sourceDocumentId", sourceDocumentId);
        return where;
    }
}
