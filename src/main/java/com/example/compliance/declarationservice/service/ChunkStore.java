package com.example.compliance.declarationservice.service;

import com.example.compliance.declarationservice.dto.RetrievalResult;
import com.example.compliance.declarationservice.model.Chunk;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Vector store holding declaration chunks. Filters are equality predicates on
 * chunk fields ({@code materialId}, {@code sourceDocumentId}) or, for any
 * other key, on chunk metadata.
 */
public interface ChunkStore {

    /** Inserts or overwrites chunks by id. */
    void upsert(List<Chunk> chunks);

    /** Deletes every chunk of {@code indexKey} whose id is not in {@code keepIds}. */
    long removeStale(String indexKey, Set<String> keepIds);

    RetrievalResult query(float[] embedding, int k, Map<String, String> where);

    /** All matching chunks ordered by source document and sequence index. */
    List<Chunk> get(Map<String, String> where);

    String collectionName();
}
