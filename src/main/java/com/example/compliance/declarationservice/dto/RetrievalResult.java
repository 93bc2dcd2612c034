package com.example.compliance.declarationservice.dto;

import com.example.compliance.declarationservice.model.Chunk;

import java.util.List;

/**
 * Ranked chunks for one query, closest first.
 */
public record RetrievalResult(List<Hit> hits) {

    public RetrievalResult {
        hits = hits == null ? List.of() : List.copyOf(hits);
    }

    public static RetrievalResult empty() {
        return new RetrievalResult(List.of());
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }

    public int size() {
        return hits.size();
    }

    public List<String> texts() {
        return hits.stream().map(h -> h.chunk().getText()).toList();
    }

    public record Hit(Chunk chunk, double distance) {}
}
