package com.example.compliance.declarationservice.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Sliding word-window chunking. Consecutive chunks share {@code overlap} words
 * and the window start advances by {@code max(size - overlap, 1)} words until
 * it passes the last word, so every word lands in at least one chunk and an
 * input of {@code n} words yields {@code ceil(n / step)} chunks.
 */
@Component
public class TextChunker {

    public List<String> chunk(String text, int size, int overlap) {
        if (size < 1) throw new IllegalArgumentException("chunk size must be >= 1, got " + size);
        if (overlap < 0) throw new IllegalArgumentException("overlap must be >= 0, got " + overlap);
        if (overlap >= size) {
            throw new IllegalArgumentException("overlap (" + overlap + ") must be < size (" + size + ")");
        }
        List<String> words = words(text);
        if (words.isEmpty()) return List.of();

        int step = Math.max(size - overlap, 1);
        List<String> chunks = new ArrayList<>();
        for (int start = 0; start < words.size(); start += step) {
            int end = Math.min(start + size, words.size());
            chunks.add(String.join(" ", words.subList(start, end)));
        }
        return chunks;
    }

    /**
     * Inverse of {@link #chunk}: drops the leading {@code overlap} words of
     * every chunk after the first and joins the rest.
     */
    public String reassemble(List<String> chunks, int overlap) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            List<String> w = words(chunks.get(i));
            int from = (i == 0) ? 0 : Math.min(overlap, w.size());
            out.addAll(w.subList(from, w.size()));
        }
        return String.join(" ", out);
    }

    static List<String> words(String text) {
        if (text == null || text.isBlank()) return List.of();
        return Arrays.asList(text.strip().split("\\s+"));
    }
}
