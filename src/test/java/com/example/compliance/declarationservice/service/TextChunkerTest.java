package com.example.compliance.declarationservice.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextChunkerTest {

    private final TextChunker chunker = new TextChunker();

    private static String words(int n) {
        return IntStream.range(0, n).mapToObj(i -> "w" + i).collect(Collectors.joining(" "));
    }

    @Test
    void chunk_shouldProduceOverlappingWordWindows() {
        List<String> chunks = chunker.chunk(words(10), 4, 1);

        assertThat(chunks).containsExactly(
                "w0 w1 w2 w3",
                "w3 w4 w5 w6",
                "w6 w7 w8 w9",
                "w9");
    }

    @ParameterizedTest
    @CsvSource({
            "1, 300, 50",
            "250, 300, 50",
            "1000, 300, 50",
            "1001, 300, 50",
            "7, 4, 1",
            "13, 5, 0",
            "20, 6, 5"
    })
    void chunk_countFollowsStep(int n, int size, int overlap) {
        int step = Math.max(size - overlap, 1);

        List<String> chunks = chunker.chunk(words(n), size, overlap);

        assertThat(chunks).hasSize((n + step - 1) / step);
        assertThat(chunks).allSatisfy(c -> assertThat(c.split(" ").length).isLessThanOrEqualTo(size));
    }

    @ParameterizedTest
    @CsvSource({
            "1000, 300, 50",
            "7, 4, 1",
            "10, 6, 4",
            "3, 4, 1",
            "20, 6, 5"
    })
    void reassemble_shouldRestoreOriginalWordSequence(int n, int size, int overlap) {
        String text = words(n);

        String rebuilt = chunker.reassemble(chunker.chunk(text, size, overlap), overlap);

        assertThat(rebuilt).isEqualTo(text);
    }

    @Test
    void chunk_shouldNormaliseWhitespace() {
        List<String> chunks = chunker.chunk("  alpha\n\nbeta\tgamma  ", 10, 2);

        assertThat(chunks).containsExactly("alpha beta gamma");
    }

    @Test
    void chunk_shouldReturnNothingForBlankText() {
        assertThat(chunker.chunk("   ", 300, 50)).isEmpty();
        assertThat(chunker.chunk(null, 300, 50)).isEmpty();
    }

    @Test
    void chunk_shouldRejectOverlapNotSmallerThanSize() {
        assertThatThrownBy(() -> chunker.chunk("a b c", 5, 5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("overlap");
        assertThatThrownBy(() -> chunker.chunk("a b c", 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> chunker.chunk("a b c", 5, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
