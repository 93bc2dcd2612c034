package com.example.compliance.declarationservice.service;

import com.example.compliance.declarationservice.dto.RetrievalResult;
import com.example.compliance.declarationservice.model.Chunk;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MongoChunkStoreTest {

    private static Chunk chunk(String id, Double... embedding) {
        return Chunk.builder().id(id).text(id).embedding(embedding == null ? null : List.of(embedding)).build();
    }

    @Test
    void rankByCosine_shouldOrderByDistanceAndLimit() {
        List<Chunk> candidates = List.of(
                chunk("orthogonal", 0.0, 1.0),
                chunk("same", 2.0, 0.0),
                chunk("diagonal", 1.0, 1.0),
                chunk("wrong-dim", 1.0, 0.0, 0.0));

        RetrievalResult result = MongoChunkStore.rankByCosine(candidates, new float[]{1f, 0f}, 2);

        assertThat(result.texts()).containsExactly("same", "diagonal");
        assertThat(result.hits().get(0).distance()).isCloseTo(0.0, within(1e-6));
        assertThat(result.hits().get(1).distance()).isCloseTo(1 - Math.sqrt(0.5), within(1e-6));
    }

    @Test
    void rankByCosine_shouldIgnoreChunksWithoutEmbedding() {
        Chunk bare = Chunk.builder().id("bare").text("bare").build();

        assertThat(MongoChunkStore.rankByCosine(List.of(bare), new float[]{1f}, 3).isEmpty()).isTrue();
    }

    @Test
    void toQuery_shouldMapChunkFieldsAndMetadata() {
        Map<String, String> where = new LinkedHashMap<>();
        where.put("materialId", "MAT-1");
        where.put("sku", "SKU-9");

        Document query = MongoChunkStore.toQuery(where).getQueryObject();

        assertThat(query).containsEntry("materialId", "MAT-1").containsEntry("metadata.sku", "SKU-9");
        assertThat(MongoChunkStore.toQuery(null).getQueryObject()).isEmpty();
    }
}
