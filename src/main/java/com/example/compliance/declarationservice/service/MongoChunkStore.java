// src/main/java/com/example/compliance/declarationservice/service/MongoChunkStore.java
package com.example.compliance.declarationservice.service;

import com.example.compliance.declarationservice.config.PipelineProperties;
import com.example.compliance.declarationservice.dto.RetrievalResult;
import com.example.compliance.declarationservice.model.Chunk;
import com.mongodb.client.AggregateIterable;
import com.mongodb.client.MongoCollection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class MongoChunkStore implements ChunkStore {

    private static final Set<String> CHUNK_FIELDS = Set.of("materialId", "sourceDocumentId");

    private final MongoTemplate mongoTemplate;
    private final PipelineProperties properties;

    @Override
    public void upsert(List<Chunk> chunks) {
        for (Chunk c : chunks) {
            mongoTemplate.save(c, collectionName());
        }
    }

    @Override
    public long removeStale(String indexKey, Set<String> keepIds) {
        Query q = new Query(Criteria.where("_id").regex("^" + Pattern.quote(indexKey) + "_chunk_\\d+$")
                .nin(keepIds));
        long removed = mongoTemplate.remove(q, Chunk.class, collectionName()).getDeletedCount();
        if (removed > 0) {
            log.info("Removed {} stale chunk(s) for {}", removed, indexKey);
        }
        return removed;
    }

    @Override
    public RetrievalResult query(float[] embedding, int k, Map<String, String> where) {
        if (properties.getVector().isUseAtlasVector()) {
            return atlasQuery(embedding, k, where);
        }
        // Fallback: compute cosine in Java against the filtered chunks
        List<Chunk> candidates = mongoTemplate.find(toQuery(where), Chunk.class, collectionName());
        return rankByCosine(candidates, embedding, k);
    }

    @Override
    public List<Chunk> get(Map<String, String> where) {
        Query q = toQuery(where).with(Sort.by("sourceDocumentId", "sequenceIndex"));
        return mongoTemplate.find(q, Chunk.class, collectionName());
    }

    @Override
    public String collectionName() {
        return properties.getCollectionName();
    }

    private RetrievalResult atlasQuery(float[] embedding, int k, Map<String, String> where) {
        MongoCollection<Document> col = mongoTemplate.getCollection(collectionName());
        Document search = new Document("index", properties.getVector().getIndexName())
                .append("path", "embedding")
                .append("queryVector", toList(embedding))
                .append("numCandidates", Math.max(200, k * properties.getVector().getNumCandidatesFactor()))
                .append("limit", k);
        if (where != null && !where.isEmpty()) {
            Document filter = new Document();
            where.forEach((key, value) -> filter.append(fieldPath(key), value));
            search.append("filter", filter);
        }
        Document addScore = new Document("$addFields", new Document("score", new Document("$meta", "vectorSearchScore")));
        List<Document> pipeline = List.of(new Document("$vectorSearch", search), addScore);

        AggregateIterable<Document> agg = col.aggregate(pipeline);
        List<RetrievalResult.Hit> hits = new ArrayList<>();
        for (Document d : agg) {
            Chunk chunk = mongoTemplate.getConverter().read(Chunk.class, d);
            Number score = (Number) d.get("score");
            // vectorSearchScore is a similarity in [0, 1]
            hits.add(new RetrievalResult.Hit(chunk, 1.0 - (score == null ? 0.0 : score.doubleValue())));
        }
        return new RetrievalResult(hits);
    }

    static RetrievalResult rankByCosine(List<Chunk> candidates, float[] query, int k) {
        List<RetrievalResult.Hit> hits = candidates.stream()
                .filter(c -> c.getEmbedding() != null && c.getEmbedding().size() == query.length)
                .map(c -> new RetrievalResult.Hit(c, 1.0 - cosine(query, toFloatArray(c.getEmbedding()))))
                .sorted(Comparator.comparingDouble(RetrievalResult.Hit::distance))
                .limit(k)
                .toList();
        return new RetrievalResult(hits);
    }

    static Query toQuery(Map<String, String> where) {
        Query q = new Query();
        if (where != null) {
            where.forEach((key, value) -> q.addCriteria(Criteria.where(fieldPath(key)).is(value)));
        }
        return q;
    }

    private static String fieldPath(String key) {
        return CHUNK_FIELDS.contains(key) ? key : "metadata." + key;
    }

    private static List<Double> toList(float[] v) {
        List<Double> out = new ArrayList<>(v.length);
        for (float f : v) out.add((double) f);
        return out;
    }

    private static float[] toFloatArray(List<Double> list) {
        float[] a = new float[list.size()];
        for (int i = 0; i < list.size(); i++) a[i] = list.get(i).floatValue();
        return a;
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na  += a[i] * a[i];
            nb  += b[i] * b[i];
        }
        return dot / (Math.sqrt(na) * Math.sqrt(nb) + 1e-12);
    }
}
