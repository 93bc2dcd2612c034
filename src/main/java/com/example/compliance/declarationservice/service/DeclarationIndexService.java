// src/main/java/com/example/compliance/declarationservice/service/DeclarationIndexService.java
package com.example.compliance.declarationservice.service;

import com.example.compliance.declarationservice.config.PipelineProperties;
import com.example.compliance.declarationservice.dto.IndexingResult;
import com.example.compliance.declarationservice.model.BomMaterial;
import com.example.compliance.declarationservice.model.Chunk;
import com.example.compliance.declarationservice.repo.BomMaterialRepository;
import com.example.compliance.declarationservice.webdto.IndexRequest;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class DeclarationIndexService {

    private final EmbeddingModel embeddingModel;
    private final ChunkStore chunkStore;
    private final TextChunker chunker;
    private final BomMaterialRepository bomRepo;
    private final PipelineProperties properties;

    /**
     * Chunks, embeds and stores one declaration. Chunks are keyed
     * {@code {indexKey}_chunk_{i}}; indexing the same key again replaces all of
     * its previous chunks. A chunk whose embedding fails is skipped.
     */
    public IndexingResult index(IndexRequest request) {
        String indexKey = request.indexKey();
        if (indexKey == null || indexKey.isBlank()) {
            throw new IllegalArgumentException("materialId or sourceDocumentId is required");
        }
        int size = properties.getChunking().getSize();
        int overlap = properties.getChunking().getOverlap();
        List<String> texts = chunker.chunk(request.text(), size, overlap);
        Map<String, String> metadata = chunkMetadata(request);

        List<Chunk> toSave = new ArrayList<>();
        for (int i = 0; i < texts.size(); i++) {
            Embedding emb;
            try {
                emb = embeddingModel.embed(texts.get(i)).content();
            } catch (RuntimeException e) {
                log.warn("Embedding failed for chunk {} of {}: {}", i, indexKey, e.getMessage());
                continue;
            }
            toSave.add(Chunk.builder()
                    .id(Chunk.chunkId(indexKey, i))
                    .materialId(blankToNull(request.materialId()))
                    .sourceDocumentId(request.sourceDocumentId())
                    .sequenceIndex(i)
                    .totalChunks(texts.size())
                    .text(texts.get(i))
                    .embedding(toList(emb))
                    .metadata(metadata)
                    .build());
        }

        if (!toSave.isEmpty()) {
            chunkStore.upsert(toSave);
        }
        // the previous version goes entirely, including slots whose new embedding failed
        Set<String> kept = toSave.stream().map(Chunk::getId).collect(Collectors.toSet());
        chunkStore.removeStale(indexKey, kept);
        log.info("Indexed {}/{} chunk(s) for {} into {}", toSave.size(), texts.size(), indexKey,
                chunkStore.collectionName());
        return new IndexingResult(toSave.size(), texts.size(), chunkStore.collectionName());
    }

    private Map<String, String> chunkMetadata(IndexRequest request) {
        Map<String, String> metadata = new LinkedHashMap<>();
        if (request.metadata() != null) {
            request.metadata().forEach((k, v) -> {
                if (k != null && v != null) metadata.put(k, v);
            });
        }
        if (request.sourceDocumentId() != null) metadata.put("source", request.sourceDocumentId());
        if (request.sku() != null && !request.sku().isBlank()) metadata.put("sku", request.sku());

        String materialId = blankToNull(request.materialId());
        if (materialId != null) {
            bomRepo.findById(materialId).ifPresent(bom -> enrich(metadata, bom));
        }
        return metadata;
    }

    private static void enrich(Map<String, String> metadata, BomMaterial bom) {
        putIfPresent(metadata, "material_name", bom.getMaterialName());
        putIfPresent(metadata, "supplier_name", bom.getSupplierName());
        putIfPresent(metadata, "component", bom.getComponent());
        putIfPresent(metadata, "subcomponent", bom.getSubcomponent());
    }

    private static void putIfPresent(Map<String, String> m, String key, String value) {
        if (value != null && !value.isBlank()) m.putIfAbsent(key, value);
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    private static List<Double> toList(Embedding e) {
        float[] v = e.vector();
        List<Double> out = new ArrayList<>(v.length);
        for (float f : v) out.add((double) f);
        return out;
    }
}
