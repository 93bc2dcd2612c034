// src/main/java/com/example/compliance/declarationservice/service/ComplianceAssessmentService.java
package com.example.compliance.declarationservice.service;

import com.example.compliance.declarationservice.config.PipelineProperties;
import com.example.compliance.declarationservice.dto.*;
import com.example.compliance.declarationservice.model.BomMaterial;
import com.example.compliance.declarationservice.model.Chunk;
import com.example.compliance.declarationservice.model.ExtractionRecord;
import com.example.compliance.declarationservice.repo.BomMaterialRepository;
import com.example.compliance.declarationservice.webdto.IndexRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Batch entry points of the pipeline. Documents and materials are handled one
 * at a time; a failure in one of them becomes a skip record and the batch goes
 * on. All resulting writes are committed together at the end of the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComplianceAssessmentService {

    private final PdfTextExtractor textExtractor;
    private final DeclarationIndexService indexService;
    private final DeclarationRetriever retriever;
    private final DeclarationExtractor extractor;
    private final MaterialResolver resolver;
    private final MaterialRecordWriter writer;
    private final TextChunker chunker;
    private final BomMaterialRepository bomRepo;
    private final PipelineProperties properties;

    /**
     * Indexes each uploaded declaration under its own document scope, extracts
     * and reconciles it, and upserts the records that resolve to the BOM.
     */
    public ConsolidationResult assessDocuments(List<String> bomMaterialIds, List<DeclarationDocument> documents) {
        List<ResolvedRecord> resolved = new ArrayList<>();
        List<SkipRecord> skips = new ArrayList<>();

        for (DeclarationDocument doc : documents) {
            String file = doc.fileName();
            try {
                String text = textExtractor.extractText(doc.content());
                if (text == null || text.isBlank()) {
                    log.warn("No text extracted from {}", file);
                    skips.add(SkipRecord.forFile(SkipRecord.EMPTY_DOCUMENT, file));
                    continue;
                }
                IndexingResult indexed = indexService.index(new IndexRequest(null, null, file, text, Map.of()));
                log.info("Indexed {} of {} chunk(s) from {}", indexed.chunksCreated(), indexed.totalChunks(), file);

                List<ExtractionRecord> records = extractor.extract(DeclarationRetriever.documentScope(file), text, file);
                resolveAll(records, bomMaterialIds, file, resolved, skips);
            } catch (RuntimeException e) {
                log.warn("Assessment of {} failed: {}", file, e.getMessage());
                skips.add(SkipRecord.forFile(SkipRecord.DOCUMENT_FAILED, file));
            }
        }
        return persist(resolved, skips);
    }

    /**
     * Assesses declarations already indexed per material. Each material is
     * extracted from its own chunks and resolved against itself only.
     */
    public ConsolidationResult assessMaterials(List<String> bomMaterialIds) {
        List<ResolvedRecord> resolved = new ArrayList<>();
        List<SkipRecord> skips = new ArrayList<>();

        for (String materialId : new LinkedHashSet<>(bomMaterialIds)) {
            try {
                Map<String, String> scope = DeclarationRetriever.materialScope(materialId);
                List<Chunk> chunks = retriever.fetchAll(scope);
                if (chunks.isEmpty()) {
                    log.warn("Nothing indexed for material {}", materialId);
                    skips.add(SkipRecord.forMaterial(SkipRecord.NO_INDEXED_CHUNKS, materialId, null));
                    continue;
                }
                String source = chunks.get(0).getSourceDocumentId();
                List<ExtractionRecord> records = extractor.extract(scope, fullText(chunks), materialId);
                resolveAll(records, List.of(materialId), source, resolved, skips);
            } catch (RuntimeException e) {
                log.warn("Assessment of material {} failed: {}", materialId, e.getMessage());
                skips.add(SkipRecord.forMaterial(SkipRecord.DOCUMENT_FAILED, materialId, null));
            }
        }
        return persist(resolved, skips);
    }

    public ConsolidationResult assessSku(String sku) {
        List<String> ids = bomRepo.findBySkuOrderByMaterialIdAsc(sku).stream()
                .map(BomMaterial::getMaterialId)
                .toList();
        log.info("SKU {} has {} BOM material(s)", sku, ids.size());
        return assessMaterials(ids);
    }

    private void resolveAll(List<ExtractionRecord> records, List<String> bom, String source,
                            List<ResolvedRecord> resolved, List<SkipRecord> skips) {
        if (records.isEmpty()) {
            String only = bom.size() == 1 ? bom.get(0) : null;
            log.warn("No records extracted from {}", source);
            skips.add(SkipRecord.forMaterial(SkipRecord.NO_RECORDS_EXTRACTED, only, source));
            return;
        }
        MaterialResolver.DocumentScope scope = resolver.forDocument(bom, source);
        for (ExtractionRecord record : records) {
            MaterialResolver.Resolution r = scope.resolve(record);
            if (r.isResolved()) {
                resolved.add(new ResolvedRecord(r.materialId(), r.record(), source));
            } else {
                skips.add(r.skip());
            }
        }
    }

    // Rebuilds each source document from its chunks; documents are separated by a newline.
    private String fullText(List<Chunk> chunks) {
        Map<String, List<String>> byDocument = new LinkedHashMap<>();
        chunks.stream()
                .sorted(Comparator.comparing((Chunk c) -> String.valueOf(c.getSourceDocumentId()))
                        .thenComparingInt(Chunk::getSequenceIndex))
                .forEach(c -> byDocument.computeIfAbsent(String.valueOf(c.getSourceDocumentId()),
                        k -> new ArrayList<>()).add(c.getText()));
        int overlap = properties.getChunking().getOverlap();
        List<String> texts = new ArrayList<>();
        byDocument.values().forEach(parts -> texts.add(chunker.reassemble(parts, overlap)));
        return String.join("\n", texts);
    }

    private ConsolidationResult persist(List<ResolvedRecord> resolved, List<SkipRecord> skips) {
        UpsertOutcome outcome = resolved.isEmpty() ? new UpsertOutcome(0, 0) : writer.upsertAll(resolved);
        ConsolidationResult result = new ConsolidationResult(outcome.inserted(), outcome.updated(), skips.size(), skips);
        log.info("Assessment run finished: inserted={} updated={} skipped={}",
                result.inserted(), result.updated(), result.skipped());
        return result;
    }
}
