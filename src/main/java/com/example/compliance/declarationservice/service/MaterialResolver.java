package com.example.compliance.declarationservice.service;

import com.example.compliance.declarationservice.dto.SkipRecord;
import com.example.compliance.declarationservice.model.ExtractionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Maps extracted material ids onto the BOM of the current run.
 *
 * <ol>
 *   <li>case-insensitive match, adopting the BOM casing;</li>
 *   <li>otherwise, with exactly one BOM material, that material;</li>
 *   <li>otherwise skipped as {@value SkipRecord#MATERIAL_NOT_IN_BOM}.</li>
 * </ol>
 * A material already claimed by an earlier record of the same document is
 * skipped as {@value SkipRecord#DUPLICATE_MATERIAL_IN_PDF}.
 */
@Slf4j
@Component
public class MaterialResolver {

    /**
     * Either a resolved record (material id in BOM casing) or a skip.
     */
    public record Resolution(String materialId, ExtractionRecord record, SkipRecord skip) {

        static Resolution resolved(String materialId, ExtractionRecord record) {
            return new Resolution(materialId, record, null);
        }

        static Resolution skipped(SkipRecord skip) {
            return new Resolution(null, null, skip);
        }

        public boolean isResolved() {
            return skip == null;
        }
    }

    /**
     * Tracks the materials claimed within one source document.
     */
    public DocumentScope forDocument(Collection<String> bomMaterialIds, String sourceDocument) {
        return new DocumentScope(bomMaterialIds, sourceDocument);
    }

    public static final class DocumentScope {

        private final Map<String, String> bomByLower = new LinkedHashMap<>();
        private final String sourceDocument;
        private final Set<String> claimed = new HashSet<>();

        private DocumentScope(Collection<String> bomMaterialIds, String sourceDocument) {
            for (String id : bomMaterialIds) {
                if (id != null && !id.isBlank()) {
                    bomByLower.putIfAbsent(id.strip().toLowerCase(Locale.ROOT), id.strip());
                }
            }
            this.sourceDocument = sourceDocument;
        }

        public Resolution resolve(ExtractionRecord record) {
            String extracted = record.materialId();
            String materialId = match(extracted);
            if (materialId == null) {
                log.warn("Material '{}' from {} not in BOM {}, skipping", extracted, sourceDocument, bomByLower.values());
                return Resolution.skipped(SkipRecord.forMaterial(SkipRecord.MATERIAL_NOT_IN_BOM, extracted, sourceDocument));
            }
            if (!claimed.add(materialId)) {
                log.warn("Material {} already taken from {}, skipping duplicate record", materialId, sourceDocument);
                return Resolution.skipped(SkipRecord.forMaterial(SkipRecord.DUPLICATE_MATERIAL_IN_PDF, materialId, sourceDocument));
            }
            return Resolution.resolved(materialId, record.withMaterialId(materialId));
        }

        private String match(String extracted) {
            if (extracted != null && !extracted.isBlank()) {
                String hit = bomByLower.get(extracted.strip().toLowerCase(Locale.ROOT));
                if (hit != null) return hit;
            }
            if (bomByLower.size() == 1) {
                String only = bomByLower.values().iterator().next();
                log.info("Material '{}' from {} unresolved, using single BOM candidate {}", extracted, sourceDocument, only);
                return only;
            }
            return null;
        }
    }
}
