package com.example.compliance.declarationservice.service;

import com.example.compliance.declarationservice.dto.ResolvedRecord;
import com.example.compliance.declarationservice.dto.UpsertOutcome;
import com.example.compliance.declarationservice.model.ExtractionRecord;
import com.example.compliance.declarationservice.model.MaterialRecord;
import com.example.compliance.declarationservice.repo.MaterialRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Upserts material records keyed by material id. Every write of one run shares
 * a single transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MaterialRecordWriter {

    private final MaterialRecordRepository repo;
    private final Clock clock;

    @Transactional
    public UpsertOutcome upsertAll(List<ResolvedRecord> records) {
        int inserted = 0;
        int updated = 0;
        try {
            for (ResolvedRecord r : records) {
                Instant now = clock.instant();
                Optional<MaterialRecord> existing = repo.findById(r.materialId());
                if (existing.isPresent()) {
                    MaterialRecord row = existing.get();
                    apply(row, r, now);
                    repo.save(row);
                    updated++;
                    log.info("Updated material record {}", r.materialId());
                } else {
                    MaterialRecord row = MaterialRecord.builder().materialId(r.materialId()).createdAt(now).build();
                    apply(row, r, now);
                    repo.save(row);
                    inserted++;
                    log.info("Inserted material record {}", r.materialId());
                }
            }
        } catch (DataAccessException e) {
            log.error("Writing material records failed, rolling back run: {}", e.getMessage());
            throw new AssessmentPersistenceException("Database save error: " + e.getMessage(), e);
        }
        return new UpsertOutcome(inserted, updated);
    }

    private static void apply(MaterialRecord row, ResolvedRecord r, Instant now) {
        ExtractionRecord rec = r.record();
        row.setSupplierName(rec.supplierName());
        row.setDeclarationDate(rec.declarationDate());
        row.setComplianceFlag(rec.complianceFlag());
        row.setRecyclability(rec.recyclability());
        row.setRecycledContentPercent(rec.recycledContentPercent());
        row.setRestrictedSubstances(rec.restrictedSubstances());
        row.setNotes(rec.notes());
        row.setRegulatoryMentions(rec.regulatoryMentions());
        row.setSourcePath(r.sourcePath());
        row.setUpdatedAt(now);
    }
}
