// src/main/java/com/example/compliance/declarationservice/api/DeclarationController.java
package com.example.compliance.declarationservice.api;

import com.example.compliance.declarationservice.dto.ConsolidationResult;
import com.example.compliance.declarationservice.dto.DeclarationDocument;
import com.example.compliance.declarationservice.dto.IndexingResult;
import com.example.compliance.declarationservice.model.MaterialRecord;
import com.example.compliance.declarationservice.repo.MaterialRecordRepository;
import com.example.compliance.declarationservice.service.ComplianceAssessmentService;
import com.example.compliance.declarationservice.service.DeclarationIndexService;
import com.example.compliance.declarationservice.service.PdfTextExtractor;
import com.example.compliance.declarationservice.webdto.AssessMaterialsRequest;
import com.example.compliance.declarationservice.webdto.IndexRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.*;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DeclarationController {

    private final DeclarationIndexService indexService;
    private final ComplianceAssessmentService assessmentService;
    private final PdfTextExtractor textExtractor;
    private final MaterialRecordRepository recordRepo;
    private final ObjectMapper om;

    @PostMapping(value = "/declarations/index", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> index(@RequestParam("file") MultipartFile file,
                                   @RequestParam("materialId") String materialId,
                                   @RequestParam(value = "sku", required = false) String sku,
                                   @RequestParam(value = "metadata", required = false) String metadataJson) throws IOException {
        if (materialId == null || materialId.isBlank()) {
            return badRequest("materialId is required");
        }
        if (file.isEmpty()) {
            return badRequest("Uploaded file is empty: " + file.getOriginalFilename());
        }
        Map<String, String> metadata;
        try {
            metadata = parseMetadata(metadataJson);
        } catch (JsonProcessingException e) {
            return badRequest("metadata must be a JSON object of strings: " + e.getOriginalMessage());
        }
        String text = textExtractor.extractText(file.getBytes());
        IndexingResult result = indexService.index(new IndexRequest(
                materialId.strip(), sku, file.getOriginalFilename(), text, metadata));
        return ResponseEntity.ok(result);
    }

    @PostMapping(value = "/assessments", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> assessDocuments(@RequestParam("bomMaterialIds") String bomMaterialIds,
                                             @RequestParam("files") List<MultipartFile> files) throws IOException {
        List<String> bomIds = splitIds(bomMaterialIds);
        if (bomIds.isEmpty()) {
            return badRequest("bomMaterialIds must list at least one material id");
        }
        List<DeclarationDocument> documents = new ArrayList<>();
        for (MultipartFile f : files) {
            documents.add(new DeclarationDocument(f.getOriginalFilename(), f.getBytes()));
        }
        ConsolidationResult result = assessmentService.assessDocuments(bomIds, documents);
        return ResponseEntity.ok(Map.of("success", true, "result", result));
    }

    @PostMapping("/assessments/materials")
    public ResponseEntity<?> assessMaterials(@RequestBody AssessMaterialsRequest req) {
        ConsolidationResult result;
        if (req.bomMaterialIds() != null && !req.bomMaterialIds().isEmpty()) {
            result = assessmentService.assessMaterials(req.bomMaterialIds().stream()
                    .filter(Objects::nonNull).map(String::strip).filter(s -> !s.isEmpty()).toList());
        } else if (req.sku() != null && !req.sku().isBlank()) {
            result = assessmentService.assessSku(req.sku().strip());
        } else {
            return badRequest("Pass {\"bomMaterialIds\": [...]} or {\"sku\": \"...\"}");
        }
        return ResponseEntity.ok(Map.of("success", true, "result", result));
    }

    @GetMapping("/assessments")
    public Map<String, Object> assessments(@RequestParam(value = "materialId", required = false) String materialId) {
        List<MaterialRecord> rows = (materialId == null || materialId.isBlank())
                ? recordRepo.findAll()
                : recordRepo.findById(materialId.strip()).map(List::of).orElse(List.of());
        return Map.of("success", true, "assessments", rows);
    }

    private Map<String, String> parseMetadata(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) return Map.of();
        return om.readValue(json, new TypeReference<Map<String, String>>() {});
    }

    static List<String> splitIds(String csv) {
        if (csv == null) return List.of();
        return Arrays.stream(csv.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static ResponseEntity<Map<String, Object>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
