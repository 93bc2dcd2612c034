// src/main/java/com/example/compliance/declarationservice/model/MaterialRecord.java
package com.example.compliance.declarationservice.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

@Document("material_records")
@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class MaterialRecord {
    @Id
    private String materialId;            // BOM casing
    private String supplierName;
    private String declarationDate;
    private Boolean complianceFlag;
    private String recyclability;
    private Double recycledContentPercent;
    private List<String> restrictedSubstances;
    private String notes;
    private List<Mention> regulatoryMentions;
    private String sourcePath;            // originating document name
    private Instant createdAt;
    private Instant updatedAt;
}
