// src/main/java/com/example/compliance/declarationservice/model/BomMaterial.java
package com.example.compliance.declarationservice.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Document("bom_materials")
@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class BomMaterial {
    @Id
    private String materialId;
    private String sku;
    private String materialName;
    private String supplierName;
    private String component;
    private String subcomponent;
}
