package com.example.compliance.declarationservice.repo;

import com.example.compliance.declarationservice.model.BomMaterial;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface BomMaterialRepository extends MongoRepository<BomMaterial, String> {

    List<BomMaterial> findBySkuOrderByMaterialIdAsc(String sku);
}
