package com.example.compliance.declarationservice.repo;

import com.example.compliance.declarationservice.model.MaterialRecord;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface MaterialRecordRepository extends MongoRepository<MaterialRecord, String> {
}
