package com.example.compliance.declarationservice.api;

import com.example.compliance.declarationservice.service.AssessmentPersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(AssessmentPersistenceException.class)
    public ResponseEntity<Map<String, Object>> handlePersistence(AssessmentPersistenceException e) {
        log.error("Assessment run rolled back: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("success", false, "error", e.getMessage()));
    }

    // commit failures surface from the transaction proxy, after the writer returned
    @ExceptionHandler(TransactionException.class)
    public ResponseEntity<Map<String, Object>> handleTransaction(TransactionException e) {
        log.error("Assessment run could not be committed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("success", false, "error", "Database save error: " + e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadInput(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
