package com.example.compliance.declarationservice.service;

/**
 * Raised when a run's material records could not be written. The run's
 * writes have been rolled back.
 */
public class AssessmentPersistenceException extends RuntimeException {

    public AssessmentPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
