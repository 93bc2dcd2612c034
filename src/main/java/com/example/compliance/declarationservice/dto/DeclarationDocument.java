package com.example.compliance.declarationservice.dto;

/**
 * An uploaded declaration file.
 */
public record DeclarationDocument(String fileName, byte[] content) {}
