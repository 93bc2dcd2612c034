package com.example.compliance.declarationservice.dto;

public record UpsertOutcome(int inserted, int updated) {}
