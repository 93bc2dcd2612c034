package com.example.compliance.declarationservice.webdto;

import java.util.List;

public record AssessMaterialsRequest(List<String> bomMaterialIds, String sku) {}
