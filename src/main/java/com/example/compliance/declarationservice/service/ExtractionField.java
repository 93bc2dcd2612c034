package com.example.compliance.declarationservice.service;

/**
 * Fields requested from the model one at a time, each with its own retrieval
 * query and extraction instructions. Declaration order is consolidation order.
 */
public enum ExtractionField {

    MATERIAL_ID("material_id",
            "Extract the material_id (same as product number or part number) from the supplier declaration.",
            """
            Return JSON with key material_id: the exact material, part or product code the declaration \
            is about, copied as written (alphanumeric, may contain dashes or underscores). \
            If the declaration covers several materials return one object per material. \
            If no code is stated return {"material_id": ""}.
            """),

    SUPPLIER_NAME("supplier_name",
            "Extract the supplier (vendor) name from the supplier declaration.",
            """
            Return JSON with key supplier_name: the company providing or manufacturing the product. \
            Look at letterheads, signature blocks and document headers. Use the full official name. \
            Supplier and vendor mean the same thing. If no company is named return "Not specified".
            """),

    DECLARATION_DATE("declaration_date",
            "Extract the issue or signature date of the supplier declaration.",
            """
            Return JSON with key declaration_date: the date the declaration was issued or signed, \
            formatted YYYY-MM-DD when possible. Return "" when no date is stated.
            """),

    COMPLIANCE_FLAGS("compliance_flags",
            "Extract packaging compliance, recyclability, recycled content and restricted substances from the declaration.",
            """
            Return JSON with keys:
            - ppwr_compliant: boolean, true only if the document affirms compliance with packaging regulations.
            - packaging_recyclability: string describing recyclability (e.g. "Recyclable", "Partially").
            - recycled_content_percent: number between 0 and 100, or "" when not stated.
            - restricted_substances: list of restricted substances the document says are PRESENT above limits. \
            Substances declared absent, not intentionally added or below limits must not be listed.
            """),

    NOTES("notes",
            "Extract qualifiers, exemptions or remarks from the supplier declaration.",
            """
            Return JSON with key notes: a short summary of qualifiers, exemptions, validity limits \
            or other remarks relevant to packaging compliance. Return "" if there are none.
            """),

    REGULATORY_MENTIONS("regulatory_mentions",
            "Find references to packaging regulations and heavy metals (lead, cadmium, hexavalent chromium) in the declaration.",
            """
            Return JSON with key regulatory_mentions as a list. Match case-insensitively. Targets:
            - "PPWD 94/62/EC": 94/62/EC, 94/62 EC, Packaging and Packaging Waste Directive, Packaging Directive, PPWD.
            - "PPWD 94/62/1": 94/62/1.
            - "PPWR (EU) 2025/40": 2025/40, Packaging and Packaging Waste Regulation, PPWR.
            - "Lead (Pb)": lead or Pb as a metal.
            - "Cadmium (Cd)": cadmium or Cd as a metal.
            - "Hexavalent Chromium (Cr6+)": hexavalent chromium, Cr6, Cr(VI).
            Each item is {"keyword": <target label>, "text": <exact sentence containing the match>, \
            "compliant": true | false | null}. compliant is true when the sentence affirms compliance, \
            absence or values below limits, false when it states non-compliance or exceedance, null otherwise.
            Example: "Heavy metals (Pb, Cd) are below limits." yields two items, Lead (Pb) and Cadmium (Cd), \
            both with that sentence and compliant true.
            If no target occurs return {"regulatory_mentions": []}. Do not invent text.
            """);

    private final String key;
    private final String query;
    private final String instructions;

    ExtractionField(String key, String query, String instructions) {
        this.key = key;
        this.query = query;
        this.instructions = instructions;
    }

    public String key() {
        return key;
    }

    public String query() {
        return query;
    }

    public String instructions() {
        return instructions;
    }
}
