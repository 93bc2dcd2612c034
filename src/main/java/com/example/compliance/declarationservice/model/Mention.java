package com.example.compliance.declarationservice.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * A snippet cited as evidence that a regulation or substance was referenced.
 *
 * @param keyword      regulation label, normally one of {@link RegulationKeyword#label()}
 * @param evidenceText quoted text window
 * @param compliant    model judgment, {@code null} when unknown or not assessed
 */
public record Mention(
        @JsonProperty("keyword") String keyword,
        @JsonProperty("text") String evidenceText,
        @JsonProperty("compliant") Boolean compliant
) {

    public static Mention unassessed(String keyword, String evidenceText) {
        return new Mention(keyword, evidenceText, null);
    }

    /** Key for exact-duplicate collapsing within one record. */
    public String identityKey() {
        return lowerKeyword() + "\u0000" + (evidenceText == null ? "" : evidenceText);
    }

    /** Looser key used when merging model and scanner mentions. */
    public String mergeKey(int evidencePrefix) {
        String ev = evidenceText == null ? "" : evidenceText;
        return lowerKeyword() + "\u0000" + ev.substring(0, Math.min(evidencePrefix, ev.length()));
    }

    private String lowerKeyword() {
        return keyword == null ? "" : keyword.toLowerCase(Locale.ROOT);
    }
}
