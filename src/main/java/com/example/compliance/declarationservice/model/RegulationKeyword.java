package com.example.compliance.declarationservice.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Regulation and substance keywords recognised by the deterministic scanner.
 * A line counts as a hit when none of the exclusion patterns match it and the
 * inclusion pattern does. All patterns are case-insensitive.
 */
public enum RegulationKeyword {

    PPWD_94_62_EC("PPWD 94/62/EC",
            "94/62\\s*/?\\s*ec|packaging and packaging waste directive|packaging directive(?!\\s+for)|ppwd"),
    PPWD_94_62_1("PPWD 94/62/1",
            "94/62/1"),
    PPWR_2025_40("PPWR (EU) 2025/40",
            "2025/40|packaging and packaging waste regulation|ppwr"),
    LEAD("Lead (Pb)",
            "\\blead\\b(?!\\s+(?:to|time|in|by|through)\\b)|\\bpb\\b(?!\\s*-?\\s*(?:rom|&j|ratio))",
            "\\blead\\s+to\\b"),
    CADMIUM("Cadmium (Cd)",
            "\\bcadmium\\b|\\bcd\\b(?=\\s*(?:metal|ppm|\\(|concentration|content|level))"),
    HEXAVALENT_CHROMIUM("Hexavalent Chromium (Cr6+)",
            "hexavalent chromium|\\bcr\\s*6\\+?|\\bcr\\s*\\(vi\\)|chrome\\s*6");

    private final String label;
    private final Pattern pattern;
    private final List<Pattern> exclusions;

    RegulationKeyword(String label, String pattern, String... exclusions) {
        this.label = label;
        this.pattern = Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
        this.exclusions = Arrays.stream(exclusions)
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    public String label() {
        return label;
    }

    public boolean matches(String line) {
        if (line == null || line.isEmpty()) return false;
        for (Pattern exclusion : exclusions) {
            if (exclusion.matcher(line).find()) {
                return false;
            }
        }
        return pattern.matcher(line).find();
    }

    public static Optional<RegulationKeyword> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String trimmed = label.trim();
        return Arrays.stream(values())
                .filter(k -> k.label.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
