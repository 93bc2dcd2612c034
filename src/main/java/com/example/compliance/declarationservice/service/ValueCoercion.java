package com.example.compliance.declarationservice.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Total conversions from loosely typed model values. None of these throw.
 */
final class ValueCoercion {

    static final Set<String> TRUE_WORDS = Set.of("true", "yes", "y", "1");
    static final Set<String> FALSE_WORDS = Set.of("false", "no", "n", "0");
    private static final Set<String> EMPTY_TOKENS = Set.of("none", "n/a", "na", "nil", "null", "-");

    private ValueCoercion() {
    }

    static String text(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Map<?, ?> || raw instanceof List<?>) return null;
        String s = String.valueOf(raw).strip();
        return s.isEmpty() ? null : s;
    }

    /**
     * Strict flag: recognised true words are true, any other non-blank string
     * is false. Blank or missing is null.
     */
    static Boolean flag(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Boolean b) return b;
        if (raw instanceof Number n) return n.doubleValue() != 0.0;
        String s = text(raw);
        if (s == null) return null;
        return TRUE_WORDS.contains(s.toLowerCase(Locale.ROOT));
    }

    /**
     * Tri-state: true words, false words, otherwise null.
     */
    static Boolean triState(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Boolean b) return b;
        if (raw instanceof Number n) return n.doubleValue() != 0.0;
        String s = text(raw);
        if (s == null) return null;
        String lower = s.toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(lower)) return Boolean.TRUE;
        if (FALSE_WORDS.contains(lower)) return Boolean.FALSE;
        return null;
    }

    static Double number(Object raw) {
        if (raw == null || raw instanceof Boolean) return null;
        if (raw instanceof Number n) return finite(n.doubleValue());
        String s = text(raw);
        if (s == null) return null;
        if (s.endsWith("%")) s = s.substring(0, s.length() - 1).strip();
        try {
            return finite(Double.parseDouble(s));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static List<String> stringList(Object raw) {
        List<String> out = new ArrayList<>();
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                addToken(out, text(item));
            }
        } else if (raw instanceof String s) {
            for (String token : s.split(",")) {
                addToken(out, token.strip());
            }
        }
        return out;
    }

    private static void addToken(List<String> out, String token) {
        if (token == null || token.isEmpty()) return;
        if (EMPTY_TOKENS.contains(token.toLowerCase(Locale.ROOT))) return;
        out.add(token);
    }

    private static Double finite(double d) {
        return (Double.isNaN(d) || Double.isInfinite(d)) ? null : d;
    }
}
