package com.example.compliance.declarationservice.service;

import com.example.compliance.declarationservice.model.ExtractionRecord;
import com.example.compliance.declarationservice.model.Mention;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Supplier;

/**
 * Coerces parsed model records into {@link ExtractionRecord}s. Each field is
 * converted on its own; a value that cannot be converted becomes null (or an
 * empty list) without affecting the rest of the record.
 *
 * <p>Compliance flag: any restricted substance forces {@code false}. Otherwise
 * the model's flag is used, and when the model gave none the record is assumed
 * compliant.</p>
 */
@Slf4j
@Component
public class ExtractionNormalizer {

    private final ObjectMapper om;

    public ExtractionNormalizer() {
        this(new ObjectMapper());
    }

    public ExtractionNormalizer(ObjectMapper om) {
        this.om = om;
    }

    public List<ExtractionRecord> normalize(List<Map<String, Object>> items) {
        List<ExtractionRecord> out = new ArrayList<>();
        if (items == null) return out;
        for (Map<String, Object> item : items) {
            if (item != null) out.add(normalize(item));
        }
        return out;
    }

    public ExtractionRecord normalize(Map<String, Object> it) {
        String materialId = safely("material_id",
                () -> ValueCoercion.text(first(it, "material_id", "materialId", "part_number")), null);
        List<String> restricted = safely("restricted_substances",
                () -> ValueCoercion.stringList(first(it, "restricted_substances", "restrictedSubstances")), List.of());
        Boolean explicit = safely("ppwr_compliant",
                () -> ValueCoercion.flag(first(it, "ppwr_compliant", "compliance_flag", "compliant")), null);

        return ExtractionRecord.builder()
                .materialId(materialId)
                .supplierName(safely("supplier_name",
                        () -> ValueCoercion.text(first(it, "supplier_name", "supplierName", "vendor_name")), null))
                .declarationDate(safely("declaration_date",
                        () -> ValueCoercion.text(first(it, "declaration_date", "declarationDate")), null))
                .complianceFlag(complianceFlag(materialId, explicit, restricted))
                .recyclability(safely("packaging_recyclability",
                        () -> ValueCoercion.text(first(it, "packaging_recyclability", "recyclability")), null))
                .recycledContentPercent(safely("recycled_content_percent",
                        () -> ValueCoercion.number(first(it, "recycled_content_percent", "recycledContentPercent")), null))
                .restrictedSubstances(restricted)
                .notes(safely("notes", () -> ValueCoercion.text(it.get("notes")), null))
                .regulatoryMentions(safely("regulatory_mentions",
                        () -> mentions(first(it, "regulatory_mentions", "regulatoryMentions")), List.of()))
                .build();
    }

    /**
     * Coerces a raw mention list. Accepts a list, a JSON string holding a list,
     * a single object or a bare string. Entries with neither keyword nor text
     * are dropped and exact duplicates collapsed.
     */
    public List<Mention> mentions(Object raw) {
        List<Object> entries = mentionEntries(raw);
        Map<String, Mention> unique = new LinkedHashMap<>();
        for (Object entry : entries) {
            Mention m = toMention(entry);
            if (m != null) unique.putIfAbsent(m.identityKey(), m);
        }
        return new ArrayList<>(unique.values());
    }

    private List<Object> mentionEntries(Object raw) {
        if (raw instanceof List<?> list) return new ArrayList<>(list);
        if (raw instanceof Map<?, ?> map) return List.of(map);
        if (raw instanceof String s && !s.isBlank()) {
            try {
                Object parsed = om.readValue(s, Object.class);
                if (parsed instanceof List<?> || parsed instanceof Map<?, ?>) return mentionEntries(parsed);
            } catch (JsonProcessingException e) {
                log.debug("regulatory_mentions is plain text, keeping it as one mention");
            }
            return List.of(s);
        }
        return List.of();
    }

    private static Mention toMention(Object entry) {
        if (entry instanceof Map<?, ?> m) {
            String keyword = Objects.requireNonNullElse(ValueCoercion.text(m.get("keyword")), "");
            Object evidence = m.get("text") != null ? m.get("text") : m.get("evidence");
            String text = Objects.requireNonNullElse(ValueCoercion.text(evidence), "");
            if (keyword.isEmpty() && text.isEmpty()) return null;
            return new Mention(keyword, text, ValueCoercion.triState(m.get("compliant")));
        }
        String text = ValueCoercion.text(entry);
        return text == null ? null : Mention.unassessed("", text);
    }

    private static Boolean complianceFlag(String materialId, Boolean explicit, List<String> restricted) {
        if (!restricted.isEmpty()) {
            if (Boolean.TRUE.equals(explicit)) {
                log.warn("Compliance conflict for material '{}': model reported compliant but restricted substances {} "
                        + "were extracted, recording non-compliant", materialId, restricted);
            }
            return Boolean.FALSE;
        }
        if (explicit == null) {
            log.info("No compliance flag for material '{}' and no restricted substances, inferring compliant", materialId);
            return Boolean.TRUE;
        }
        return explicit;
    }

    private static Object first(Map<String, Object> it, String... keys) {
        for (String k : keys) {
            Object v = it.get(k);
            if (v != null) return v;
        }
        return null;
    }

    private static <T> T safely(String field, Supplier<T> conversion, T fallback) {
        try {
            return conversion.get();
        } catch (RuntimeException e) {
            log.warn("Could not coerce field {}: {}", field, e.getMessage());
            return fallback;
        }
    }
}
