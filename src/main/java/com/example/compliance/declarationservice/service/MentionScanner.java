package com.example.compliance.declarationservice.service;

import com.example.compliance.declarationservice.model.Mention;
import com.example.compliance.declarationservice.model.RegulationKeyword;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Rule-based regulation scan over raw document text, independent of the model.
 *
 * <p>For each keyword only the first matching line is used: the snippet is
 * that line plus {@code windowLines} lines on either side. A later line that
 * mentions the same regulation, even with a contradicting statement, is not
 * reported.</p>
 */
@Slf4j
@Component
public class MentionScanner {

    public List<Mention> scan(String text, int windowLines) {
        if (text == null || text.isBlank()) return List.of();
        if (windowLines < 0) throw new IllegalArgumentException("windowLines must be >= 0, got " + windowLines);

        String[] lines = text.split("\\R", -1);
        List<Mention> mentions = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();

        for (RegulationKeyword keyword : RegulationKeyword.values()) {
            for (int idx = 0; idx < lines.length; idx++) {
                if (!keyword.matches(lines[idx])) continue;

                int start = Math.max(0, idx - windowLines);
                int end = Math.min(lines.length, idx + windowLines + 1);
                String snippet = String.join("\n", List.of(lines).subList(start, end)).strip();
                if (!snippet.isEmpty() && seen.add(keyword.label() + "\u0000" + snippet)) {
                    mentions.add(Mention.unassessed(keyword.label(), snippet));
                }
                break;
            }
        }
        log.debug("Deterministic scan found {} mention(s)", mentions.size());
        return mentions;
    }
}
