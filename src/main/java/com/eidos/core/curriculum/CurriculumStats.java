package com.eidos.core.curriculum;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate counts for a curriculum run. Gap and severity counts cover the emitted
 * (truncated) card list.
 */
public record CurriculumStats(
        int rowsScanned,
        int cardsGenerated,
        Map<String, Integer> gaps,
        Map<String, Integer> severity
) {

    public CurriculumStats {
        gaps = Map.copyOf(gaps);
        severity = Map.copyOf(severity);
    }

    public static CurriculumStats empty() {
        return new CurriculumStats(0, 0, Map.of(), Map.of());
    }

    public int severityCount(Severity s) {
        return severity.getOrDefault(s.value(), 0);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("rows_scanned", rowsScanned);
        out.put("cards_generated", cardsGenerated);
        out.put("gaps", new LinkedHashMap<>(gaps));
        out.put("severity", new LinkedHashMap<>(severity));
        return out;
    }
}
