package com.eidos.core.curriculum;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link CurriculumBuilder#build}.
 *
 * @param generatedAt epoch seconds
 * @param gapSummary  narrative from the summarization area, empty when it is disabled
 * @param error       empty when the database could be read; otherwise {@code db_missing}
 *                    or {@code db_open_failed: ...}
 */
public record CurriculumReport(
        long generatedAt,
        String dbPath,
        CurriculumStats stats,
        List<GapCard> cards,
        String gapSummary,
        String error
) {

    public CurriculumReport {
        cards = List.copyOf(cards);
        gapSummary = gapSummary == null ? "" : gapSummary;
        error = error == null ? "" : error;
    }

    static CurriculumReport failed(long generatedAt, String dbPath, String error) {
        return new CurriculumReport(generatedAt, dbPath, CurriculumStats.empty(), List.of(), "", error);
    }

    public boolean hasError() {
        return !error.isEmpty();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("generated_at", generatedAt);
        out.put("db_path", dbPath);
        out.put("stats", stats.toMap());
        out.put("cards", cards.stream().map(GapCard::toMap).toList());
        out.put("gap_summary", gapSummary);
        if (hasError()) {
            out.put("error", error);
        }
        return out;
    }
}
