package com.eidos.core.curriculum;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-row line of an {@link AutofixReport}. Scores are rounded to four decimals.
 *
 * @param error empty unless reading or writing this row failed
 */
public record AutofixRow(
        String distillationId,
        String source,
        double oldUnified,
        double newUnified,
        boolean oldSuppressed,
        boolean newSuppressed,
        boolean changedText,
        AutofixAction action,
        String error
) {

    public AutofixRow {
        oldUnified = AutofixReport.round4(oldUnified);
        newUnified = AutofixReport.round4(newUnified);
        error = error == null ? "" : error;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("distillation_id", distillationId);
        out.put("source", source);
        out.put("old_unified", oldUnified);
        out.put("new_unified", newUnified);
        out.put("old_suppressed", oldSuppressed);
        out.put("new_suppressed", newSuppressed);
        out.put("changed_text", changedText);
        out.put("action", action.value());
        if (!error.isEmpty()) {
            out.put("error", error);
        }
        return out;
    }
}
