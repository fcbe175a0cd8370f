package com.eidos.core.curriculum;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one autofix batch. The archive update rate and stagnation flag are
 * derived from the archive counters.
 *
 * @param committed true only when {@code apply} was set and the transaction committed
 * @param error     empty, or {@code db_missing}, {@code db_open_failed: ...}, {@code commit_failed: ...}
 */
public record AutofixReport(
        long ts,
        String dbPath,
        AutofixOptions options,
        int candidates,
        int attempted,
        int updated,
        int archiveAttempted,
        int archiveUpdated,
        int archivePromoted,
        double suppressionRecoveryRate,
        boolean committed,
        String error,
        List<AutofixRow> rows
) {

    /** Archive update rate below which the batch is flagged as stagnating. */
    public static final double STAGNATION_RATE = 0.05;

    public AutofixReport {
        suppressionRecoveryRate = round4(suppressionRecoveryRate);
        error = error == null ? "" : error;
        rows = List.copyOf(rows);
    }

    static AutofixReport failed(long ts, String dbPath, AutofixOptions options, int candidates, String error) {
        return new AutofixReport(ts, dbPath, options, candidates, 0, 0, 0, 0, 0, 0.0, false, error, List.of());
    }

    public double archiveUpdateRate() {
        return archiveAttempted > 0 ? round4((double) archiveUpdated / archiveAttempted) : 0.0;
    }

    public boolean archiveStagnationDetected() {
        return archiveAttempted > 0 && archiveUpdateRate() < STAGNATION_RATE;
    }

    public boolean hasError() {
        return !error.isEmpty();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ts", ts);
        out.put("db_path", dbPath);
        out.put("max_cards", options.maxCards());
        out.put("min_gain", options.minGain());
        out.put("apply", options.apply());
        out.put("include_archive", options.includeArchive());
        out.put("promote_on_success", options.promoteOnSuccess());
        out.put("promote_min_unified", options.promoteMinUnified());
        out.put("archive_fallback_llm", options.archiveFallbackLlm());
        out.put("soft_promote_on_success", options.softPromoteOnSuccess());
        out.put("soft_promote_min_unified", options.softPromoteMinUnified());
        out.put("mode_used", options.modeUsed());
        out.put("candidates", candidates);
        out.put("attempted", attempted);
        out.put("updated", updated);
        out.put("archive_attempted", archiveAttempted);
        out.put("archive_updated", archiveUpdated);
        out.put("archive_promoted", archivePromoted);
        out.put("archive_stagnation_detected", archiveStagnationDetected());
        out.put("archive_update_rate", archiveUpdateRate());
        out.put("suppression_recovery_rate", suppressionRecoveryRate);
        out.put("committed", committed);
        if (hasError()) {
            out.put("error", error);
        }
        out.put("rows", rows.stream().map(AutofixRow::toMap).toList());
        return out;
    }

    static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
