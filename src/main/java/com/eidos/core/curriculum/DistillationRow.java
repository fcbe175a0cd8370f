package com.eidos.core.curriculum;

import com.eidos.core.persistence.DistillationTable;
import com.eidos.core.quality.AdvisoryQuality;

/**
 * Read-only snapshot of one active or archived distillation, holding only what the
 * curriculum and autofix need. Columns missing from the table read as empty/zero.
 */
public record DistillationRow(
        String distillationId,
        String type,
        String statement,
        String refinedStatement,
        AdvisoryQuality quality,
        int timesUsed,
        int timesHelped,
        DistillationTable source,
        String archiveReason
) {

    public DistillationRow {
        distillationId = distillationId == null ? "" : distillationId;
        type = type == null ? "" : type;
        statement = statement == null ? "" : statement;
        refinedStatement = refinedStatement == null ? "" : refinedStatement;
        quality = quality == null ? AdvisoryQuality.empty() : quality;
        archiveReason = archiveReason == null ? "" : archiveReason;
    }

    /** Refined text when present, else the raw statement. */
    public String effectiveStatement() {
        return refinedStatement.isBlank() ? statement : refinedStatement;
    }
}
