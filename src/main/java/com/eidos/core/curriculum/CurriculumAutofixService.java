package com.eidos.core.curriculum;

import com.eidos.core.config.EidosProperties;
import com.eidos.core.logging.MdcContext;
import com.eidos.core.metrics.EidosMetrics;
import com.eidos.core.model.ContentIds;
import com.eidos.core.persistence.AdaptiveRowWriter;
import com.eidos.core.persistence.DistillationTable;
import com.eidos.core.persistence.JsonColumns;
import com.eidos.core.persistence.SchemaRegistry;
import com.eidos.core.persistence.SqliteConnections;
import com.eidos.core.quality.AdvisoryQuality;
import com.eidos.core.refinement.DistillationRefiner;
import com.eidos.core.refinement.RefinementResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Re-runs refinement over the highest-priority curriculum cards and, when applying,
 * writes the improvements back in a single transaction. Each row's writes sit behind
 * a savepoint so a row that fails part way leaves nothing behind.
 */
@Service
public class CurriculumAutofixService {

    private static final Logger log = LoggerFactory.getLogger(CurriculumAutofixService.class);

    static final int CURRICULUM_ROWS = 300;
    static final int MIN_CURRICULUM_CARDS = 20;
    static final int CARDS_PER_TARGET = 6;
    static final double REFINE_MIN_UNIFIED = 0.60;
    static final String REFINE_SOURCE = "eidos";

    /** Suppression, unified score, then combined sub-scores. No length term. */
    static final Comparator<AdvisoryQuality> AUTOFIX_RANK = Comparator
            .comparing((AdvisoryQuality q) -> !q.suppressed())
            .thenComparingDouble(AdvisoryQuality::unifiedScore)
            .thenComparingDouble(AdvisoryQuality::combinedScore);

    private final CurriculumBuilder curriculumBuilder;
    private final DistillationRefiner refiner;
    private final SqliteConnections connections;
    private final EidosProperties properties;
    private final EidosMetrics metrics;

    public CurriculumAutofixService(CurriculumBuilder curriculumBuilder, DistillationRefiner refiner,
                                    SqliteConnections connections, EidosProperties properties,
                                    EidosMetrics metrics) {
        this.curriculumBuilder = curriculumBuilder;
        this.refiner = refiner;
        this.connections = connections;
        this.properties = properties;
        this.metrics = metrics;
    }

    public AutofixReport run(AutofixOptions options) {
        return run(Path.of(properties.getDbPath()), options);
    }

    /**
     * Runs one batch. Never throws; resource failures are reported in the report's
     * {@code error} and a failed commit leaves the database untouched.
     */
    public AutofixReport run(Path db, AutofixOptions options) {
        long ts = System.currentTimeMillis() / 1000L;
        String dbPath = db.toString();
        if (!Files.exists(db)) {
            return AutofixReport.failed(ts, dbPath, options, 0, "db_missing");
        }

        CurriculumReport curriculum = curriculumBuilder.build(db, CURRICULUM_ROWS,
                Math.max(MIN_CURRICULUM_CARDS, options.maxCards() * CARDS_PER_TARGET), options.includeArchive());
        if (curriculum.hasError()) {
            return AutofixReport.failed(ts, dbPath, options, 0, curriculum.error());
        }
        List<Target> ordered = targets(curriculum.cards(), options.includeArchive());
        List<Target> targets = ordered.subList(0, Math.min(ordered.size(), options.maxCards()));

        String batchId = ContentIds.generate("autofix:" + dbPath, ContentIds.now());
        MdcContext.setBatch(batchId);
        long started = System.nanoTime();
        log.info("Autofix batch {} starting: {} of {} candidates, apply={}",
                batchId, targets.size(), ordered.size(), options.apply());
        try (Connection conn = connections.open(db, !options.apply())) {
            if (options.apply()) {
                conn.setAutoCommit(false);
            }
            SchemaRegistry schemas = new SchemaRegistry(conn);
            Batch batch = new Batch(conn, new DistillationRowReader(conn, schemas), new AdaptiveRowWriter(conn, schemas),
                    options);
            for (Target target : targets) {
                MdcContext.setDistillation(target.distillationId());
                try {
                    batch.process(target);
                } finally {
                    MdcContext.clearDistillation();
                }
            }

            boolean committed = false;
            String error = "";
            if (options.apply() && batch.rollbackOnly) {
                log.error("Autofix batch {} left a row half-written, rolling back", batchId);
                rollback(conn);
                error = "rollback_failed: batch abandoned";
            } else if (options.apply()) {
                try {
                    conn.commit();
                    committed = true;
                } catch (SQLException e) {
                    log.error("Autofix batch {} failed to commit, rolling back", batchId, e);
                    rollback(conn);
                    error = "commit_failed: " + e.getMessage();
                }
            }
            AutofixReport report = new AutofixReport(ts, dbPath, options, ordered.size(),
                    batch.attempted, committed ? batch.updated : 0,
                    batch.archiveAttempted, committed ? batch.archiveUpdated : 0,
                    committed ? batch.archivePromoted : 0,
                    batch.suppressedAttempted > 0 ? (double) batch.suppressedRecovered / batch.suppressedAttempted : 0.0,
                    committed, error, batch.rows);
            log.info("Autofix batch {} done: attempted={} updated={} archive_promoted={} stagnation={}",
                    batchId, report.attempted(), report.updated(), report.archivePromoted(),
                    report.archiveStagnationDetected());
            return report;
        } catch (SQLException e) {
            log.warn("Autofix could not open {}: {}", dbPath, e.getMessage());
            return AutofixReport.failed(ts, dbPath, options, ordered.size(), "db_open_failed: " + e.getMessage());
        } finally {
            metrics.recordAutofixDuration((System.nanoTime() - started) / 1_000_000L, options.apply());
            MdcContext.clear();
        }
    }

    /**
     * Distinct (table, id) pairs in card priority order. Archive cards are dropped
     * unless {@code includeArchive} is set.
     */
    static List<Target> targets(List<GapCard> cards, boolean includeArchive) {
        Set<Target> seen = new LinkedHashSet<>();
        for (GapCard card : cards) {
            Optional<DistillationTable> table = DistillationTable.fromTableName(card.source().strip());
            String id = card.distillationId().strip();
            if (table.isEmpty() || id.isEmpty()) continue;
            if (table.get() == DistillationTable.ARCHIVE && !includeArchive) continue;
            seen.add(new Target(table.get(), id));
        }
        return new ArrayList<>(seen);
    }

    /**
     * True if {@code updated} ranks strictly higher without losing unified score, or
     * if the unified score alone rose by at least {@code minGain}.
     */
    static boolean isImproved(AdvisoryQuality old, AdvisoryQuality updated, double minGain) {
        if (AUTOFIX_RANK.compare(updated, old) > 0 && updated.unifiedScore() >= old.unifiedScore()) {
            return true;
        }
        return updated.unifiedScore() - old.unifiedScore() >= Math.max(0.0, minGain);
    }

    private static void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }

    record Target(DistillationTable table, String distillationId) {}

    /** Mutable state of one running batch. */
    private final class Batch {

        private final Connection conn;
        private final DistillationRowReader reader;
        private final AdaptiveRowWriter writer;
        private final AutofixOptions options;
        private final List<AutofixRow> rows = new ArrayList<>();

        private int attempted;
        private int updated;
        private int archiveAttempted;
        private int archiveUpdated;
        private int archivePromoted;
        private int suppressedAttempted;
        private int suppressedRecovered;
        private boolean rollbackOnly;

        Batch(Connection conn, DistillationRowReader reader, AdaptiveRowWriter writer, AutofixOptions options) {
            this.conn = conn;
            this.reader = reader;
            this.writer = writer;
            this.options = options;
        }

        void process(Target target) {
            Optional<DistillationRow> loaded;
            try {
                loaded = reader.readOne(target.table(), target.distillationId());
            } catch (SQLException e) {
                log.warn("Could not load {} from {}: {}", target.distillationId(),
                        target.table().tableName(), e.getMessage());
                record(target, AdvisoryQuality.empty(), AdvisoryQuality.empty(), false, AutofixAction.NOOP,
                        "read_failed: " + e.getMessage());
                return;
            }
            if (loaded.isEmpty()) {
                return;
            }
            DistillationRow row = loaded.get();
            String statement = row.statement().strip();
            String refined = row.refinedStatement().strip();
            String input = refined.isEmpty() ? statement : refined;
            if (input.isEmpty()) {
                return;
            }

            AdvisoryQuality oldQ = row.quality();
            RefinementResult result = refine(target, input, oldQ);
            AdvisoryQuality newQ = result.quality();
            String newText = result.text().strip();
            boolean changedText = !newText.isEmpty() && !newText.equals(input);

            if (oldQ.suppressed()) {
                suppressedAttempted++;
                if (!newQ.suppressed()) {
                    suppressedRecovered++;
                }
            }

            AutofixAction action = AutofixAction.NOOP;
            String error = "";
            if (isImproved(oldQ, newQ, options.minGain())) {
                action = AutofixAction.IMPROVED;
                if (options.apply()) {
                    Savepoint savepoint = null;
                    try {
                        savepoint = conn.setSavepoint();
                        WriteOutcome written = write(target, statement, newText, oldQ, newQ);
                        conn.releaseSavepoint(savepoint);
                        action = written.action();
                        newQ = written.quality();
                        count(target, written);
                    } catch (SQLException e) {
                        log.warn("Could not write {} to {}: {}", target.distillationId(),
                                target.table().tableName(), e.getMessage());
                        rollbackRow(savepoint);
                        action = AutofixAction.FAILED;
                        newQ = oldQ;
                        error = "write_failed: " + e.getMessage();
                    }
                }
            }
            log.debug("Autofix {} {}: {} -> {} ({})", target.table().tableName(), target.distillationId(),
                    oldQ.unifiedScore(), newQ.unifiedScore(), action.value());

            attempted++;
            if (target.table() == DistillationTable.ARCHIVE) {
                archiveAttempted++;
            }
            record(target, oldQ, newQ, changedText, action, error);
        }

        private RefinementResult refine(Target target, String input, AdvisoryQuality oldQ) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("curriculum_autofix", true);
            context.put("distillation_id", target.distillationId());
            context.put("source", target.table().tableName());
            RefinementResult first = refiner.refine(input, REFINE_SOURCE, context, REFINE_MIN_UNIFIED);
            if (target.table() != DistillationTable.ARCHIVE || !options.archiveFallbackLlm()) {
                return first;
            }
            double gain = first.quality().unifiedScore() - oldQ.unifiedScore();
            if (!first.quality().suppressed() && gain >= options.minGain()) {
                return first;
            }
            Map<String, Object> fallbackContext = new LinkedHashMap<>(context);
            fallbackContext.put("archive_fallback_pass", true);
            String seed = first.text().isBlank() ? input : first.text().strip();
            RefinementResult second = refiner.refine(seed, REFINE_SOURCE, fallbackContext, REFINE_MIN_UNIFIED);
            return AUTOFIX_RANK.compare(second.quality(), first.quality()) > 0 ? second : first;
        }

        /** Row writes only; counters are applied by the caller once every write has succeeded. */
        private WriteOutcome write(Target target, String statement, String newText,
                                   AdvisoryQuality oldQ, AdvisoryQuality newQ) throws SQLException {
            boolean archive = target.table() == DistillationTable.ARCHIVE;
            String qualityJson = JsonColumns.write(newQ.toMap());

            boolean persisted = writer.persistRefinement(target.table(), target.distillationId(), statement,
                    newText, qualityJson);
            AutofixAction action = persisted ? AutofixAction.UPDATED : AutofixAction.IMPROVED;

            boolean notRegressed = !newQ.suppressed() && newQ.combinedScore() >= oldQ.combinedScore();
            boolean promoteCandidate = archive && options.promoteOnSuccess() && notRegressed
                    && newQ.unifiedScore() >= options.promoteMinUnified();
            if (promoteCandidate) {
                boolean promoted = writer.promoteArchiveRow(target.distillationId(), newText, qualityJson);
                return new WriteOutcome(promoted ? AutofixAction.PROMOTED : action, newQ, persisted, promoted);
            }

            boolean softCandidate = archive && options.softPromoteOnSuccess() && notRegressed
                    && newQ.unifiedScore() >= options.softPromoteMinUnified();
            if (softCandidate) {
                AdvisoryQuality soft = newQ.withSoftPromoted(true);
                if (writer.persistRefinement(target.table(), target.distillationId(), statement, newText,
                        JsonColumns.write(soft.toMap()))) {
                    return new WriteOutcome(AutofixAction.SOFT_PROMOTED, soft, persisted, false);
                }
            }
            return new WriteOutcome(action, newQ, persisted, false);
        }

        private void count(Target target, WriteOutcome written) {
            boolean archive = target.table() == DistillationTable.ARCHIVE;
            if (written.persisted()) {
                updated++;
                if (archive) {
                    archiveUpdated++;
                }
            }
            if (written.promoted()) {
                archivePromoted++;
            }
        }

        /**
         * Undoes a failed row. If even that fails the batch can no longer be committed
         * safely, so the whole transaction is marked for rollback.
         */
        private void rollbackRow(Savepoint savepoint) {
            if (savepoint == null) {
                return;
            }
            try {
                conn.rollback(savepoint);
                conn.releaseSavepoint(savepoint);
            } catch (SQLException e) {
                log.error("Could not roll back row writes, abandoning batch: {}", e.getMessage());
                rollbackOnly = true;
            }
        }

        private void record(Target target, AdvisoryQuality oldQ, AdvisoryQuality newQ, boolean changedText,
                            AutofixAction action, String error) {
            rows.add(new AutofixRow(target.distillationId(), target.table().tableName(),
                    oldQ.unifiedScore(), newQ.unifiedScore(), oldQ.suppressed(), newQ.suppressed(),
                    changedText, action, error));
            metrics.recordAutofixRow(action.value());
        }
    }

    private record WriteOutcome(AutofixAction action, AdvisoryQuality quality, boolean persisted, boolean promoted) {}
}
