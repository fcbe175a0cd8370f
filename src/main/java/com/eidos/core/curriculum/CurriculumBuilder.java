package com.eidos.core.curriculum;

import com.eidos.core.config.EidosProperties;
import com.eidos.core.llm.LlmArea;
import com.eidos.core.llm.LlmAreaResult;
import com.eidos.core.llm.LlmAreaService;
import com.eidos.core.metrics.EidosMetrics;
import com.eidos.core.persistence.DistillationTable;
import com.eidos.core.persistence.SchemaRegistry;
import com.eidos.core.persistence.SqliteConnections;
import com.eidos.core.quality.AdvisoryQuality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scans recent active and archived distillations and turns their quality gaps into
 * prioritized question cards.
 */
@Service
public class CurriculumBuilder {

    private static final Logger log = LoggerFactory.getLogger(CurriculumBuilder.class);

    static final double UNIFIED_FLOOR = 0.35;
    static final double UNIFIED_LLM_FLOOR = 0.25;
    static final double ACTIONABILITY_FLOOR = 0.40;
    static final double REASONING_FLOOR = 0.35;
    static final double SPECIFICITY_FLOOR = 0.35;
    static final int EFFECTIVENESS_MIN_USES = 5;
    static final double EFFECTIVENESS_FLOOR = 0.30;
    static final int STATEMENT_PREVIEW_CHARS = 300;

    static final String SUPPRESSED_REASON_PREFIX = "suppressed:";
    static final String BELOW_FLOOR_REASON_PREFIX = "unified_score_below_floor:";

    private final SqliteConnections connections;
    private final LlmAreaService llmAreas;
    private final EidosProperties properties;
    private final EidosMetrics metrics;

    public CurriculumBuilder(SqliteConnections connections, LlmAreaService llmAreas,
                             EidosProperties properties, EidosMetrics metrics) {
        this.connections = connections;
        this.llmAreas = llmAreas;
        this.properties = properties;
        this.metrics = metrics;
    }

    public CurriculumReport build(int maxRows, int maxCards, boolean includeArchive) {
        return build(Path.of(properties.getDbPath()), maxRows, maxCards, includeArchive);
    }

    /**
     * Builds the curriculum for {@code db}. Never throws: a missing or unreadable
     * database produces an empty report with its {@code error} set.
     */
    public CurriculumReport build(Path db, int maxRows, int maxCards, boolean includeArchive) {
        long generatedAt = System.currentTimeMillis() / 1000L;
        String dbPath = db.toString();
        if (!Files.exists(db)) {
            log.warn("Curriculum skipped, database {} does not exist", dbPath);
            return CurriculumReport.failed(generatedAt, dbPath, "db_missing");
        }

        List<DistillationRow> rows = new ArrayList<>();
        try (Connection conn = connections.open(db, true)) {
            DistillationRowReader reader = new DistillationRowReader(conn, new SchemaRegistry(conn));
            rows.addAll(readTable(reader, DistillationTable.ACTIVE, maxRows));
            if (includeArchive) {
                rows.addAll(readTable(reader, DistillationTable.ARCHIVE, maxRows / 2));
            }
        } catch (SQLException e) {
            log.warn("Curriculum could not open {}: {}", dbPath, e.getMessage());
            return CurriculumReport.failed(generatedAt, dbPath, "db_open_failed: " + e.getMessage());
        }

        List<GapCard> cards = new ArrayList<>();
        for (DistillationRow row : rows) {
            cards.addAll(deriveCards(row));
        }
        cards.sort(GapCard.PRIORITY);
        if (cards.size() > Math.max(1, maxCards)) {
            cards = new ArrayList<>(cards.subList(0, Math.max(1, maxCards)));
        }

        Map<String, Integer> gapCounts = new LinkedHashMap<>();
        Map<String, Integer> severityCounts = new LinkedHashMap<>();
        for (GapCard card : cards) {
            gapCounts.merge(card.gap().value(), 1, Integer::sum);
            severityCounts.merge(card.severity().value(), 1, Integer::sum);
            metrics.recordCurriculumCard(card.severity().value());
        }
        CurriculumStats stats = new CurriculumStats(rows.size(), cards.size(), gapCounts, severityCounts);
        log.info("Curriculum built from {} rows: {} cards {}", rows.size(), cards.size(), severityCounts);

        return new CurriculumReport(generatedAt, dbPath, stats, cards,
                summarizeGaps(gapCounts, severityCounts, rows.size()), "");
    }

    private List<DistillationRow> readTable(DistillationRowReader reader, DistillationTable table, int limit) {
        try {
            return reader.readRecent(table, limit);
        } catch (SQLException e) {
            log.warn("Could not read {} for curriculum: {}", table.tableName(), e.getMessage());
            return List.of();
        }
    }

    private String summarizeGaps(Map<String, Integer> gaps, Map<String, Integer> severity, int rowsScanned) {
        LlmAreaResult result = llmAreas.call(LlmArea.CURRICULUM_GAP_SUMMARIZE, "", gaps, severity, rowsScanned);
        return result.usedLlm() && result.hasText() ? result.text() : "";
    }

    /** Gap cards for one row, in rule order. */
    static List<GapCard> deriveCards(DistillationRow row) {
        AdvisoryQuality q = row.quality();
        String reason = row.archiveReason();
        List<GapCard> cards = new ArrayList<>();

        if (q.suppressed() || reason.startsWith(SUPPRESSED_REASON_PREFIX)) {
            cards.add(card(row, GapType.SUPPRESSED_STATEMENT, Severity.HIGH, RecommendedLoop.DETERMINISTIC_THEN_LLM,
                    "Suppressed distillations are currently unusable in advisory retrieval."));
        }
        if (q.unifiedScore() < UNIFIED_FLOOR || reason.startsWith(BELOW_FLOOR_REASON_PREFIX)) {
            RecommendedLoop loop = q.unifiedScore() < UNIFIED_LLM_FLOOR
                    ? RecommendedLoop.DETERMINISTIC_THEN_LLM
                    : RecommendedLoop.DETERMINISTIC_ONLY;
            cards.add(card(row, GapType.LOW_UNIFIED_SCORE, Severity.HIGH, loop,
                    format("Unified score %.2f is below advisory floor.", q.unifiedScore())));
        }
        if (q.actionability() < ACTIONABILITY_FLOOR) {
            cards.add(card(row, GapType.LOW_ACTIONABILITY, Severity.MEDIUM, RecommendedLoop.DETERMINISTIC_ONLY,
                    format("Actionability is low (%.2f).", q.actionability())));
        }
        if (q.reasoning() < REASONING_FLOOR) {
            cards.add(card(row, GapType.LOW_REASONING, Severity.MEDIUM, RecommendedLoop.DETERMINISTIC_THEN_LLM,
                    format("Reasoning is low (%.2f).", q.reasoning())));
        }
        if (q.specificity() < SPECIFICITY_FLOOR) {
            cards.add(card(row, GapType.LOW_SPECIFICITY, Severity.MEDIUM, RecommendedLoop.DETERMINISTIC_ONLY,
                    format("Specificity is low (%.2f).", q.specificity())));
        }
        if (row.timesUsed() >= EFFECTIVENESS_MIN_USES) {
            double effectiveness = (double) row.timesHelped() / Math.max(row.timesUsed(), 1);
            if (effectiveness < EFFECTIVENESS_FLOOR) {
                cards.add(card(row, GapType.LOW_EFFECTIVENESS, Severity.HIGH, RecommendedLoop.DETERMINISTIC_THEN_LLM,
                        format("Usage effectiveness is low (%.2f%%).", effectiveness * 100.0)));
            }
        }
        return cards;
    }

    private static GapCard card(DistillationRow row, GapType gap, Severity severity,
                                RecommendedLoop loop, String why) {
        String source = row.source().tableName();
        String id = row.distillationId().isEmpty() ? "unknown" : row.distillationId();
        String statement = row.effectiveStatement();
        if (statement.length() > STATEMENT_PREVIEW_CHARS) {
            statement = statement.substring(0, STATEMENT_PREVIEW_CHARS);
        }
        return new GapCard(source + ":" + id + ":" + gap.value(), row.distillationId(), row.type(), source,
                gap, severity, loop, statement, why, row.archiveReason());
    }

    private static String format(String pattern, double value) {
        return String.format(Locale.ROOT, pattern, value);
    }
}
