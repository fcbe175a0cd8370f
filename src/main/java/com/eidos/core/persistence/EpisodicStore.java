package com.eidos.core.persistence;

import com.eidos.core.model.ActionType;
import com.eidos.core.model.Budget;
import com.eidos.core.model.Distillation;
import com.eidos.core.model.DistillationType;
import com.eidos.core.model.Episode;
import com.eidos.core.model.Evaluation;
import com.eidos.core.model.Outcome;
import com.eidos.core.model.Phase;
import com.eidos.core.model.Policy;
import com.eidos.core.model.PolicyScope;
import com.eidos.core.model.PolicySource;
import com.eidos.core.model.Step;
import com.eidos.core.model.ContentIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * SQLite persistence for episodes, steps, distillations and policies.
 * <p>
 * Every save is a single {@code INSERT OR REPLACE} keyed by the entity id, so re-saving
 * fully replaces the row. Each call uses its own short-lived connection. Lookups log and
 * return an empty result on failure; saves raise {@link StoreException}.
 * <p>
 * The {@code refined_statement} and {@code advisory_quality} distillation columns are only
 * read or written after {@link TableSchema} confirms them, since older databases lack them.
 */
public class EpisodicStore {

    private static final Logger log = LoggerFactory.getLogger(EpisodicStore.class);

    public static final double HIGH_CONFIDENCE = 0.7;

    private static final List<String> SCHEMA_SQL = List.of(
            """
            CREATE TABLE IF NOT EXISTS episodes (
                episode_id TEXT PRIMARY KEY,
                goal TEXT NOT NULL,
                success_criteria TEXT,
                constraints TEXT,
                budget_max_steps INTEGER DEFAULT 25,
                budget_max_time_seconds INTEGER DEFAULT 720,
                budget_max_retries INTEGER DEFAULT 3,
                phase TEXT DEFAULT 'explore',
                outcome TEXT DEFAULT 'in_progress',
                final_evaluation TEXT,
                start_ts REAL,
                end_ts REAL,
                step_count INTEGER DEFAULT 0,
                error_counts TEXT
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS steps (
                step_id TEXT PRIMARY KEY,
                episode_id TEXT REFERENCES episodes(episode_id),
                intent TEXT NOT NULL,
                decision TEXT NOT NULL,
                alternatives TEXT,
                assumptions TEXT,
                prediction TEXT,
                confidence_before REAL DEFAULT 0.5,
                action_type TEXT DEFAULT 'reasoning',
                action_details TEXT,
                result TEXT,
                evaluation TEXT DEFAULT 'unknown',
                surprise_level REAL DEFAULT 0.0,
                lesson TEXT,
                confidence_after REAL DEFAULT 0.5,
                retrieved_memories TEXT,
                memory_cited INTEGER DEFAULT 0,
                memory_useful INTEGER,
                validated INTEGER DEFAULT 0,
                validation_method TEXT,
                created_at REAL DEFAULT (strftime('%s', 'now'))
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS distillations (
                distillation_id TEXT PRIMARY KEY,
                type TEXT NOT NULL,
                statement TEXT NOT NULL,
                domains TEXT,
                triggers TEXT,
                anti_triggers TEXT,
                source_steps TEXT,
                validation_count INTEGER DEFAULT 0,
                contradiction_count INTEGER DEFAULT 0,
                confidence REAL DEFAULT 0.5,
                times_retrieved INTEGER DEFAULT 0,
                times_used INTEGER DEFAULT 0,
                times_helped INTEGER DEFAULT 0,
                created_at REAL DEFAULT (strftime('%s', 'now')),
                revalidate_by REAL,
                refined_statement TEXT,
                advisory_quality TEXT
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS distillations_archive (
                distillation_id TEXT PRIMARY KEY,
                type TEXT NOT NULL,
                statement TEXT NOT NULL,
                domains TEXT,
                triggers TEXT,
                anti_triggers TEXT,
                source_steps TEXT,
                validation_count INTEGER DEFAULT 0,
                contradiction_count INTEGER DEFAULT 0,
                confidence REAL DEFAULT 0.5,
                times_retrieved INTEGER DEFAULT 0,
                times_used INTEGER DEFAULT 0,
                times_helped INTEGER DEFAULT 0,
                created_at REAL DEFAULT (strftime('%s', 'now')),
                revalidate_by REAL,
                refined_statement TEXT,
                advisory_quality TEXT,
                archive_reason TEXT,
                archived_at REAL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS policies (
                policy_id TEXT PRIMARY KEY,
                statement TEXT NOT NULL,
                scope TEXT DEFAULT 'GLOBAL',
                priority INTEGER DEFAULT 50,
                source TEXT DEFAULT 'INFERRED',
                created_at REAL DEFAULT (strftime('%s', 'now'))
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_steps_episode ON steps(episode_id)",
            "CREATE INDEX IF NOT EXISTS idx_steps_created ON steps(created_at DESC)",
            "CREATE INDEX IF NOT EXISTS idx_distillations_type ON distillations(type)",
            "CREATE INDEX IF NOT EXISTS idx_distillations_confidence ON distillations(confidence DESC)",
            "CREATE INDEX IF NOT EXISTS idx_policies_scope ON policies(scope)",
            "CREATE INDEX IF NOT EXISTS idx_policies_priority ON policies(priority DESC)"
    );

    private static final String UPSERT_EPISODE_SQL = """
            INSERT OR REPLACE INTO episodes (
                episode_id, goal, success_criteria, constraints,
                budget_max_steps, budget_max_time_seconds, budget_max_retries,
                phase, outcome, final_evaluation, start_ts, end_ts,
                step_count, error_counts
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String UPSERT_STEP_SQL = """
            INSERT OR REPLACE INTO steps (
                step_id, episode_id, intent, decision, alternatives, assumptions,
                prediction, confidence_before, action_type, action_details,
                result, evaluation, surprise_level, lesson, confidence_after,
                retrieved_memories, memory_cited, memory_useful,
                validated, validation_method, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String UPSERT_POLICY_SQL = """
            INSERT OR REPLACE INTO policies (
                policy_id, statement, scope, priority, source, created_at
            ) VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final List<String> DISTILLATION_COLUMNS = List.of(
            "distillation_id", "type", "statement", "domains", "triggers", "anti_triggers",
            "source_steps", "validation_count", "contradiction_count", "confidence",
            "times_retrieved", "times_used", "times_helped", "created_at", "revalidate_by");

    private final DataSource dataSource;
    private final String dbPath;

    public EpisodicStore(DataSource dataSource, String dbPath) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.dbPath = dbPath;
    }

    /**
     * Creates the tables and indexes if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String ddl : SCHEMA_SQL) {
                stmt.execute(ddl);
            }
            log.info("EIDOS schema ensured at {}", dbPath);
        } catch (SQLException e) {
            throw new StoreException("Failed to create EIDOS schema at " + dbPath, e);
        }
    }

    public String getDbPath() {
        return dbPath;
    }

    // ── Episodes ────────────────────────────────────────────────────

    public String saveEpisode(Episode episode) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_EPISODE_SQL)) {
            Budget budget = episode.getBudget();
            stmt.setString(1, episode.getEpisodeId());
            stmt.setString(2, episode.getGoal());
            stmt.setString(3, episode.getSuccessCriteria());
            stmt.setString(4, JsonColumns.write(episode.getConstraints()));
            stmt.setInt(5, budget.maxSteps());
            stmt.setInt(6, budget.maxTimeSeconds());
            stmt.setInt(7, budget.maxRetriesPerError());
            stmt.setString(8, episode.getPhase().value());
            stmt.setString(9, episode.getOutcome().value());
            stmt.setString(10, episode.getFinalEvaluation());
            stmt.setDouble(11, episode.getStartTs());
            setNullableDouble(stmt, 12, episode.getEndTs());
            stmt.setInt(13, episode.getStepCount());
            stmt.setString(14, JsonColumns.write(episode.getErrorCounts()));
            stmt.executeUpdate();
            return episode.getEpisodeId();
        } catch (SQLException e) {
            throw new StoreException("Failed to save episode " + episode.getEpisodeId(), e);
        }
    }

    public Optional<Episode> getEpisode(String episodeId) {
        List<Episode> found = queryEpisodes("SELECT * FROM episodes WHERE episode_id = ?", episodeId);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public List<Episode> getRecentEpisodes(int limit) {
        return queryEpisodes("SELECT * FROM episodes ORDER BY start_ts DESC LIMIT ?", limit);
    }

    private List<Episode> queryEpisodes(String sql, Object... params) {
        List<Episode> episodes = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, sql, params);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                episodes.add(toEpisode(rs));
            }
        } catch (SQLException e) {
            log.error("Episode query failed: {}", sql.strip(), e);
        }
        return episodes;
    }

    private Episode toEpisode(ResultSet rs) throws SQLException {
        Budget budget = new Budget(
                intOr(rs, "budget_max_steps", Budget.DEFAULT_MAX_STEPS),
                intOr(rs, "budget_max_time_seconds", Budget.DEFAULT_MAX_TIME_SECONDS),
                intOr(rs, "budget_max_retries", Budget.DEFAULT_MAX_RETRIES_PER_ERROR));
        Episode episode = new Episode(
                rs.getString("episode_id"),
                rs.getString("goal"),
                nullToEmpty(rs.getString("success_criteria")),
                budget,
                rs.getDouble("start_ts"));
        episode.setConstraints(JsonColumns.readList(rs.getString("constraints")));
        episode.setPhase(Phase.fromValue(rs.getString("phase")));
        episode.setOutcome(Outcome.fromValue(rs.getString("outcome")));
        episode.setFinalEvaluation(nullToEmpty(rs.getString("final_evaluation")));
        episode.setEndTs(nullableDouble(rs, "end_ts"));
        episode.setStepCount(rs.getInt("step_count"));
        episode.getErrorCounts().putAll(JsonColumns.readCounts(rs.getString("error_counts")));
        return episode;
    }

    // ── Steps ───────────────────────────────────────────────────────

    public String saveStep(Step step) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_STEP_SQL)) {
            stmt.setString(1, step.getStepId());
            stmt.setString(2, step.getEpisodeId());
            stmt.setString(3, step.getIntent());
            stmt.setString(4, step.getDecision());
            stmt.setString(5, JsonColumns.write(step.getAlternatives()));
            stmt.setString(6, JsonColumns.write(step.getAssumptions()));
            stmt.setString(7, step.getPrediction());
            stmt.setDouble(8, step.getConfidenceBefore());
            stmt.setString(9, step.getActionType().value());
            stmt.setString(10, JsonColumns.write(step.getActionDetails()));
            stmt.setString(11, step.getResult());
            stmt.setString(12, step.getEvaluation().value());
            stmt.setDouble(13, step.getSurpriseLevel());
            stmt.setString(14, step.getLesson());
            stmt.setDouble(15, step.getConfidenceAfter());
            stmt.setString(16, JsonColumns.write(step.getRetrievedMemories()));
            stmt.setInt(17, step.isMemoryCited() ? 1 : 0);
            if (step.getMemoryUseful() == null) {
                stmt.setNull(18, Types.INTEGER);
            } else {
                stmt.setInt(18, step.getMemoryUseful() ? 1 : 0);
            }
            stmt.setInt(19, step.isValidated() ? 1 : 0);
            stmt.setString(20, step.getValidationMethod());
            stmt.setDouble(21, step.getCreatedAt());
            stmt.executeUpdate();
            return step.getStepId();
        } catch (SQLException e) {
            throw new StoreException("Failed to save step " + step.getStepId(), e);
        }
    }

    public Optional<Step> getStep(String stepId) {
        List<Step> found = querySteps("SELECT * FROM steps WHERE step_id = ?", stepId);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    /** Steps of one episode, oldest first. */
    public List<Step> getEpisodeSteps(String episodeId) {
        return querySteps("SELECT * FROM steps WHERE episode_id = ? ORDER BY created_at", episodeId);
    }

    public List<Step> getRecentSteps(int limit) {
        return querySteps("SELECT * FROM steps ORDER BY created_at DESC LIMIT ?", limit);
    }

    private List<Step> querySteps(String sql, Object... params) {
        List<Step> steps = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, sql, params);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                steps.add(toStep(rs));
            }
        } catch (SQLException e) {
            log.error("Step query failed: {}", sql.strip(), e);
        }
        return steps;
    }

    private Step toStep(ResultSet rs) throws SQLException {
        Step step = new Step(
                rs.getString("step_id"),
                rs.getString("episode_id"),
                rs.getString("intent"),
                rs.getString("decision"),
                rs.getDouble("created_at"));
        step.setAlternatives(JsonColumns.readList(rs.getString("alternatives")));
        step.setAssumptions(JsonColumns.readList(rs.getString("assumptions")));
        step.setPrediction(rs.getString("prediction"));
        step.setConfidenceBefore(doubleOr(rs, "confidence_before", 0.5));
        step.setActionType(ActionType.fromValue(rs.getString("action_type")));
        step.setActionDetails(JsonColumns.readMap(rs.getString("action_details")));
        step.setResult(rs.getString("result"));
        step.setEvaluation(Evaluation.fromValue(rs.getString("evaluation")));
        step.setSurpriseLevel(doubleOr(rs, "surprise_level", 0.0));
        step.setLesson(rs.getString("lesson"));
        step.setConfidenceAfter(doubleOr(rs, "confidence_after", 0.5));
        step.setRetrievedMemories(JsonColumns.readList(rs.getString("retrieved_memories")));
        step.setMemoryCited(rs.getInt("memory_cited") != 0);
        Object useful = rs.getObject("memory_useful");
        step.setMemoryUseful(useful instanceof Number n ? n.intValue() != 0 : null);
        step.setValidated(rs.getInt("validated") != 0);
        step.setValidationMethod(rs.getString("validation_method"));
        return step;
    }

    // ── Distillations ───────────────────────────────────────────────

    public String saveDistillation(Distillation distillation) {
        try (Connection conn = dataSource.getConnection()) {
            SchemaRegistry schemas = new SchemaRegistry(conn);
            writeDistillation(conn, schemas.schema(DistillationTable.ACTIVE), distillation, null);
            return distillation.getDistillationId();
        } catch (SQLException e) {
            throw new StoreException("Failed to save distillation " + distillation.getDistillationId(), e);
        }
    }

    public Optional<Distillation> getDistillation(String distillationId) {
        List<Distillation> found = queryDistillations(DistillationTable.ACTIVE,
                "SELECT * FROM distillations WHERE distillation_id = ?", distillationId);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public List<Distillation> getDistillationsByType(DistillationType type, int limit) {
        return queryDistillations(DistillationTable.ACTIVE,
                "SELECT * FROM distillations WHERE type = ? ORDER BY confidence DESC LIMIT ?",
                type.value(), limit);
    }

    public List<Distillation> getHighConfidenceDistillations(double minConfidence, int limit) {
        return queryDistillations(DistillationTable.ACTIVE,
                "SELECT * FROM distillations WHERE confidence >= ? ORDER BY confidence DESC LIMIT ?",
                minConfidence, limit);
    }

    public List<Distillation> getDistillationsForRevalidation() {
        return getDistillationsForRevalidation(ContentIds.now());
    }

    /** All rows whose {@code revalidate_by} is at or before {@code now}. */
    public List<Distillation> getDistillationsForRevalidation(double now) {
        return queryDistillations(DistillationTable.ACTIVE,
                "SELECT * FROM distillations WHERE revalidate_by IS NOT NULL AND revalidate_by <= ?",
                now);
    }

    /**
     * Moves a distillation into {@code distillations_archive} with the given reason,
     * removing it from the active table in the same transaction.
     */
    public void archiveDistillation(Distillation distillation, String reason) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                SchemaRegistry schemas = new SchemaRegistry(conn);
                TableSchema archive = schemas.schema(DistillationTable.ARCHIVE);
                if (!archive.exists()) {
                    throw new SQLException("distillations_archive table is missing");
                }
                writeDistillation(conn, archive, distillation, reason);
                try (PreparedStatement del = conn.prepareStatement(
                        "DELETE FROM distillations WHERE distillation_id = ?")) {
                    del.setString(1, distillation.getDistillationId());
                    del.executeUpdate();
                }
                conn.commit();
                log.info("Archived distillation {} ({})", distillation.getDistillationId(), reason);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to archive distillation " + distillation.getDistillationId(), e);
        }
    }

    public Optional<Distillation> getArchivedDistillation(String distillationId) {
        List<Distillation> found = queryDistillations(DistillationTable.ARCHIVE,
                "SELECT * FROM distillations_archive WHERE distillation_id = ? ORDER BY rowid DESC LIMIT 1",
                distillationId);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    private void writeDistillation(Connection conn, TableSchema schema, Distillation d,
                                   String archiveReason) throws SQLException {
        List<String> columns = new ArrayList<>(DISTILLATION_COLUMNS);
        List<Object> values = new ArrayList<>(List.of(
                d.getDistillationId(),
                d.getType().value(),
                d.getStatement(),
                JsonColumns.write(d.getDomains()),
                JsonColumns.write(d.getTriggers()),
                JsonColumns.write(d.getAntiTriggers()),
                JsonColumns.write(d.getSourceSteps()),
                d.getValidationCount(),
                d.getContradictionCount(),
                d.getConfidence(),
                d.getTimesRetrieved(),
                d.getTimesUsed(),
                d.getTimesHelped(),
                d.getCreatedAt()));
        values.add(d.getRevalidateBy());
        if (schema.has(OptionalColumn.REFINED_STATEMENT)) {
            columns.add(OptionalColumn.REFINED_STATEMENT.columnName());
            values.add(d.getRefinedStatement());
        }
        if (schema.has(OptionalColumn.ADVISORY_QUALITY)) {
            columns.add(OptionalColumn.ADVISORY_QUALITY.columnName());
            values.add(d.getAdvisoryQuality().isEmpty() ? null : JsonColumns.write(d.getAdvisoryQuality()));
        }
        if (archiveReason != null && schema.hasColumn("archive_reason")) {
            columns.add("archive_reason");
            values.add(archiveReason);
        }
        if (archiveReason != null && schema.hasColumn("archived_at")) {
            columns.add("archived_at");
            values.add(ContentIds.now());
        }

        StringJoiner names = new StringJoiner(", ");
        StringJoiner marks = new StringJoiner(", ");
        columns.forEach(c -> {
            names.add(c);
            marks.add("?");
        });
        String sql = "INSERT OR REPLACE INTO " + schema.table() + " (" + names + ") VALUES (" + marks + ")";
        try (PreparedStatement stmt = prepare(conn, sql, values.toArray())) {
            stmt.executeUpdate();
        }
    }

    private List<Distillation> queryDistillations(DistillationTable table, String sql, Object... params) {
        List<Distillation> out = new ArrayList<>();
        try (Connection conn = dataSource.getConnection()) {
            TableSchema schema = new SchemaRegistry(conn).schema(table);
            if (!schema.exists()) {
                return out;
            }
            try (PreparedStatement stmt = prepare(conn, sql, params);
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    out.add(toDistillation(rs, schema));
                }
            }
        } catch (SQLException e) {
            log.error("Distillation query failed: {}", sql.strip(), e);
        }
        return out;
    }

    private Distillation toDistillation(ResultSet rs, TableSchema schema) throws SQLException {
        Distillation d = new Distillation(
                rs.getString("distillation_id"),
                DistillationType.fromValue(rs.getString("type")),
                rs.getString("statement"),
                rs.getDouble("created_at"));
        d.setDomains(JsonColumns.readList(rs.getString("domains")));
        d.setTriggers(JsonColumns.readList(rs.getString("triggers")));
        d.setAntiTriggers(JsonColumns.readList(rs.getString("anti_triggers")));
        d.setSourceSteps(JsonColumns.readList(rs.getString("source_steps")));
        d.setValidationCount(rs.getInt("validation_count"));
        d.setContradictionCount(rs.getInt("contradiction_count"));
        d.setConfidence(doubleOr(rs, "confidence", 0.5));
        d.setTimesRetrieved(rs.getInt("times_retrieved"));
        d.setTimesUsed(rs.getInt("times_used"));
        d.setTimesHelped(rs.getInt("times_helped"));
        d.setRevalidateBy(nullableDouble(rs, "revalidate_by"));
        if (schema.has(OptionalColumn.REFINED_STATEMENT)) {
            d.setRefinedStatement(rs.getString(OptionalColumn.REFINED_STATEMENT.columnName()));
        }
        if (schema.has(OptionalColumn.ADVISORY_QUALITY)) {
            d.setAdvisoryQuality(JsonColumns.readMap(rs.getString(OptionalColumn.ADVISORY_QUALITY.columnName())));
        }
        return d;
    }

    // ── Policies ────────────────────────────────────────────────────

    public String savePolicy(Policy policy) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_POLICY_SQL)) {
            stmt.setString(1, policy.policyId());
            stmt.setString(2, policy.statement());
            stmt.setString(3, policy.scope().name());
            stmt.setInt(4, policy.priority());
            stmt.setString(5, policy.source().name());
            stmt.setDouble(6, policy.createdAt());
            stmt.executeUpdate();
            return policy.policyId();
        } catch (SQLException e) {
            throw new StoreException("Failed to save policy " + policy.policyId(), e);
        }
    }

    public Optional<Policy> getPolicy(String policyId) {
        List<Policy> found = queryPolicies("SELECT * FROM policies WHERE policy_id = ?", policyId);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public List<Policy> getPoliciesByScope(PolicyScope scope, int limit) {
        return queryPolicies("SELECT * FROM policies WHERE scope = ? ORDER BY priority DESC LIMIT ?",
                scope.name(), limit);
    }

    public List<Policy> getAllPolicies() {
        return queryPolicies("SELECT * FROM policies ORDER BY priority DESC");
    }

    private List<Policy> queryPolicies(String sql, Object... params) {
        List<Policy> policies = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, sql, params);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                policies.add(new Policy(
                        rs.getString("policy_id"),
                        rs.getString("statement"),
                        PolicyScope.fromValue(rs.getString("scope")),
                        intOr(rs, "priority", Policy.DEFAULT_PRIORITY),
                        PolicySource.fromValue(rs.getString("source")),
                        rs.getDouble("created_at")));
            }
        } catch (SQLException e) {
            log.error("Policy query failed: {}", sql.strip(), e);
        }
        return policies;
    }

    // ── Statistics ──────────────────────────────────────────────────

    public StoreStats getStats() {
        try (Connection conn = dataSource.getConnection()) {
            int episodes = count(conn, "SELECT COUNT(*) FROM episodes");
            int successes = count(conn, "SELECT COUNT(*) FROM episodes WHERE outcome = 'success'");
            int archived = new SchemaRegistry(conn).schema(DistillationTable.ARCHIVE).exists()
                    ? count(conn, "SELECT COUNT(*) FROM distillations_archive")
                    : 0;
            return new StoreStats(
                    episodes,
                    count(conn, "SELECT COUNT(*) FROM steps"),
                    count(conn, "SELECT COUNT(*) FROM distillations"),
                    count(conn, "SELECT COUNT(*) FROM policies"),
                    archived,
                    episodes > 0 ? (double) successes / episodes : 0.0,
                    count(conn, "SELECT COUNT(*) FROM distillations WHERE confidence >= " + HIGH_CONFIDENCE),
                    dbPath);
        } catch (SQLException e) {
            log.error("Failed to compute store stats for {}", dbPath, e);
            return new StoreStats(0, 0, 0, 0, 0, 0.0, 0, dbPath);
        }
    }

    private static int count(Connection conn, String sql) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    // ── JDBC helpers ────────────────────────────────────────────────

    static PreparedStatement prepare(Connection conn, String sql, Object... params) throws SQLException {
        PreparedStatement stmt = conn.prepareStatement(sql);
        try {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            return stmt;
        } catch (SQLException e) {
            stmt.close();
            throw e;
        }
    }

    private static void setNullableDouble(PreparedStatement stmt, int index, Double value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.REAL);
        } else {
            stmt.setDouble(index, value);
        }
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        Object v = rs.getObject(column);
        return v instanceof Number n ? n.doubleValue() : null;
    }

    private static double doubleOr(ResultSet rs, String column, double fallback) throws SQLException {
        Double v = nullableDouble(rs, column);
        return v == null ? fallback : v;
    }

    private static int intOr(ResultSet rs, String column, int fallback) throws SQLException {
        Object v = rs.getObject(column);
        return v instanceof Number n ? n.intValue() : fallback;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
