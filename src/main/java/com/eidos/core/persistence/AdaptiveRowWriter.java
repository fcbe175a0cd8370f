package com.eidos.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Writes refinement results into whatever distillation schema the connected database
 * actually has. Every column written is first confirmed through {@link SchemaRegistry};
 * nothing here commits, so callers control the transaction.
 */
public class AdaptiveRowWriter {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveRowWriter.class);

    static final String ID_COLUMN = "distillation_id";
    private static final int SQLITE_CONSTRAINT = 19;

    private final Connection connection;
    private final SchemaRegistry schemas;

    public AdaptiveRowWriter(Connection connection, SchemaRegistry schemas) {
        this.connection = connection;
        this.schemas = schemas;
    }

    /**
     * Updates {@code refined_statement} and {@code advisory_quality} in place, each only if
     * the table has it. A refined text equal to {@code statement} is stored as empty.
     *
     * @return false when the table or its id column is missing or neither optional column exists
     */
    public boolean persistRefinement(DistillationTable table, String distillationId, String statement,
                                     String refinedText, String qualityJson) throws SQLException {
        TableSchema schema = schemas.schema(table);
        if (!schema.exists() || !schema.hasColumn(ID_COLUMN)) {
            return false;
        }
        Map<String, Object> sets = new LinkedHashMap<>();
        if (schema.has(OptionalColumn.REFINED_STATEMENT)) {
            sets.put(OptionalColumn.REFINED_STATEMENT.columnName(), refinedText.equals(statement) ? "" : refinedText);
        }
        if (schema.has(OptionalColumn.ADVISORY_QUALITY)) {
            sets.put(OptionalColumn.ADVISORY_QUALITY.columnName(), qualityJson);
        }
        if (sets.isEmpty()) {
            log.debug("{} has no refinement columns, skipping {}", table.tableName(), distillationId);
            return false;
        }
        update(table.tableName(), sets, List.of(ID_COLUMN), List.of(distillationId));
        return true;
    }

    /**
     * Copies the newest archive row for {@code distillationId} into the active table.
     * <p>
     * The row is built from the columns both tables share, plus the verified refinement
     * columns. Existence is checked by the active table's primary key; an existing row is
     * updated in place, otherwise a new one is inserted. A constraint violation on insert
     * degrades to updating just the refinement columns by id.
     *
     * @return true if the active table now carries the refinement for this id
     */
    public boolean promoteArchiveRow(String distillationId, String refinedText, String qualityJson)
            throws SQLException {
        TableSchema archive = schemas.schema(DistillationTable.ARCHIVE);
        TableSchema active = schemas.schema(DistillationTable.ACTIVE);
        if (!archive.hasColumn(ID_COLUMN) || !active.hasColumn(ID_COLUMN)) {
            return false;
        }

        Map<String, Object> source = loadNewest(archive.table(), distillationId);
        if (source.isEmpty()) {
            return false;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        for (String column : active.commonColumns(archive)) {
            if (source.containsKey(column)) {
                payload.put(column, source.get(column));
            }
        }
        payload.putIfAbsent(ID_COLUMN, distillationId);
        if (active.has(OptionalColumn.REFINED_STATEMENT)) {
            payload.put(OptionalColumn.REFINED_STATEMENT.columnName(), refinedText);
        }
        if (active.has(OptionalColumn.ADVISORY_QUALITY)) {
            payload.put(OptionalColumn.ADVISORY_QUALITY.columnName(), qualityJson);
        }

        List<String> keys = active.keyColumns(ID_COLUMN);
        if (keys.isEmpty() || !payload.keySet().containsAll(keys)) {
            log.warn("Cannot promote {}: active table key {} not covered by archive row", distillationId, keys);
            return false;
        }
        List<Object> keyValues = keys.stream().map(payload::get).toList();

        if (exists(active.table(), keys, keyValues)) {
            Map<String, Object> sets = new LinkedHashMap<>(payload);
            keys.forEach(sets::remove);
            if (!sets.isEmpty()) {
                update(active.table(), sets, keys, keyValues);
            }
            return true;
        }
        try {
            insert(active.table(), payload);
            return true;
        } catch (SQLException e) {
            if ((e.getErrorCode() & 0xFF) != SQLITE_CONSTRAINT) {
                throw e;
            }
            log.warn("Insert of promoted {} hit a constraint, updating refinement columns instead: {}",
                    distillationId, e.getMessage());
            Map<String, Object> sets = new LinkedHashMap<>();
            if (active.has(OptionalColumn.REFINED_STATEMENT)) {
                sets.put(OptionalColumn.REFINED_STATEMENT.columnName(), refinedText);
            }
            if (active.has(OptionalColumn.ADVISORY_QUALITY)) {
                sets.put(OptionalColumn.ADVISORY_QUALITY.columnName(), qualityJson);
            }
            if (sets.isEmpty()) {
                return false;
            }
            update(active.table(), sets, List.of(ID_COLUMN), List.of(distillationId));
            return true;
        }
    }

    private Map<String, Object> loadNewest(String table, String distillationId) throws SQLException {
        Map<String, Object> row = new LinkedHashMap<>();
        String sql = "SELECT * FROM " + table + " WHERE " + ID_COLUMN + " = ? ORDER BY rowid DESC LIMIT 1";
        try (PreparedStatement stmt = EpisodicStore.prepare(connection, sql, distillationId);
             ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                ResultSetMetaData meta = rs.getMetaData();
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    row.put(meta.getColumnName(i), rs.getObject(i));
                }
            }
        }
        return row;
    }

    private boolean exists(String table, List<String> keys, List<Object> keyValues) throws SQLException {
        String sql = "SELECT 1 FROM " + table + " WHERE " + where(keys) + " LIMIT 1";
        try (PreparedStatement stmt = EpisodicStore.prepare(connection, sql, keyValues.toArray());
             ResultSet rs = stmt.executeQuery()) {
            return rs.next();
        }
    }

    private void update(String table, Map<String, Object> sets, List<String> keys, List<Object> keyValues)
            throws SQLException {
        StringJoiner assignments = new StringJoiner(", ");
        sets.keySet().forEach(c -> assignments.add(c + " = ?"));
        List<Object> params = new ArrayList<>(sets.values());
        params.addAll(keyValues);
        String sql = "UPDATE " + table + " SET " + assignments + " WHERE " + where(keys);
        try (PreparedStatement stmt = EpisodicStore.prepare(connection, sql, params.toArray())) {
            stmt.executeUpdate();
        }
    }

    private void insert(String table, Map<String, Object> payload) throws SQLException {
        StringJoiner names = new StringJoiner(", ");
        StringJoiner marks = new StringJoiner(", ");
        payload.keySet().forEach(c -> {
            names.add(c);
            marks.add("?");
        });
        String sql = "INSERT INTO " + table + " (" + names + ") VALUES (" + marks + ")";
        try (PreparedStatement stmt = EpisodicStore.prepare(connection, sql, payload.values().toArray())) {
            stmt.executeUpdate();
        }
    }

    private static String where(List<String> keys) {
        StringJoiner clause = new StringJoiner(" AND ");
        keys.forEach(k -> clause.add(k + " = ?"));
        return clause.toString();
    }
}
