package com.eidos.core.curriculum;

import com.eidos.core.persistence.DistillationTable;
import com.eidos.core.persistence.JsonColumns;
import com.eidos.core.persistence.SchemaRegistry;
import com.eidos.core.persistence.TableSchema;
import com.eidos.core.quality.AdvisoryQuality;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads {@link DistillationRow}s selecting only the columns each table actually has,
 * so databases created before the refinement columns existed still load.
 */
public class DistillationRowReader {

    private static final List<String> ACTIVE_COLUMNS = List.of(
            "distillation_id", "type", "statement", "refined_statement",
            "advisory_quality", "times_used", "times_helped");

    private static final List<String> ARCHIVE_COLUMNS = List.of(
            "distillation_id", "type", "statement", "refined_statement",
            "advisory_quality", "times_used", "times_helped", "archive_reason");

    private final Connection connection;
    private final SchemaRegistry schemas;

    public DistillationRowReader(Connection connection, SchemaRegistry schemas) {
        this.connection = connection;
        this.schemas = schemas;
    }

    /** Newest rows first; an absent table yields an empty list. */
    public List<DistillationRow> readRecent(DistillationTable table, int limit) throws SQLException {
        List<String> selected = selectedColumns(table);
        List<DistillationRow> out = new ArrayList<>();
        if (selected.isEmpty()) {
            return out;
        }
        String sql = "SELECT " + String.join(", ", selected) + " FROM " + table.tableName()
                + " ORDER BY rowid DESC LIMIT ?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setInt(1, Math.max(1, limit));
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    out.add(toRow(rs, selected, table));
                }
            }
        }
        return out;
    }

    /** Current state of one row, or empty if the table lacks an id column or the row. */
    public Optional<DistillationRow> readOne(DistillationTable table, String distillationId) throws SQLException {
        List<String> selected = selectedColumns(table);
        if (!selected.contains("distillation_id")) {
            return Optional.empty();
        }
        String sql = "SELECT " + String.join(", ", selected) + " FROM " + table.tableName()
                + " WHERE distillation_id = ? ORDER BY rowid DESC LIMIT 1";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, distillationId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(toRow(rs, selected, table)) : Optional.empty();
            }
        }
    }

    private List<String> selectedColumns(DistillationTable table) throws SQLException {
        TableSchema schema = schemas.schema(table);
        List<String> wanted = table == DistillationTable.ARCHIVE ? ARCHIVE_COLUMNS : ACTIVE_COLUMNS;
        return wanted.stream().filter(schema::hasColumn).toList();
    }

    private static DistillationRow toRow(ResultSet rs, List<String> selected, DistillationTable table)
            throws SQLException {
        return new DistillationRow(
                text(rs, selected, "distillation_id"),
                text(rs, selected, "type"),
                text(rs, selected, "statement"),
                text(rs, selected, "refined_statement"),
                AdvisoryQuality.fromMap(JsonColumns.readMap(text(rs, selected, "advisory_quality"))),
                count(rs, selected, "times_used"),
                count(rs, selected, "times_helped"),
                table,
                text(rs, selected, "archive_reason"));
    }

    private static String text(ResultSet rs, List<String> selected, String column) throws SQLException {
        if (!selected.contains(column)) return "";
        String value = rs.getString(column);
        return value == null ? "" : value;
    }

    private static int count(ResultSet rs, List<String> selected, String column) throws SQLException {
        if (!selected.contains(column)) return 0;
        Object value = rs.getObject(column);
        if (value instanceof Number n) return n.intValue();
        if (value == null) return 0;
        try {
            return (int) Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
