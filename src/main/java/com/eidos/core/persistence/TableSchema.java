package com.eidos.core.persistence;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Column layout of one table as reported by {@code PRAGMA table_info}.
 * An absent table introspects to an empty schema.
 *
 * @param table          table name
 * @param columns        column names in declaration order
 * @param primaryKey     primary-key columns in key order
 * @param optionalColumns which {@link OptionalColumn}s are present
 */
public record TableSchema(
    String table,
    Set<String> columns,
    List<String> primaryKey,
    Set<OptionalColumn> optionalColumns
) {

    public static TableSchema introspect(Connection conn, String table) throws SQLException {
        if (!table.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        Set<String> columns = new LinkedHashSet<>();
        Map<Integer, String> pk = new TreeMap<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                String name = rs.getString("name");
                columns.add(name);
                int pkIndex = rs.getInt("pk");
                if (pkIndex > 0) {
                    pk.put(pkIndex, name);
                }
            }
        }
        Set<OptionalColumn> optional = EnumSet.noneOf(OptionalColumn.class);
        for (OptionalColumn c : OptionalColumn.values()) {
            if (columns.contains(c.columnName())) optional.add(c);
        }
        return new TableSchema(table,
                Collections.unmodifiableSet(columns),
                List.copyOf(pk.values()),
                Collections.unmodifiableSet(optional));
    }

    public boolean exists() {
        return !columns.isEmpty();
    }

    public boolean has(OptionalColumn column) {
        return optionalColumns.contains(column);
    }

    public boolean hasColumn(String name) {
        return columns.contains(name);
    }

    /** Primary key columns, falling back to {@code fallback} when none is declared. */
    public List<String> keyColumns(String fallback) {
        if (!primaryKey.isEmpty()) return primaryKey;
        return columns.contains(fallback) ? List.of(fallback) : List.of();
    }

    /** Columns present in both tables, in this table's declaration order. */
    public List<String> commonColumns(TableSchema other) {
        List<String> out = new ArrayList<>();
        for (String c : columns) {
            if (other.columns.contains(c)) out.add(c);
        }
        return out;
    }
}
