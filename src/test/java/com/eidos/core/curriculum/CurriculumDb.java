package com.eidos.core.curriculum;

import com.eidos.core.persistence.EpisodicStore;
import com.eidos.core.persistence.JsonColumns;
import com.eidos.core.persistence.SqliteConnections;
import com.eidos.core.quality.AdvisoryQuality;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * SQLite fixtures for curriculum and autofix tests.
 */
final class CurriculumDb {

    private CurriculumDb() {}

    /** Current schema, created the same way the store creates it. */
    static Path current(Path dir) {
        Path db = dir.resolve("eidos.db");
        new EpisodicStore(new SqliteConnections(1000).dataSource(db), db.toString()).createTables();
        return db;
    }

    /** An older layout without refined_statement / advisory_quality and without a declared primary key. */
    static Path legacy(Path dir) throws SQLException {
        Path db = dir.resolve("legacy.db");
        exec(db, """
                CREATE TABLE distillations (
                    distillation_id TEXT,
                    type TEXT,
                    statement TEXT,
                    times_used INTEGER DEFAULT 0,
                    times_helped INTEGER DEFAULT 0
                )""");
        exec(db, """
                CREATE TABLE distillations_archive (
                    distillation_id TEXT,
                    type TEXT,
                    statement TEXT,
                    archive_reason TEXT
                )""");
        return db;
    }

    static void exec(Path db, String sql) throws SQLException {
        try (Connection conn = connect(db); Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }

    static void insertActive(Path db, String id, String statement, AdvisoryQuality quality,
                             int timesUsed, int timesHelped) throws SQLException {
        try (Connection conn = connect(db); PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO distillations (distillation_id, type, statement, advisory_quality, times_used, times_helped)"
                        + " VALUES (?, 'heuristic', ?, ?, ?, ?)")) {
            stmt.setString(1, id);
            stmt.setString(2, statement);
            stmt.setString(3, quality == null ? null : JsonColumns.write(quality.toMap()));
            stmt.setInt(4, timesUsed);
            stmt.setInt(5, timesHelped);
            stmt.executeUpdate();
        }
    }

    static void insertArchive(Path db, String id, String statement, AdvisoryQuality quality,
                              String archiveReason) throws SQLException {
        try (Connection conn = connect(db); PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO distillations_archive (distillation_id, type, statement, advisory_quality, archive_reason)"
                        + " VALUES (?, 'heuristic', ?, ?, ?)")) {
            stmt.setString(1, id);
            stmt.setString(2, statement);
            stmt.setString(3, quality == null ? null : JsonColumns.write(quality.toMap()));
            stmt.setString(4, archiveReason);
            stmt.executeUpdate();
        }
    }

    /** Every row of a table as ordered strings, for before/after comparison. */
    static List<String> dump(Path db, String table) throws SQLException {
        List<String> out = new ArrayList<>();
        try (Connection conn = connect(db); Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT * FROM " + table + " ORDER BY rowid")) {
            int columns = rs.getMetaData().getColumnCount();
            while (rs.next()) {
                StringBuilder row = new StringBuilder();
                for (int i = 1; i <= columns; i++) {
                    row.append(rs.getString(i)).append('|');
                }
                out.add(row.toString());
            }
        }
        return out;
    }

    static String column(Path db, String table, String id, String column) throws SQLException {
        try (Connection conn = connect(db); PreparedStatement stmt = conn.prepareStatement(
                "SELECT " + column + " FROM " + table + " WHERE distillation_id = ?")) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    static int count(Path db, String table) throws SQLException {
        return dump(db, table).size();
    }

    static Map<String, Object> qualityOf(Path db, String table, String id) throws SQLException {
        return JsonColumns.readMap(column(db, table, id, "advisory_quality"));
    }

    static AdvisoryQuality quality(double unified, boolean suppressed, double subScore) {
        return new AdvisoryQuality(unified, suppressed, suppressed ? "too_short" : "",
                subScore, subScore, subScore, 0.0, AdvisoryQuality.Structure.EMPTY, "", false);
    }

    static Connection connect(Path db) throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + db.toAbsolutePath());
    }
}
