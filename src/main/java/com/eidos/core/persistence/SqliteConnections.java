package com.eidos.core.persistence;

import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens SQLite connections with the configured busy timeout, so that lock
 * contention from another writer process waits instead of failing at once.
 */
public class SqliteConnections {

    private final int busyTimeoutMs;

    public SqliteConnections(int busyTimeoutMs) {
        this.busyTimeoutMs = Math.max(0, busyTimeoutMs);
    }

    public SQLiteDataSource dataSource(Path dbPath) {
        SQLiteDataSource ds = new SQLiteDataSource(config(false));
        ds.setUrl(url(dbPath));
        return ds;
    }

    /**
     * Opens a dedicated connection. Read-only connections cannot write even by mistake,
     * which is what dry runs rely on.
     */
    public Connection open(Path dbPath, boolean readOnly) throws SQLException {
        return DriverManager.getConnection(url(dbPath), config(readOnly).toProperties());
    }

    private SQLiteConfig config(boolean readOnly) {
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(busyTimeoutMs);
        config.setReadOnly(readOnly);
        return config;
    }

    private static String url(Path dbPath) {
        return "jdbc:sqlite:" + dbPath.toAbsolutePath();
    }
}
