package com.eidos.core.persistence;

import com.eidos.core.config.EidosProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Spring {@link Configuration} that wires the SQLite-backed {@link EpisodicStore}.
 * The database file and its parent directory are created on startup if missing.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    public SqliteConnections sqliteConnections(EidosProperties properties) {
        return new SqliteConnections(properties.getBusyTimeoutMs());
    }

    @Bean
    public EpisodicStore episodicStore(EidosProperties properties, SqliteConnections connections) {
        Path dbPath = Path.of(properties.getDbPath());
        try {
            Path parent = dbPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory for " + dbPath, e);
        }
        log.info("Configuring episodic store (SQLite) at {}", dbPath);
        var store = new EpisodicStore(connections.dataSource(dbPath), dbPath.toString());
        store.createTables();
        return store;
    }
}
