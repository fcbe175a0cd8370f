package com.eidos.core.persistence;

import java.util.Optional;

/**
 * The two tables a distillation row can live in.
 */
public enum DistillationTable {
    ACTIVE("distillations"),
    ARCHIVE("distillations_archive");

    private final String tableName;

    DistillationTable(String tableName) {
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }

    /** The table called {@code name}, or empty for anything else. */
    public static Optional<DistillationTable> fromTableName(String name) {
        for (DistillationTable t : values()) {
            if (t.tableName.equals(name)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
