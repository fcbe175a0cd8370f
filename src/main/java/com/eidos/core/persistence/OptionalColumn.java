package com.eidos.core.persistence;

/**
 * Distillation columns that older databases may lack. Never written unless
 * {@link TableSchema#has(OptionalColumn)} confirms them.
 */
public enum OptionalColumn {
    REFINED_STATEMENT("refined_statement"),
    ADVISORY_QUALITY("advisory_quality");

    private final String columnName;

    OptionalColumn(String columnName) {
        this.columnName = columnName;
    }

    public String columnName() {
        return columnName;
    }
}
