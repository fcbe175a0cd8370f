package com.eidos.core.model;

import java.util.Locale;

/**
 * Kinds of distilled knowledge.
 */
public enum DistillationType {
    HEURISTIC,      // "If X, then Y"
    SHARP_EDGE,     // gotcha / pitfall
    ANTI_PATTERN,   // "Never do X because..."
    PLAYBOOK,       // step-by-step procedure
    POLICY;         // operating constraint

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DistillationType fromValue(String value) {
        if (value == null) return HEURISTIC;
        for (DistillationType t : values()) {
            if (t.value().equalsIgnoreCase(value.trim())) return t;
        }
        return HEURISTIC;
    }
}
