package com.eidos.core.model;

import java.util.Locale;

/**
 * Step evaluation results.
 */
public enum Evaluation {
    PASS,
    FAIL,
    PARTIAL,
    UNKNOWN;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Evaluation fromValue(String value) {
        if (value == null) return UNKNOWN;
        for (Evaluation e : values()) {
            if (e.value().equalsIgnoreCase(value.trim())) return e;
        }
        return UNKNOWN;
    }
}
