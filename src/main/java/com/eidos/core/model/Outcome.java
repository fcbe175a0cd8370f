package com.eidos.core.model;

import java.util.Locale;

/**
 * Episode outcomes. {@link #IN_PROGRESS} is the only non-terminal value.
 */
public enum Outcome {
    SUCCESS,
    FAILURE,
    PARTIAL,
    ESCALATED,
    IN_PROGRESS;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    public static Outcome fromValue(String value) {
        if (value == null) return IN_PROGRESS;
        for (Outcome o : values()) {
            if (o.value().equalsIgnoreCase(value.trim())) return o;
        }
        return IN_PROGRESS;
    }
}
