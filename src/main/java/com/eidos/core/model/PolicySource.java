package com.eidos.core.model;

/**
 * Where a {@link Policy} came from.
 */
public enum PolicySource {
    USER,
    DISTILLED,
    INFERRED;

    public static PolicySource fromValue(String value) {
        if (value == null) return INFERRED;
        for (PolicySource s : values()) {
            if (s.name().equalsIgnoreCase(value.trim())) return s;
        }
        return INFERRED;
    }
}
