package com.eidos.core.model;

/**
 * Reach of a {@link Policy}. Persisted by name (upper case) for compatibility with existing databases.
 */
public enum PolicyScope {
    GLOBAL,
    PROJECT,
    SESSION;

    public static PolicyScope fromValue(String value) {
        if (value == null) return GLOBAL;
        for (PolicyScope s : values()) {
            if (s.name().equalsIgnoreCase(value.trim())) return s;
        }
        return GLOBAL;
    }
}
