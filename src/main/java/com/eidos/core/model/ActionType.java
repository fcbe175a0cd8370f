package com.eidos.core.model;

import java.util.Locale;

public enum ActionType {
    TOOL_CALL,
    REASONING,
    QUESTION,
    WAIT;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ActionType fromValue(String value) {
        if (value == null) return REASONING;
        for (ActionType t : values()) {
            if (t.value().equalsIgnoreCase(value.trim())) return t;
        }
        return REASONING;
    }
}
