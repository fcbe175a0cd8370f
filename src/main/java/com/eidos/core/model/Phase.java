package com.eidos.core.model;

import java.util.Locale;

/**
 * Episode phases. Transitions are rule-driven: EXPLORE → DIAGNOSE → EXECUTE → CONSOLIDATE,
 * with ESCALATE reachable from any phase and absorbing once entered.
 */
public enum Phase {
    EXPLORE,
    DIAGNOSE,
    EXECUTE,
    CONSOLIDATE,
    ESCALATE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether {@code next} is a legal successor of this phase. Staying in place is allowed.
     */
    public boolean canTransitionTo(Phase next) {
        if (this == ESCALATE) {
            return next == ESCALATE;
        }
        if (next == ESCALATE || next == this) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }

    public static Phase fromValue(String value) {
        if (value == null) return EXPLORE;
        for (Phase p : values()) {
            if (p.value().equalsIgnoreCase(value.trim())) return p;
        }
        return EXPLORE;
    }
}
