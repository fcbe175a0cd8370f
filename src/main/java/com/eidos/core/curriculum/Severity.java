package com.eidos.core.curriculum;

import java.util.Locale;

/**
 * Card severity. The weight drives curriculum ordering.
 */
public enum Severity {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int weight;

    Severity(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
