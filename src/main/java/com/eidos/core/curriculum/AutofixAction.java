package com.eidos.core.curriculum;

/**
 * What an autofix pass did to one row.
 */
public enum AutofixAction {
    /** Refinement did not improve the row. */
    NOOP("noop"),
    /** Improved, but not written (dry run, or no writable column). */
    IMPROVED("improved"),
    UPDATED("updated"),
    /** Copied from the archive into the active table. */
    PROMOTED("promoted"),
    /** Left in the archive with its quality tagged {@code soft_promoted}. */
    SOFT_PROMOTED("soft_promoted"),
    /** Improved, but its writes failed and were rolled back. */
    FAILED("failed");

    private final String value;

    AutofixAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
