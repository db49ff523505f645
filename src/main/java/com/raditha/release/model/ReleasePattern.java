package com.raditha.release.model;

/**
 * How a verdict was reached.
 */
public enum ReleasePattern {
    /**
     * try-with-resources owns the variable.
     */
    SCOPED_ACQUISITION("Scoped acquisition"),

    /**
     * A finally block releases the variable.
     */
    GUARANTEED_CLEANUP("Guaranteed cleanup"),

    /**
     * Every explicit exit hands the variable back to the caller.
     */
    OWNERSHIP_TRANSFER("Ownership transfer"),

    /**
     * Dataflow showed a release before every exit.
     */
    EXPLICIT_ALL_PATHS("Explicit release on all paths"),

    /**
     * Some releases exist but at least one path misses them.
     */
    INCOMPLETE("Incomplete release"),

    NONE("None");

    private final String displayName;

    ReleasePattern(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
