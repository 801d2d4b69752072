package com.z254.butterfly.sentinel.domain.model;

/**
 * Alert severity, ordered from least to most severe.
 */
public enum Severity {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int level;

    Severity(int level) {
        this.level = level;
    }

    /** Ordinal level, 1 (low) to 4 (critical). */
    public int level() {
        return level;
    }

    public boolean isHigherThan(Severity other) {
        return other == null || level > other.level;
    }
}
