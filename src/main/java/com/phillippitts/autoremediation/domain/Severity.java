package com.phillippitts.autoremediation.domain;

/**
 * Severity of a finding or incident, ordered from least to most severe.
 */
public enum Severity {
    INFO,
    WARNING,
    CRITICAL;

    public boolean isHigherThan(Severity other) {
        return other == null || compareTo(other) > 0;
    }

    /**
     * Returns the more severe of the two values; {@code null} is treated as lowest.
     */
    public static Severity max(Severity a, Severity b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }
}
