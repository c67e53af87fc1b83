package io.schemadrift.core.model;

/**
 * Ordered ranking of how serious a detected discrepancy is: {@code NONE < INFO < WARNING < ERROR}.
 * The severity reported for a column is the {@link #max(Severity, Severity) max} over all of its
 * descriptions.
 */
public enum Severity {
    NONE,
    INFO,
    WARNING,
    ERROR;

    /** Returns the more serious of the two severities. */
    public static Severity max(Severity a, Severity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /** Returns true if this severity is at least as serious as {@code other}. */
    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
