package io.schemadrift.core.model;

/**
 * Kinds of discrepancy the engine can report, each with its default {@link Severity}. Defaults
 * can be remapped per update call through {@link UpdaterConfig#severityOverrides()}.
 */
public enum AnomalyType {
    /** Column present in data but not in the schema; the schema grows. */
    SCHEMA_NEW_COLUMN(Severity.WARNING),
    /** Existence-required column absent from the data. */
    SCHEMA_MISSING_COLUMN(Severity.ERROR),
    UNEXPECTED_DATA_TYPE(Severity.ERROR),
    FEATURE_TYPE_LOW_FRACTION_PRESENT(Severity.ERROR),
    FEATURE_TYPE_LOW_NUMBER_PRESENT(Severity.ERROR),
    FEATURE_TYPE_LOW_NUMBER_VALUES(Severity.ERROR),
    FEATURE_TYPE_HIGH_NUMBER_VALUES(Severity.ERROR),
    /** Column observed in an environment it is not a member of. */
    FEATURE_UNEXPECTED_ENVIRONMENT(Severity.ERROR),
    /** Observed categorical values missing from the domain; the domain is extended. */
    ENUM_TYPE_UNEXPECTED_STRING_VALUES(Severity.WARNING),
    /** Domain grew past the delete threshold and was detached from the feature. */
    ENUM_TYPE_TOO_LARGE(Severity.WARNING),
    /** Training/serving L-infinity distance above the skew comparator threshold. */
    COMPARATOR_L_INFTY_HIGH(Severity.ERROR),
    SPARSE_FEATURE_MISSING_VALUE(Severity.ERROR),
    SPARSE_FEATURE_LENGTH_MISMATCH(Severity.ERROR),
    /** A feature contradicted itself and was repaired. */
    INVALID_SCHEMA_SPECIFICATION(Severity.INFO);

    private final Severity defaultSeverity;

    AnomalyType(Severity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }
}
