package io.schemadrift.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-call policy for {@code SchemaEngine.update()} and {@code SchemaEngine.getRelatedEnums()}.
 * Immutable; use {@link #builder()} or {@link #toBuilder()} to derive variants.
 */
public final class UpdaterConfig {

    /** Default maximum number of distinct values for a column to be treated as categorical. */
    public static final int DEFAULT_ENUM_THRESHOLD = 400;

    private static final UpdaterConfig DEFAULTS = builder().build();

    private final Set<String> columnsToIgnore;
    private final Map<String, String> enumGrouping;
    private final int enumThreshold;
    private final int enumDeleteThreshold;
    private final boolean deprecateMissingColumns;
    private final Map<AnomalyType, Severity> severityOverrides;
    private final EnumsSimilarConfig enumsSimilarConfig;

    private UpdaterConfig(Builder builder) {
        this.columnsToIgnore = Collections.unmodifiableSet(new LinkedHashSet<>(builder.columnsToIgnore));
        this.enumGrouping = Collections.unmodifiableMap(new LinkedHashMap<>(builder.enumGrouping));
        this.enumThreshold = builder.enumThreshold;
        this.enumDeleteThreshold = builder.enumDeleteThreshold;
        this.deprecateMissingColumns = builder.deprecateMissingColumns;
        this.severityOverrides = builder.severityOverrides.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(builder.severityOverrides));
        this.enumsSimilarConfig = builder.enumsSimilarConfig;
    }

    public static UpdaterConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-populated with this config's values. */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.columnsToIgnore.addAll(columnsToIgnore);
        builder.enumGrouping.putAll(enumGrouping);
        builder.enumThreshold = enumThreshold;
        builder.enumDeleteThreshold = enumDeleteThreshold;
        builder.deprecateMissingColumns = deprecateMissingColumns;
        builder.severityOverrides.putAll(severityOverrides);
        builder.enumsSimilarConfig = enumsSimilarConfig;
        return builder;
    }

    /** Columns skipped entirely: no feature is created, updated or reported missing. */
    public Set<String> columnsToIgnore() {
        return columnsToIgnore;
    }

    /** Column name to shared domain name; such columns use that domain instead of their own. */
    public Map<String, String> enumGrouping() {
        return enumGrouping;
    }

    public int enumThreshold() {
        return enumThreshold;
    }

    /** Domain size above which a feature's domain is detached; 0 disables the check. */
    public int enumDeleteThreshold() {
        return enumDeleteThreshold;
    }

    public boolean deprecateMissingColumns() {
        return deprecateMissingColumns;
    }

    public Map<AnomalyType, Severity> severityOverrides() {
        return severityOverrides;
    }

    public EnumsSimilarConfig enumsSimilarConfig() {
        return enumsSimilarConfig;
    }

    /** Resolves the severity of an anomaly type, honoring overrides. */
    public Severity severityFor(AnomalyType type) {
        return severityOverrides.getOrDefault(type, type.defaultSeverity());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UpdaterConfig other)) {
            return false;
        }
        return enumThreshold == other.enumThreshold
                && enumDeleteThreshold == other.enumDeleteThreshold
                && deprecateMissingColumns == other.deprecateMissingColumns
                && columnsToIgnore.equals(other.columnsToIgnore)
                && enumGrouping.equals(other.enumGrouping)
                && severityOverrides.equals(other.severityOverrides)
                && enumsSimilarConfig.equals(other.enumsSimilarConfig);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                columnsToIgnore,
                enumGrouping,
                enumThreshold,
                enumDeleteThreshold,
                deprecateMissingColumns,
                severityOverrides,
                enumsSimilarConfig);
    }

    @Override
    public String toString() {
        return "UpdaterConfig[ignore=" + columnsToIgnore + ", grouping=" + enumGrouping + ", enumThreshold="
                + enumThreshold + ", enumDeleteThreshold=" + enumDeleteThreshold + "]";
    }

    /** Builder for {@link UpdaterConfig}. */
    public static final class Builder {

        private final Set<String> columnsToIgnore = new LinkedHashSet<>();
        private final Map<String, String> enumGrouping = new LinkedHashMap<>();
        private int enumThreshold = DEFAULT_ENUM_THRESHOLD;
        private int enumDeleteThreshold;
        private boolean deprecateMissingColumns = true;
        private final Map<AnomalyType, Severity> severityOverrides = new EnumMap<>(AnomalyType.class);
        private EnumsSimilarConfig enumsSimilarConfig = EnumsSimilarConfig.DEFAULT;

        Builder() {}

        public Builder ignoreColumn(String column) {
            columnsToIgnore.add(Objects.requireNonNull(column, "column must not be null"));
            return this;
        }

        public Builder ignoreColumns(Set<String> columns) {
            columns.forEach(this::ignoreColumn);
            return this;
        }

        public Builder groupEnum(String column, String domainName) {
            enumGrouping.put(
                    Objects.requireNonNull(column, "column must not be null"),
                    Objects.requireNonNull(domainName, "domainName must not be null"));
            return this;
        }

        public Builder enumGrouping(Map<String, String> grouping) {
            grouping.forEach(this::groupEnum);
            return this;
        }

        public Builder enumThreshold(int threshold) {
            if (threshold < 0) {
                throw new IllegalArgumentException("enumThreshold must be >= 0, got " + threshold);
            }
            this.enumThreshold = threshold;
            return this;
        }

        public Builder enumDeleteThreshold(int threshold) {
            if (threshold < 0) {
                throw new IllegalArgumentException("enumDeleteThreshold must be >= 0, got " + threshold);
            }
            this.enumDeleteThreshold = threshold;
            return this;
        }

        public Builder deprecateMissingColumns(boolean deprecate) {
            this.deprecateMissingColumns = deprecate;
            return this;
        }

        public Builder severityOverride(AnomalyType type, Severity severity) {
            severityOverrides.put(
                    Objects.requireNonNull(type, "type must not be null"),
                    Objects.requireNonNull(severity, "severity must not be null"));
            return this;
        }

        public Builder enumsSimilarConfig(EnumsSimilarConfig config) {
            this.enumsSimilarConfig = Objects.requireNonNull(config, "enumsSimilarConfig must not be null");
            return this;
        }

        public UpdaterConfig build() {
            return new UpdaterConfig(this);
        }
    }
}
