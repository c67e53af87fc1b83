package io.schemadrift.core.model;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Aggregated result of a whole-schema operation: one {@link AnomalyInfo} per affected column,
 * sorted by column name so the order does not depend on processing order.
 */
public final class SchemaAnomalies {

    private static final SchemaAnomalies EMPTY = new SchemaAnomalies(List.of());

    private final List<AnomalyInfo> anomalies;

    private SchemaAnomalies(List<AnomalyInfo> anomalies) {
        this.anomalies = anomalies;
    }

    /**
     * Creates a result from per-column infos. Columns without descriptions are dropped and the
     * rest are stable-sorted by column name.
     */
    public static SchemaAnomalies of(List<AnomalyInfo> infos) {
        List<AnomalyInfo> sorted = infos.stream()
                .filter(info -> !info.isEmpty())
                .sorted(Comparator.comparing(AnomalyInfo::column))
                .toList();
        return sorted.isEmpty() ? EMPTY : new SchemaAnomalies(sorted);
    }

    public static SchemaAnomalies empty() {
        return EMPTY;
    }

    /** Unmodifiable per-column anomalies, sorted by column name. */
    public List<AnomalyInfo> anomalies() {
        return anomalies;
    }

    public Optional<AnomalyInfo> forColumn(String column) {
        return anomalies.stream().filter(a -> a.column().equals(column)).findFirst();
    }

    /** The maximum severity over all columns, {@link Severity#NONE} if nothing was found. */
    public Severity maxSeverity() {
        Severity max = Severity.NONE;
        for (AnomalyInfo info : anomalies) {
            max = Severity.max(max, info.severity());
        }
        return max;
    }

    public boolean hasErrors() {
        return maxSeverity() == Severity.ERROR;
    }

    public boolean isEmpty() {
        return anomalies.isEmpty();
    }

    public int size() {
        return anomalies.size();
    }

    @Override
    public String toString() {
        return "SchemaAnomalies[columns=" + anomalies.size() + ", max_severity=" + maxSeverity() + "]";
    }
}
