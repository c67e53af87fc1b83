package io.schemadrift.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/** All discrepancies detected for a single column, with the column's folded severity. */
public record AnomalyInfo(String column, Severity severity, List<Description> descriptions) {

    public AnomalyInfo {
        Objects.requireNonNull(column, "column must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        descriptions = descriptions == null ? List.of() : List.copyOf(descriptions);
    }

    /** An empty result for a column: severity {@link Severity#NONE}, no descriptions. */
    public static AnomalyInfo none(String column) {
        return new AnomalyInfo(column, Severity.NONE, List.of());
    }

    public boolean isEmpty() {
        return descriptions.isEmpty();
    }

    /** The distinct anomaly types among this column's descriptions. */
    public Set<AnomalyType> types() {
        return descriptions.stream().map(Description::type).collect(Collectors.toUnmodifiableSet());
    }

    public boolean hasType(AnomalyType type) {
        return descriptions.stream().anyMatch(d -> d.type() == type);
    }
}
