package io.schemadrift.core.stats;

import java.util.List;

/**
 * String statistics of a column.
 *
 * @param unique    number of distinct values
 * @param topValues most frequent values, in descending frequency; holds every distinct value when
 *                  {@code topValues.size() >= unique}
 * @param avgLength average value length in bytes
 */
public record StringStatistics(long unique, List<ValueFrequency> topValues, double avgLength) {

    /**
     * Values longer than the top-k length threshold are counted under this token instead of
     * their own text.
     */
    public static final String LARGE_BYTES_PLACEHOLDER = "__LARGE_BYTES__";

    public StringStatistics {
        topValues = topValues == null ? List.of() : List.copyOf(topValues);
    }

    /** Returns true if {@link #topValues()} lists every distinct value. */
    public boolean isComplete() {
        return topValues.size() >= unique;
    }

    public boolean containsLargeValues() {
        return topValues.stream().anyMatch(v -> LARGE_BYTES_PLACEHOLDER.equals(v.value()));
    }
}
