package io.schemadrift.core.stats;

import java.util.Map;
import java.util.Objects;

/**
 * Externally computed statistics of one column, read-only to the engine.
 *
 * @param name          column name
 * @param type          observed basic type
 * @param numNonMissing examples containing the column
 * @param numMissing    examples not containing the column
 * @param minNumValues  minimum number of values in a containing example
 * @param maxNumValues  maximum number of values in a containing example
 * @param stringStats   string statistics, or {@code null} for non-string columns
 * @param customStats   named numeric side statistics (e.g. {@code missing_value} for sparse features)
 */
public record FeatureStatistics(
        String name,
        StatsType type,
        long numNonMissing,
        long numMissing,
        long minNumValues,
        long maxNumValues,
        StringStatistics stringStats,
        Map<String, Double> customStats) {

    /** Custom stat: examples where a sparse feature's value column is missing. */
    public static final String SPARSE_MISSING_VALUE = "missing_value";
    /** Custom stat: minimum (value length - index length) over a sparse feature's examples. */
    public static final String SPARSE_MIN_LENGTH_DIFF = "min_length_diff";
    /** Custom stat: maximum (value length - index length) over a sparse feature's examples. */
    public static final String SPARSE_MAX_LENGTH_DIFF = "max_length_diff";

    public FeatureStatistics {
        Objects.requireNonNull(type, "type must not be null");
        customStats = customStats == null ? Map.of() : Map.copyOf(customStats);
    }
}
