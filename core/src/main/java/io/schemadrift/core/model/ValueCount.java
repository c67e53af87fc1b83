package io.schemadrift.core.model;

/**
 * Bounds on the number of values per example.
 *
 * @param min lower bound (inclusive)
 * @param max upper bound (inclusive), or {@code null} if unbounded
 */
public record ValueCount(long min, Long max) {

    /** Exactly one value per example. */
    public static final ValueCount SINGLE = new ValueCount(1, 1L);

    /** At least one value per example. */
    public static final ValueCount AT_LEAST_ONE = new ValueCount(1, null);

    public ValueCount withMin(long newMin) {
        return new ValueCount(newMin, max);
    }

    public ValueCount withMax(Long newMax) {
        return new ValueCount(min, newMax);
    }
}
