package io.schemadrift.core.model;

/**
 * Presence constraints of a feature. A zero value means "unconstrained".
 *
 * @param minFraction minimum fraction of examples that must contain the feature, in {@code [0, 1]}
 * @param minCount    minimum number of examples that must contain the feature
 */
public record Presence(double minFraction, long minCount) {

    /** No presence constraint at all. */
    public static final Presence NONE = new Presence(0.0, 0);

    /** Present in every example. */
    public static final Presence REQUIRED = new Presence(1.0, 1);

    /** Returns true if at least one example must contain the feature. */
    public boolean isExistenceRequired() {
        return minCount > 0 || minFraction > 0.0;
    }

    public Presence withMinFraction(double fraction) {
        return new Presence(fraction, minCount);
    }

    public Presence withMinCount(long count) {
        return new Presence(minFraction, count);
    }
}
