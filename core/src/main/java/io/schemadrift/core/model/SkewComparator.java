package io.schemadrift.core.model;

/**
 * Training/serving skew check for a categorical feature. The L-infinity distance between the two
 * normalized value distributions must not exceed {@code infinityNormThreshold}.
 */
public record SkewComparator(double infinityNormThreshold) {}
