package io.schemadrift.core.model;

/**
 * Declared value type of a schema feature.
 *
 * <p>String and raw-bytes columns both map to {@link #BYTES}; only {@link #BYTES} features may
 * reference a string domain.
 */
public enum FeatureType {
    INT,
    FLOAT,
    BYTES,
    STRUCT
}
