package io.schemadrift.core.model;

import java.util.Objects;

/**
 * One detected discrepancy: its kind, a short identifier-like summary (e.g. {@code "New column"})
 * and a human-readable explanation.
 */
public record Description(AnomalyType type, String shortDescription, String longDescription) {

    public Description {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(shortDescription, "shortDescription must not be null");
        Objects.requireNonNull(longDescription, "longDescription must not be null");
    }

    @Override
    public String toString() {
        return type + ": " + shortDescription + " (" + longDescription + ")";
    }
}
