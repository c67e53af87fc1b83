package io.schemadrift.core.stats;

import java.util.Objects;

/** One entry of a top-values list: a value and the number of examples it occurred in. */
public record ValueFrequency(String value, double frequency) {

    public ValueFrequency {
        Objects.requireNonNull(value, "value must not be null");
    }
}
