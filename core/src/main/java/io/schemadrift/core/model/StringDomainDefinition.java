package io.schemadrift.core.model;

import java.util.List;
import java.util.Objects;

/** Serializable string domain: a name plus its allowed values in insertion order. */
public record StringDomainDefinition(String name, List<String> values) {

    public StringDomainDefinition {
        Objects.requireNonNull(name, "name must not be null");
        values = values == null ? List.of() : List.copyOf(values);
    }
}
