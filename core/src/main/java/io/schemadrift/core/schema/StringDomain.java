package io.schemadrift.core.schema;

import io.schemadrift.core.model.StringDomainDefinition;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named set of allowed categorical values. The name is bound permanently at creation; the
 * value set only grows, through {@link DomainRegistry#extendValues}.
 */
public final class StringDomain {

    private final String name;
    private final Set<String> values = new LinkedHashSet<>();

    StringDomain(String name, Collection<String> initialValues) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.values.addAll(initialValues);
    }

    public String name() {
        return name;
    }

    /** Unmodifiable view of the values in insertion order. */
    public Set<String> values() {
        return Collections.unmodifiableSet(values);
    }

    public boolean contains(String value) {
        return values.contains(value);
    }

    public int size() {
        return values.size();
    }

    public StringDomainDefinition toDefinition() {
        return new StringDomainDefinition(name, List.copyOf(values));
    }

    boolean add(String value) {
        return values.add(value);
    }

    @Override
    public String toString() {
        return "StringDomain[" + name + ", values=" + values + "]";
    }
}
