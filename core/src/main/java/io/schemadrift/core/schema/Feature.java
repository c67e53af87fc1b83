package io.schemadrift.core.schema;

import io.schemadrift.core.model.FeatureDefinition;
import io.schemadrift.core.model.FeatureType;
import io.schemadrift.core.model.Presence;
import io.schemadrift.core.model.SkewComparator;
import io.schemadrift.core.model.ValueCount;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable schema entry for one column. Created by {@link FeatureStore} and mutated only by the
 * engine's updater and consistency checker. Not thread-safe.
 */
public final class Feature implements SchemaElement {

    private final String name;
    private FeatureType type;
    private String domain;
    private Presence presence = Presence.NONE;
    private ValueCount valueCount;
    private final Set<String> inEnvironment = new LinkedHashSet<>();
    private final Set<String> notInEnvironment = new LinkedHashSet<>();
    private boolean deprecated;
    private SkewComparator skewComparator;

    Feature(String name, FeatureType type) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    /** Creates a detached feature carrying every attribute of {@code definition}. */
    public static Feature from(FeatureDefinition definition) {
        Feature feature = new Feature(definition.name(), definition.type());
        feature.domain = definition.domain();
        feature.presence = definition.presence() != null ? definition.presence() : Presence.NONE;
        feature.valueCount = definition.valueCount();
        feature.inEnvironment.addAll(definition.inEnvironment());
        feature.notInEnvironment.addAll(definition.notInEnvironment());
        feature.deprecated = definition.deprecated();
        feature.skewComparator = definition.skewComparator();
        return feature;
    }

    /** Snapshot of this feature as a serializable definition. */
    public FeatureDefinition toDefinition() {
        return new FeatureDefinition(
                name,
                type,
                domain,
                presence.equals(Presence.NONE) ? null : presence,
                valueCount,
                List.copyOf(inEnvironment),
                List.copyOf(notInEnvironment),
                deprecated,
                skewComparator);
    }

    @Override
    public String name() {
        return name;
    }

    public FeatureType type() {
        return type;
    }

    public void setType(FeatureType type) {
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    public Optional<String> domain() {
        return Optional.ofNullable(domain);
    }

    /** Restricts the feature to {@code domain}, which must belong to the feature's schema. */
    public void setDomain(StringDomain domain) {
        this.domain = Objects.requireNonNull(domain, "domain must not be null").name();
    }

    public void clearDomain() {
        this.domain = null;
    }

    /** Presence constraints; {@link Presence#NONE} when unconstrained. */
    public Presence presence() {
        return presence;
    }

    public void setPresence(Presence presence) {
        this.presence = presence != null ? presence : Presence.NONE;
    }

    public Optional<ValueCount> valueCount() {
        return Optional.ofNullable(valueCount);
    }

    public void setValueCount(ValueCount valueCount) {
        this.valueCount = valueCount;
    }

    public Set<String> inEnvironment() {
        return Collections.unmodifiableSet(inEnvironment);
    }

    public Set<String> notInEnvironment() {
        return Collections.unmodifiableSet(notInEnvironment);
    }

    /**
     * The explicit environment scope: the environments this feature is listed in, or empty when
     * the feature declares no membership of its own (resolved against the schema's default
     * environments, and "all environments" when there are none).
     */
    public Optional<Set<String>> environmentScope() {
        return inEnvironment.isEmpty() ? Optional.empty() : Optional.of(inEnvironment());
    }

    public void addInEnvironment(String environment) {
        inEnvironment.add(environment);
    }

    public boolean removeNotInEnvironment(String environment) {
        return notInEnvironment.remove(environment);
    }

    @Override
    public boolean isDeprecated() {
        return deprecated;
    }

    @Override
    public void deprecate() {
        this.deprecated = true;
    }

    public Optional<SkewComparator> skewComparator() {
        return Optional.ofNullable(skewComparator);
    }

    public void setSkewComparator(SkewComparator skewComparator) {
        this.skewComparator = skewComparator;
    }

    @Override
    public String toString() {
        return "Feature[" + name + ", " + type + (domain != null ? ", domain=" + domain : "")
                + (deprecated ? ", deprecated" : "") + "]";
    }
}
