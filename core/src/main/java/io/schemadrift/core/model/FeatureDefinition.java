package io.schemadrift.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Serializable description of one feature, as consumed by {@code SchemaEngine.init()} and
 * produced by {@code SchemaEngine.getSchema()}. Immutable.
 *
 * <p>An empty {@code inEnvironment} list means the feature's membership is not restricted
 * explicitly; see {@code Feature#environmentScope()} for how that is resolved against the
 * schema's default environments.
 *
 * @param name             feature name, unique within the schema
 * @param type             declared value type
 * @param domain           name of the referenced string domain, or {@code null}
 * @param presence         presence constraints, or {@code null} if unconstrained
 * @param valueCount       per-example value-count bounds, or {@code null} if unconstrained
 * @param inEnvironment    environments the feature is explicitly expected in
 * @param notInEnvironment environments the feature is explicitly excluded from
 * @param deprecated       soft-delete flag
 * @param skewComparator   training/serving skew check, or {@code null}
 */
public record FeatureDefinition(
        String name,
        FeatureType type,
        String domain,
        Presence presence,
        ValueCount valueCount,
        List<String> inEnvironment,
        List<String> notInEnvironment,
        boolean deprecated,
        SkewComparator skewComparator) {

    public FeatureDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        inEnvironment = inEnvironment == null ? List.of() : List.copyOf(inEnvironment);
        notInEnvironment = notInEnvironment == null ? List.of() : List.copyOf(notInEnvironment);
    }

    public static Builder builder(String name, FeatureType type) {
        return new Builder(name, type);
    }

    /** Builder for {@link FeatureDefinition}; mostly used by parsers and tests. */
    public static final class Builder {

        private final String name;
        private final FeatureType type;
        private String domain;
        private Presence presence;
        private ValueCount valueCount;
        private final List<String> inEnvironment = new ArrayList<>();
        private final List<String> notInEnvironment = new ArrayList<>();
        private boolean deprecated;
        private SkewComparator skewComparator;

        Builder(String name, FeatureType type) {
            this.name = name;
            this.type = type;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder presence(Presence presence) {
            this.presence = presence;
            return this;
        }

        public Builder valueCount(ValueCount valueCount) {
            this.valueCount = valueCount;
            return this;
        }

        public Builder inEnvironment(String... environments) {
            this.inEnvironment.addAll(List.of(environments));
            return this;
        }

        public Builder notInEnvironment(String... environments) {
            this.notInEnvironment.addAll(List.of(environments));
            return this;
        }

        public Builder deprecated(boolean deprecated) {
            this.deprecated = deprecated;
            return this;
        }

        public Builder skewComparator(SkewComparator skewComparator) {
            this.skewComparator = skewComparator;
            return this;
        }

        public FeatureDefinition build() {
            return new FeatureDefinition(
                    name,
                    type,
                    domain,
                    presence,
                    valueCount,
                    inEnvironment,
                    notInEnvironment,
                    deprecated,
                    skewComparator);
        }
    }
}
