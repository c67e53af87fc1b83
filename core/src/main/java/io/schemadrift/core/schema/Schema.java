package io.schemadrift.core.schema;

import io.schemadrift.core.model.FeatureDefinition;
import io.schemadrift.core.model.SchemaDocument;
import io.schemadrift.core.model.SparseFeatureDefinition;
import io.schemadrift.core.model.StringDomainDefinition;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Root aggregate: the features, sparse features and string domains describing the expected shape
 * of a dataset, plus the schema's default environments.
 *
 * <p>A schema starts empty and is populated by {@code SchemaEngine.init()} or the first
 * {@code SchemaEngine.update()}; {@link #clear()} returns it to the empty state. Every feature's
 * domain reference names a domain of the same schema.
 *
 * <p>Not thread-safe. Concurrent mutation of one instance must be serialized by the caller;
 * independent instances share no state.
 */
public final class Schema {

    private final FeatureStore features = new FeatureStore();
    private final DomainRegistry domains = new DomainRegistry();
    private final Set<String> defaultEnvironments = new LinkedHashSet<>();

    public FeatureStore features() {
        return features;
    }

    public DomainRegistry domains() {
        return domains;
    }

    /** Environments a feature without explicit membership belongs to; empty means all. */
    public Set<String> defaultEnvironments() {
        return Collections.unmodifiableSet(defaultEnvironments);
    }

    public void setDefaultEnvironments(List<String> environments) {
        defaultEnvironments.clear();
        defaultEnvironments.addAll(environments);
    }

    /** Returns true if the schema has no domains and no features. */
    public boolean isEmpty() {
        return domains.isEmpty() && features.isEmpty();
    }

    public void clear() {
        features.clear();
        domains.clear();
        defaultEnvironments.clear();
    }

    /**
     * Returns true if {@code feature} is expected in {@code environment}. With no environment, every
     * feature is. Otherwise explicit membership wins, then explicit exclusion; a feature with an
     * explicit membership list is outside every environment it does not name; a feature without one
     * follows the default environments, or belongs everywhere when there are none.
     */
    public boolean isFeatureInEnvironment(Feature feature, Optional<String> environment) {
        if (environment.isEmpty()) {
            return true;
        }
        String env = environment.get();
        if (feature.inEnvironment().contains(env)) {
            return true;
        }
        if (feature.notInEnvironment().contains(env)) {
            return false;
        }
        if (!feature.inEnvironment().isEmpty()) {
            return false;
        }
        return defaultEnvironments.isEmpty() || defaultEnvironments.contains(env);
    }

    /**
     * Returns true if a snapshot taken in {@code environment} must contain {@code feature}: the
     * feature is not deprecated, its presence constraints require at least one example, and it is
     * expected in that environment.
     */
    public boolean isExistenceRequired(Feature feature, Optional<String> environment) {
        if (feature.isDeprecated()) {
            return false;
        }
        if (!feature.presence().isExistenceRequired()) {
            return false;
        }
        return isFeatureInEnvironment(feature, environment);
    }

    /**
     * Builds a detached schema holding exactly the elements of {@code document}. Domain values are
     * de-duplicated; feature domain references are copied as written and may be dangling until the
     * features are repaired. {@link #replaceContents} refuses a staged schema that still has one.
     */
    public static Schema staged(SchemaDocument document) {
        Schema staged = new Schema();
        staged.setDefaultEnvironments(document.defaultEnvironments());
        for (StringDomainDefinition domain : document.stringDomains()) {
            staged.domains.register(domain.name(), new LinkedHashSet<>(domain.values()));
        }
        for (FeatureDefinition definition : document.features()) {
            staged.features.add(Feature.from(definition));
        }
        for (SparseFeatureDefinition definition : document.sparseFeatures()) {
            staged.features.addSparse(SparseFeature.from(definition));
        }
        return staged;
    }

    /**
     * Moves all state of {@code staged} into this schema, leaving {@code staged} empty.
     *
     * @throws IllegalStateException if a feature of {@code staged} references a domain it does not
     *                               contain; both schemas are left unchanged
     */
    public void replaceContents(Schema staged) {
        for (Feature feature : staged.features.features()) {
            feature.domain()
                    .filter(domain -> !staged.domains.contains(domain))
                    .ifPresent(domain -> {
                        throw new IllegalStateException(
                                "Feature '" + feature.name() + "' references unknown domain '" + domain + "'");
                    });
        }
        features.transferFrom(staged.features);
        domains.transferFrom(staged.domains);
        defaultEnvironments.clear();
        defaultEnvironments.addAll(staged.defaultEnvironments);
        staged.defaultEnvironments.clear();
    }

    @Override
    public String toString() {
        return "Schema[features=" + features.size() + ", sparse_features=" + features.sparseFeatures().size()
                + ", domains=" + domains.size() + "]";
    }
}
