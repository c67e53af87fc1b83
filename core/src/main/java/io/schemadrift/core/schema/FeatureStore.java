package io.schemadrift.core.schema;

import io.schemadrift.core.model.FeatureType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Column name to {@link Feature} mapping, plus the schema's {@link SparseFeature}s. Iteration is
 * ordered by name. Entries are never removed individually; see {@link SchemaElement#deprecate()}.
 */
public final class FeatureStore {

    private final Map<String, Feature> features = new TreeMap<>();
    private final Map<String, SparseFeature> sparseFeatures = new TreeMap<>();

    public Optional<Feature> get(String name) {
        return Optional.ofNullable(features.get(name));
    }

    public Optional<SparseFeature> getSparse(String name) {
        return Optional.ofNullable(sparseFeatures.get(name));
    }

    /** Finds a feature or sparse feature by name. Features take precedence. */
    public Optional<SchemaElement> find(String name) {
        Feature feature = features.get(name);
        if (feature != null) {
            return Optional.of(feature);
        }
        return Optional.ofNullable(sparseFeatures.get(name));
    }

    public boolean contains(String name) {
        return features.containsKey(name) || sparseFeatures.containsKey(name);
    }

    /**
     * Creates and stores a new feature.
     *
     * @throws IllegalStateException if a feature or sparse feature with this name exists
     */
    public Feature create(String name, FeatureType type) {
        return add(new Feature(name, type));
    }

    /**
     * Stores a detached feature.
     *
     * @throws IllegalStateException if a feature or sparse feature with this name exists
     */
    Feature add(Feature feature) {
        if (contains(feature.name())) {
            throw new IllegalStateException("Feature already exists: '" + feature.name() + "'");
        }
        features.put(feature.name(), feature);
        return feature;
    }

    /**
     * Stores a detached sparse feature.
     *
     * @throws IllegalStateException if a feature or sparse feature with this name exists
     */
    SparseFeature addSparse(SparseFeature sparseFeature) {
        if (contains(sparseFeature.name())) {
            throw new IllegalStateException("Feature already exists: '" + sparseFeature.name() + "'");
        }
        sparseFeatures.put(sparseFeature.name(), sparseFeature);
        return sparseFeature;
    }

    /** Features sorted by name. */
    public Collection<Feature> features() {
        return Collections.unmodifiableCollection(features.values());
    }

    /** Sparse features sorted by name. */
    public Collection<SparseFeature> sparseFeatures() {
        return Collections.unmodifiableCollection(sparseFeatures.values());
    }

    /** Names of the features referencing the given domain, sorted. */
    public List<String> featuresUsingDomain(String domainName) {
        List<String> names = new ArrayList<>();
        for (Feature feature : features.values()) {
            if (domainName.equals(feature.domain().orElse(null))) {
                names.add(feature.name());
            }
        }
        return names;
    }

    public int size() {
        return features.size();
    }

    public boolean isEmpty() {
        return features.isEmpty() && sparseFeatures.isEmpty();
    }

    public void clear() {
        features.clear();
        sparseFeatures.clear();
    }

    void transferFrom(FeatureStore other) {
        clear();
        features.putAll(other.features);
        sparseFeatures.putAll(other.sparseFeatures);
        other.clear();
    }
}
