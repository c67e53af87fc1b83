package io.schemadrift.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Serializable description of a sparse feature: a composite of one or more index columns and a
 * value column, all of which must be features of the same schema.
 */
public record SparseFeatureDefinition(
        String name, List<String> indexFeatures, String valueFeature, boolean deprecated) {

    public SparseFeatureDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(valueFeature, "valueFeature must not be null");
        indexFeatures = indexFeatures == null ? List.of() : List.copyOf(indexFeatures);
    }

    /** All underlying feature names: index features first, then the value feature. */
    public List<String> componentFeatures() {
        return Stream.concat(indexFeatures.stream(), Stream.of(valueFeature)).toList();
    }
}
