package io.schemadrift.core.schema;

import io.schemadrift.core.model.SparseFeatureDefinition;
import java.util.List;
import java.util.Objects;

/** Schema entry for a composite feature spanning index columns and a value column. */
public final class SparseFeature implements SchemaElement {

    private final String name;
    private final List<String> indexFeatures;
    private final String valueFeature;
    private boolean deprecated;

    SparseFeature(String name, List<String> indexFeatures, String valueFeature, boolean deprecated) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.indexFeatures = List.copyOf(indexFeatures);
        this.valueFeature = Objects.requireNonNull(valueFeature, "valueFeature must not be null");
        this.deprecated = deprecated;
    }

    public static SparseFeature from(SparseFeatureDefinition definition) {
        return new SparseFeature(
                definition.name(), definition.indexFeatures(), definition.valueFeature(), definition.deprecated());
    }

    public SparseFeatureDefinition toDefinition() {
        return new SparseFeatureDefinition(name, indexFeatures, valueFeature, deprecated);
    }

    @Override
    public String name() {
        return name;
    }

    public List<String> indexFeatures() {
        return indexFeatures;
    }

    public String valueFeature() {
        return valueFeature;
    }

    @Override
    public boolean isDeprecated() {
        return deprecated;
    }

    @Override
    public void deprecate() {
        this.deprecated = true;
    }

    @Override
    public String toString() {
        return "SparseFeature[" + name + ", index=" + indexFeatures + ", value=" + valueFeature + "]";
    }
}
