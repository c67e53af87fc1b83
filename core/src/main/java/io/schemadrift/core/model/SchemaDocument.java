package io.schemadrift.core.model;

import java.util.List;

/**
 * Structured, serializable form of a whole schema. Consumed by {@code SchemaEngine.init()} and
 * produced by {@code SchemaEngine.getSchema()}; {@code init(getSchema(s))} on an empty schema
 * reproduces {@code s}.
 *
 * @param features            features (produced sorted by name)
 * @param sparseFeatures      sparse features (produced sorted by name)
 * @param stringDomains       string domains (produced sorted by name)
 * @param defaultEnvironments environments a feature without explicit membership belongs to; empty
 *                            means "all environments"
 */
public record SchemaDocument(
        List<FeatureDefinition> features,
        List<SparseFeatureDefinition> sparseFeatures,
        List<StringDomainDefinition> stringDomains,
        List<String> defaultEnvironments) {

    public SchemaDocument {
        features = features == null ? List.of() : List.copyOf(features);
        sparseFeatures = sparseFeatures == null ? List.of() : List.copyOf(sparseFeatures);
        stringDomains = stringDomains == null ? List.of() : List.copyOf(stringDomains);
        defaultEnvironments = defaultEnvironments == null ? List.of() : List.copyOf(defaultEnvironments);
    }

    public static SchemaDocument empty() {
        return new SchemaDocument(List.of(), List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return features.isEmpty() && sparseFeatures.isEmpty() && stringDomains.isEmpty();
    }
}
