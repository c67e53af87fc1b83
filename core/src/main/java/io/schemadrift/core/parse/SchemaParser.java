package io.schemadrift.core.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import io.schemadrift.core.error.SchemaParseException;
import io.schemadrift.core.model.FeatureDefinition;
import io.schemadrift.core.model.FeatureType;
import io.schemadrift.core.model.Presence;
import io.schemadrift.core.model.SchemaDocument;
import io.schemadrift.core.model.SkewComparator;
import io.schemadrift.core.model.SparseFeatureDefinition;
import io.schemadrift.core.model.StringDomainDefinition;
import io.schemadrift.core.model.ValueCount;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses YAML or JSON schema documents into {@link SchemaDocument}s.
 *
 * <p>The document is first validated against the bundled {@code schema-document.schema.json},
 * which rejects unknown keys, missing names and unknown feature types. Semantic checks (duplicate
 * names, dangling references) are left to {@code SchemaEngine.init()}.
 *
 * <p>Thread-safe.
 */
public final class SchemaParser {

    private static final JsonSchema DOCUMENT_SCHEMA = YamlDocuments.loadSchema("/schemadrift/schema-document.schema.json");

    /**
     * Parses the schema document at {@code path}.
     *
     * @throws SchemaParseException if the file cannot be read or is not a valid schema document
     */
    public SchemaDocument parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        return toDocument(YamlDocuments.read(path), path.toString());
    }

    /**
     * Parses a schema document held in memory.
     *
     * @param content YAML or JSON text
     * @param source  identifier used in error messages
     * @throws SchemaParseException if the text is not a valid schema document
     */
    public SchemaDocument parse(String content, String source) {
        Objects.requireNonNull(content, "content must not be null");
        return toDocument(YamlDocuments.read(content, source), source);
    }

    private SchemaDocument toDocument(JsonNode root, String source) {
        YamlDocuments.validate(root, DOCUMENT_SCHEMA, "schema document", source);

        List<FeatureDefinition> features = new ArrayList<>();
        for (JsonNode node : root.path("features")) {
            features.add(parseFeature(node));
        }
        List<SparseFeatureDefinition> sparseFeatures = new ArrayList<>();
        for (JsonNode node : root.path("sparse_features")) {
            sparseFeatures.add(new SparseFeatureDefinition(
                    node.get("name").asText(),
                    YamlDocuments.stringList(node, "index_features"),
                    node.get("value_feature").asText(),
                    node.path("deprecated").asBoolean(false)));
        }
        List<StringDomainDefinition> domains = new ArrayList<>();
        for (JsonNode node : root.path("string_domains")) {
            domains.add(new StringDomainDefinition(node.get("name").asText(), YamlDocuments.stringList(node, "values")));
        }
        return new SchemaDocument(
                features, sparseFeatures, domains, YamlDocuments.stringList(root, "default_environments"));
    }

    private FeatureDefinition parseFeature(JsonNode node) {
        FeatureDefinition.Builder builder = FeatureDefinition.builder(
                        node.get("name").asText(), FeatureType.valueOf(node.get("type").asText()))
                .domain(YamlDocuments.optionalString(node, "domain"))
                .deprecated(node.path("deprecated").asBoolean(false));

        JsonNode presence = node.get("presence");
        if (presence != null && presence.isObject()) {
            builder.presence(new Presence(
                    presence.path("min_fraction").asDouble(0.0), presence.path("min_count").asLong(0)));
        }
        JsonNode valueCount = node.get("value_count");
        if (valueCount != null && valueCount.isObject()) {
            JsonNode max = valueCount.get("max");
            builder.valueCount(new ValueCount(valueCount.path("min").asLong(0), max == null ? null : max.asLong()));
        }
        JsonNode skew = node.get("skew_comparator");
        if (skew != null && skew.isObject()) {
            builder.skewComparator(new SkewComparator(skew.get("infinity_norm_threshold").asDouble()));
        }
        builder.inEnvironment(YamlDocuments.stringList(node, "in_environment").toArray(String[]::new));
        builder.notInEnvironment(YamlDocuments.stringList(node, "not_in_environment").toArray(String[]::new));
        return builder.build();
    }
}
