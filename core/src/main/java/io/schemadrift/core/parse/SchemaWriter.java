package io.schemadrift.core.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import io.schemadrift.core.model.FeatureDefinition;
import io.schemadrift.core.model.Presence;
import io.schemadrift.core.model.SchemaDocument;
import io.schemadrift.core.model.SparseFeatureDefinition;
import io.schemadrift.core.model.StringDomainDefinition;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes {@link SchemaDocument}s in the format {@link SchemaParser} reads. Attributes at their
 * default (no domain, no constraints, not deprecated) are omitted.
 */
public final class SchemaWriter {

    private static final ObjectMapper YAML_WRITER = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));
    private static final ObjectMapper JSON_WRITER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public String toYaml(SchemaDocument document) {
        return write(YAML_WRITER, document);
    }

    public String toJson(SchemaDocument document) {
        return write(JSON_WRITER, document);
    }

    /** Writes the document as YAML to {@code path}, replacing any existing file. */
    public void writeYaml(SchemaDocument document, Path path) {
        try {
            Files.writeString(path, toYaml(document), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write schema document to " + path, e);
        }
    }

    private String write(ObjectMapper mapper, SchemaDocument document) {
        try {
            return mapper.writeValueAsString(toTree(mapper, document));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize schema document", e);
        }
    }

    private ObjectNode toTree(ObjectMapper mapper, SchemaDocument document) {
        ObjectNode root = mapper.createObjectNode();
        putList(root, "default_environments", document.defaultEnvironments());
        if (!document.features().isEmpty()) {
            ArrayNode features = root.putArray("features");
            document.features().forEach(feature -> features.add(featureNode(mapper, feature)));
        }
        if (!document.sparseFeatures().isEmpty()) {
            ArrayNode sparse = root.putArray("sparse_features");
            for (SparseFeatureDefinition definition : document.sparseFeatures()) {
                ObjectNode node = sparse.addObject();
                node.put("name", definition.name());
                putList(node, "index_features", definition.indexFeatures());
                node.put("value_feature", definition.valueFeature());
                if (definition.deprecated()) {
                    node.put("deprecated", true);
                }
            }
        }
        if (!document.stringDomains().isEmpty()) {
            ArrayNode domains = root.putArray("string_domains");
            for (StringDomainDefinition domain : document.stringDomains()) {
                ObjectNode node = domains.addObject();
                node.put("name", domain.name());
                ArrayNode values = node.putArray("values");
                domain.values().forEach(values::add);
            }
        }
        return root;
    }

    private ObjectNode featureNode(ObjectMapper mapper, FeatureDefinition feature) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", feature.name());
        node.put("type", feature.type().name());
        if (feature.domain() != null) {
            node.put("domain", feature.domain());
        }
        Presence presence = feature.presence();
        if (presence != null) {
            ObjectNode presenceNode = node.putObject("presence");
            presenceNode.put("min_fraction", presence.minFraction());
            presenceNode.put("min_count", presence.minCount());
        }
        if (feature.valueCount() != null) {
            ObjectNode valueCount = node.putObject("value_count");
            valueCount.put("min", feature.valueCount().min());
            if (feature.valueCount().max() != null) {
                valueCount.put("max", feature.valueCount().max());
            }
        }
        putList(node, "in_environment", feature.inEnvironment());
        putList(node, "not_in_environment", feature.notInEnvironment());
        if (feature.deprecated()) {
            node.put("deprecated", true);
        }
        if (feature.skewComparator() != null) {
            node.putObject("skew_comparator")
                    .put("infinity_norm_threshold", feature.skewComparator().infinityNormThreshold());
        }
        return node;
    }

    private static void putList(ObjectNode node, String field, List<String> values) {
        if (!values.isEmpty()) {
            ArrayNode array = node.putArray(field);
            values.forEach(array::add);
        }
    }
}
