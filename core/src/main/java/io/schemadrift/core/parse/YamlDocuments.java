package io.schemadrift.core.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.schemadrift.core.error.SchemaParseException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Shared reading helpers for the YAML/JSON documents this package parses. JSON input is read by
 * the same mapper, since JSON documents are valid YAML.
 */
final class YamlDocuments {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private YamlDocuments() {}

    /** Loads a bundled JSON Schema from the classpath. */
    static JsonSchema loadSchema(String resource) {
        try (InputStream in = YamlDocuments.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Bundled JSON Schema not found on classpath: " + resource);
            }
            return SCHEMA_FACTORY.getSchema(JSON_MAPPER.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled JSON Schema " + resource, e);
        }
    }

    static JsonNode read(Path path) {
        String source = path.toString();
        try {
            return requireObject(YAML_MAPPER.readTree(path.toFile()), source);
        } catch (IOException e) {
            throw new SchemaParseException("Failed to read or parse YAML: " + e.getMessage(), e, null, source);
        }
    }

    static JsonNode read(String content, String source) {
        try {
            return requireObject(YAML_MAPPER.readTree(content), source);
        } catch (IOException e) {
            throw new SchemaParseException("Failed to parse YAML: " + e.getMessage(), e, null, source);
        }
    }

    private static JsonNode requireObject(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new SchemaParseException("Document root must be a mapping", null, source);
        }
        return root;
    }

    /**
     * Validates {@code root} against {@code schema}.
     *
     * @throws SchemaParseException listing every violation, sorted for stable messages
     */
    static void validate(JsonNode root, JsonSchema schema, String kind, String source) {
        Set<ValidationMessage> errors = schema.validate(root);
        if (!errors.isEmpty()) {
            List<String> messages = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.toList());
            throw new SchemaParseException("Invalid " + kind + ": " + String.join("; ", messages), null, source);
        }
    }

    static String optionalString(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    static List<String> stringList(JsonNode node, String field) {
        JsonNode array = node.get(field);
        if (array == null || !array.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            values.add(element.asText());
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Rejects keys not in {@code knownKeys}, so typos in hand-written documents are caught at load
     * time instead of silently ignored.
     */
    static void rejectUnknownKeys(JsonNode node, Set<String> knownKeys, String blockName, String source) {
        if (node == null || !node.isObject()) {
            return;
        }
        List<String> unknown = StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                .filter(key -> !knownKeys.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new SchemaParseException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in '" + blockName + "': " + unknown
                            + " - recognized keys are: " + knownKeys,
                    null,
                    source);
        }
    }
}
