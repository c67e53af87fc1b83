package io.schemadrift.core.parse;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemadrift.core.error.SchemaParseException;
import io.schemadrift.core.model.AnomalyType;
import io.schemadrift.core.model.EnumsSimilarConfig;
import io.schemadrift.core.model.Severity;
import io.schemadrift.core.model.UpdaterConfig;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Parses {@link UpdaterConfig} from YAML.
 *
 * <pre>
 * columns_to_ignore: [user_id]
 * enum_grouping:
 *   country_code: countries
 * enum_threshold: 400
 * enum_delete_threshold: 0
 * deprecate_missing_columns: true
 * severity_overrides:
 *   SCHEMA_NEW_COLUMN: INFO
 * enums_similar:
 *   min_count: 1
 *   min_jaccard_similarity: 0.5
 * </pre>
 *
 * Every key is optional; omitted keys keep {@link UpdaterConfig#defaults()}.
 */
public final class UpdaterConfigParser {

    private static final Set<String> ROOT_KEYS = Set.of(
            "columns_to_ignore",
            "enum_grouping",
            "enum_threshold",
            "enum_delete_threshold",
            "deprecate_missing_columns",
            "severity_overrides",
            "enums_similar");
    private static final Set<String> ENUMS_SIMILAR_KEYS = Set.of("min_count", "min_jaccard_similarity");

    public UpdaterConfig parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        return toConfig(YamlDocuments.read(path), path.toString());
    }

    public UpdaterConfig parse(String content, String source) {
        Objects.requireNonNull(content, "content must not be null");
        return toConfig(YamlDocuments.read(content, source), source);
    }

    private UpdaterConfig toConfig(JsonNode root, String source) {
        YamlDocuments.rejectUnknownKeys(root, ROOT_KEYS, "updater config", source);
        UpdaterConfig.Builder builder = UpdaterConfig.builder();
        YamlDocuments.stringList(root, "columns_to_ignore").forEach(builder::ignoreColumn);

        JsonNode grouping = root.get("enum_grouping");
        if (grouping != null) {
            requireMapping(grouping, "enum_grouping", source);
            Iterator<Map.Entry<String, JsonNode>> fields = grouping.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.groupEnum(field.getKey(), field.getValue().asText());
            }
        }

        try {
            if (root.has("enum_threshold")) {
                builder.enumThreshold(requireInt(root, "enum_threshold", source));
            }
            if (root.has("enum_delete_threshold")) {
                builder.enumDeleteThreshold(requireInt(root, "enum_delete_threshold", source));
            }
            JsonNode similar = root.get("enums_similar");
            if (similar != null) {
                requireMapping(similar, "enums_similar", source);
                YamlDocuments.rejectUnknownKeys(similar, ENUMS_SIMILAR_KEYS, "enums_similar", source);
                builder.enumsSimilarConfig(new EnumsSimilarConfig(
                        similar.has("min_count")
                                ? requireInt(similar, "min_count", source)
                                : EnumsSimilarConfig.DEFAULT.minCount(),
                        similar.path("min_jaccard_similarity")
                                .asDouble(EnumsSimilarConfig.DEFAULT.minJaccardSimilarity())));
            }
        } catch (IllegalArgumentException e) {
            throw new SchemaParseException("Invalid updater config: " + e.getMessage(), e, null, source);
        }

        JsonNode deprecate = root.get("deprecate_missing_columns");
        if (deprecate != null) {
            if (!deprecate.isBoolean()) {
                throw new SchemaParseException("'deprecate_missing_columns' must be a boolean", null, source);
            }
            builder.deprecateMissingColumns(deprecate.booleanValue());
        }

        JsonNode overrides = root.get("severity_overrides");
        if (overrides != null) {
            requireMapping(overrides, "severity_overrides", source);
            Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.severityOverride(
                        enumValue(AnomalyType.class, field.getKey(), "anomaly type", source),
                        enumValue(Severity.class, field.getValue().asText(), "severity", source));
            }
        }
        return builder.build();
    }

    private static int requireInt(JsonNode node, String field, String source) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new SchemaParseException("'" + field + "' must be an integer, got " + value, null, source);
        }
        return value.intValue();
    }

    private static void requireMapping(JsonNode node, String field, String source) {
        if (!node.isObject()) {
            throw new SchemaParseException("'" + field + "' must be a mapping", null, source);
        }
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String name, String kind, String source) {
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new SchemaParseException("Unknown " + kind + " '" + name + "'", e, null, source);
        }
    }
}
