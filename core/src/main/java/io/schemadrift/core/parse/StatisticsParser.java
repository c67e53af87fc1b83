package io.schemadrift.core.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import io.schemadrift.core.error.SchemaParseException;
import io.schemadrift.core.stats.DatasetStatistics;
import io.schemadrift.core.stats.FeatureStatistics;
import io.schemadrift.core.stats.StatsType;
import io.schemadrift.core.stats.StringStatistics;
import io.schemadrift.core.stats.ValueFrequency;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses dataset statistics snapshots (YAML or JSON) into {@link DatasetStatistics}.
 *
 * <p>Counts omitted from a feature default to 0. Consistency between counts is not checked here;
 * {@code SchemaEngine.update()} validates the snapshot before touching the schema.
 */
public final class StatisticsParser {

    private static final JsonSchema STATISTICS_SCHEMA = YamlDocuments.loadSchema("/schemadrift/statistics.schema.json");

    /**
     * Parses the statistics snapshot at {@code path}.
     *
     * @throws SchemaParseException if the file cannot be read or does not match the statistics format
     */
    public DatasetStatistics parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        return toStatistics(YamlDocuments.read(path), path.toString());
    }

    public DatasetStatistics parse(String content, String source) {
        Objects.requireNonNull(content, "content must not be null");
        return toStatistics(YamlDocuments.read(content, source), source);
    }

    private DatasetStatistics toStatistics(JsonNode root, String source) {
        YamlDocuments.validate(root, STATISTICS_SCHEMA, "statistics", source);
        List<FeatureStatistics> features = new ArrayList<>();
        for (JsonNode node : root.path("features")) {
            features.add(parseFeature(node));
        }
        return new DatasetStatistics(
                YamlDocuments.optionalString(root, "name"), root.path("num_examples").asLong(0), features);
    }

    private FeatureStatistics parseFeature(JsonNode node) {
        StringStatistics stringStats = null;
        JsonNode strings = node.get("string_stats");
        if (strings != null && strings.isObject()) {
            List<ValueFrequency> topValues = new ArrayList<>();
            for (JsonNode entry : strings.path("top_values")) {
                topValues.add(new ValueFrequency(entry.get("value").asText(), entry.path("frequency").asDouble(0.0)));
            }
            stringStats = new StringStatistics(
                    strings.path("unique").asLong(topValues.size()), topValues, strings.path("avg_length").asDouble(0.0));
        }
        Map<String, Double> customStats = new LinkedHashMap<>();
        JsonNode custom = node.get("custom_stats");
        if (custom != null && custom.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = custom.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                customStats.put(field.getKey(), field.getValue().asDouble());
            }
        }
        return new FeatureStatistics(
                node.get("name").asText(),
                StatsType.valueOf(node.get("type").asText()),
                node.path("num_non_missing").asLong(0),
                node.path("num_missing").asLong(0),
                node.path("min_num_values").asLong(0),
                node.path("max_num_values").asLong(0),
                stringStats,
                customStats);
    }
}
