package io.schemadrift.core.stats;

import io.schemadrift.core.model.FeatureType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/** Read-only view of one column's statistics within a {@link DatasetStatsView}. */
public final class FeatureStatsView {

    private final DatasetStatsView parent;
    private final FeatureStatistics data;

    FeatureStatsView(DatasetStatsView parent, FeatureStatistics data) {
        this.parent = parent;
        this.data = data;
    }

    public String name() {
        return data.name();
    }

    /** The feature type a column with these statistics is declared with. */
    public FeatureType featureType() {
        return data.type().featureType();
    }

    /** Number of examples that contain the column. */
    public long numPresent() {
        return data.numNonMissing();
    }

    public long numMissing() {
        return data.numMissing();
    }

    /**
     * Number of examples in the snapshot. Falls back to present + missing when the snapshot does
     * not carry an example count.
     */
    public long numExamples() {
        long total = parent.numExamples();
        return total > 0 ? total : data.numNonMissing() + data.numMissing();
    }

    /** Fraction of examples that contain the column, 0 for an empty snapshot. */
    public double fractionPresent() {
        long total = numExamples();
        return total == 0 ? 0.0 : (double) data.numNonMissing() / total;
    }

    public long minNumValues() {
        return data.minNumValues();
    }

    public long maxNumValues() {
        return data.maxNumValues();
    }

    public Optional<StringStatistics> stringStats() {
        return Optional.ofNullable(data.stringStats());
    }

    /** Observed string values (the top-values list), most frequent first. */
    public List<String> stringValues() {
        if (data.stringStats() == null) {
            return List.of();
        }
        return data.stringStats().topValues().stream().map(ValueFrequency::value).toList();
    }

    /**
     * Returns true if the column looks like an enumeration: a string column whose complete value
     * list is known and holds at most {@code enumThreshold} distinct values.
     */
    public boolean isCategorical(int enumThreshold) {
        StringStatistics strings = data.stringStats();
        return featureType() == FeatureType.BYTES
                && strings != null
                && strings.unique() > 0
                && strings.unique() <= enumThreshold
                && strings.isComplete()
                && !strings.containsLargeValues();
    }

    /** The top-values frequencies normalized to sum to 1, most frequent first. */
    public Map<String, Double> valueDistribution() {
        StringStatistics strings = data.stringStats();
        if (strings == null) {
            return Map.of();
        }
        double total = strings.topValues().stream()
                .mapToDouble(ValueFrequency::frequency)
                .sum();
        if (total <= 0.0) {
            return Map.of();
        }
        Map<String, Double> distribution = new LinkedHashMap<>();
        for (ValueFrequency value : strings.topValues()) {
            distribution.merge(value.value(), value.frequency() / total, Double::sum);
        }
        return Collections.unmodifiableMap(distribution);
    }

    public OptionalDouble customStat(String statName) {
        Double value = data.customStats().get(statName);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /** The same column in the paired serving snapshot, if any. */
    public Optional<FeatureStatsView> servingView() {
        return parent.servingView().flatMap(serving -> serving.getByName(data.name()));
    }

    public Optional<String> environment() {
        return parent.environment();
    }

    public FeatureStatistics data() {
        return data;
    }

    @Override
    public String toString() {
        return "FeatureStatsView[" + data.name() + ", " + data.type() + "]";
    }
}
