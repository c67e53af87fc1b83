package io.schemadrift.core.stats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view over a {@link DatasetStatistics} snapshot, optionally scoped to a named
 * environment and optionally paired with a serving-side snapshot for skew checks.
 *
 * <p>An absent environment means the snapshot is checked against every feature regardless of its
 * environment membership.
 */
public final class DatasetStatsView {

    private final DatasetStatistics data;
    private final String environment;
    private final DatasetStatsView serving;
    private final List<FeatureStatsView> features;
    private final Map<String, FeatureStatsView> byName;

    public DatasetStatsView(DatasetStatistics data) {
        this(data, null, null);
    }

    public DatasetStatsView(DatasetStatistics data, String environment) {
        this(data, environment, null);
    }

    /**
     * @param data        the snapshot
     * @param environment environment the snapshot was taken in, or {@code null} for "all"
     * @param serving     serving-side snapshot compared against for skew, or {@code null}
     */
    public DatasetStatsView(DatasetStatistics data, String environment, DatasetStatsView serving) {
        this.data = Objects.requireNonNull(data, "data must not be null");
        this.environment = environment;
        this.serving = serving;
        List<FeatureStatsView> views = new ArrayList<>(data.features().size());
        Map<String, FeatureStatsView> index = new HashMap<>();
        for (FeatureStatistics feature : data.features()) {
            FeatureStatsView view = new FeatureStatsView(this, feature);
            views.add(view);
            if (feature.name() != null) {
                index.putIfAbsent(feature.name(), view);
            }
        }
        this.features = Collections.unmodifiableList(views);
        this.byName = Collections.unmodifiableMap(index);
    }

    /** Returns a copy of this view scoped to another environment. */
    public DatasetStatsView withEnvironment(String newEnvironment) {
        return new DatasetStatsView(data, newEnvironment, serving);
    }

    /** Returns a copy of this view paired with a serving-side snapshot. */
    public DatasetStatsView withServing(DatasetStatsView servingView) {
        return new DatasetStatsView(data, environment, servingView);
    }

    /** Per-column views in snapshot order. */
    public List<FeatureStatsView> features() {
        return features;
    }

    /** Looks up a column by exact name (first occurrence if the snapshot repeats a name). */
    public Optional<FeatureStatsView> getByName(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    public Optional<String> environment() {
        return Optional.ofNullable(environment);
    }

    public Optional<DatasetStatsView> servingView() {
        return Optional.ofNullable(serving);
    }

    public long numExamples() {
        return data.numExamples();
    }

    public String name() {
        return data.name();
    }

    public DatasetStatistics data() {
        return data;
    }
}
