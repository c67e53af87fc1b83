package io.schemadrift.core.stats;

import java.util.List;

/** Statistics of one dataset snapshot: the example count and one entry per column. */
public record DatasetStatistics(String name, long numExamples, List<FeatureStatistics> features) {

    public DatasetStatistics {
        features = features == null ? List.of() : List.copyOf(features);
    }
}
