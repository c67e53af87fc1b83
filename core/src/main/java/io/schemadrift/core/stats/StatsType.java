package io.schemadrift.core.stats;

import io.schemadrift.core.model.FeatureType;

/** Basic value type reported by the statistics generator for a column. */
public enum StatsType {
    INT(FeatureType.INT),
    FLOAT(FeatureType.FLOAT),
    STRING(FeatureType.BYTES),
    BYTES(FeatureType.BYTES),
    STRUCT(FeatureType.STRUCT);

    private final FeatureType featureType;

    StatsType(FeatureType featureType) {
        this.featureType = featureType;
    }

    /** The schema feature type a column of this statistics type is declared with. */
    public FeatureType featureType() {
        return featureType;
    }
}
