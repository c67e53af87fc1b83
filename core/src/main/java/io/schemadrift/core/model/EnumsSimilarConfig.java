package io.schemadrift.core.model;

/**
 * Policy for deciding that two string domains are near-duplicates.
 *
 * @param minCount             domains with fewer values than this are never clustered
 * @param minJaccardSimilarity minimum {@code |a ∩ b| / |a ∪ b|} for two domains to be similar
 */
public record EnumsSimilarConfig(int minCount, double minJaccardSimilarity) {

    public static final EnumsSimilarConfig DEFAULT = new EnumsSimilarConfig(1, 0.5);

    public EnumsSimilarConfig {
        if (minCount < 0) {
            throw new IllegalArgumentException("minCount must be >= 0, got " + minCount);
        }
        if (minJaccardSimilarity < 0.0 || minJaccardSimilarity > 1.0) {
            throw new IllegalArgumentException(
                    "minJaccardSimilarity must be in [0, 1], got " + minJaccardSimilarity);
        }
    }
}
