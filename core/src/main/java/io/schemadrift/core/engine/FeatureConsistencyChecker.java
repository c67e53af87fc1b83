package io.schemadrift.core.engine;

import io.schemadrift.core.model.AnomalyType;
import io.schemadrift.core.model.Description;
import io.schemadrift.core.model.FeatureType;
import io.schemadrift.core.model.Presence;
import io.schemadrift.core.model.SkewComparator;
import io.schemadrift.core.model.StringDomainDefinition;
import io.schemadrift.core.model.ValueCount;
import io.schemadrift.core.schema.DomainRegistry;
import io.schemadrift.core.schema.Feature;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Repairs internal contradictions of a single feature in place.
 *
 * <p>Never fails: every contradiction is resolved by moving the feature to the nearest valid
 * state, and each fix is reported as one {@link AnomalyType#INVALID_SCHEMA_SPECIFICATION}
 * description. A deprecated feature only has its domain reference checked.
 */
public final class FeatureConsistencyChecker {

    /**
     * Checks {@code feature} against itself and against {@code domains}, fixing what is wrong.
     *
     * @return one description per fix applied, empty if the feature was consistent
     */
    public List<Description> repair(Feature feature, DomainRegistry domains) {
        List<Description> fixes = new ArrayList<>();
        repairDomain(feature, domains, fixes);
        if (feature.isDeprecated()) {
            return fixes;
        }
        repairPresence(feature, fixes);
        repairValueCount(feature, fixes);
        repairEnvironments(feature, fixes);
        repairSkewComparator(feature, fixes);
        return fixes;
    }

    /**
     * Checks a domain as read from a document for repeated values.
     *
     * @return a description if {@code definition} lists a value more than once
     */
    public List<Description> checkDomainValues(StringDomainDefinition definition) {
        Set<String> distinct = new LinkedHashSet<>(definition.values());
        if (distinct.size() == definition.values().size()) {
            return List.of();
        }
        return List.of(fix(
                "Repeated values in domain",
                "Domain '" + definition.name() + "' lists " + (definition.values().size() - distinct.size())
                        + " repeated value(s); duplicates removed."));
    }

    private void repairDomain(Feature feature, DomainRegistry domains, List<Description> fixes) {
        String domain = feature.domain().orElse(null);
        if (domain == null) {
            return;
        }
        if (!domains.contains(domain)) {
            feature.clearDomain();
            fixes.add(fix(
                    "Missing domain",
                    "Feature '" + feature.name() + "' references unknown domain '" + domain
                            + "'; reference removed."));
        } else if (feature.type() != FeatureType.BYTES) {
            feature.clearDomain();
            fixes.add(fix(
                    "Domain on non-string feature",
                    "Feature '" + feature.name() + "' of type " + feature.type()
                            + " cannot use string domain '" + domain + "'; reference removed."));
        }
    }

    private void repairPresence(Feature feature, List<Description> fixes) {
        Presence presence = feature.presence();
        double fraction = presence.minFraction();
        double repairedFraction = Double.isNaN(fraction) ? 0.0 : Math.max(0.0, Math.min(1.0, fraction));
        long repairedCount = Math.max(0, presence.minCount());
        if (repairedFraction != fraction || repairedCount != presence.minCount()) {
            feature.setPresence(new Presence(repairedFraction, repairedCount));
            fixes.add(fix(
                    "Invalid presence",
                    "Feature '" + feature.name() + "' had presence min_fraction=" + fraction + ", min_count="
                            + presence.minCount() + "; clamped to min_fraction=" + repairedFraction
                            + ", min_count=" + repairedCount + "."));
        }
    }

    private void repairValueCount(Feature feature, List<Description> fixes) {
        ValueCount valueCount = feature.valueCount().orElse(null);
        if (valueCount == null) {
            return;
        }
        long min = Math.max(0, valueCount.min());
        Long max = valueCount.max();
        if (max != null && max < min) {
            max = min;
        }
        ValueCount repaired = new ValueCount(min, max);
        if (!repaired.equals(valueCount)) {
            feature.setValueCount(repaired);
            fixes.add(fix(
                    "Invalid value count",
                    "Feature '" + feature.name() + "' had value count [" + valueCount.min() + ", "
                            + valueCount.max() + "]; repaired to [" + min + ", " + max + "]."));
        }
    }

    private void repairEnvironments(Feature feature, List<Description> fixes) {
        List<String> overlap = feature.inEnvironment().stream()
                .filter(feature.notInEnvironment()::contains)
                .toList();
        for (String environment : overlap) {
            feature.removeNotInEnvironment(environment);
            fixes.add(fix(
                    "Contradictory environment",
                    "Feature '" + feature.name() + "' was both in and not in environment '" + environment
                            + "'; exclusion removed."));
        }
    }

    private void repairSkewComparator(Feature feature, List<Description> fixes) {
        SkewComparator comparator = feature.skewComparator().orElse(null);
        if (comparator == null) {
            return;
        }
        double threshold = comparator.infinityNormThreshold();
        if (Double.isNaN(threshold) || threshold < 0.0) {
            feature.setSkewComparator(new SkewComparator(0.0));
            fixes.add(fix(
                    "Invalid skew threshold",
                    "Feature '" + feature.name() + "' had skew threshold " + threshold + "; reset to 0."));
        }
    }

    private static Description fix(String shortDescription, String longDescription) {
        return new Description(AnomalyType.INVALID_SCHEMA_SPECIFICATION, shortDescription, longDescription);
    }
}
