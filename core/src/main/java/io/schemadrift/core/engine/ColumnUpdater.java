package io.schemadrift.core.engine;

import io.schemadrift.core.model.AnomalyInfo;
import io.schemadrift.core.model.AnomalyType;
import io.schemadrift.core.model.Description;
import io.schemadrift.core.model.FeatureType;
import io.schemadrift.core.model.Presence;
import io.schemadrift.core.model.Severity;
import io.schemadrift.core.model.SkewComparator;
import io.schemadrift.core.model.UpdaterConfig;
import io.schemadrift.core.model.ValueCount;
import io.schemadrift.core.schema.DomainRegistry;
import io.schemadrift.core.schema.Feature;
import io.schemadrift.core.schema.Schema;
import io.schemadrift.core.schema.SparseFeature;
import io.schemadrift.core.schema.StringDomain;
import io.schemadrift.core.stats.FeatureStatistics;
import io.schemadrift.core.stats.FeatureStatsView;
import io.schemadrift.core.stats.StringStatistics;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates or reconciles the schema entry for one column.
 *
 * <p>An updater is built once per update call from an {@link UpdaterConfig}; the ignore set, the
 * enum grouping map and the set of reserved domain names are derived at construction and reused
 * for every column. The result for a column never depends on other columns' results.
 *
 * <p>Every discrepancy found is healed: bounds are widened, domains extended, types replaced.
 * The returned severity is the maximum over the column's descriptions.
 */
public final class ColumnUpdater {

    private static final Logger LOG = LoggerFactory.getLogger(ColumnUpdater.class);

    private final UpdaterConfig config;
    private final FeatureConsistencyChecker checker;
    private final Set<String> columnsToIgnore;
    private final Map<String, String> groupedEnums;
    private final Set<String> reservedDomainNames;

    public ColumnUpdater(UpdaterConfig config) {
        this(config, new FeatureConsistencyChecker());
    }

    public ColumnUpdater(UpdaterConfig config, FeatureConsistencyChecker checker) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.checker = Objects.requireNonNull(checker, "checker must not be null");
        this.columnsToIgnore = config.columnsToIgnore();
        this.groupedEnums = config.enumGrouping();
        this.reservedDomainNames = Set.copyOf(groupedEnums.values());
    }

    public UpdaterConfig config() {
        return config;
    }

    public boolean isIgnored(String column) {
        return columnsToIgnore.contains(column);
    }

    /** Domain names the grouping map routes columns to; never taken by automatically named domains. */
    public Set<String> reservedDomainNames() {
        return reservedDomainNames;
    }

    /**
     * Creates a feature for a previously unseen column, or reconciles the existing feature or sparse
     * feature of that name with the observed statistics. Ignored columns yield an empty result and
     * leave the schema untouched.
     */
    public AnomalyInfo createOrUpdate(FeatureStatsView view, Schema schema) {
        String column = view.name();
        if (isIgnored(column)) {
            return AnomalyInfo.none(column);
        }
        Optional<Feature> existing = schema.features().get(column);
        if (existing.isPresent()) {
            return updateFeature(view, existing.get(), schema);
        }
        Optional<SparseFeature> sparse = schema.features().getSparse(column);
        if (sparse.isPresent()) {
            return updateSparseFeature(view, sparse.get());
        }
        return createColumn(view, schema);
    }

    /**
     * Adds a feature inferred from {@code view} and reports it as {@link AnomalyType#SCHEMA_NEW_COLUMN}
     * (WARNING unless overridden). No domain is bound when the observed values exceed
     * {@code enumDeleteThreshold}.
     */
    AnomalyInfo createColumn(FeatureStatsView view, Schema schema) {
        Feature feature = schema.features().create(view.name(), view.featureType());

        long present = view.numPresent();
        if (present > 0) {
            double minFraction = view.numMissing() == 0 ? 1.0 : 0.0;
            feature.setPresence(new Presence(minFraction, 1));
            if (view.minNumValues() == 1 && view.maxNumValues() == 1) {
                feature.setValueCount(ValueCount.SINGLE);
            } else if (view.minNumValues() >= 1) {
                feature.setValueCount(ValueCount.AT_LEAST_ONE);
            }
        }

        view.environment().ifPresent(environment -> {
            if (!schema.isFeatureInEnvironment(feature, Optional.of(environment))) {
                feature.addInEnvironment(environment);
            }
        });

        String groupedDomain = groupedEnums.get(view.name());
        if (groupedDomain != null && view.featureType() == FeatureType.BYTES) {
            StringDomain domain = schema.domains().getOrCreateShared(groupedDomain);
            schema.domains().extendValues(domain, observedValues(view));
            if (withinDeleteThreshold(domain.size())) {
                feature.setDomain(domain);
            }
        } else if (view.isCategorical(config.enumThreshold())) {
            List<String> values = observedValues(view);
            if (withinDeleteThreshold(values.size())) {
                feature.setDomain(schema.domains().create(view.name(), values, reservedDomainNames));
            }
        }

        List<Description> descriptions = new ArrayList<>();
        descriptions.add(new Description(
                AnomalyType.SCHEMA_NEW_COLUMN, "New column", "New column (column in data but not in schema)"));
        descriptions.addAll(checker.repair(feature, schema.domains()));
        LOG.debug(
                "column.created name={} type={} domain={}",
                feature.name(),
                feature.type(),
                feature.domain().orElse("none"));
        return result(view.name(), descriptions);
    }

    /** Reconciles an existing feature with {@code view}. Deprecated features are skipped. */
    AnomalyInfo updateFeature(FeatureStatsView view, Feature feature, Schema schema) {
        if (feature.isDeprecated()) {
            return AnomalyInfo.none(feature.name());
        }
        List<Description> descriptions = new ArrayList<>();
        checkEnvironment(view, feature, schema, descriptions);
        checkType(view, feature, descriptions);
        checkPresence(view, feature, descriptions);
        checkValueCount(view, feature, descriptions);
        checkDomain(view, feature, schema.domains(), descriptions);
        descriptions.addAll(updateSkewComparator(view, feature));
        descriptions.addAll(checker.repair(feature, schema.domains()));
        if (!descriptions.isEmpty()) {
            LOG.debug("column.checked name={} descriptions={}", feature.name(), descriptions.size());
        }
        return result(feature.name(), descriptions);
    }

    /**
     * Checks a sparse feature's composite statistics. These are data defects rather than drift:
     * nothing in the schema changes, so they are reported again on every update.
     */
    AnomalyInfo updateSparseFeature(FeatureStatsView view, SparseFeature sparse) {
        if (sparse.isDeprecated()) {
            return AnomalyInfo.none(sparse.name());
        }
        List<Description> descriptions = new ArrayList<>();
        double missing = view.customStat(FeatureStatistics.SPARSE_MISSING_VALUE).orElse(0.0);
        if (missing > 0) {
            descriptions.add(new Description(
                    AnomalyType.SPARSE_FEATURE_MISSING_VALUE,
                    "Missing value in sparse feature",
                    "Found " + (long) missing + " example(s) where the value feature '" + sparse.valueFeature()
                            + "' is missing."));
        }
        OptionalDouble minDiff = view.customStat(FeatureStatistics.SPARSE_MIN_LENGTH_DIFF);
        OptionalDouble maxDiff = view.customStat(FeatureStatistics.SPARSE_MAX_LENGTH_DIFF);
        if (minDiff.orElse(0.0) != 0.0 || maxDiff.orElse(0.0) != 0.0) {
            descriptions.add(new Description(
                    AnomalyType.SPARSE_FEATURE_LENGTH_MISMATCH,
                    "Length mismatch between value and index feature",
                    "Mismatch between index length and value length (min diff = " + (long) minDiff.orElse(0.0)
                            + ", max diff = " + (long) maxDiff.orElse(0.0) + ")."));
        }
        return result(sparse.name(), descriptions);
    }

    /**
     * Compares the training and serving value distributions of a feature carrying a skew
     * comparator. A distance above the threshold is reported and becomes the new threshold.
     */
    List<Description> updateSkewComparator(FeatureStatsView view, Feature feature) {
        SkewComparator comparator = feature.skewComparator().orElse(null);
        Optional<FeatureStatsView> serving = view.servingView();
        if (comparator == null || serving.isEmpty()) {
            return List.of();
        }
        Map<String, Double> training = view.valueDistribution();
        Map<String, Double> servingDistribution = serving.get().valueDistribution();
        Set<String> keys = new TreeSet<>(training.keySet());
        keys.addAll(servingDistribution.keySet());

        double distance = 0.0;
        String maxKey = null;
        for (String key : keys) {
            double diff = Math.abs(training.getOrDefault(key, 0.0) - servingDistribution.getOrDefault(key, 0.0));
            if (diff > distance) {
                distance = diff;
                maxKey = key;
            }
        }
        if (distance <= comparator.infinityNormThreshold()) {
            return List.of();
        }
        feature.setSkewComparator(new SkewComparator(distance));
        return List.of(new Description(
                AnomalyType.COMPARATOR_L_INFTY_HIGH,
                "High Linfty distance between training and serving",
                String.format(
                        Locale.ROOT,
                        "The Linfty distance between training and serving is %.6g, above the threshold %s. "
                                + "The feature value with maximum difference is: %s",
                        distance,
                        comparator.infinityNormThreshold(),
                        maxKey)));
    }

    private void checkEnvironment(FeatureStatsView view, Feature feature, Schema schema, List<Description> out) {
        Optional<String> environment = view.environment();
        if (environment.isEmpty() || schema.isFeatureInEnvironment(feature, environment)) {
            return;
        }
        String env = environment.get();
        feature.removeNotInEnvironment(env);
        if (feature.inEnvironment().isEmpty() && !schema.defaultEnvironments().isEmpty()) {
            // pin the defaults first so the feature keeps the membership it had implicitly
            schema.defaultEnvironments().forEach(feature::addInEnvironment);
            feature.addInEnvironment(env);
        } else if (!feature.inEnvironment().isEmpty()) {
            feature.addInEnvironment(env);
        }
        out.add(new Description(
                AnomalyType.FEATURE_UNEXPECTED_ENVIRONMENT,
                "Column in unexpected environment",
                "Column is present in environment '" + env + "' where it was not expected; membership extended."));
    }

    private void checkType(FeatureStatsView view, Feature feature, List<Description> out) {
        FeatureType observed = view.featureType();
        if (view.numPresent() == 0 || observed == feature.type()) {
            return;
        }
        out.add(new Description(
                AnomalyType.UNEXPECTED_DATA_TYPE,
                "Unexpected data type",
                "Expected data of type: " + feature.type() + " but got " + observed));
        feature.setType(observed);
    }

    private void checkPresence(FeatureStatsView view, Feature feature, List<Description> out) {
        Presence presence = feature.presence();
        double fraction = view.fractionPresent();
        if (presence.minFraction() > fraction) {
            out.add(new Description(
                    AnomalyType.FEATURE_TYPE_LOW_FRACTION_PRESENT,
                    "Column dropped",
                    String.format(
                            Locale.ROOT,
                            "The feature was present in fewer examples than expected: minimum fraction = %s, "
                                    + "actual = %.6g",
                            presence.minFraction(),
                            fraction)));
            presence = presence.withMinFraction(fraction);
        }
        if (presence.minCount() > view.numPresent()) {
            out.add(new Description(
                    AnomalyType.FEATURE_TYPE_LOW_NUMBER_PRESENT,
                    "Column dropped",
                    "The feature was present in fewer examples than expected: minimum count = "
                            + presence.minCount() + ", actual = " + view.numPresent()));
            presence = presence.withMinCount(view.numPresent());
        }
        feature.setPresence(presence);
    }

    private void checkValueCount(FeatureStatsView view, Feature feature, List<Description> out) {
        ValueCount valueCount = feature.valueCount().orElse(null);
        if (valueCount == null || view.numPresent() == 0) {
            return;
        }
        if (view.minNumValues() < valueCount.min()) {
            out.add(new Description(
                    AnomalyType.FEATURE_TYPE_LOW_NUMBER_VALUES,
                    "Missing values",
                    "Some examples have fewer values than expected: minimum = " + valueCount.min() + ", actual = "
                            + view.minNumValues()));
            valueCount = valueCount.withMin(view.minNumValues());
        }
        if (valueCount.max() != null && view.maxNumValues() > valueCount.max()) {
            out.add(new Description(
                    AnomalyType.FEATURE_TYPE_HIGH_NUMBER_VALUES,
                    "Superfluous values",
                    "Some examples have more values than expected: maximum = " + valueCount.max() + ", actual = "
                            + view.maxNumValues()));
            valueCount = valueCount.withMax(view.maxNumValues());
        }
        feature.setValueCount(valueCount);
    }

    private void checkDomain(FeatureStatsView view, Feature feature, DomainRegistry domains, List<Description> out) {
        if (feature.type() != FeatureType.BYTES) {
            return;
        }
        Optional<StringDomain> bound = feature.domain().flatMap(domains::get);
        if (bound.isEmpty()) {
            return;
        }
        StringDomain domain = bound.get();
        List<String> added = domains.extendValues(domain, observedValues(view));
        if (!added.isEmpty()) {
            out.add(new Description(
                    AnomalyType.ENUM_TYPE_UNEXPECTED_STRING_VALUES,
                    "Unexpected string values",
                    "Examples contain values missing from the schema: " + describeValues(added, view)
                            + ". Domain '" + domain.name() + "' extended."));
        }
        if (!withinDeleteThreshold(domain.size())) {
            int limit = config.enumDeleteThreshold();
            feature.clearDomain();
            out.add(new Description(
                    AnomalyType.ENUM_TYPE_TOO_LARGE,
                    "Domain too large",
                    "Domain '" + domain.name() + "' has " + domain.size() + " values, more than the limit of "
                            + limit + "; feature '" + feature.name() + "' is no longer restricted to it."));
        }
    }

    private boolean withinDeleteThreshold(int domainSize) {
        int limit = config.enumDeleteThreshold();
        return limit <= 0 || domainSize <= limit;
    }

    private static List<String> observedValues(FeatureStatsView view) {
        return view.stringValues().stream()
                .filter(value -> !StringStatistics.LARGE_BYTES_PLACEHOLDER.equals(value))
                .toList();
    }

    private static String describeValues(List<String> values, FeatureStatsView view) {
        Map<String, Double> distribution = view.valueDistribution();
        return values.stream()
                .map(value -> {
                    Double share = distribution.get(value);
                    return share == null
                            ? value
                            : value + " (~" + Math.round(share * 100) + "%)";
                })
                .collect(Collectors.joining(", "));
    }

    private AnomalyInfo result(String column, List<Description> descriptions) {
        Severity severity = Severity.NONE;
        for (Description description : descriptions) {
            severity = Severity.max(severity, config.severityFor(description.type()));
        }
        return new AnomalyInfo(column, severity, descriptions);
    }
}
