package io.schemadrift.core.engine;

import io.schemadrift.core.error.InvalidSchemaException;
import io.schemadrift.core.error.InvalidStatisticsException;
import io.schemadrift.core.model.AnomalyInfo;
import io.schemadrift.core.model.AnomalyType;
import io.schemadrift.core.model.Description;
import io.schemadrift.core.model.FeatureDefinition;
import io.schemadrift.core.model.SchemaAnomalies;
import io.schemadrift.core.model.SchemaDocument;
import io.schemadrift.core.model.Severity;
import io.schemadrift.core.model.SparseFeatureDefinition;
import io.schemadrift.core.model.StringDomainDefinition;
import io.schemadrift.core.model.UpdaterConfig;
import io.schemadrift.core.schema.Feature;
import io.schemadrift.core.schema.FeatureStore;
import io.schemadrift.core.schema.Schema;
import io.schemadrift.core.schema.SchemaElement;
import io.schemadrift.core.schema.SparseFeature;
import io.schemadrift.core.schema.StringDomain;
import io.schemadrift.core.spi.SchemaEventListener;
import io.schemadrift.core.spi.SchemaEventListener.AnomalyDetectedEvent;
import io.schemadrift.core.spi.SchemaEventListener.ColumnCreatedEvent;
import io.schemadrift.core.spi.SchemaEventListener.FeatureDeprecatedEvent;
import io.schemadrift.core.spi.SchemaEventListener.SchemaInitializedEvent;
import io.schemadrift.core.spi.SchemaEventListener.SchemaUpdatedEvent;
import io.schemadrift.core.stats.DatasetStatsView;
import io.schemadrift.core.stats.FeatureStatistics;
import io.schemadrift.core.stats.FeatureStatsView;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schema engine: bootstraps a {@link Schema} from statistics or a document, and checks and heals it
 * against later statistics snapshots.
 *
 * <p>Example:
 *
 * <pre>{@code
 * SchemaEngine engine = new SchemaEngine();
 * Schema schema = new Schema();
 * engine.update(schema, new DatasetStatsView(firstBatch), UpdaterConfig.defaults());
 * SchemaDocument saved = engine.getSchema(schema);
 *
 * Schema restored = new Schema();
 * engine.init(restored, saved);
 * SchemaAnomalies anomalies = engine.update(restored, new DatasetStatsView(nextBatch), config);
 * }</pre>
 *
 * <p>Data discrepancies never fail a call: they are reported as descriptions and the schema is
 * moved to the repaired or extended form. Only structural precondition violations throw, and
 * they throw before anything is mutated.
 *
 * <p>The engine itself is stateless apart from its listener and may be shared; each
 * {@link Schema} it operates on must be confined to one thread at a time.
 */
public final class SchemaEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaEngine.class);
    private static final SortedSet<String> EMPTY_COLUMNS = Collections.emptySortedSet();

    private final FeatureConsistencyChecker checker;
    private final DomainSimilarityClusterer clusterer;
    private final SchemaEventListener listener;

    public SchemaEngine() {
        this(SchemaEventListener.NO_OP);
    }

    /**
     * Creates an engine reporting to the given listener.
     *
     * @param listener observability hook, or {@code null} for none
     */
    public SchemaEngine(SchemaEventListener listener) {
        this.checker = new FeatureConsistencyChecker();
        this.clusterer = new DomainSimilarityClusterer();
        this.listener = listener != null ? listener : SchemaEventListener.NO_OP;
    }

    // --- Initialization ---

    /**
     * Populates an empty schema from a document, then repairs every feature.
     *
     * @return the repairs applied, keyed by feature or domain name
     * @throws InvalidSchemaException if {@code schema} is not empty, or the document has blank or
     *                                duplicate names or sparse features referencing unknown
     *                                features; {@code schema} is left unchanged
     */
    public SchemaAnomalies init(Schema schema, SchemaDocument document) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(document, "document must not be null");
        if (!schema.isEmpty()) {
            throw new InvalidSchemaException("Schema is not empty when init() called", null, null);
        }
        validateDocument(document);

        Schema staged = Schema.staged(document);
        Map<String, List<Description>> repairs = new LinkedHashMap<>();

        for (StringDomainDefinition domain : document.stringDomains()) {
            List<Description> fixes = checker.checkDomainValues(domain);
            if (!fixes.isEmpty()) {
                repairs.computeIfAbsent(domain.name(), k -> new ArrayList<>()).addAll(fixes);
            }
        }
        for (Feature feature : staged.features().features()) {
            List<Description> fixes = checker.repair(feature, staged.domains());
            if (!fixes.isEmpty()) {
                repairs.computeIfAbsent(feature.name(), k -> new ArrayList<>()).addAll(fixes);
            }
        }

        schema.replaceContents(staged);

        UpdaterConfig defaults = UpdaterConfig.defaults();
        List<AnomalyInfo> infos = new ArrayList<>();
        repairs.forEach((name, fixes) -> infos.add(new AnomalyInfo(name, severityOf(fixes, defaults), fixes)));
        SchemaAnomalies result = SchemaAnomalies.of(infos);
        if (!result.isEmpty()) {
            LOG.warn("schema.repaired elements={} names={}", result.size(), repairs.keySet());
        }
        LOG.info(
                "schema.initialized features={} sparse_features={} domains={} repairs={}",
                schema.features().size(),
                schema.features().sparseFeatures().size(),
                schema.domains().size(),
                result.size());
        notifySafely(() -> listener.onSchemaInitialized(new SchemaInitializedEvent(
                schema.features().size(),
                schema.features().sparseFeatures().size(),
                schema.domains().size(),
                result.size())));
        return result;
    }

    private void validateDocument(SchemaDocument document) {
        Set<String> featureNames = new HashSet<>();
        for (FeatureDefinition feature : document.features()) {
            requireName(feature.name(), "feature");
            if (!featureNames.add(feature.name())) {
                throw new InvalidSchemaException(
                        "Duplicate feature name: '" + feature.name() + "'", feature.name(), null);
            }
        }
        Set<String> sparseNames = new HashSet<>();
        for (SparseFeatureDefinition sparse : document.sparseFeatures()) {
            requireName(sparse.name(), "sparse feature");
            if (featureNames.contains(sparse.name()) || !sparseNames.add(sparse.name())) {
                throw new InvalidSchemaException(
                        "Duplicate feature name: '" + sparse.name() + "'", sparse.name(), null);
            }
            for (String component : sparse.componentFeatures()) {
                if (!featureNames.contains(component)) {
                    throw new InvalidSchemaException(
                            "Sparse feature '" + sparse.name() + "' references unknown feature '" + component + "'",
                            sparse.name(),
                            null);
                }
            }
        }
        Set<String> domainNames = new HashSet<>();
        for (StringDomainDefinition domain : document.stringDomains()) {
            requireName(domain.name(), "string domain");
            if (!domainNames.add(domain.name())) {
                throw new InvalidSchemaException("Duplicate domain name: '" + domain.name() + "'", null, null);
            }
        }
    }

    private static void requireName(String name, String kind) {
        if (name.isBlank()) {
            throw new InvalidSchemaException("A " + kind + " has a blank name", name, null);
        }
    }

    // --- Update ---

    /**
     * Checks every column of {@code statistics} not ignored by {@code config} against the schema,
     * creating features for unseen columns, then reports (and by default deprecates) features that
     * are required but missing.
     *
     * @throws InvalidStatisticsException if the snapshot has blank or duplicate column names or
     *                                    negative counts; {@code schema} is left unchanged
     */
    public SchemaAnomalies update(Schema schema, DatasetStatsView statistics, UpdaterConfig config) {
        return update(schema, statistics, config, null);
    }

    /**
     * Same as {@link #update(Schema, DatasetStatsView, UpdaterConfig)}, restricted to the named
     * columns. Features outside the subset are neither updated nor checked for missingness.
     *
     * @param columnsToConsider columns to process, or {@code null} for all
     */
    public SchemaAnomalies update(
            Schema schema, DatasetStatsView statistics, UpdaterConfig config, Collection<String> columnsToConsider) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(statistics, "statistics must not be null");
        Objects.requireNonNull(config, "config must not be null");
        long start = System.nanoTime();

        UpdateOutcome outcome = applyUpdate(schema, statistics, config, columnsToConsider, true);

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        SchemaAnomalies result = outcome.anomalies();
        LOG.info(
                "schema.updated columns={} anomalies={} max_severity={} environment={} duration_ms={}",
                outcome.columnsConsidered(),
                result.size(),
                result.maxSeverity(),
                statistics.environment().orElse("all"),
                durationMs);
        for (AnomalyInfo info : result.anomalies()) {
            notifySafely(() -> listener.onAnomalyDetected(
                    new AnomalyDetectedEvent(info.column(), info.severity(), info.types())));
        }
        notifySafely(() -> listener.onSchemaUpdated(new SchemaUpdatedEvent(
                outcome.columnsConsidered(), result.size(), result.maxSeverity(), durationMs)));
        return result;
    }

    /**
     * Creates or heals the feature for one column, as {@link #update} does per column. Missing
     * columns are not looked for; a column {@code updater} ignores yields an empty result.
     */
    public AnomalyInfo updateColumn(Schema schema, ColumnUpdater updater, FeatureStatsView view) {
        return updateColumn(schema, updater, view, true);
    }

    /**
     * Re-checks only the training/serving skew comparator of one column.
     *
     * @return the skew description, empty if the column is ignored, the feature has no
     *         comparator or serving statistics, or the distance is within its threshold
     */
    public List<Description> updateSkewComparator(Schema schema, FeatureStatsView view, UpdaterConfig config) {
        ColumnUpdater updater = new ColumnUpdater(config, checker);
        if (updater.isIgnored(view.name())) {
            return List.of();
        }
        return schema.features()
                .get(view.name())
                .filter(feature -> !feature.isDeprecated())
                .map(feature -> updater.updateSkewComparator(view, feature))
                .orElse(List.of());
    }

    private UpdateOutcome applyUpdate(
            Schema schema,
            DatasetStatsView statistics,
            UpdaterConfig config,
            Collection<String> columnsToConsider,
            boolean notify) {
        validateStatistics(statistics);
        Set<String> subset = columnsToConsider == null ? null : new HashSet<>(columnsToConsider);
        ColumnUpdater updater = new ColumnUpdater(config, checker);

        List<AnomalyInfo> infos = new ArrayList<>();
        int considered = 0;
        for (FeatureStatsView view : statistics.features()) {
            if ((subset != null && !subset.contains(view.name())) || updater.isIgnored(view.name())) {
                continue;
            }
            considered++;
            infos.add(updateColumn(schema, updater, view, notify));
        }

        for (String missing : getMissingColumns(schema, statistics)) {
            if ((subset != null && !subset.contains(missing)) || updater.isIgnored(missing)) {
                continue;
            }
            considered++;
            Description description = new Description(
                    AnomalyType.SCHEMA_MISSING_COLUMN,
                    "Column dropped",
                    "Column is completely missing"
                            + statistics.environment().map(e -> " in environment '" + e + "'").orElse(""));
            infos.add(new AnomalyInfo(missing, config.severityFor(description.type()), List.of(description)));
            if (config.deprecateMissingColumns()) {
                deprecate(schema, missing, true, notify);
            }
        }
        return new UpdateOutcome(SchemaAnomalies.of(infos), considered);
    }

    private AnomalyInfo updateColumn(Schema schema, ColumnUpdater updater, FeatureStatsView view, boolean notify) {
        boolean isNew = !schema.features().contains(view.name());
        AnomalyInfo info = updater.createOrUpdate(view, schema);
        if (notify && isNew && info.hasType(AnomalyType.SCHEMA_NEW_COLUMN)) {
            schema.features().get(view.name()).ifPresent(feature -> notifySafely(() -> listener.onColumnCreated(
                    new ColumnCreatedEvent(feature.name(), feature.type().name(), feature.domain().orElse(null)))));
        }
        return info;
    }

    private static void validateStatistics(DatasetStatsView statistics) {
        if (statistics.numExamples() < 0) {
            throw new InvalidStatisticsException(
                    "Statistics report a negative example count: " + statistics.numExamples(), null);
        }
        Set<String> seen = new HashSet<>();
        for (FeatureStatsView view : statistics.features()) {
            FeatureStatistics data = view.data();
            if (data.name() == null || data.name().isBlank()) {
                throw new InvalidStatisticsException("Statistics contain a column without a name", null);
            }
            if (!seen.add(data.name())) {
                throw new InvalidStatisticsException(
                        "Statistics contain column '" + data.name() + "' more than once", data.name());
            }
            if (data.numNonMissing() < 0 || data.numMissing() < 0 || data.minNumValues() < 0
                    || data.maxNumValues() < 0) {
                throw new InvalidStatisticsException(
                        "Column '" + data.name() + "' has negative counts", data.name());
            }
        }
    }

    // --- Deprecation and missing columns ---

    /**
     * Marks a feature or sparse feature deprecated. Deprecated entries stay in the schema but are
     * no longer updated, required, or checked for environment membership.
     *
     * @return true if an entry with that name exists
     */
    public boolean deprecateFeature(Schema schema, String name) {
        return deprecate(schema, name, false, true);
    }

    private boolean deprecate(Schema schema, String name, boolean missing, boolean notify) {
        Optional<SchemaElement> element = schema.features().find(name);
        if (element.isEmpty()) {
            LOG.debug("feature.deprecate.skipped name={} reason=unknown", name);
            return false;
        }
        if (!element.get().isDeprecated()) {
            element.get().deprecate();
            LOG.info("feature.deprecated name={} missing={}", name, missing);
            if (notify) {
                notifySafely(() -> listener.onFeatureDeprecated(new FeatureDeprecatedEvent(name, missing)));
            }
        }
        return true;
    }

    /**
     * Returns the names of features that a snapshot taken in {@code statistics}' environment must
     * contain but does not, in schema order.
     */
    public List<String> getMissingColumns(Schema schema, DatasetStatsView statistics) {
        Optional<String> environment = statistics.environment();
        List<String> missing = new ArrayList<>();
        for (Feature feature : schema.features().features()) {
            if (schema.isExistenceRequired(feature, environment) && !statistics.contains(feature.name())) {
                missing.add(feature.name());
            }
        }
        return missing;
    }

    // --- Related enums ---

    /**
     * Proposes enum grouping for a later update: bootstraps a scratch schema from
     * {@code statistics}, clusters its near-duplicate domains, and maps every column of a cluster
     * to the cluster's first domain name. Existing grouping entries are kept.
     *
     * @return {@code config} with the proposed grouping added
     */
    public UpdaterConfig getRelatedEnums(DatasetStatsView statistics, UpdaterConfig config) {
        Schema scratch = new Schema();
        applyUpdate(scratch, statistics, config, null, false);

        List<SortedSet<String>> clusters =
                clusterer.similarDomains(scratch.domains().domains(), config.enumsSimilarConfig());
        Map<String, SortedSet<String>> columnsByDomain = clusterer.domainToColumns(scratch.features());

        UpdaterConfig.Builder builder = config.toBuilder();
        int grouped = 0;
        for (SortedSet<String> cluster : clusters) {
            String canonical = cluster.first();
            for (String domain : cluster) {
                for (String column : columnsByDomain.getOrDefault(domain, EMPTY_COLUMNS)) {
                    if (!config.enumGrouping().containsKey(column)) {
                        builder.groupEnum(column, canonical);
                        grouped++;
                    }
                }
            }
        }
        LOG.info("enums.related clusters={} grouped_columns={}", clusters.size(), grouped);
        return builder.build();
    }

    // --- Schema access ---

    /** Snapshot of {@code schema} as a document; {@link #init} on an empty schema reproduces it. */
    public SchemaDocument getSchema(Schema schema) {
        FeatureStore store = schema.features();
        return new SchemaDocument(
                store.features().stream().map(Feature::toDefinition).toList(),
                store.sparseFeatures().stream().map(SparseFeature::toDefinition).toList(),
                schema.domains().domains().stream().map(StringDomain::toDefinition).toList(),
                List.copyOf(schema.defaultEnvironments()));
    }

    public boolean isEmpty(Schema schema) {
        return schema.isEmpty();
    }

    public void clear(Schema schema) {
        schema.clear();
        LOG.info("schema.cleared");
    }

    // --- Helpers ---

    private static Severity severityOf(List<Description> descriptions, UpdaterConfig config) {
        Severity severity = Severity.NONE;
        for (Description description : descriptions) {
            severity = Severity.max(severity, config.severityFor(description.type()));
        }
        return severity;
    }

    // Listener exceptions are caught and logged; they must not affect the schema operation.
    private void notifySafely(Runnable notification) {
        try {
            notification.run();
        } catch (Exception e) {
            LOG.warn("SchemaEventListener callback failed", e);
        }
    }

    private record UpdateOutcome(SchemaAnomalies anomalies, int columnsConsidered) {}
}
