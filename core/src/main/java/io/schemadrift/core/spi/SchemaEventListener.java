package io.schemadrift.core.spi;

import io.schemadrift.core.model.AnomalyType;
import io.schemadrift.core.model.Severity;
import java.util.Set;

/**
 * SPI for observability hooks on schema operations.
 *
 * <p>Implementations bridge to whatever metrics or audit system the host uses; the core has no
 * telemetry dependency of its own. All methods receive immutable event records and have no-op
 * defaults. Exceptions thrown by listeners are caught by the engine and logged; they never affect
 * the schema operation.
 *
 * <p>Suggested metrics vocabulary:
 * <ul>
 * <li>{@code schema_updates_total} - counter, incremented on updated</li>
 * <li>{@code schema_update_duration_seconds} - histogram</li>
 * <li>{@code schema_anomalies_total} - counter by severity, incremented on anomaly detected</li>
 * <li>{@code schema_columns_created_total} - counter</li>
 * </ul>
 */
public interface SchemaEventListener {

    /** A listener that ignores every event. */
    SchemaEventListener NO_OP = new SchemaEventListener() {};

    /** Called after {@code init()} committed a schema document. */
    default void onSchemaInitialized(SchemaInitializedEvent event) {}

    /** Called when a previously unseen column is added to the schema. */
    default void onColumnCreated(ColumnCreatedEvent event) {}

    /** Called once per column with at least one description after an update. */
    default void onAnomalyDetected(AnomalyDetectedEvent event) {}

    /** Called when a feature is deprecated, explicitly or because it went missing. */
    default void onFeatureDeprecated(FeatureDeprecatedEvent event) {}

    /** Called when an update call completes. */
    default void onSchemaUpdated(SchemaUpdatedEvent event) {}

    // --- Event records ---

    /** Event emitted after a schema document was loaded. */
    record SchemaInitializedEvent(int features, int sparseFeatures, int domains, int repairs) {}

    /** Event emitted when a new column was created from statistics. */
    record ColumnCreatedEvent(String column, String type, String domain) {}

    /** Event emitted for a column with detected discrepancies. */
    record AnomalyDetectedEvent(String column, Severity severity, Set<AnomalyType> types) {}

    /** Event emitted when a feature is deprecated. */
    record FeatureDeprecatedEvent(String feature, boolean missing) {}

    /** Event emitted when an update call completes. */
    record SchemaUpdatedEvent(int columnsConsidered, int anomalies, Severity maxSeverity, long durationMs) {}
}
