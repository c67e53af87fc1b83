package io.schemadrift.core.engine;

import static io.schemadrift.core.testkit.TestStatistics.categorical;
import static io.schemadrift.core.testkit.TestStatistics.numeric;
import static io.schemadrift.core.testkit.TestStatistics.snapshot;
import static org.assertj.core.api.Assertions.assertThat;

import io.schemadrift.core.model.AnomalyType;
import io.schemadrift.core.model.SchemaAnomalies;
import io.schemadrift.core.model.SchemaDocument;
import io.schemadrift.core.model.Severity;
import io.schemadrift.core.model.UpdaterConfig;
import io.schemadrift.core.schema.Schema;
import io.schemadrift.core.spi.SchemaEventListener;
import io.schemadrift.core.spi.SchemaEventListener.AnomalyDetectedEvent;
import io.schemadrift.core.spi.SchemaEventListener.ColumnCreatedEvent;
import io.schemadrift.core.spi.SchemaEventListener.FeatureDeprecatedEvent;
import io.schemadrift.core.spi.SchemaEventListener.SchemaInitializedEvent;
import io.schemadrift.core.spi.SchemaEventListener.SchemaUpdatedEvent;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for the {@link SchemaEventListener} SPI: a registered listener receives one event per
 * created column, per column with anomalies, per deprecation and per completed call.
 */
@DisplayName("SchemaEventListenerTest")
class SchemaEventListenerTest {

    private CapturingListener listener;
    private SchemaEngine engine;
    private Schema schema;

    @BeforeEach
    void setUp() {
        listener = new CapturingListener();
        engine = new SchemaEngine(listener);
        schema = new Schema();
    }

    @Test
    @DisplayName("First update → column created + anomaly detected + updated events")
    void firstUpdateEmitsCreationEvents() {
        engine.update(schema, snapshot(10, categorical("color", "red"), numeric("age")), UpdaterConfig.defaults());

        assertThat(listener.created)
                .containsExactly(
                        new ColumnCreatedEvent("color", "BYTES", "color"), new ColumnCreatedEvent("age", "INT", null));
        assertThat(listener.anomalies).extracting(AnomalyDetectedEvent::column).containsExactly("age", "color");
        assertThat(listener.anomalies.get(0).types()).containsExactly(AnomalyType.SCHEMA_NEW_COLUMN);
        assertThat(listener.updated).hasSize(1);
        SchemaUpdatedEvent updated = listener.updated.get(0);
        assertThat(updated.columnsConsidered()).isEqualTo(2);
        assertThat(updated.anomalies()).isEqualTo(2);
        assertThat(updated.maxSeverity()).isEqualTo(Severity.WARNING);
    }

    @Test
    @DisplayName("Missing column → deprecation event flagged as missing")
    void missingColumnEmitsDeprecationEvent() {
        engine.update(schema, snapshot(10, numeric("age"), numeric("height")), UpdaterConfig.defaults());

        engine.update(schema, snapshot(10, numeric("age")), UpdaterConfig.defaults());

        assertThat(listener.deprecated).containsExactly(new FeatureDeprecatedEvent("height", true));
    }

    @Test
    void explicitDeprecationIsNotFlaggedMissing() {
        engine.update(schema, snapshot(10, numeric("age")), UpdaterConfig.defaults());

        engine.deprecateFeature(schema, "age");
        engine.deprecateFeature(schema, "age");

        assertThat(listener.deprecated).containsExactly(new FeatureDeprecatedEvent("age", false));
    }

    @Test
    void initEmitsInitializedEvent() {
        engine.init(schema, SchemaDocument.empty());

        assertThat(listener.initialized).containsExactly(new SchemaInitializedEvent(0, 0, 0, 0));
    }

    @Test
    @DisplayName("getRelatedEnums works on a scratch schema and emits no column events")
    void relatedEnumsEmitNoColumnEvents() {
        engine.getRelatedEnums(snapshot(10, categorical("a", "x")), UpdaterConfig.defaults());

        assertThat(listener.created).isEmpty();
        assertThat(listener.updated).isEmpty();
    }

    @Test
    @DisplayName("Throwing listener → update still completes")
    void listenerFailureDoesNotBreakUpdate() {
        SchemaEngine failing = new SchemaEngine(new SchemaEventListener() {
            @Override
            public void onSchemaUpdated(SchemaUpdatedEvent event) {
                throw new IllegalStateException("listener broke");
            }

            @Override
            public void onColumnCreated(ColumnCreatedEvent event) {
                throw new IllegalStateException("listener broke");
            }
        });

        SchemaAnomalies anomalies = failing.update(schema, snapshot(10, numeric("age")), UpdaterConfig.defaults());

        assertThat(anomalies.size()).isEqualTo(1);
        assertThat(schema.features().contains("age")).isTrue();
    }

    @Test
    void nullListenerFallsBackToNoOp() {
        SchemaEngine silent = new SchemaEngine(null);

        assertThat(silent.update(schema, snapshot(10, numeric("age")), UpdaterConfig.defaults()).size())
                .isEqualTo(1);
    }

    private static final class CapturingListener implements SchemaEventListener {

        final List<SchemaInitializedEvent> initialized = new ArrayList<>();
        final List<ColumnCreatedEvent> created = new ArrayList<>();
        final List<AnomalyDetectedEvent> anomalies = new ArrayList<>();
        final List<FeatureDeprecatedEvent> deprecated = new ArrayList<>();
        final List<SchemaUpdatedEvent> updated = new ArrayList<>();

        @Override
        public void onSchemaInitialized(SchemaInitializedEvent event) {
            initialized.add(event);
        }

        @Override
        public void onColumnCreated(ColumnCreatedEvent event) {
            created.add(event);
        }

        @Override
        public void onAnomalyDetected(AnomalyDetectedEvent event) {
            anomalies.add(event);
        }

        @Override
        public void onFeatureDeprecated(FeatureDeprecatedEvent event) {
            deprecated.add(event);
        }

        @Override
        public void onSchemaUpdated(SchemaUpdatedEvent event) {
            updated.add(event);
        }
    }
}
