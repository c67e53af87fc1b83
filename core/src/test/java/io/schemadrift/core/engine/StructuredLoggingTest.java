package io.schemadrift.core.engine;

import static io.schemadrift.core.testkit.TestStatistics.numeric;
import static io.schemadrift.core.testkit.TestStatistics.snapshot;
import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.schemadrift.core.model.FeatureDefinition;
import io.schemadrift.core.model.FeatureType;
import io.schemadrift.core.model.SchemaDocument;
import io.schemadrift.core.model.UpdaterConfig;
import io.schemadrift.core.schema.Schema;
import io.schemadrift.core.spi.SchemaEventListener;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Tests for the key=value log lines {@link SchemaEngine} emits. Every update produces exactly one
 * {@code schema.updated} entry; deprecations and repairs are logged as they happen.
 */
@DisplayName("StructuredLoggingTest")
class StructuredLoggingTest {

    private SchemaEngine engine;
    private Schema schema;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger engineLogger;

    @BeforeEach
    void setUp() {
        engine = new SchemaEngine();
        schema = new Schema();

        engineLogger = (Logger) LoggerFactory.getLogger(SchemaEngine.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        engineLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        engineLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private List<String> messages(Level level) {
        return logAppender.list.stream()
                .filter(event -> event.getLevel() == level)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
    }

    @Test
    @DisplayName("Update → one schema.updated entry with column count, anomaly count and severity")
    void updateEmitsSummaryLine() {
        engine.update(schema, snapshot("training", 10, numeric("age"), numeric("height")), UpdaterConfig.defaults());

        List<String> info = messages(Level.INFO);
        assertThat(info).filteredOn(m -> m.startsWith("schema.updated")).hasSize(1);
        assertThat(info.stream().filter(m -> m.startsWith("schema.updated")).findFirst().orElseThrow())
                .contains("columns=2")
                .contains("anomalies=2")
                .contains("max_severity=WARNING")
                .contains("environment=training")
                .contains("duration_ms=");
    }

    @Test
    @DisplayName("Missing column → feature.deprecated entry with missing=true")
    void deprecationIsLogged() {
        engine.update(schema, snapshot(10, numeric("age"), numeric("height")), UpdaterConfig.defaults());
        logAppender.list.clear();

        engine.update(schema, snapshot(10, numeric("age")), UpdaterConfig.defaults());

        assertThat(messages(Level.INFO)).contains("feature.deprecated name=height missing=true");
    }

    @Test
    @DisplayName("init with contradictions → WARN schema.repaired entry")
    void repairsAreLoggedAsWarning() {
        engine.init(
                schema,
                new SchemaDocument(
                        List.of(FeatureDefinition.builder("age", FeatureType.INT).domain("nope").build()),
                        List.of(),
                        List.of(),
                        List.of()));

        assertThat(messages(Level.WARN)).containsExactly("schema.repaired elements=1 names=[age]");
        assertThat(messages(Level.INFO))
                .contains("schema.initialized features=1 sparse_features=0 domains=0 repairs=1");
    }

    @Test
    @DisplayName("Listener failure → WARN entry, callback exception attached")
    void listenerFailureIsLogged() {
        SchemaEngine failing = new SchemaEngine(new SchemaEventListener() {
            @Override
            public void onSchemaUpdated(SchemaEventListener.SchemaUpdatedEvent event) {
                throw new IllegalStateException("boom");
            }
        });

        failing.update(schema, snapshot(10, numeric("age")), UpdaterConfig.defaults());

        ILoggingEvent warning = logAppender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .findFirst()
                .orElseThrow();
        assertThat(warning.getFormattedMessage()).isEqualTo("SchemaEventListener callback failed");
        assertThat(warning.getThrowableProxy().getMessage()).isEqualTo("boom");
    }
}
