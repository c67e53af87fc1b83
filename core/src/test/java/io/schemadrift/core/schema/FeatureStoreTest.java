package io.schemadrift.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.schemadrift.core.model.FeatureDefinition;
import io.schemadrift.core.model.FeatureType;
import io.schemadrift.core.model.SparseFeatureDefinition;
import java.util.List;
import org.junit.jupiter.api.Test;

class FeatureStoreTest {

    private final FeatureStore store = new FeatureStore();

    @Test
    void featuresAreListedByName() {
        store.create("zeta", FeatureType.INT);
        store.create("alpha", FeatureType.FLOAT);

        assertThat(store.features()).extracting(Feature::name).containsExactly("alpha", "zeta");
    }

    @Test
    void featureAndSparseFeatureShareOneNamespace() {
        store.create("weights", FeatureType.INT);

        assertThatThrownBy(() -> store.addSparse(
                        SparseFeature.from(new SparseFeatureDefinition("weights", List.of("i"), "v", false))))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> store.create("weights", FeatureType.BYTES))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Feature already exists: 'weights'");
    }

    @Test
    void findCoversBothKinds() {
        store.create("idx", FeatureType.INT);
        store.addSparse(SparseFeature.from(new SparseFeatureDefinition("sp", List.of("idx"), "idx", false)));

        assertThat(store.find("idx")).containsInstanceOf(Feature.class);
        assertThat(store.find("sp")).containsInstanceOf(SparseFeature.class);
        assertThat(store.find("none")).isEmpty();
    }

    @Test
    void featuresUsingDomain() {
        store.add(Feature.from(FeatureDefinition.builder("a", FeatureType.BYTES).domain("d").build()));
        store.add(Feature.from(FeatureDefinition.builder("b", FeatureType.BYTES).domain("d").build()));
        store.create("c", FeatureType.BYTES);

        assertThat(store.featuresUsingDomain("d")).containsExactly("a", "b");
    }

    @Test
    void definitionRoundTripPreservesAttributes() {
        FeatureDefinition definition = FeatureDefinition.builder("a", FeatureType.BYTES)
                .domain("d")
                .inEnvironment("prod")
                .notInEnvironment("dev")
                .deprecated(true)
                .build();

        assertThat(Feature.from(definition).toDefinition()).isEqualTo(definition);
    }
}
