package io.schemadrift.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.schemadrift.core.model.AnomalyType;
import io.schemadrift.core.model.Description;
import io.schemadrift.core.model.FeatureDefinition;
import io.schemadrift.core.model.FeatureType;
import io.schemadrift.core.model.Presence;
import io.schemadrift.core.model.SkewComparator;
import io.schemadrift.core.model.StringDomainDefinition;
import io.schemadrift.core.model.ValueCount;
import io.schemadrift.core.schema.DomainRegistry;
import io.schemadrift.core.schema.Feature;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FeatureConsistencyCheckerTest {

    private final FeatureConsistencyChecker checker = new FeatureConsistencyChecker();
    private final DomainRegistry domains = new DomainRegistry();

    @Test
    void consistentFeatureNeedsNoRepair() {
        domains.create("color", List.of("red"), Set.of());
        Feature feature = Feature.from(FeatureDefinition.builder("color", FeatureType.BYTES)
                .domain("color")
                .presence(Presence.REQUIRED)
                .valueCount(ValueCount.SINGLE)
                .build());

        assertThat(checker.repair(feature, domains)).isEmpty();
        assertThat(feature.domain()).contains("color");
    }

    @Test
    void unknownDomainReferenceIsRemoved() {
        Feature feature = Feature.from(
                FeatureDefinition.builder("color", FeatureType.BYTES).domain("nope").build());

        List<Description> fixes = checker.repair(feature, domains);

        assertThat(fixes).extracting(Description::shortDescription).containsExactly("Missing domain");
        assertThat(fixes).extracting(Description::type).containsOnly(AnomalyType.INVALID_SCHEMA_SPECIFICATION);
        assertThat(feature.domain()).isEmpty();
    }

    @Test
    void domainOnNumericFeatureIsRemoved() {
        domains.create("color", List.of("red"), Set.of());
        Feature feature = Feature.from(
                FeatureDefinition.builder("age", FeatureType.INT).domain("color").build());

        assertThat(checker.repair(feature, domains))
                .extracting(Description::shortDescription)
                .containsExactly("Domain on non-string feature");
        assertThat(feature.domain()).isEmpty();
    }

    @Test
    void outOfRangePresenceIsClamped() {
        Feature feature = Feature.from(FeatureDefinition.builder("age", FeatureType.INT)
                .presence(new Presence(-0.5, -3))
                .build());

        checker.repair(feature, domains);

        assertThat(feature.presence()).isEqualTo(Presence.NONE);
    }

    @Test
    void invertedValueCountIsRepaired() {
        Feature feature = Feature.from(FeatureDefinition.builder("tags", FeatureType.INT)
                .valueCount(new ValueCount(3, 1L))
                .build());

        List<Description> fixes = checker.repair(feature, domains);

        assertThat(fixes).hasSize(1);
        assertThat(feature.valueCount()).contains(new ValueCount(3, 3L));
    }

    @Test
    void contradictoryEnvironmentDropsExclusion() {
        Feature feature = Feature.from(FeatureDefinition.builder("age", FeatureType.INT)
                .inEnvironment("prod")
                .notInEnvironment("prod", "dev")
                .build());

        checker.repair(feature, domains);

        assertThat(feature.inEnvironment()).containsExactly("prod");
        assertThat(feature.notInEnvironment()).containsExactly("dev");
    }

    @Test
    void negativeSkewThresholdIsReset() {
        Feature feature = Feature.from(FeatureDefinition.builder("color", FeatureType.BYTES)
                .skewComparator(new SkewComparator(-1.0))
                .build());

        checker.repair(feature, domains);

        assertThat(feature.skewComparator()).contains(new SkewComparator(0.0));
    }

    @Test
    void deprecatedFeatureOnlyHasItsDomainReferenceRepaired() {
        Feature feature = Feature.from(FeatureDefinition.builder("age", FeatureType.INT)
                .domain("nope")
                .presence(new Presence(1.5, 1))
                .deprecated(true)
                .build());

        assertThat(checker.repair(feature, domains))
                .extracting(Description::shortDescription)
                .containsExactly("Missing domain");
        assertThat(feature.domain()).isEmpty();
        assertThat(feature.presence()).isEqualTo(new Presence(1.5, 1));
    }

    @Test
    void repeatedDomainValuesAreReported() {
        List<Description> fixes =
                checker.checkDomainValues(new StringDomainDefinition("color", List.of("red", "blue", "red")));

        assertThat(fixes).hasSize(1);
        assertThat(fixes.get(0).longDescription()).contains("1 repeated value");
        assertThat(checker.checkDomainValues(new StringDomainDefinition("color", List.of("red")))).isEmpty();
    }
}
