package io.schemadrift.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DomainRegistryTest")
class DomainRegistryTest {

    private final DomainRegistry registry = new DomainRegistry();

    @Test
    @DisplayName("Taken candidate names get the smallest free suffix >= 2")
    void uniquifiesWithSmallestSuffix() {
        StringDomain first = registry.create("foo", List.of("a"), Set.of());
        StringDomain second = registry.create("foo", List.of("b"), Set.of());
        StringDomain third = registry.create("foo", List.of("c"), Set.of());

        assertThat(first.name()).isEqualTo("foo");
        assertThat(second.name()).isEqualTo("foo2");
        assertThat(third.name()).isEqualTo("foo3");
        assertThat(registry.domains()).extracting(StringDomain::name).containsExactly("foo", "foo2", "foo3");
    }

    @Test
    void reservedNamesAreSkipped() {
        assertThat(registry.create("countries", List.of("DE"), Set.of("countries")).name())
                .isEqualTo("countries2");
        assertThat(registry.uniqueName("x", Set.of("x", "x2"))).isEqualTo("x3");
    }

    @Test
    @DisplayName("Same candidate, disjoint values → second domain named status2")
    void getOrCreateSeparatesDistinctValueSets() {
        StringDomain status = registry.getOrCreate("status", List.of("active", "inactive"));

        StringDomain other = registry.getOrCreate("status", List.of("200", "404"));

        assertThat(other).isNotSameAs(status);
        assertThat(other.name()).isEqualTo("status2");
        assertThat(status.values()).containsExactly("active", "inactive");
    }

    @Test
    void getOrCreateReturnsExistingDomainForSameValues() {
        StringDomain status = registry.getOrCreate("status", List.of("active", "inactive"));

        assertThat(registry.getOrCreate("status", List.of("inactive", "active"))).isSameAs(status);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("extendValues only adds unseen values and reports them in order")
    void extendValuesIsMonotonic() {
        StringDomain color = registry.create("color", List.of("red", "blue"), Set.of());

        List<String> added = registry.extendValues(color, List.of("blue", "green", "red", "black", "green"));

        assertThat(added).containsExactly("green", "black");
        assertThat(color.values()).containsExactly("red", "blue", "green", "black");
        assertThat(registry.extendValues(color, List.of("red"))).isEmpty();
    }

    @Test
    void extendValuesRejectsForeignDomain() {
        StringDomain foreign = new DomainRegistry().create("color", List.of(), Set.of());
        registry.create("color", List.of(), Set.of());

        assertThatThrownBy(() -> registry.extendValues(foreign, List.of("red")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sharedDomainIsCreatedOnceByExactName() {
        StringDomain shared = registry.getOrCreateShared("countries");

        assertThat(registry.getOrCreateShared("countries")).isSameAs(shared);
        assertThat(shared.size()).isZero();
    }

    @Test
    void lookupIsCaseSensitive() {
        registry.create("Color", List.of("red"), Set.of());

        assertThat(registry.get("color")).isEmpty();
        assertThat(registry.contains("Color")).isTrue();
    }

    @Test
    void registerRejectsDuplicateName() {
        registry.register("color", List.of("red"));

        assertThatThrownBy(() -> registry.register("color", List.of("blue")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'color'");
    }
}
