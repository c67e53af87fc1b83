package io.schemadrift.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: the two-tier structure, common fields and concrete types. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void schemaExceptionIsAbstractAndRoot() {
        assertThat(SchemaException.class).isAbstract();
        assertThat(SchemaException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void loadAndUpdateExceptionsAreAbstract() {
        assertThat(SchemaLoadException.class).isAbstract();
        assertThat(SchemaLoadException.class.getSuperclass()).isEqualTo(SchemaException.class);
        assertThat(SchemaUpdateException.class).isAbstract();
        assertThat(SchemaUpdateException.class.getSuperclass()).isEqualTo(SchemaException.class);
    }

    // --- Concrete types ---

    @Test
    void schemaParseExceptionExtendsLoadException() {
        var cause = new RuntimeException("scanner error");
        var ex = new SchemaParseException("bad yaml", cause, null, "/path/to/schema.yaml");

        assertThat(ex).isInstanceOf(SchemaLoadException.class);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.detail()).isEqualTo("bad yaml");
        assertThat(ex.phase()).isEqualTo(SchemaException.Phase.LOAD);
        assertThat(ex.source()).isEqualTo("/path/to/schema.yaml");
        assertThat(ex.featureName()).isNull();
    }

    @Test
    void invalidSchemaExceptionExtendsLoadException() {
        var ex = new InvalidSchemaException("Duplicate feature name: 'age'", "age", null);

        assertThat(ex).isInstanceOf(SchemaLoadException.class);
        assertThat(ex.featureName()).isEqualTo("age");
        assertThat(ex.phase()).isEqualTo(SchemaException.Phase.LOAD);
    }

    @Test
    void invalidStatisticsExceptionExtendsUpdateException() {
        var ex = new InvalidStatisticsException("negative counts", "age");

        assertThat(ex).isInstanceOf(SchemaUpdateException.class);
        assertThat(ex).isInstanceOf(SchemaException.class);
        assertThat(ex.featureName()).isEqualTo("age");
        assertThat(ex.phase()).isEqualTo(SchemaException.Phase.UPDATE);
    }
}
