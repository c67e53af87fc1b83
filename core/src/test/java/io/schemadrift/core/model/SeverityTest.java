package io.schemadrift.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SeverityTest {

    @Test
    void severitiesAreOrdered() {
        assertThat(Severity.values()).containsExactly(Severity.NONE, Severity.INFO, Severity.WARNING, Severity.ERROR);
        assertThat(Severity.max(Severity.WARNING, Severity.INFO)).isEqualTo(Severity.WARNING);
        assertThat(Severity.max(Severity.NONE, Severity.ERROR)).isEqualTo(Severity.ERROR);
        assertThat(Severity.ERROR.isAtLeast(Severity.WARNING)).isTrue();
        assertThat(Severity.INFO.isAtLeast(Severity.WARNING)).isFalse();
    }

    @Test
    void healingAnomaliesDefaultBelowError() {
        assertThat(AnomalyType.SCHEMA_NEW_COLUMN.defaultSeverity()).isEqualTo(Severity.WARNING);
        assertThat(AnomalyType.ENUM_TYPE_UNEXPECTED_STRING_VALUES.defaultSeverity()).isEqualTo(Severity.WARNING);
        assertThat(AnomalyType.INVALID_SCHEMA_SPECIFICATION.defaultSeverity()).isEqualTo(Severity.INFO);
        assertThat(AnomalyType.SCHEMA_MISSING_COLUMN.defaultSeverity()).isEqualTo(Severity.ERROR);
    }
}
