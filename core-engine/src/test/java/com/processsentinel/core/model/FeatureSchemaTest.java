package com.processsentinel.core.model;

import com.processsentinel.core.error.DataIntegrityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FeatureSchema}.
 */
class FeatureSchemaTest {

    private final FeatureSchema schema = FeatureSchema.of(List.of("a", "b", "c"));

    @Test
    @DisplayName("Default schema should hold the 54 plant columns")
    void defaultSchemaHas54Columns() {
        assertThat(FeatureSchema.DEFAULT.size()).isEqualTo(54);
        assertThat(FeatureSchema.DEFAULT.columnAt(0)).isEqualTo("Mixer/OpenDumpValve");
        assertThat(FeatureSchema.DEFAULT.indexOf("Hardening/InFlowMix")).isEqualTo(53);
    }

    @Test
    @DisplayName("Should fill missing and null fields with zero and ignore unknown keys")
    void shouldFillMissingWithZero() {
        Map<String, Object> row = new HashMap<>();
        row.put("a", 1.5);
        row.put("c", null);
        row.put("unrelated", "ignored");

        assertThat(schema.toVector(row)).containsExactly(1.5, 0.0, 0.0);
        assertThat(schema.missingFrom(row)).containsExactly("b", "c");
    }

    @Test
    @DisplayName("Should coerce numeric strings and booleans")
    void shouldCoerceValues() {
        Map<String, Object> row = Map.of("a", "2.5", "b", true, "c", 3);

        assertThat(schema.toVector(row)).containsExactly(2.5, 1.0, 3.0);
    }

    @Test
    @DisplayName("Should reject non-numeric values")
    void shouldRejectNonNumeric() {
        assertThatThrownBy(() -> schema.toVector(Map.of("a", "hot")))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("a");
    }

    @Test
    @DisplayName("Should reject NaN and infinite values")
    void shouldRejectNonFinite() {
        assertThatThrownBy(() -> schema.toVector(Map.of("b", "NaN")))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("'b'")
                .hasMessageContaining("not finite");
        assertThatThrownBy(() -> schema.toVector(Map.of("c", Double.POSITIVE_INFINITY)))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("'c'")
                .hasMessageContaining("not finite");
    }

    @Test
    @DisplayName("Should name every column absent from a header")
    void shouldRequireColumns() {
        assertThatThrownBy(() -> schema.requireColumns(List.of("a", "x")))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("b")
                .hasMessageContaining("c");
    }

    @Test
    @DisplayName("Should reject duplicate or blank column names")
    void shouldRejectInvalidColumns() {
        assertThatThrownBy(() -> FeatureSchema.of(List.of("a", "a")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
        assertThatThrownBy(() -> FeatureSchema.of(List.of(" ")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FeatureSchema.of(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
