package com.processsentinel.core.model;

import com.processsentinel.core.error.DataIntegrityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnomalyCode}.
 */
class AnomalyCodeTest {

    @Test
    @DisplayName("Should resolve every supported code")
    void shouldResolveCodes() {
        assertThat(AnomalyCode.fromCode(0)).isEqualTo(AnomalyCode.NORMAL);
        assertThat(AnomalyCode.fromCode(1)).isEqualTo(AnomalyCode.FREEZE);
        assertThat(AnomalyCode.fromCode(2)).isEqualTo(AnomalyCode.STEP);
        assertThat(AnomalyCode.fromCode(3)).isEqualTo(AnomalyCode.RAMP);
    }

    @Test
    @DisplayName("Should reject unknown codes as a data integrity error")
    void shouldRejectUnknownCode() {
        assertThatThrownBy(() -> AnomalyCode.fromCode(4))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("Unknown anomaly code: 4");
        assertThatThrownBy(() -> AnomalyCode.fromCode(-1))
                .isInstanceOf(DataIntegrityException.class);
    }

    @Test
    @DisplayName("Type index should be dense and exclude NORMAL")
    void typeIndexShouldBeDense() {
        assertThat(AnomalyCode.typeCount()).isEqualTo(3);
        for (AnomalyCode type : AnomalyCode.anomalyTypes()) {
            assertThat(AnomalyCode.fromTypeIndex(type.typeIndex())).isEqualTo(type);
        }
        assertThat(AnomalyCode.anomalyTypes()).doesNotContain(AnomalyCode.NORMAL);
        assertThatThrownBy(AnomalyCode.NORMAL::typeIndex).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> AnomalyCode.fromTypeIndex(3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Only NORMAL should be non-anomalous")
    void onlyNormalIsNotAnomalous() {
        assertThat(AnomalyCode.NORMAL.isAnomalous()).isFalse();
        assertThat(AnomalyCode.RAMP.isAnomalous()).isTrue();
        assertThat(AnomalyCode.STEP.getLabel()).isEqualTo("Step");
    }

    @Test
    @DisplayName("Most likely type should take the arg-max, ties going to the lower index")
    void mostLikelyTypeShouldTakeArgMax() {
        assertThat(AnomalyCode.mostLikelyType(new double[] { 0.1, 0.2, 0.7 })).isEqualTo(AnomalyCode.RAMP);
        assertThat(AnomalyCode.mostLikelyType(new double[] { 0.4, 0.4, 0.2 })).isEqualTo(AnomalyCode.FREEZE);
        assertThat(AnomalyCode.mostLikelyType(new double[] { 0.2, 0.4, 0.4 })).isEqualTo(AnomalyCode.STEP);
        assertThatThrownBy(() -> AnomalyCode.mostLikelyType(new double[] { 0.5, 0.5 }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("got: 2");
    }
}
