package com.processsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Window}.
 */
class WindowTest {

    @Test
    @DisplayName("Changing the source matrix should not change the window")
    void shouldCopySourceMatrix() {
        double[][] source = { { 1.0, 2.0 }, { 3.0, 4.0 } };
        Window window = Window.unlabeled("r", 0, source);

        source[0][0] = 99.0;
        source[1] = new double[] { -1.0, -1.0 };

        assertThat(window.value(0, 0)).isEqualTo(1.0);
        assertThat(window.features()[1]).containsExactly(3.0, 4.0);
    }

    @Test
    @DisplayName("Changing the returned matrix should not change the window")
    void shouldReturnCopies() {
        Window window = Window.unlabeled("r", 0, new double[][] { { 1.0 }, { 2.0 } });

        window.features()[1][0] = 42.0;

        assertThat(window.value(1, 0)).isEqualTo(2.0);
        assertThat(window.length()).isEqualTo(2);
        assertThat(window.featureCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject ragged or null rows")
    void shouldRejectRaggedRows() {
        assertThatThrownBy(() -> Window.unlabeled("r", 0, new double[][] { { 1.0, 2.0 }, { 3.0 } }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("row 1 has 1, expected 2");
        assertThatThrownBy(() -> Window.unlabeled("r", 0, new double[][] { { 1.0 }, null }))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should reject binary labels other than 0 and 1")
    void shouldRejectInvalidBinaryLabel() {
        assertThatThrownBy(() -> new Window("r", 0, new double[][] { { 1.0 } }, 2,
                AnomalyCode.STEP, AnomalyCode.STEP))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
