package com.processsentinel.core.preprocessing;

import com.processsentinel.core.SyntheticRuns;
import com.processsentinel.core.data.RunStore;
import com.processsentinel.core.model.AnomalyCode;
import com.processsentinel.core.model.Run;
import com.processsentinel.core.model.Window;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.processsentinel.core.model.AnomalyCode.FREEZE;
import static com.processsentinel.core.model.AnomalyCode.NORMAL;
import static com.processsentinel.core.model.AnomalyCode.RAMP;
import static com.processsentinel.core.model.AnomalyCode.STEP;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link WindowExtractor}.
 */
class WindowExtractorTest {

    @Test
    @DisplayName("Window count should be floor((T - L) / S) + 1, or 0 for short runs")
    void windowCountShouldFollowFormula() {
        WindowExtractor extractor = new WindowExtractor(60, 10);

        assertThat(extractor.windowCount(59)).isZero();
        assertThat(extractor.windowCount(60)).isEqualTo(1);
        assertThat(extractor.windowCount(69)).isEqualTo(1);
        assertThat(extractor.windowCount(70)).isEqualTo(2);
        assertThat(extractor.windowCount(100)).isEqualTo(5);
    }

    @Test
    @DisplayName("Windows should start every stride and stay inside the run")
    void windowsShouldStayInsideRun() {
        Run run = SyntheticRuns.normalRun("r", 47, 3, 1);

        List<Window> windows = new WindowExtractor(10, 4).extract(run);

        assertThat(windows).hasSize(10);
        for (int w = 0; w < windows.size(); w++) {
            Window window = windows.get(w);
            assertThat(window.getStart()).isEqualTo(w * 4);
            assertThat(window.length()).isEqualTo(10);
            assertThat(window.getStart() + window.length()).isLessThanOrEqualTo(run.length());
            assertThat(window.features()[0]).containsExactly(run.featureRow(window.getStart()));
        }
    }

    @Test
    @DisplayName("A step over 35 of the first 60 timesteps should label window 0 Step")
    void stepMajorityShouldLabelWindowStep() {
        Run run = SyntheticRuns.run("r", 100, 13, STEP, 25, 60, 4);

        Window first = new WindowExtractor(60, 10).extract(run).get(0);

        assertThat(first.getBinaryLabel()).isEqualTo(1);
        assertThat(first.getMulticlassLabel()).isEqualTo(STEP);
        assertThat(first.getAnomalyTypeLabel()).isEqualTo(STEP);
    }

    @Test
    @DisplayName("An all-normal run should yield no positive windows")
    void normalRunShouldYieldNoPositives() {
        Run run = SyntheticRuns.normalRun("r", 200, 13, 8);

        List<Window> windows = new WindowExtractor(60, 10).extract(run);

        assertThat(windows).hasSize(15);
        assertThat(windows).noneMatch(Window::isAnomalous);
        assertThat(windows).allMatch(w -> w.getMulticlassLabel() == NORMAL);
    }

    @Test
    @DisplayName("Binary label should be the OR of member codes")
    void binaryLabelShouldBeOr() {
        assertThat(WindowExtractor.binaryLabel(codes(NORMAL, NORMAL, NORMAL))).isZero();
        assertThat(WindowExtractor.binaryLabel(codes(NORMAL, RAMP, NORMAL))).isEqualTo(1);
    }

    @Test
    @DisplayName("Majority ties should resolve to the lowest code")
    void majorityTieShouldPickLowestCode() {
        assertThat(WindowExtractor.majorityLabel(codes(STEP, FREEZE, STEP, FREEZE))).isEqualTo(FREEZE);
        assertThat(WindowExtractor.majorityLabel(codes(NORMAL, RAMP))).isEqualTo(NORMAL);
        assertThat(WindowExtractor.majorityLabel(codes(RAMP, RAMP, NORMAL))).isEqualTo(RAMP);
    }

    @Test
    @DisplayName("Anomaly type label should fall back to the majority among anomalous members")
    void anomalyTypeLabelShouldIgnoreNormal() {
        AnomalyCode[] mostlyNormal = codes(NORMAL, NORMAL, NORMAL, RAMP, STEP, RAMP);

        AnomalyCode majority = WindowExtractor.majorityLabel(mostlyNormal);

        assertThat(majority).isEqualTo(NORMAL);
        assertThat(WindowExtractor.anomalyTypeLabel(mostlyNormal, majority)).isEqualTo(RAMP);
        assertThat(WindowExtractor.anomalyTypeLabel(codes(NORMAL, NORMAL, RAMP, STEP), NORMAL)).isEqualTo(STEP);
        assertThat(WindowExtractor.anomalyTypeLabel(codes(NORMAL), NORMAL)).isEqualTo(NORMAL);
    }

    @Test
    @DisplayName("Should reject a window longer than the shortest run")
    void shouldRejectWindowLongerThanShortestRun() {
        RunStore store = RunStore.of(List.of(
                SyntheticRuns.normalRun("long", 100, 2, 1),
                SyntheticRuns.normalRun("short", 30, 2, 2)));

        assertThatThrownBy(() -> new WindowExtractor(60, 10).requireFits(store))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("shortest run");
    }

    @Test
    @DisplayName("Should reject non-positive length or stride")
    void shouldRejectInvalidGeometry() {
        assertThatThrownBy(() -> new WindowExtractor(0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WindowExtractor(5, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static AnomalyCode[] codes(AnomalyCode... codes) {
        return codes;
    }
}
