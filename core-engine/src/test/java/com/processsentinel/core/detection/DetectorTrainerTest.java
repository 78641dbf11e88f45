package com.processsentinel.core.detection;

import com.processsentinel.core.SyntheticRuns;
import com.processsentinel.core.error.DegenerateClassException;
import com.processsentinel.core.error.TrainingDivergedException;
import com.processsentinel.core.evaluation.Metrics;
import com.processsentinel.core.model.AnomalyCode;
import com.processsentinel.core.model.Window;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.nd4j.linalg.dataset.DataSet;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DetectorTrainer}.
 */
class DetectorTrainerTest {

    private static final int LENGTH = 5;
    private static final int FEATURES = 2;

    private static TrainingSettings settings(int epochs) {
        return TrainingSettings.builder()
                .hiddenSize(4)
                .epochs(epochs)
                .batchSize(16)
                .learningRate(0.05)
                .seed(3L)
                .build();
    }

    @Test
    @DisplayName("Should learn a separable detection task")
    void shouldLearnSeparableTask() {
        List<Window> windows = SyntheticRuns.separableWindows(20, LENGTH, FEATURES, 1L);
        DetectorTrainer trainer = new DetectorTrainer(settings(30), FEATURES);

        RecurrentDetector detector = trainer.train(windows, windows);

        double[] scores = detector.score(windows);
        int[] truth = new int[windows.size()];
        int[] predicted = new int[windows.size()];
        for (int i = 0; i < truth.length; i++) {
            truth[i] = windows.get(i).getBinaryLabel();
            predicted[i] = scores[i] >= 0.5 ? 1 : 0;
        }
        assertThat(Metrics.balancedAccuracy(truth, predicted)).isGreaterThanOrEqualTo(0.9);

        List<EpochMetrics> history = trainer.getHistory();
        assertThat(history).hasSize(30);
        assertThat(history.get(29).getTrainLoss()).isLessThan(history.get(0).getTrainLoss());
        assertThat(history).allSatisfy(m -> assertThat(m.getStage()).isEqualTo("Detector"));
    }

    @Test
    @DisplayName("Positive weight should be negatives over positives")
    void positiveWeightShouldReflectImbalance() {
        // 20 normal, 60 anomalous
        List<Window> windows = SyntheticRuns.separableWindows(20, LENGTH, FEATURES, 1L);
        DetectorTrainer trainer = new DetectorTrainer(settings(1), FEATURES);

        trainer.train(windows, List.of());

        assertThat(trainer.getPositiveWeight()).isCloseTo(20.0 / 60.0, within(1e-12));
    }

    @Test
    @DisplayName("Same inputs and settings should give identical detectors")
    void trainingShouldBeDeterministic() {
        List<Window> windows = SyntheticRuns.separableWindows(8, LENGTH, FEATURES, 2L);

        double[] first = new DetectorTrainer(settings(3), FEATURES).train(windows, List.of()).score(windows);
        double[] second = new DetectorTrainer(settings(3), FEATURES).train(windows, List.of()).score(windows);

        assertThat(second).containsExactly(first, within(1e-9));
    }

    @Test
    @DisplayName("Empty validation set should report NaN validation accuracy")
    void emptyValidationShouldBeNaN() {
        List<Window> windows = SyntheticRuns.separableWindows(4, LENGTH, FEATURES, 2L);
        DetectorTrainer trainer = new DetectorTrainer(settings(2), FEATURES);

        trainer.train(windows, List.of());

        assertThat(trainer.getHistory())
                .extracting(EpochMetrics::getValidationBalancedAccuracy)
                .allSatisfy(v -> assertThat(v).isNaN());
    }

    @Test
    @DisplayName("Should reject a training set without anomalous windows")
    void shouldRejectNoPositives() {
        List<Window> windows = List.of(
                SyntheticRuns.constantWindow("a", LENGTH, FEATURES, 0.0, AnomalyCode.NORMAL),
                SyntheticRuns.constantWindow("b", LENGTH, FEATURES, 0.5, AnomalyCode.NORMAL));

        assertThatThrownBy(() -> new DetectorTrainer(settings(1), FEATURES).train(windows, List.of()))
                .isInstanceOf(DegenerateClassException.class)
                .hasMessageContaining("no anomalous windows");
    }

    @Test
    @DisplayName("Non-finite loss should abort with the failing epoch")
    void nonFiniteLossShouldAbort() {
        List<Window> windows = SyntheticRuns.separableWindows(2, LENGTH, FEATURES, 2L);
        DetectorTrainer trainer = new DetectorTrainer(settings(5), FEATURES) {
            @Override
            protected DataSet toDataSet(List<Window> batch) {
                DataSet dataSet = super.toDataSet(batch);
                dataSet.getLabels().putScalar(0, 0, Double.NaN);
                return dataSet;
            }
        };

        assertThatThrownBy(() -> trainer.train(windows, List.of()))
                .isInstanceOfSatisfying(TrainingDivergedException.class, e -> {
                    assertThat(e.getStage()).isEqualTo("Detector");
                    assertThat(e.getEpoch()).isEqualTo(1);
                });
        assertThat(trainer.getHistory()).isEmpty();
    }

    @Test
    @DisplayName("Positive windows should carry the positive weight in the minibatch")
    void dataSetShouldWeightPositives() {
        List<Window> windows = SyntheticRuns.separableWindows(6, LENGTH, FEATURES, 2L);
        DetectorTrainer trainer = new DetectorTrainer(settings(1), FEATURES);
        trainer.train(windows, List.of());
        List<Window> batch = List.of(
                SyntheticRuns.constantWindow("n", LENGTH, FEATURES, -2.0, AnomalyCode.NORMAL),
                SyntheticRuns.constantWindow("a", LENGTH, FEATURES, 1.0, AnomalyCode.STEP));

        DataSet dataSet = trainer.toDataSet(batch);

        assertThat(dataSet.getFeatures().shape()).containsExactly(2L, FEATURES, LENGTH);
        assertThat(dataSet.getLabels().getDouble(0, 0)).isEqualTo(0.0);
        assertThat(dataSet.getLabels().getDouble(1, 0)).isEqualTo(1.0);
        assertThat(dataSet.getLabelsMaskArray().getDouble(0, 0)).isEqualTo(1.0);
        assertThat(dataSet.getLabelsMaskArray().getDouble(1, 0)).isCloseTo(6.0 / 18.0, within(1e-12));
    }

    @Test
    @DisplayName("Listener returning false should stop training after that epoch")
    void listenerShouldStopTraining() {
        List<Window> windows = SyntheticRuns.separableWindows(4, LENGTH, FEATURES, 2L);
        DetectorTrainer trainer = new DetectorTrainer(settings(10), FEATURES);
        List<EpochMetrics> seen = new ArrayList<>();
        trainer.setEpochListener(metrics -> {
            seen.add(metrics);
            return metrics.getEpoch() < 2;
        });

        trainer.train(windows, windows);

        assertThat(seen).hasSize(2);
        assertThat(trainer.getHistory()).hasSize(2);
        assertThat(seen.get(0).getTotalEpochs()).isEqualTo(10);
        assertThat(seen.get(0).getValidationBalancedAccuracy()).isBetween(0.0, 1.0);
    }

    @Test
    @DisplayName("Should reject windows with the wrong feature count")
    void shouldRejectFeatureMismatch() {
        List<Window> windows = SyntheticRuns.separableWindows(2, LENGTH, FEATURES + 1, 2L);

        assertThatThrownBy(() -> new DetectorTrainer(settings(1), FEATURES).train(windows, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected " + FEATURES);
    }
}
