package com.processsentinel.core.detection;

import com.processsentinel.core.SyntheticRuns;
import com.processsentinel.core.evaluation.Metrics;
import com.processsentinel.core.model.AnomalyCode;
import com.processsentinel.core.model.Window;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.nd4j.linalg.dataset.DataSet;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ClassifierTrainer}.
 */
class ClassifierTrainerTest {

    private static final int LENGTH = 5;
    private static final int FEATURES = 2;

    private static TrainingSettings settings(int epochs) {
        return TrainingSettings.builder()
                .hiddenSize(8)
                .epochs(epochs)
                .batchSize(16)
                .learningRate(0.05)
                .seed(5L)
                .build();
    }

    @Test
    @DisplayName("selectAnomalous should keep only windows with binary label 1")
    void selectAnomalousShouldFilter() {
        List<Window> windows = SyntheticRuns.separableWindows(3, LENGTH, FEATURES, 1L);

        List<Window> anomalous = ClassifierTrainer.selectAnomalous(windows);

        assertThat(anomalous).hasSize(9).allMatch(Window::isAnomalous);
    }

    @Test
    @DisplayName("Empty training set should yield an untrained classifier without error")
    void emptyTrainingSetShouldYieldUntrainedClassifier() {
        ClassifierTrainer trainer = new ClassifierTrainer(settings(3), FEATURES);

        RecurrentClassifier classifier = trainer.train(List.of(), List.of());

        assertThat(classifier.isTrained()).isFalse();
        assertThat(trainer.getHistory()).isEmpty();
        assertThat(trainer.getClassWeights()).containsExactly(1.0, 1.0, 1.0);
        double[][] distributions = classifier.probabilities(
                List.of(SyntheticRuns.constantWindow("x", LENGTH, FEATURES, 1.0, AnomalyCode.STEP)));
        assertThat(distributions[0]).hasSize(AnomalyCode.typeCount());
        assertThat(distributions[0][0] + distributions[0][1] + distributions[0][2]).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Should learn to separate anomaly types")
    void shouldLearnSeparableTypes() {
        List<Window> train = ClassifierTrainer.selectAnomalous(
                SyntheticRuns.separableWindows(20, LENGTH, FEATURES, 4L));
        ClassifierTrainer trainer = new ClassifierTrainer(settings(60), FEATURES);

        RecurrentClassifier classifier = trainer.train(train, train);

        List<AnomalyCode> predicted = classifier.classify(train);
        int[] truth = new int[train.size()];
        int[] guesses = new int[train.size()];
        for (int i = 0; i < truth.length; i++) {
            truth[i] = train.get(i).getAnomalyTypeLabel().getCode();
            guesses[i] = predicted.get(i).getCode();
        }
        assertThat(classifier.isTrained()).isTrue();
        assertThat(predicted).doesNotContain(AnomalyCode.NORMAL);
        assertThat(Metrics.balancedAccuracy(truth, guesses)).isGreaterThanOrEqualTo(0.7);
        List<EpochMetrics> history = trainer.getHistory();
        assertThat(history.get(history.size() - 1).getTrainLoss()).isLessThan(history.get(0).getTrainLoss());
    }

    @Test
    @DisplayName("Missing anomaly types should get the largest class weight")
    void missingTypeShouldGetLargestWeight() {
        List<Window> train = List.of(
                SyntheticRuns.constantWindow("a", LENGTH, FEATURES, 1.0, AnomalyCode.FREEZE),
                SyntheticRuns.constantWindow("b", LENGTH, FEATURES, 1.1, AnomalyCode.FREEZE),
                SyntheticRuns.constantWindow("c", LENGTH, FEATURES, 3.0, AnomalyCode.STEP));
        ClassifierTrainer trainer = new ClassifierTrainer(settings(1), FEATURES);

        trainer.train(train, List.of());

        assertThat(trainer.getClassWeights()).containsExactly(1.0, 2.0, 2.0);
    }

    @Test
    @DisplayName("Minibatch labels should be one-hot anomaly types")
    void dataSetShouldOneHotTypes() {
        ClassifierTrainer trainer = new ClassifierTrainer(settings(1), FEATURES);
        List<Window> batch = List.of(
                SyntheticRuns.constantWindow("a", LENGTH, FEATURES, 1.0, AnomalyCode.RAMP),
                SyntheticRuns.constantWindow("b", LENGTH, FEATURES, 2.0, AnomalyCode.FREEZE));

        DataSet dataSet = trainer.toDataSet(batch);

        assertThat(dataSet.getLabels().getRow(0).toDoubleVector()).containsExactly(0.0, 0.0, 1.0);
        assertThat(dataSet.getLabels().getRow(1).toDoubleVector()).containsExactly(1.0, 0.0, 0.0);
        assertThat(dataSet.getLabelsMaskArray()).isNull();
    }

    @Test
    @DisplayName("Should reject normal windows in the training set")
    void shouldRejectNormalWindows() {
        List<Window> train = List.of(
                SyntheticRuns.constantWindow("a", LENGTH, FEATURES, 0.0, AnomalyCode.NORMAL));

        assertThatThrownBy(() -> new ClassifierTrainer(settings(1), FEATURES).train(train, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no anomaly type");
    }
}
