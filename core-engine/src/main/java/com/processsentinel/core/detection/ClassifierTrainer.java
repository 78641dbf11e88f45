package com.processsentinel.core.detection;

import com.processsentinel.core.evaluation.Metrics;
import com.processsentinel.core.model.AnomalyCode;
import com.processsentinel.core.model.Window;
import com.processsentinel.core.nn.WindowTensors;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.nd4j.linalg.dataset.DataSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Trains the stage-2 anomaly-type classifier on anomalous windows only.
 *
 * <p>
 * Loss is class-weighted categorical cross-entropy with weights from
 * {@link ClassWeights#inverseFrequency(long[])}, averaged over the minibatch. An empty training set is not an error: an
 * untrained classifier is returned and a warning is logged.
 * </p>
 *
 * @since 1.0.0
 */
public class ClassifierTrainer extends SequenceTrainer {

    private static final Logger LOG = LoggerFactory.getLogger(ClassifierTrainer.class);

    static final String STAGE = "Classifier";

    private double[] classWeights = unitWeights();

    public ClassifierTrainer(TrainingSettings settings, int featureCount) {
        super(settings, featureCount);
    }

    /**
     * Keep only windows whose true binary label is 1.
     */
    public static List<Window> selectAnomalous(Collection<Window> windows) {
        Objects.requireNonNull(windows, "Windows must not be null");
        return windows.stream().filter(Window::isAnomalous).toList();
    }

    /**
     * @param train      anomalous training windows; may be empty
     * @param validation anomalous validation windows; may be empty
     * @return the classifier, untrained if {@code train} is empty
     */
    public RecurrentClassifier train(List<Window> train, List<Window> validation) {
        Objects.requireNonNull(train, "Training windows must not be null");
        Objects.requireNonNull(validation, "Validation windows must not be null");

        if (train.isEmpty()) {
            LOG.warn("No anomalous training windows; stage-2 classifier left untrained");
            classWeights = unitWeights();
            return new RecurrentClassifier(
                    RecurrentClassifier.newNetwork(featureCount, settings, classWeights), false);
        }

        long[] counts = ClassWeights.countTypes(train);
        ClassWeights.countTypes(validation); // rejects untyped validation windows
        classWeights = ClassWeights.inverseFrequency(counts);
        for (AnomalyCode type : AnomalyCode.anomalyTypes()) {
            if (counts[type.typeIndex()] == 0) {
                LOG.warn("No training windows of type {}; class weight set to {}",
                        type.getLabel(), classWeights[type.typeIndex()]);
            }
        }
        LOG.info("Training classifier on {} windows (counts={}, weights={}), {} validation windows",
                train.size(), Arrays.toString(counts), Arrays.toString(classWeights), validation.size());

        MultiLayerNetwork network = RecurrentClassifier.newNetwork(featureCount, settings, classWeights);
        fit(network, train, validation);
        return new RecurrentClassifier(network, true);
    }

    /**
     * @return the class weights used by the last {@link #train} call
     */
    public double[] getClassWeights() {
        return classWeights.clone();
    }

    @Override
    protected String stageName() {
        return STAGE;
    }

    @Override
    protected DataSet toDataSet(List<Window> batch) {
        return new DataSet(WindowTensors.features(batch), WindowTensors.oneHotTypes(batch));
    }

    @Override
    protected double validate(MultiLayerNetwork network, List<Window> validation) {
        List<AnomalyCode> predicted = new RecurrentClassifier(network, true).classify(validation);
        int[] truth = new int[validation.size()];
        int[] guesses = new int[validation.size()];
        for (int i = 0; i < truth.length; i++) {
            truth[i] = validation.get(i).getAnomalyTypeLabel().getCode();
            guesses[i] = predicted.get(i).getCode();
        }
        return Metrics.balancedAccuracy(truth, guesses);
    }

    private static double[] unitWeights() {
        double[] weights = new double[AnomalyCode.typeCount()];
        Arrays.fill(weights, 1.0);
        return weights;
    }
}
