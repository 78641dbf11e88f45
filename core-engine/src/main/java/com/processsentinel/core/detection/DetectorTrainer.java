package com.processsentinel.core.detection;

import com.processsentinel.core.error.DegenerateClassException;
import com.processsentinel.core.evaluation.Metrics;
import com.processsentinel.core.model.Window;
import com.processsentinel.core.nn.WindowTensors;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.nd4j.linalg.dataset.DataSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Trains the stage-1 binary detector.
 *
 * <p>
 * Loss is binary cross-entropy on the sigmoid output with the positive term
 * weighted by {@code max(1, negatives) / positives}, averaged over the
 * minibatch. The weight is carried as the per-example labels mask of each
 * minibatch, which DL4J multiplies into the loss and its gradient.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorTrainer extends SequenceTrainer {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorTrainer.class);

    static final String STAGE = "Detector";

    private double positiveWeight = 1.0;

    public DetectorTrainer(TrainingSettings settings, int featureCount) {
        super(settings, featureCount);
    }

    /**
     * @param train      training windows; at least one must be anomalous
     * @param validation windows scored after every epoch; may be empty
     * @return the trained detector
     * @throws DegenerateClassException if {@code train} has no anomalous window
     */
    public RecurrentDetector train(List<Window> train, List<Window> validation) {
        Objects.requireNonNull(train, "Training windows must not be null");
        Objects.requireNonNull(validation, "Validation windows must not be null");

        long positives = train.stream().filter(Window::isAnomalous).count();
        long negatives = train.size() - positives;
        if (positives == 0) {
            throw new DegenerateClassException("Detector training set has no anomalous windows ("
                    + train.size() + " windows)");
        }
        positiveWeight = Math.max(1L, negatives) / (double) positives;
        LOG.info("Training detector on {} windows ({} anomalous, pos_weight={}), {} validation windows",
                train.size(), positives, String.format("%.3f", positiveWeight), validation.size());

        MultiLayerNetwork network = RecurrentDetector.newNetwork(featureCount, settings);
        fit(network, train, validation);
        return new RecurrentDetector(network);
    }

    /**
     * @return the positive-class weight used by the last {@link #train} call
     */
    public double getPositiveWeight() {
        return positiveWeight;
    }

    @Override
    protected String stageName() {
        return STAGE;
    }

    @Override
    protected DataSet toDataSet(List<Window> batch) {
        double[] weights = new double[batch.size()];
        for (int i = 0; i < weights.length; i++) {
            weights[i] = batch.get(i).isAnomalous() ? positiveWeight : 1.0;
        }
        return new DataSet(WindowTensors.features(batch), WindowTensors.binaryLabels(batch),
                null, WindowTensors.column(weights));
    }

    @Override
    protected double validate(MultiLayerNetwork network, List<Window> validation) {
        double[] probabilities = new RecurrentDetector(network).score(validation);
        int[] truth = new int[validation.size()];
        int[] predicted = new int[validation.size()];
        for (int i = 0; i < truth.length; i++) {
            truth[i] = validation.get(i).getBinaryLabel();
            predicted[i] = probabilities[i] >= settings.getThreshold() ? 1 : 0;
        }
        return Metrics.balancedAccuracy(truth, predicted);
    }
}
