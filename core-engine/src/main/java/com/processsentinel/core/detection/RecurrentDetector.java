package com.processsentinel.core.detection;

import com.processsentinel.core.model.Window;
import com.processsentinel.core.nn.SequenceNetworks;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.lossfunctions.impl.LossBinaryXENT;

import java.util.List;
import java.util.Objects;

/**
 * {@link AnomalyDetector} backed by an LSTM network with a single sigmoid
 * output.
 *
 * <p>
 * Windows are scored in batches of {@value #INFERENCE_BATCH}; the network
 * must not be trained while a detector built on it is in use.
 * </p>
 *
 * @since 1.0.0
 */
public final class RecurrentDetector implements AnomalyDetector {

    static final int INFERENCE_BATCH = 512;

    private final MultiLayerNetwork network;

    public RecurrentDetector(MultiLayerNetwork network) {
        this.network = Objects.requireNonNull(network, "Network must not be null");
        int outputs = SequenceNetworks.outputSize(network);
        if (outputs != 1) {
            throw new IllegalArgumentException("Detector network must have 1 output, got: " + outputs);
        }
    }

    /**
     * Fresh detector network: sigmoid output trained with binary
     * cross-entropy.
     */
    public static MultiLayerNetwork newNetwork(int featureCount, TrainingSettings settings) {
        return SequenceNetworks.builder()
                .inputSize(featureCount)
                .hiddenSize(settings.getHiddenSize())
                .outputSize(1)
                .outputActivation(Activation.SIGMOID)
                .lossFunction(new LossBinaryXENT())
                .learningRate(settings.getLearningRate())
                .gradientClipNorm(settings.getGradientClipNorm())
                .seed(settings.getSeed())
                .build();
    }

    @Override
    public double[] score(List<Window> windows) {
        Objects.requireNonNull(windows, "Windows must not be null");
        double[] probabilities = new double[windows.size()];
        for (int from = 0; from < windows.size(); from += INFERENCE_BATCH) {
            int to = Math.min(windows.size(), from + INFERENCE_BATCH);
            INDArray output = SequenceNetworks.output(network, windows.subList(from, to));
            for (int i = from; i < to; i++) {
                probabilities[i] = output.getDouble(i - from, 0);
            }
        }
        return probabilities;
    }

    public MultiLayerNetwork getNetwork() {
        return network;
    }

    public int getFeatureCount() {
        return SequenceNetworks.inputSize(network);
    }
}
