package com.processsentinel.core.detection;

import com.processsentinel.core.model.AnomalyCode;
import com.processsentinel.core.model.Window;
import com.processsentinel.core.nn.SequenceNetworks;
import com.processsentinel.core.nn.WindowTensors;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.lossfunctions.impl.LossMCXENT;

import java.util.List;
import java.util.Objects;

/**
 * {@link AnomalyClassifier} backed by an LSTM network with a softmax over
 * the anomaly types.
 *
 * <p>
 * A classifier may be <em>untrained</em> when no anomalous training windows
 * were available; it still answers with its initial weights, and
 * {@link #isTrained()} lets callers report the situation.
 * </p>
 *
 * @since 1.0.0
 */
public final class RecurrentClassifier implements AnomalyClassifier {

    private final MultiLayerNetwork network;
    private final boolean trained;

    public RecurrentClassifier(MultiLayerNetwork network, boolean trained) {
        this.network = Objects.requireNonNull(network, "Network must not be null");
        int outputs = SequenceNetworks.outputSize(network);
        if (outputs != AnomalyCode.typeCount()) {
            throw new IllegalArgumentException("Classifier network must have " + AnomalyCode.typeCount()
                    + " outputs, got: " + outputs);
        }
        this.trained = trained;
    }

    /**
     * Fresh classifier network: softmax output trained with categorical
     * cross-entropy, each example weighted by the weight of its true type.
     *
     * @param classWeights one weight per anomaly type, in type-index order
     */
    public static MultiLayerNetwork newNetwork(int featureCount, TrainingSettings settings, double[] classWeights) {
        Objects.requireNonNull(classWeights, "Class weights must not be null");
        if (classWeights.length != AnomalyCode.typeCount()) {
            throw new IllegalArgumentException("Expected " + AnomalyCode.typeCount() + " class weights, got: "
                    + classWeights.length);
        }
        return SequenceNetworks.builder()
                .inputSize(featureCount)
                .hiddenSize(settings.getHiddenSize())
                .outputSize(AnomalyCode.typeCount())
                .outputActivation(Activation.SOFTMAX)
                .lossFunction(new LossMCXENT(WindowTensors.row(classWeights)))
                .learningRate(settings.getLearningRate())
                .gradientClipNorm(settings.getGradientClipNorm())
                .seed(settings.getSeed())
                .build();
    }

    @Override
    public double[][] probabilities(List<Window> windows) {
        Objects.requireNonNull(windows, "Windows must not be null");
        int types = AnomalyCode.typeCount();
        double[][] distributions = new double[windows.size()][];
        for (int from = 0; from < windows.size(); from += RecurrentDetector.INFERENCE_BATCH) {
            int to = Math.min(windows.size(), from + RecurrentDetector.INFERENCE_BATCH);
            INDArray output = SequenceNetworks.output(network, windows.subList(from, to));
            for (int i = from; i < to; i++) {
                double[] distribution = new double[types];
                for (int k = 0; k < types; k++) {
                    distribution[k] = output.getDouble(i - from, k);
                }
                distributions[i] = distribution;
            }
        }
        return distributions;
    }

    public MultiLayerNetwork getNetwork() {
        return network;
    }

    public int getFeatureCount() {
        return SequenceNetworks.inputSize(network);
    }

    public boolean isTrained() {
        return trained;
    }
}
