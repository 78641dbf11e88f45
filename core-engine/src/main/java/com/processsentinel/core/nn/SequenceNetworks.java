package com.processsentinel.core.nn;

import com.processsentinel.core.model.Window;
import org.deeplearning4j.nn.conf.GradientNormalization;
import org.deeplearning4j.nn.conf.MultiLayerConfiguration;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.inputs.InputType;
import org.deeplearning4j.nn.conf.layers.FeedForwardLayer;
import org.deeplearning4j.nn.conf.layers.LSTM;
import org.deeplearning4j.nn.conf.layers.Layer;
import org.deeplearning4j.nn.conf.layers.OutputLayer;
import org.deeplearning4j.nn.conf.layers.recurrent.LastTimeStep;
import org.deeplearning4j.nn.conf.layers.wrapper.BaseWrapperLayer;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.nn.weights.WeightInit;
import org.deeplearning4j.util.ModelSerializer;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.learning.config.Adam;
import org.nd4j.linalg.lossfunctions.ILossFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds, runs and serializes the recurrent networks used by both cascade
 * stages.
 *
 * <p>
 * Every network has the same shape: an LSTM encoder over the window, whose
 * last hidden state feeds one output layer. Input is laid out
 * {@code [windows, features, timesteps]} by {@link WindowTensors}. Networks
 * are configured in double precision, updated with Adam and clipped per layer
 * to an L2 norm.
 * </p>
 *
 * <p>
 * A {@link MultiLayerNetwork} is not safe for concurrent {@code output}
 * calls; {@link #output(MultiLayerNetwork, List)} serializes them on the
 * network instance.
 * </p>
 *
 * @since 1.0.0
 */
public final class SequenceNetworks {

    private static final Logger LOG = LoggerFactory.getLogger(SequenceNetworks.class);

    private SequenceNetworks() {
        // utility class
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Shape
    // ---------------------------------------------------------------

    /**
     * @return number of features per timestep the network expects
     */
    public static int inputSize(MultiLayerNetwork network) {
        return (int) feedForward(network, 0).getNIn();
    }

    /**
     * @return width of the output layer
     */
    public static int outputSize(MultiLayerNetwork network) {
        return (int) feedForward(network, network.getnLayers() - 1).getNOut();
    }

    private static FeedForwardLayer feedForward(MultiLayerNetwork network, int index) {
        Objects.requireNonNull(network, "Network must not be null");
        Layer layer = network.getLayerWiseConfigurations().getConf(index).getLayer();
        if (layer instanceof BaseWrapperLayer wrapper) {
            layer = wrapper.getUnderlying();
        }
        if (!(layer instanceof FeedForwardLayer feedForward)) {
            throw new IllegalArgumentException("Layer " + index + " has no fixed size: "
                    + layer.getClass().getSimpleName());
        }
        return feedForward;
    }

    // ---------------------------------------------------------------
    // Inference
    // ---------------------------------------------------------------

    /**
     * Run the network on a batch of windows in inference mode.
     *
     * @param windows non-empty, all of the network's input width
     * @return one output row per window
     * @throws IllegalArgumentException if a window has the wrong width
     */
    public static INDArray output(MultiLayerNetwork network, List<Window> windows) {
        int expected = inputSize(network);
        for (Window window : windows) {
            if (window.featureCount() != expected) {
                throw new IllegalArgumentException("Window " + window + " has " + window.featureCount()
                        + " features, network expects " + expected);
            }
        }
        INDArray input = WindowTensors.features(windows);
        synchronized (network) {
            return network.output(input, false);
        }
    }

    // ---------------------------------------------------------------
    // Serialization
    // ---------------------------------------------------------------

    /**
     * Serialize configuration and parameters (without updater state) in the
     * DL4J model zip format.
     *
     * @throws IllegalStateException if serialization fails
     */
    public static byte[] toBytes(MultiLayerNetwork network) {
        Objects.requireNonNull(network, "Network must not be null");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            synchronized (network) {
                ModelSerializer.writeModel(network, out, false);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize network", e);
        }
        return out.toByteArray();
    }

    /**
     * @throws IllegalArgumentException if {@code bytes} is not a serialized
     *                                  network
     */
    public static MultiLayerNetwork fromBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "Network bytes must not be null");
        try {
            return ModelSerializer.restoreMultiLayerNetwork(new ByteArrayInputStream(bytes), false);
        } catch (IOException | RuntimeException e) {
            throw new IllegalArgumentException("Malformed network model: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for an initialized network. Sizes, activation and loss
     * are required; the optimizer settings default to the stage defaults.
     */
    public static final class Builder {
        private int inputSize;
        private int hiddenSize;
        private int outputSize;
        private Activation outputActivation;
        private ILossFunction lossFunction;
        private double learningRate = 1e-3;
        private double gradientClipNorm = 5.0;
        private long seed = 42L;

        private Builder() {
        }

        public Builder inputSize(int inputSize) {
            this.inputSize = inputSize;
            return this;
        }

        public Builder hiddenSize(int hiddenSize) {
            this.hiddenSize = hiddenSize;
            return this;
        }

        public Builder outputSize(int outputSize) {
            this.outputSize = outputSize;
            return this;
        }

        public Builder outputActivation(Activation outputActivation) {
            this.outputActivation = outputActivation;
            return this;
        }

        public Builder lossFunction(ILossFunction lossFunction) {
            this.lossFunction = lossFunction;
            return this;
        }

        public Builder learningRate(double learningRate) {
            this.learningRate = learningRate;
            return this;
        }

        public Builder gradientClipNorm(double gradientClipNorm) {
            this.gradientClipNorm = gradientClipNorm;
            return this;
        }

        /**
         * Seed of the weight initialization.
         */
        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        /**
         * @throws IllegalArgumentException listing every invalid setting
         */
        public MultiLayerNetwork build() {
            List<String> errors = new ArrayList<>();
            if (inputSize <= 0) {
                errors.add("inputSize must be > 0, got: " + inputSize);
            }
            if (hiddenSize <= 0) {
                errors.add("hiddenSize must be > 0, got: " + hiddenSize);
            }
            if (outputSize <= 0) {
                errors.add("outputSize must be > 0, got: " + outputSize);
            }
            if (outputActivation == null) {
                errors.add("outputActivation must be set");
            }
            if (lossFunction == null) {
                errors.add("lossFunction must be set");
            }
            if (!(learningRate > 0.0)) {
                errors.add("learningRate must be > 0, got: " + learningRate);
            }
            if (!(gradientClipNorm > 0.0)) {
                errors.add("gradientClipNorm must be > 0, got: " + gradientClipNorm);
            }
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException("Invalid network settings: " + String.join("; ", errors));
            }

            MultiLayerConfiguration conf = new NeuralNetConfiguration.Builder()
                    .seed(seed)
                    .dataType(DataType.DOUBLE)
                    .weightInit(WeightInit.XAVIER)
                    .updater(new Adam(learningRate))
                    .gradientNormalization(GradientNormalization.ClipL2PerLayer)
                    .gradientNormalizationThreshold(gradientClipNorm)
                    .list()
                    .layer(new LastTimeStep(new LSTM.Builder()
                            .nIn(inputSize)
                            .nOut(hiddenSize)
                            .activation(Activation.TANH)
                            .build()))
                    .layer(new OutputLayer.Builder(lossFunction)
                            .nIn(hiddenSize)
                            .nOut(outputSize)
                            .activation(outputActivation)
                            .build())
                    .setInputType(InputType.recurrent(inputSize))
                    .build();

            MultiLayerNetwork network = new MultiLayerNetwork(conf);
            network.init();
            LOG.debug("Initialized LSTM network {}->{}->{} ({} parameters, seed {})",
                    inputSize, hiddenSize, outputSize, network.numParams(), seed);
            return network;
        }
    }
}
