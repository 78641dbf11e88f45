package com.processsentinel.core.detection;

import com.processsentinel.core.error.TrainingDivergedException;
import com.processsentinel.core.model.Window;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.nd4j.linalg.dataset.DataSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Minibatch training loop shared by both cascade stages.
 *
 * <p>
 * Each epoch visits the training windows in a fresh permutation drawn from a
 * generator seeded with {@link TrainingSettings#getSeed()}; the same seed
 * initializes the network weights. Each minibatch is handed to
 * {@link MultiLayerNetwork#fit(org.nd4j.linalg.dataset.api.DataSet)}, which
 * applies the configured loss, per-layer gradient clipping and Adam update. A
 * non-finite minibatch score aborts training with
 * {@link TrainingDivergedException}.
 * </p>
 *
 * <p>
 * Subclasses define the loss by how they build the network and the
 * minibatch {@link DataSet}.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class SequenceTrainer {

    private static final Logger LOG = LoggerFactory.getLogger(SequenceTrainer.class);

    protected final TrainingSettings settings;
    protected final int featureCount;
    private EpochListener listener = EpochListener.CONTINUE;
    private List<EpochMetrics> history = List.of();

    protected SequenceTrainer(TrainingSettings settings, int featureCount) {
        this.settings = Objects.requireNonNull(settings, "Training settings must not be null");
        if (featureCount <= 0) {
            throw new IllegalArgumentException("featureCount must be > 0, got: " + featureCount);
        }
        this.featureCount = featureCount;
    }

    /**
     * Register the callback notified after each epoch. Returning {@code false}
     * from it stops training early.
     */
    public void setEpochListener(EpochListener listener) {
        this.listener = Objects.requireNonNull(listener, "Epoch listener must not be null");
    }

    public TrainingSettings getSettings() {
        return settings;
    }

    /**
     * @return metrics of the epochs completed by the last training call
     */
    public List<EpochMetrics> getHistory() {
        return history;
    }

    // ---------------------------------------------------------------
    // Loss definition
    // ---------------------------------------------------------------

    /** Name used in logs and divergence errors. */
    protected abstract String stageName();

    /**
     * Features, labels and (optionally) per-example label weights of one
     * minibatch.
     */
    protected abstract DataSet toDataSet(List<Window> batch);

    /**
     * @return balanced accuracy of the network on {@code validation}
     *         ({@code validation} is never empty here)
     */
    protected abstract double validate(MultiLayerNetwork network, List<Window> validation);

    // ---------------------------------------------------------------
    // Loop
    // ---------------------------------------------------------------

    /**
     * Train {@code network} in place.
     *
     * @return the metrics of every completed epoch
     * @throws TrainingDivergedException if a minibatch loss is not finite
     */
    protected List<EpochMetrics> fit(MultiLayerNetwork network, List<Window> train, List<Window> validation) {
        requireFeatureCount(train);
        requireFeatureCount(validation);

        Random shuffler = new Random(settings.getSeed());
        int[] order = new int[train.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }

        List<EpochMetrics> completed = new ArrayList<>();
        history = Collections.unmodifiableList(completed);
        int epochs = settings.getEpochs();
        for (int epoch = 1; epoch <= epochs; epoch++) {
            shuffle(order, shuffler);
            double lossSum = 0.0;
            for (int from = 0; from < order.length; from += settings.getBatchSize()) {
                int to = Math.min(order.length, from + settings.getBatchSize());
                List<Window> batch = new ArrayList<>(to - from);
                for (int i = from; i < to; i++) {
                    batch.add(train.get(order[i]));
                }
                network.fit(toDataSet(batch));
                double batchLoss = network.score();
                if (!Double.isFinite(batchLoss)) {
                    LOG.error("{} training diverged at epoch {} (loss={})", stageName(), epoch, batchLoss);
                    throw new TrainingDivergedException(stageName(), epoch, batchLoss);
                }
                LOG.trace("{} minibatch loss={}", stageName(), batchLoss);
                lossSum += batchLoss * (to - from);
            }

            double validationScore = validation.isEmpty() ? Double.NaN : validate(network, validation);
            EpochMetrics metrics = new EpochMetrics(stageName(), epoch, epochs,
                    lossSum / order.length, validationScore);
            completed.add(metrics);
            LOG.info("{}", metrics);

            if (!listener.onEpoch(metrics)) {
                LOG.info("{} training stopped by listener after epoch {}", stageName(), epoch);
                break;
            }
        }
        return history;
    }

    private void requireFeatureCount(List<Window> windows) {
        for (Window window : windows) {
            if (window.featureCount() != featureCount) {
                throw new IllegalArgumentException("Window " + window + " has " + window.featureCount()
                        + " features, expected " + featureCount);
            }
        }
    }

    private static void shuffle(int[] order, Random random) {
        for (int i = order.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
    }
}
