package com.processsentinel.core.detection;

import java.util.ArrayList;
import java.util.List;

/**
 * Hyper-parameters for training one cascade stage.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}; every field has the default of the reference
 * training run, and {@link Builder#build()} rejects invalid values with an
 * {@link IllegalArgumentException} listing every problem.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrainingSettings {

    private final int hiddenSize;
    private final int epochs;
    private final int batchSize;
    private final double learningRate;
    private final double gradientClipNorm;
    private final double threshold;
    private final long seed;

    private TrainingSettings(Builder builder) {
        this.hiddenSize = builder.hiddenSize;
        this.epochs = builder.epochs;
        this.batchSize = builder.batchSize;
        this.learningRate = builder.learningRate;
        this.gradientClipNorm = builder.gradientClipNorm;
        this.threshold = builder.threshold;
        this.seed = builder.seed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getHiddenSize() {
        return hiddenSize;
    }

    public int getEpochs() {
        return epochs;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public double getLearningRate() {
        return learningRate;
    }

    public double getGradientClipNorm() {
        return gradientClipNorm;
    }

    /**
     * @return decision threshold used when scoring validation windows
     */
    public double getThreshold() {
        return threshold;
    }

    /**
     * @return seed for weight initialization and per-epoch shuffling
     */
    public long getSeed() {
        return seed;
    }

    @Override
    public String toString() {
        return "TrainingSettings{hiddenSize=" + hiddenSize + ", epochs=" + epochs
                + ", batchSize=" + batchSize + ", learningRate=" + learningRate
                + ", gradientClipNorm=" + gradientClipNorm + ", threshold=" + threshold
                + ", seed=" + seed + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static final class Builder {
        private int hiddenSize = 64;
        private int epochs = 12;
        private int batchSize = 256;
        private double learningRate = 1e-3;
        private double gradientClipNorm = 5.0;
        private double threshold = 0.5;
        private long seed = 42L;

        private Builder() {
        }

        public Builder hiddenSize(int hiddenSize) {
            this.hiddenSize = hiddenSize;
            return this;
        }

        public Builder epochs(int epochs) {
            this.epochs = epochs;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
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

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public TrainingSettings build() {
            List<String> errors = new ArrayList<>();
            if (hiddenSize <= 0) {
                errors.add("hiddenSize must be > 0, got: " + hiddenSize);
            }
            if (epochs <= 0) {
                errors.add("epochs must be > 0, got: " + epochs);
            }
            if (batchSize <= 0) {
                errors.add("batchSize must be > 0, got: " + batchSize);
            }
            if (!(learningRate > 0.0)) {
                errors.add("learningRate must be > 0, got: " + learningRate);
            }
            if (!(gradientClipNorm > 0.0)) {
                errors.add("gradientClipNorm must be > 0, got: " + gradientClipNorm);
            }
            if (!(threshold >= 0.0 && threshold <= 1.0)) {
                errors.add("threshold must be in [0, 1], got: " + threshold);
            }
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException("Invalid training settings: " + String.join("; ", errors));
            }
            return new TrainingSettings(this);
        }
    }
}
