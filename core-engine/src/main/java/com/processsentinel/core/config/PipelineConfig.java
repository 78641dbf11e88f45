package com.processsentinel.core.config;

import com.processsentinel.core.detection.TrainingSettings;
import com.processsentinel.core.model.FeatureSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top-level POJO for the pipeline YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional):
 * </p>
 *
 * <pre>
 * windowLength: 60
 * stride: 10
 * testFraction: 0.2
 * splitSeed: 42
 * threshold: 0.5
 * epochs: 12
 * batchSize: 256
 * learningRate: 0.001
 * gradientClipNorm: 5.0
 * detectorHiddenSize: 64
 * classifierHiddenSize: 96
 * featureColumns: [ "Mixer/Level", "Mixer/Temperature" ]
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading. Unset {@code featureColumns} means
 * {@link FeatureSchema#DEFAULT}.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineConfig {

    // --- Windowing ---
    private int windowLength = 60;
    private int stride = 10;

    // --- Splitting ---
    private double testFraction = 0.2;
    private long splitSeed = 42L;
    private boolean stratifiedSplit;

    // --- Cascade ---
    private double threshold = 0.5;

    // --- Training ---
    private int epochs = 12;
    private int batchSize = 256;
    private double learningRate = 1e-3;
    private double gradientClipNorm = 5.0;
    private int detectorHiddenSize = 64;
    private int classifierHiddenSize = 96;
    private long trainingSeed = 42L;

    // --- Input columns ---
    private String runIdColumn = "Run id";
    private String timestampColumn = "Timestamp";
    private String labelColumn = "Anomaly";
    private List<String> featureColumns = new ArrayList<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every setting and report all problems at once.
     *
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (windowLength <= 0) {
            errors.add("'windowLength' must be > 0, got: " + windowLength);
        }
        if (stride <= 0) {
            errors.add("'stride' must be > 0, got: " + stride);
        }
        if (!(testFraction > 0.0 && testFraction < 1.0)) {
            errors.add("'testFraction' must be in (0, 1), got: " + testFraction);
        }
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            errors.add("'threshold' must be in [0, 1], got: " + threshold);
        }
        if (epochs <= 0) {
            errors.add("'epochs' must be > 0, got: " + epochs);
        }
        if (batchSize <= 0) {
            errors.add("'batchSize' must be > 0, got: " + batchSize);
        }
        if (!(learningRate > 0.0)) {
            errors.add("'learningRate' must be > 0, got: " + learningRate);
        }
        if (!(gradientClipNorm > 0.0)) {
            errors.add("'gradientClipNorm' must be > 0, got: " + gradientClipNorm);
        }
        if (detectorHiddenSize <= 0) {
            errors.add("'detectorHiddenSize' must be > 0, got: " + detectorHiddenSize);
        }
        if (classifierHiddenSize <= 0) {
            errors.add("'classifierHiddenSize' must be > 0, got: " + classifierHiddenSize);
        }
        requireNonBlank(runIdColumn, "runIdColumn", errors);
        requireNonBlank(timestampColumn, "timestampColumn", errors);
        requireNonBlank(labelColumn, "labelColumn", errors);
        if (!featureColumns.isEmpty()) {
            try {
                FeatureSchema.of(featureColumns);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Pipeline configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static void requireNonBlank(String value, String name, List<String> errors) {
        if (value == null || value.isBlank()) {
            errors.add("'" + name + "' must not be blank");
        }
    }

    // ---------------------------------------------------------------
    // Derived views
    // ---------------------------------------------------------------

    /**
     * @return the configured schema, or {@link FeatureSchema#DEFAULT}
     */
    public FeatureSchema featureSchema() {
        return featureColumns.isEmpty() ? FeatureSchema.DEFAULT : FeatureSchema.of(featureColumns);
    }

    public TrainingSettings detectorSettings() {
        return trainingSettings(detectorHiddenSize);
    }

    public TrainingSettings classifierSettings() {
        return trainingSettings(classifierHiddenSize);
    }

    private TrainingSettings trainingSettings(int hiddenSize) {
        return TrainingSettings.builder()
                .hiddenSize(hiddenSize)
                .epochs(epochs)
                .batchSize(batchSize)
                .learningRate(learningRate)
                .gradientClipNorm(gradientClipNorm)
                .threshold(threshold)
                .seed(trainingSeed)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public int getWindowLength() {
        return windowLength;
    }

    public void setWindowLength(int windowLength) {
        this.windowLength = windowLength;
    }

    public int getStride() {
        return stride;
    }

    public void setStride(int stride) {
        this.stride = stride;
    }

    public double getTestFraction() {
        return testFraction;
    }

    public void setTestFraction(double testFraction) {
        this.testFraction = testFraction;
    }

    public long getSplitSeed() {
        return splitSeed;
    }

    public void setSplitSeed(long splitSeed) {
        this.splitSeed = splitSeed;
    }

    public boolean isStratifiedSplit() {
        return stratifiedSplit;
    }

    public void setStratifiedSplit(boolean stratifiedSplit) {
        this.stratifiedSplit = stratifiedSplit;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getEpochs() {
        return epochs;
    }

    public void setEpochs(int epochs) {
        this.epochs = epochs;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public double getLearningRate() {
        return learningRate;
    }

    public void setLearningRate(double learningRate) {
        this.learningRate = learningRate;
    }

    public double getGradientClipNorm() {
        return gradientClipNorm;
    }

    public void setGradientClipNorm(double gradientClipNorm) {
        this.gradientClipNorm = gradientClipNorm;
    }

    public int getDetectorHiddenSize() {
        return detectorHiddenSize;
    }

    public void setDetectorHiddenSize(int detectorHiddenSize) {
        this.detectorHiddenSize = detectorHiddenSize;
    }

    public int getClassifierHiddenSize() {
        return classifierHiddenSize;
    }

    public void setClassifierHiddenSize(int classifierHiddenSize) {
        this.classifierHiddenSize = classifierHiddenSize;
    }

    public long getTrainingSeed() {
        return trainingSeed;
    }

    public void setTrainingSeed(long trainingSeed) {
        this.trainingSeed = trainingSeed;
    }

    public String getRunIdColumn() {
        return runIdColumn;
    }

    public void setRunIdColumn(String runIdColumn) {
        this.runIdColumn = runIdColumn;
    }

    public String getTimestampColumn() {
        return timestampColumn;
    }

    public void setTimestampColumn(String timestampColumn) {
        this.timestampColumn = timestampColumn;
    }

    public String getLabelColumn() {
        return labelColumn;
    }

    public void setLabelColumn(String labelColumn) {
        this.labelColumn = labelColumn;
    }

    /**
     * @return unmodifiable feature column list (empty means default schema)
     */
    public List<String> getFeatureColumns() {
        return Collections.unmodifiableList(featureColumns);
    }

    public void setFeatureColumns(List<String> featureColumns) {
        this.featureColumns = featureColumns != null ? new ArrayList<>(featureColumns) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "windowLength=" + windowLength +
                ", stride=" + stride +
                ", testFraction=" + testFraction +
                ", splitSeed=" + splitSeed +
                ", stratifiedSplit=" + stratifiedSplit +
                ", threshold=" + threshold +
                ", epochs=" + epochs +
                ", batchSize=" + batchSize +
                ", learningRate=" + learningRate +
                ", gradientClipNorm=" + gradientClipNorm +
                ", detectorHiddenSize=" + detectorHiddenSize +
                ", classifierHiddenSize=" + classifierHiddenSize +
                ", features=" + (featureColumns.isEmpty() ? "default" : featureColumns.size()) +
                '}';
    }
}
