package com.processsentinel.core.model;

import java.util.Objects;

/**
 * Fixed-length contiguous slice of one run's normalized feature vectors,
 * together with the labels derived from its member timesteps.
 *
 * <ul>
 * <li><b>binary label</b> - 1 if any member timestep is anomalous</li>
 * <li><b>multiclass label</b> - majority code of the members, ties to the
 * lowest code</li>
 * <li><b>anomaly-type label</b> - the multiclass label when it is an anomaly
 * type, otherwise the majority among the anomalous members; this is the
 * supervision target of the stage-2 classifier</li>
 * </ul>
 *
 * <p>
 * The feature matrix is copied on construction and on {@link #features()},
 * so windows are immutable and may be shared freely between threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class Window {

    private final String runId;
    private final int start;
    private final double[][] features;
    private final int binaryLabel;
    private final AnomalyCode multiclassLabel;
    private final AnomalyCode anomalyTypeLabel;

    public Window(String runId, int start, double[][] features, int binaryLabel,
            AnomalyCode multiclassLabel, AnomalyCode anomalyTypeLabel) {
        this.runId = Objects.requireNonNull(runId, "Run id must not be null");
        this.start = start;
        this.features = copyRectangular(Objects.requireNonNull(features, "Features must not be null"));
        if (binaryLabel != 0 && binaryLabel != 1) {
            throw new IllegalArgumentException("Binary label must be 0 or 1, got: " + binaryLabel);
        }
        this.binaryLabel = binaryLabel;
        this.multiclassLabel = Objects.requireNonNull(multiclassLabel, "Multiclass label must not be null");
        this.anomalyTypeLabel = Objects.requireNonNull(anomalyTypeLabel, "Anomaly type label must not be null");
    }

    /**
     * Build an unlabeled window for inference. Labels are NORMAL / 0.
     */
    public static Window unlabeled(String runId, int start, double[][] features) {
        return new Window(runId, start, features, 0, AnomalyCode.NORMAL, AnomalyCode.NORMAL);
    }

    public String getRunId() {
        return runId;
    }

    /**
     * @return offset of the first member timestep within its run
     */
    public int getStart() {
        return start;
    }

    public int length() {
        return features.length;
    }

    public int featureCount() {
        return features.length == 0 ? 0 : features[0].length;
    }

    /**
     * @return a copy of the {@code length x featureCount} feature matrix
     */
    public double[][] features() {
        return copyRectangular(features);
    }

    /**
     * @param t offset within the window
     * @param f feature index
     */
    public double value(int t, int f) {
        return features[t][f];
    }

    public int getBinaryLabel() {
        return binaryLabel;
    }

    public boolean isAnomalous() {
        return binaryLabel == 1;
    }

    public AnomalyCode getMulticlassLabel() {
        return multiclassLabel;
    }

    public AnomalyCode getAnomalyTypeLabel() {
        return anomalyTypeLabel;
    }

    private static double[][] copyRectangular(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int t = 0; t < source.length; t++) {
            Objects.requireNonNull(source[t], "Feature row must not be null");
            if (source[t].length != source[0].length) {
                throw new IllegalArgumentException("Feature rows must have equal width: row " + t + " has "
                        + source[t].length + ", expected " + source[0].length);
            }
            copy[t] = source[t].clone();
        }
        return copy;
    }

    @Override
    public String toString() {
        return "Window{runId='" + runId + "', start=" + start + ", length=" + length()
                + ", binary=" + binaryLabel + ", multiclass=" + multiclassLabel + '}';
    }
}
