package com.processsentinel.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * One recorded trial of the process: an ordered sequence of timesteps, each
 * with a feature vector and a ground-truth {@link AnomalyCode}.
 *
 * <p>
 * Instances are immutable. Accessors that return arrays return copies.
 * </p>
 *
 * @since 1.0.0
 */
public final class Run {

    private final String runId;
    private final double[] timestamps;
    private final double[][] features;
    private final AnomalyCode[] codes;
    private final int featureCount;

    /**
     * @param runId      unique run identifier
     * @param timestamps one timestamp per timestep
     * @param features   {@code T x F} feature matrix
     * @param codes      one anomaly code per timestep
     * @throws IllegalArgumentException if the three sequences differ in length
     *                                  or rows differ in width
     */
    public Run(String runId, double[] timestamps, double[][] features, AnomalyCode[] codes) {
        this.runId = Objects.requireNonNull(runId, "Run id must not be null");
        Objects.requireNonNull(timestamps, "Timestamps must not be null");
        Objects.requireNonNull(features, "Features must not be null");
        Objects.requireNonNull(codes, "Anomaly codes must not be null");
        if (timestamps.length != features.length || codes.length != features.length) {
            throw new IllegalArgumentException("Run '" + runId + "': timestamps (" + timestamps.length
                    + "), features (" + features.length + ") and codes (" + codes.length
                    + ") must have equal length");
        }
        this.featureCount = features.length == 0 ? 0 : features[0].length;
        this.features = new double[features.length][];
        for (int t = 0; t < features.length; t++) {
            if (features[t].length != featureCount) {
                throw new IllegalArgumentException("Run '" + runId + "': timestep " + t + " has "
                        + features[t].length + " features, expected " + featureCount);
            }
            this.features[t] = features[t].clone();
        }
        this.timestamps = timestamps.clone();
        this.codes = codes.clone();
    }

    public String getRunId() {
        return runId;
    }

    /**
     * @return number of timesteps
     */
    public int length() {
        return features.length;
    }

    public int featureCount() {
        return featureCount;
    }

    public double timestamp(int t) {
        return timestamps[t];
    }

    public AnomalyCode code(int t) {
        return codes[t];
    }

    /**
     * @return a copy of the feature vector at timestep {@code t}
     */
    public double[] featureRow(int t) {
        return features[t].clone();
    }

    /**
     * Copy {@code length} consecutive feature rows starting at {@code start}.
     */
    public double[][] slice(int start, int length) {
        double[][] out = new double[length][];
        for (int i = 0; i < length; i++) {
            out[i] = features[start + i].clone();
        }
        return out;
    }

    /**
     * Copy {@code length} consecutive codes starting at {@code start}.
     */
    public AnomalyCode[] codes(int start, int length) {
        return Arrays.copyOfRange(codes, start, start + length);
    }

    /**
     * @return a run with the same id, timestamps and codes but new features
     */
    public Run withFeatures(double[][] newFeatures) {
        return new Run(runId, timestamps, newFeatures, codes);
    }

    @Override
    public String toString() {
        return "Run{runId='" + runId + "', length=" + length() + ", features=" + featureCount + '}';
    }
}
