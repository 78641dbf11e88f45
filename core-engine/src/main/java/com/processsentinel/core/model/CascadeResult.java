package com.processsentinel.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Per-window output of the two-stage cascade.
 *
 * <p>
 * For a window that was not flagged the type is {@link AnomalyCode#NORMAL}
 * and its type distribution is all zeros, because the classifier never saw
 * it.
 * </p>
 *
 * @since 1.0.0
 */
public final class CascadeResult {

    private final double threshold;
    private final double[] detectorProbabilities;
    private final boolean[] flags;
    private final List<AnomalyCode> types;
    private final double[][] typeProbabilities;

    public CascadeResult(double threshold, double[] detectorProbabilities, boolean[] flags,
            List<AnomalyCode> types, double[][] typeProbabilities) {
        this.threshold = threshold;
        this.detectorProbabilities = Objects.requireNonNull(detectorProbabilities, "Probabilities must not be null");
        this.flags = Objects.requireNonNull(flags, "Flags must not be null");
        this.types = Collections.unmodifiableList(Objects.requireNonNull(types, "Types must not be null"));
        this.typeProbabilities = Objects.requireNonNull(typeProbabilities, "Type probabilities must not be null");
        int n = detectorProbabilities.length;
        if (flags.length != n || types.size() != n || typeProbabilities.length != n) {
            throw new IllegalArgumentException("Cascade result arrays must all have length " + n);
        }
    }

    public int size() {
        return flags.length;
    }

    public double getThreshold() {
        return threshold;
    }

    public double detectorProbability(int i) {
        return detectorProbabilities[i];
    }

    public boolean isFlagged(int i) {
        return flags[i];
    }

    public AnomalyCode type(int i) {
        return types.get(i);
    }

    /**
     * @return a copy of the stage-2 distribution of window {@code i}
     */
    public double[] typeProbabilities(int i) {
        return typeProbabilities[i].clone();
    }

    public List<AnomalyCode> getTypes() {
        return types;
    }

    public int flaggedCount() {
        int count = 0;
        for (boolean flag : flags) {
            if (flag) {
                count++;
            }
        }
        return count;
    }
}
