package com.processsentinel.core.detection;

import com.processsentinel.core.model.AnomalyCode;
import com.processsentinel.core.model.Window;

import java.util.Collection;

/**
 * Inverse-frequency class weights for the stage-2 loss.
 *
 * @since 1.0.0
 */
public final class ClassWeights {

    private ClassWeights() {
        // utility class
    }

    /**
     * Count windows per anomaly type, indexed by {@link AnomalyCode#typeIndex()}.
     *
     * @throws IllegalArgumentException if a window has no anomaly type
     */
    public static long[] countTypes(Collection<Window> windows) {
        long[] counts = new long[AnomalyCode.typeCount()];
        for (Window window : windows) {
            AnomalyCode type = window.getAnomalyTypeLabel();
            if (!type.isAnomalous()) {
                throw new IllegalArgumentException("Window " + window + " has no anomaly type");
            }
            counts[type.typeIndex()]++;
        }
        return counts;
    }

    /**
     * {@code weight[c] = max(counts) / max(1, counts[c])}. A class with zero
     * examples therefore receives the largest weight.
     */
    public static double[] inverseFrequency(long[] counts) {
        long max = 0;
        for (long count : counts) {
            max = Math.max(max, count);
        }
        double[] weights = new double[counts.length];
        for (int c = 0; c < counts.length; c++) {
            weights[c] = max / (double) Math.max(1L, counts[c]);
        }
        return weights;
    }
}
