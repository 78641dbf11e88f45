package com.processsentinel.core.evaluation;

import java.util.Map;
import java.util.TreeMap;

/**
 * Scalar classification metrics over integer labels.
 *
 * @since 1.0.0
 */
public final class Metrics {

    private Metrics() {
        // utility class
    }

    /**
     * Mean per-class recall over the classes that occur in {@code truth}.
     * Predictions of labels absent from {@code truth} only lower the recall
     * of the class they were taken from.
     *
     * @return the balanced accuracy, or {@code NaN} for empty input
     * @throws IllegalArgumentException if the arrays differ in length
     */
    public static double balancedAccuracy(int[] truth, int[] predicted) {
        requireSameLength(truth, predicted);
        if (truth.length == 0) {
            return Double.NaN;
        }
        Map<Integer, int[]> hitsAndTotals = new TreeMap<>();
        for (int i = 0; i < truth.length; i++) {
            int[] counts = hitsAndTotals.computeIfAbsent(truth[i], k -> new int[2]);
            if (truth[i] == predicted[i]) {
                counts[0]++;
            }
            counts[1]++;
        }
        double recallSum = 0.0;
        for (int[] counts : hitsAndTotals.values()) {
            recallSum += counts[0] / (double) counts[1];
        }
        return recallSum / hitsAndTotals.size();
    }

    /**
     * @return fraction of positions where the labels agree, {@code NaN} for
     *         empty input
     */
    public static double accuracy(int[] truth, int[] predicted) {
        requireSameLength(truth, predicted);
        if (truth.length == 0) {
            return Double.NaN;
        }
        int hits = 0;
        for (int i = 0; i < truth.length; i++) {
            if (truth[i] == predicted[i]) {
                hits++;
            }
        }
        return hits / (double) truth.length;
    }

    static void requireSameLength(int[] truth, int[] predicted) {
        if (truth.length != predicted.length) {
            throw new IllegalArgumentException("Label arrays differ in length: "
                    + truth.length + " vs " + predicted.length);
        }
    }
}
