package com.processsentinel.core.evaluation;

import java.util.List;
import java.util.Objects;

/**
 * Counts of (true label, predicted label) pairs. Rows are true labels,
 * columns are predictions; labels are dense indices {@code 0..n-1}.
 *
 * @since 1.0.0
 */
public final class ConfusionMatrix {

    private final List<String> labelNames;
    private final long[][] counts;

    private ConfusionMatrix(List<String> labelNames, long[][] counts) {
        this.labelNames = labelNames;
        this.counts = counts;
    }

    /**
     * @param labelNames display name of each label index
     * @throws IllegalArgumentException if a label falls outside
     *                                  {@code labelNames}
     */
    public static ConfusionMatrix of(int[] truth, int[] predicted, List<String> labelNames) {
        Objects.requireNonNull(labelNames, "Label names must not be null");
        Metrics.requireSameLength(truth, predicted);
        int n = labelNames.size();
        long[][] counts = new long[n][n];
        for (int i = 0; i < truth.length; i++) {
            if (truth[i] < 0 || truth[i] >= n || predicted[i] < 0 || predicted[i] >= n) {
                throw new IllegalArgumentException("Label out of range at position " + i
                        + ": truth=" + truth[i] + ", predicted=" + predicted[i]);
            }
            counts[truth[i]][predicted[i]]++;
        }
        return new ConfusionMatrix(List.copyOf(labelNames), counts);
    }

    public long count(int trueLabel, int predictedLabel) {
        return counts[trueLabel][predictedLabel];
    }

    public int labelCount() {
        return labelNames.size();
    }

    public List<String> getLabelNames() {
        return labelNames;
    }

    public long total() {
        long total = 0;
        for (long[] row : counts) {
            for (long c : row) {
                total += c;
            }
        }
        return total;
    }

    /**
     * Render as a fixed-width table with a header row of predicted labels.
     */
    public String format() {
        int width = 8;
        for (String name : labelNames) {
            width = Math.max(width, name.length() + 2);
        }
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%" + width + "s", "true\\pred"));
        for (String name : labelNames) {
            sb.append(String.format("%" + width + "s", name));
        }
        sb.append('\n');
        for (int t = 0; t < counts.length; t++) {
            sb.append(String.format("%" + width + "s", labelNames.get(t)));
            for (long c : counts[t]) {
                sb.append(String.format("%" + width + "d", c));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
