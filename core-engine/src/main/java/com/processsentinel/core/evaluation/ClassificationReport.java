package com.processsentinel.core.evaluation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Per-class precision, recall, F1 and support, with accuracy and macro /
 * support-weighted averages.
 *
 * <p>
 * Only labels that occur in the truth or the predictions are reported.
 * Undefined ratios (no predictions for a class, or no support) are 0.
 * </p>
 *
 * @since 1.0.0
 */
public final class ClassificationReport {

    private final List<ClassMetrics> classes;
    private final double accuracy;
    private final ClassMetrics macroAverage;
    private final ClassMetrics weightedAverage;
    private final long total;

    private ClassificationReport(List<ClassMetrics> classes, double accuracy,
            ClassMetrics macroAverage, ClassMetrics weightedAverage, long total) {
        this.classes = classes;
        this.accuracy = accuracy;
        this.macroAverage = macroAverage;
        this.weightedAverage = weightedAverage;
        this.total = total;
    }

    /**
     * @param labelNames display name of each label index
     */
    public static ClassificationReport of(int[] truth, int[] predicted, List<String> labelNames) {
        Objects.requireNonNull(labelNames, "Label names must not be null");
        ConfusionMatrix matrix = ConfusionMatrix.of(truth, predicted, labelNames);

        TreeSet<Integer> present = new TreeSet<>();
        for (int i = 0; i < truth.length; i++) {
            present.add(truth[i]);
            present.add(predicted[i]);
        }

        List<ClassMetrics> classes = new ArrayList<>();
        double macroP = 0.0;
        double macroR = 0.0;
        double macroF = 0.0;
        double weightedP = 0.0;
        double weightedR = 0.0;
        double weightedF = 0.0;
        for (int label : present) {
            long tp = matrix.count(label, label);
            long support = 0;
            long predictedCount = 0;
            for (int k = 0; k < matrix.labelCount(); k++) {
                support += matrix.count(label, k);
                predictedCount += matrix.count(k, label);
            }
            double precision = ratio(tp, predictedCount);
            double recall = ratio(tp, support);
            double f1 = precision + recall == 0.0 ? 0.0 : 2.0 * precision * recall / (precision + recall);
            classes.add(new ClassMetrics(labelNames.get(label), precision, recall, f1, support));

            macroP += precision;
            macroR += recall;
            macroF += f1;
            weightedP += precision * support;
            weightedR += recall * support;
            weightedF += f1 * support;
        }

        int n = Math.max(1, present.size());
        long total = truth.length;
        double denominator = Math.max(1L, total);
        ClassMetrics macro = new ClassMetrics("macro avg", macroP / n, macroR / n, macroF / n, total);
        ClassMetrics weighted = new ClassMetrics("weighted avg", weightedP / denominator,
                weightedR / denominator, weightedF / denominator, total);
        return new ClassificationReport(Collections.unmodifiableList(classes),
                Metrics.accuracy(truth, predicted), macro, weighted, total);
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : numerator / (double) denominator;
    }

    public List<ClassMetrics> getClasses() {
        return classes;
    }

    /**
     * @return the metrics of the named class, or {@code null} if absent
     */
    public ClassMetrics forLabel(String label) {
        return classes.stream().filter(c -> c.getLabel().equals(label)).findFirst().orElse(null);
    }

    public double getAccuracy() {
        return accuracy;
    }

    public ClassMetrics getMacroAverage() {
        return macroAverage;
    }

    public ClassMetrics getWeightedAverage() {
        return weightedAverage;
    }

    public long getTotal() {
        return total;
    }

    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%14s %10s %10s %10s %10s%n",
                "", "precision", "recall", "f1-score", "support"));
        for (ClassMetrics c : classes) {
            sb.append(c.formatRow()).append('\n');
        }
        sb.append('\n');
        sb.append(String.format(Locale.ROOT, "%14s %10s %10s %10.4f %10d%n",
                "accuracy", "", "", accuracy, total));
        sb.append(macroAverage.formatRow()).append('\n');
        sb.append(weightedAverage.formatRow()).append('\n');
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }

    /**
     * Metrics of one row of the report.
     */
    public static final class ClassMetrics {
        private final String label;
        private final double precision;
        private final double recall;
        private final double f1;
        private final long support;

        ClassMetrics(String label, double precision, double recall, double f1, long support) {
            this.label = label;
            this.precision = precision;
            this.recall = recall;
            this.f1 = f1;
            this.support = support;
        }

        public String getLabel() {
            return label;
        }

        public double getPrecision() {
            return precision;
        }

        public double getRecall() {
            return recall;
        }

        public double getF1() {
            return f1;
        }

        public long getSupport() {
            return support;
        }

        String formatRow() {
            return String.format(Locale.ROOT, "%14s %10.4f %10.4f %10.4f %10d",
                    label, precision, recall, f1, support);
        }
    }
}
