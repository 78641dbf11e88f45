package com.processsentinel.core.evaluation;

import java.util.Objects;

/**
 * Held-out quality of both cascade stages.
 *
 * <p>
 * The detection section covers every evaluated window. The type section is
 * restricted to windows whose true binary label is 1 and compares their
 * anomaly-type label with the cascade's final verdict, so a missed detection
 * counts as a "Normal" prediction there.
 * </p>
 *
 * @since 1.0.0
 */
public final class EvaluationReport {

    private final int windowCount;
    private final int anomalousWindowCount;
    private final double detectorBalancedAccuracy;
    private final ClassificationReport detectorReport;
    private final ConfusionMatrix detectorConfusion;
    private final double typeBalancedAccuracy;
    private final ClassificationReport typeReport;
    private final ConfusionMatrix typeConfusion;

    EvaluationReport(int windowCount, int anomalousWindowCount,
            double detectorBalancedAccuracy, ClassificationReport detectorReport,
            ConfusionMatrix detectorConfusion, double typeBalancedAccuracy,
            ClassificationReport typeReport, ConfusionMatrix typeConfusion) {
        this.windowCount = windowCount;
        this.anomalousWindowCount = anomalousWindowCount;
        this.detectorBalancedAccuracy = detectorBalancedAccuracy;
        this.detectorReport = Objects.requireNonNull(detectorReport);
        this.detectorConfusion = Objects.requireNonNull(detectorConfusion);
        this.typeBalancedAccuracy = typeBalancedAccuracy;
        this.typeReport = Objects.requireNonNull(typeReport);
        this.typeConfusion = Objects.requireNonNull(typeConfusion);
    }

    public int getWindowCount() {
        return windowCount;
    }

    public int getAnomalousWindowCount() {
        return anomalousWindowCount;
    }

    public double getDetectorBalancedAccuracy() {
        return detectorBalancedAccuracy;
    }

    public ClassificationReport getDetectorReport() {
        return detectorReport;
    }

    public ConfusionMatrix getDetectorConfusion() {
        return detectorConfusion;
    }

    /**
     * @return balanced accuracy of the final type on truly anomalous windows,
     *         {@code NaN} when there were none
     */
    public double getTypeBalancedAccuracy() {
        return typeBalancedAccuracy;
    }

    public ClassificationReport getTypeReport() {
        return typeReport;
    }

    public ConfusionMatrix getTypeConfusion() {
        return typeConfusion;
    }

    public String format() {
        return "Windows evaluated: " + windowCount + " (" + anomalousWindowCount + " anomalous)\n"
                + String.format("Detector balanced accuracy: %.4f%n", detectorBalancedAccuracy)
                + "Detector report:\n" + detectorReport.format()
                + "Detector confusion:\n" + detectorConfusion.format()
                + String.format("Type balanced accuracy (anomalous windows): %.4f%n", typeBalancedAccuracy)
                + "Type report (anomalous windows):\n" + typeReport.format()
                + "Type confusion (anomalous windows):\n" + typeConfusion.format();
    }

    @Override
    public String toString() {
        return format();
    }
}
