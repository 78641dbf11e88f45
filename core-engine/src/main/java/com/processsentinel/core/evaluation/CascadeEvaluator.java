package com.processsentinel.core.evaluation;

import com.processsentinel.core.model.AnomalyCode;
import com.processsentinel.core.model.CascadeResult;
import com.processsentinel.core.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scores a {@link CascadeResult} against the labels of the windows it was
 * computed on.
 *
 * @since 1.0.0
 */
public final class CascadeEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(CascadeEvaluator.class);

    static final List<String> BINARY_LABELS = List.of("Normal", "Anomaly");
    static final List<String> CODE_LABELS = codeLabels();

    private CascadeEvaluator() {
        // utility class
    }

    /**
     * @throws IllegalArgumentException if the result does not match the
     *                                  windows in size
     */
    public static EvaluationReport evaluate(List<Window> windows, CascadeResult result) {
        Objects.requireNonNull(windows, "Windows must not be null");
        Objects.requireNonNull(result, "Cascade result must not be null");
        if (windows.size() != result.size()) {
            throw new IllegalArgumentException("Cascade result covers " + result.size()
                    + " windows, expected " + windows.size());
        }

        int n = windows.size();
        int[] binaryTruth = new int[n];
        int[] binaryPredicted = new int[n];
        List<Integer> anomalous = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            binaryTruth[i] = windows.get(i).getBinaryLabel();
            binaryPredicted[i] = result.isFlagged(i) ? 1 : 0;
            if (windows.get(i).isAnomalous()) {
                anomalous.add(i);
            }
        }

        int[] typeTruth = new int[anomalous.size()];
        int[] typePredicted = new int[anomalous.size()];
        for (int k = 0; k < anomalous.size(); k++) {
            int i = anomalous.get(k);
            typeTruth[k] = windows.get(i).getAnomalyTypeLabel().getCode();
            typePredicted[k] = result.type(i).getCode();
        }

        EvaluationReport report = new EvaluationReport(n, anomalous.size(),
                Metrics.balancedAccuracy(binaryTruth, binaryPredicted),
                ClassificationReport.of(binaryTruth, binaryPredicted, BINARY_LABELS),
                ConfusionMatrix.of(binaryTruth, binaryPredicted, BINARY_LABELS),
                Metrics.balancedAccuracy(typeTruth, typePredicted),
                ClassificationReport.of(typeTruth, typePredicted, CODE_LABELS),
                ConfusionMatrix.of(typeTruth, typePredicted, CODE_LABELS));
        LOG.info("Evaluated {} windows: detector balanced accuracy {}, type balanced accuracy {}",
                n, String.format("%.4f", report.getDetectorBalancedAccuracy()),
                String.format("%.4f", report.getTypeBalancedAccuracy()));
        return report;
    }

    private static List<String> codeLabels() {
        List<String> labels = new ArrayList<>();
        for (AnomalyCode code : AnomalyCode.values()) {
            labels.add(code.getLabel());
        }
        return List.copyOf(labels);
    }
}
