package com.processsentinel.core.detection;

import com.processsentinel.core.model.AnomalyCode;
import com.processsentinel.core.model.CascadeResult;
import com.processsentinel.core.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Two-stage inference: the detector gates every window, the classifier only
 * sees windows whose detector probability reaches the threshold.
 *
 * <p>
 * The engine holds no mutable state and may be shared between threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class CascadeEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CascadeEngine.class);

    private final AnomalyDetector detector;
    private final AnomalyClassifier classifier;
    private final double threshold;

    /**
     * @throws IllegalArgumentException if {@code threshold} is outside [0, 1]
     */
    public CascadeEngine(AnomalyDetector detector, AnomalyClassifier classifier, double threshold) {
        this.detector = Objects.requireNonNull(detector, "Detector must not be null");
        this.classifier = Objects.requireNonNull(classifier, "Classifier must not be null");
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("threshold must be in [0, 1], got: " + threshold);
        }
        this.threshold = threshold;
    }

    public CascadeResult infer(List<Window> windows) {
        Objects.requireNonNull(windows, "Windows must not be null");
        int n = windows.size();
        double[] probabilities = detector.score(windows);
        if (probabilities == null || probabilities.length != n) {
            throw new IllegalStateException("Detector returned "
                    + (probabilities == null ? "null" : probabilities.length + " probabilities")
                    + " for " + n + " windows");
        }
        boolean[] flags = new boolean[n];
        List<Integer> flaggedIndices = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            flags[i] = probabilities[i] >= threshold;
            if (flags[i]) {
                flaggedIndices.add(i);
            }
        }

        AnomalyCode[] types = new AnomalyCode[n];
        Arrays.fill(types, AnomalyCode.NORMAL);
        double[][] typeProbabilities = new double[n][];
        for (int i = 0; i < n; i++) {
            typeProbabilities[i] = new double[AnomalyCode.typeCount()];
        }

        if (!flaggedIndices.isEmpty()) {
            List<Window> flagged = flaggedIndices.stream().map(windows::get).toList();
            double[][] distributions = classifier.probabilities(flagged);
            requireShape(distributions, flagged.size());
            for (int k = 0; k < flaggedIndices.size(); k++) {
                int i = flaggedIndices.get(k);
                types[i] = AnomalyCode.mostLikelyType(distributions[k]);
                typeProbabilities[i] = distributions[k];
            }
        }
        LOG.debug("Cascade flagged {}/{} windows at threshold {}", flaggedIndices.size(), n, threshold);
        return new CascadeResult(threshold, probabilities, flags, Arrays.asList(types), typeProbabilities);
    }

    private static void requireShape(double[][] distributions, int expected) {
        if (distributions == null || distributions.length != expected) {
            throw new IllegalStateException("Classifier returned "
                    + (distributions == null ? "null" : distributions.length + " distributions")
                    + " for " + expected + " flagged windows");
        }
        for (int k = 0; k < distributions.length; k++) {
            if (distributions[k] == null || distributions[k].length != AnomalyCode.typeCount()) {
                throw new IllegalStateException("Classifier distribution " + k + " has "
                        + (distributions[k] == null ? "no" : String.valueOf(distributions[k].length))
                        + " entries, expected " + AnomalyCode.typeCount());
            }
        }
    }

    public double getThreshold() {
        return threshold;
    }

    public AnomalyDetector getDetector() {
        return detector;
    }

    public AnomalyClassifier getClassifier() {
        return classifier;
    }
}
