package com.processsentinel.core.detection;

import com.processsentinel.core.model.AnomalyCode;
import com.processsentinel.core.model.Window;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stage-2 contract: assign an anomaly type to windows already believed to be
 * anomalous. The classifier never predicts {@link AnomalyCode#NORMAL}.
 *
 * @since 1.0.0
 */
public interface AnomalyClassifier {

    /**
     * @param windows windows to classify; may be empty
     * @return per window, a distribution over {@link AnomalyCode#anomalyTypes()}
     *         indexed by {@link AnomalyCode#typeIndex()}
     */
    double[][] probabilities(List<Window> windows);

    /**
     * Arg-max of {@link #probabilities(List)}, lowest type index on ties.
     */
    default List<AnomalyCode> classify(List<Window> windows) {
        double[][] probabilities = probabilities(windows);
        List<AnomalyCode> types = new ArrayList<>(probabilities.length);
        for (double[] distribution : probabilities) {
            types.add(AnomalyCode.mostLikelyType(distribution));
        }
        return Collections.unmodifiableList(types);
    }
}
