package com.processsentinel.core.detection;

import com.processsentinel.core.model.Window;

import java.util.List;

/**
 * Stage-1 contract: estimate, for each window, the probability that it
 * contains at least one anomalous timestep.
 *
 * <p>
 * Implementations must be safe for concurrent use once training is over.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnomalyDetector {

    /**
     * @param windows windows to score; may be empty
     * @return one probability in {@code [0, 1]} per window, same order
     */
    double[] score(List<Window> windows);
}
