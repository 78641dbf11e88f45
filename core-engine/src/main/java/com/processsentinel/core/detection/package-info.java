/**
 * The two cascade stages and their training.
 *
 * <ul>
 * <li>{@link com.processsentinel.core.detection.DetectorTrainer} /
 * {@link com.processsentinel.core.detection.RecurrentDetector} - stage 1, "is this
 * window anomalous?"</li>
 * <li>{@link com.processsentinel.core.detection.ClassifierTrainer} /
 * {@link com.processsentinel.core.detection.RecurrentClassifier} - stage 2, "which
 * anomaly type?", trained on anomalous windows only</li>
 * <li>{@link com.processsentinel.core.detection.CascadeEngine} - gates stage 2
 * on the stage-1 threshold</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.processsentinel.core.detection;
