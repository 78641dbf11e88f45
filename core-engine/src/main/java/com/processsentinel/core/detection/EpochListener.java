package com.processsentinel.core.detection;

/**
 * Callback invoked after every training epoch.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface EpochListener {

    /** Listener that never stops training. */
    EpochListener CONTINUE = metrics -> true;

    /**
     * @param metrics the finished epoch
     * @return {@code false} to stop training after this epoch
     */
    boolean onEpoch(EpochMetrics metrics);
}
