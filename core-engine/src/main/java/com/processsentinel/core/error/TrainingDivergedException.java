package com.processsentinel.core.error;

/**
 * Thrown when the training loss becomes non-finite even after gradient
 * clipping. Training stops at that point; the partially updated parameters
 * are discarded together with the trainer.
 *
 * @since 1.0.0
 */
public class TrainingDivergedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String stage;
    private final int epoch;

    public TrainingDivergedException(String stage, int epoch, double loss) {
        super(String.format("%s training diverged at epoch %d (loss=%s)", stage, epoch, loss));
        this.stage = stage;
        this.epoch = epoch;
    }

    public String getStage() {
        return stage;
    }

    /**
     * @return the 1-based epoch during which the loss became non-finite
     */
    public int getEpoch() {
        return epoch;
    }
}
