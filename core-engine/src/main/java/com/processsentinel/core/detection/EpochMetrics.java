package com.processsentinel.core.detection;

/**
 * Summary of one finished training epoch.
 *
 * @since 1.0.0
 */
public final class EpochMetrics {

    private final String stage;
    private final int epoch;
    private final int totalEpochs;
    private final double trainLoss;
    private final double validationBalancedAccuracy;

    public EpochMetrics(String stage, int epoch, int totalEpochs, double trainLoss,
            double validationBalancedAccuracy) {
        this.stage = stage;
        this.epoch = epoch;
        this.totalEpochs = totalEpochs;
        this.trainLoss = trainLoss;
        this.validationBalancedAccuracy = validationBalancedAccuracy;
    }

    public String getStage() {
        return stage;
    }

    /**
     * @return 1-based epoch number
     */
    public int getEpoch() {
        return epoch;
    }

    public int getTotalEpochs() {
        return totalEpochs;
    }

    /**
     * @return mean training loss over the epoch's windows
     */
    public double getTrainLoss() {
        return trainLoss;
    }

    /**
     * @return balanced accuracy on the validation windows, {@code NaN} when
     *         there were none
     */
    public double getValidationBalancedAccuracy() {
        return validationBalancedAccuracy;
    }

    @Override
    public String toString() {
        return String.format("%s epoch %d/%d: loss=%.4f, valBalancedAcc=%.3f",
                stage, epoch, totalEpochs, trainLoss, validationBalancedAccuracy);
    }
}
