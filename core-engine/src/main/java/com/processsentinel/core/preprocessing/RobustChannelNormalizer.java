package com.processsentinel.core.preprocessing;

import com.processsentinel.core.data.RunStore;
import com.processsentinel.core.model.Partition;
import com.processsentinel.core.model.Run;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fits a {@link ChannelScale} from the median and interquartile range of
 * each feature.
 *
 * <p>
 * Step and ramp anomalies are present in training runs and have heavy
 * tails; median/IQR are not moved by them the way mean/variance are.
 * Percentiles use linear interpolation between closest ranks. A feature with
 * zero IQR (e.g. a valve that never moves) gets a spread of 1.0 so it is
 * only centered.
 * </p>
 *
 * @since 1.0.0
 */
public final class RobustChannelNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(RobustChannelNormalizer.class);

    static final double LOWER_QUANTILE = 25.0;
    static final double UPPER_QUANTILE = 75.0;

    /**
     * Fit on the train runs of {@code partition} only.
     *
     * @throws IllegalArgumentException if the train partition has no timesteps
     */
    public ChannelScale fit(RunStore store, Partition partition) {
        Objects.requireNonNull(store, "Run store must not be null");
        Objects.requireNonNull(partition, "Partition must not be null");
        ChannelScale scale = fit(store.subset(partition.getTrain()));
        LOG.info("Fitted robust channel scale on {} train run(s)", partition.getTrain().size());
        return scale;
    }

    /**
     * Fit on every timestep of every run in {@code store}.
     *
     * @throws IllegalArgumentException if the store has no timesteps
     */
    public ChannelScale fit(RunStore store) {
        Objects.requireNonNull(store, "Run store must not be null");
        long total = store.timestepCount();
        if (total == 0) {
            throw new IllegalArgumentException("Cannot fit a channel scale on zero timesteps");
        }
        if (total > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too many timesteps to fit in memory: " + total);
        }

        int features = store.featureCount();
        double[][] columns = new double[features][(int) total];
        int row = 0;
        for (Run run : store.runs()) {
            for (int t = 0; t < run.length(); t++) {
                double[] values = run.featureRow(t);
                for (int f = 0; f < features; f++) {
                    columns[f][row] = values[f];
                }
                row++;
            }
        }

        double[] center = new double[features];
        double[] spread = new double[features];
        for (int f = 0; f < features; f++) {
            double[] sorted = columns[f];
            Arrays.sort(sorted);
            center[f] = percentile(sorted, 50.0);
            double iqr = percentile(sorted, UPPER_QUANTILE) - percentile(sorted, LOWER_QUANTILE);
            spread[f] = iqr > 0.0 ? iqr : 1.0;
        }
        return new ChannelScale(center, spread);
    }

    /**
     * Percentile of an ascending array with linear interpolation.
     *
     * @param sorted ascending, non-empty values
     * @param p      percentile in {@code [0, 100]}
     */
    static double percentile(double[] sorted, double p) {
        double position = p / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }
}
