package com.processsentinel.core.preprocessing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.processsentinel.core.data.RunStore;
import com.processsentinel.core.model.Run;

import java.util.Arrays;
import java.util.Objects;

/**
 * Per-feature (center, spread) pairs. Applying the scale maps a raw value
 * {@code x} of feature {@code i} to {@code (x - center[i]) / spread[i]}.
 *
 * <p>
 * Immutable; fitted once from the train partition and stored in the model
 * artifact for reuse at inference time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ChannelScale {

    private final double[] center;
    private final double[] spread;

    /**
     * @throws IllegalArgumentException if the arrays differ in length or a
     *                                  spread is not strictly positive
     */
    @JsonCreator
    public ChannelScale(@JsonProperty("center") double[] center,
            @JsonProperty("spread") double[] spread) {
        Objects.requireNonNull(center, "center must not be null");
        Objects.requireNonNull(spread, "spread must not be null");
        if (center.length != spread.length) {
            throw new IllegalArgumentException("center (" + center.length + ") and spread ("
                    + spread.length + ") must have equal length");
        }
        for (int i = 0; i < spread.length; i++) {
            if (!(spread[i] > 0.0) || Double.isInfinite(spread[i])) {
                throw new IllegalArgumentException("spread[" + i + "] must be finite and > 0, got: " + spread[i]);
            }
        }
        this.center = center.clone();
        this.spread = spread.clone();
    }

    @JsonProperty("center")
    public double[] getCenter() {
        return center.clone();
    }

    @JsonProperty("spread")
    public double[] getSpread() {
        return spread.clone();
    }

    public int featureCount() {
        return center.length;
    }

    /**
     * @return a new, normalized copy of {@code row}
     */
    public double[] apply(double[] row) {
        if (row.length != center.length) {
            throw new IllegalArgumentException("Expected " + center.length + " features, got " + row.length);
        }
        double[] out = new double[row.length];
        for (int i = 0; i < row.length; i++) {
            out[i] = (row[i] - center[i]) / spread[i];
        }
        return out;
    }

    public Run apply(Run run) {
        double[][] normalized = new double[run.length()][];
        for (int t = 0; t < run.length(); t++) {
            normalized[t] = apply(run.featureRow(t));
        }
        return run.withFeatures(normalized);
    }

    public RunStore apply(RunStore store) {
        return store.map(this::apply);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ChannelScale that))
            return false;
        return Arrays.equals(center, that.center) && Arrays.equals(spread, that.spread);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(center) + Arrays.hashCode(spread);
    }

    @Override
    public String toString() {
        return "ChannelScale{features=" + center.length + '}';
    }
}
