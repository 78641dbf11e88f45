package com.processsentinel.core.nn;

import com.processsentinel.core.model.AnomalyCode;
import com.processsentinel.core.model.Window;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import java.util.List;
import java.util.Objects;

/**
 * Converts windows and labels into double-precision ND4J arrays.
 *
 * @since 1.0.0
 */
public final class WindowTensors {

    private WindowTensors() {
        // utility class
    }

    /**
     * @param windows non-empty, all of equal length and width
     * @return a {@code [windows, features, timesteps]} array
     */
    public static INDArray features(List<Window> windows) {
        requireNonEmpty(windows);
        int length = windows.get(0).length();
        int width = windows.get(0).featureCount();
        double[] data = new double[windows.size() * width * length];
        int i = 0;
        for (Window window : windows) {
            if (window.length() != length || window.featureCount() != width) {
                throw new IllegalArgumentException("Window " + window + " is " + window.length() + "x"
                        + window.featureCount() + ", expected " + length + "x" + width);
            }
            for (int f = 0; f < width; f++) {
                for (int t = 0; t < length; t++) {
                    data[i++] = window.value(t, f);
                }
            }
        }
        return Nd4j.create(data, new long[] { windows.size(), width, length }, 'c');
    }

    /**
     * @return a {@code [windows, 1]} array of binary labels
     */
    public static INDArray binaryLabels(List<Window> windows) {
        requireNonEmpty(windows);
        double[] labels = new double[windows.size()];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = windows.get(i).getBinaryLabel();
        }
        return column(labels);
    }

    /**
     * @return a {@code [windows, typeCount]} one-hot array of anomaly types
     * @throws IllegalArgumentException if a window has no anomaly type
     */
    public static INDArray oneHotTypes(List<Window> windows) {
        requireNonEmpty(windows);
        int types = AnomalyCode.typeCount();
        double[] data = new double[windows.size() * types];
        for (int i = 0; i < windows.size(); i++) {
            AnomalyCode type = windows.get(i).getAnomalyTypeLabel();
            if (!type.isAnomalous()) {
                throw new IllegalArgumentException("Window " + windows.get(i) + " has no anomaly type");
            }
            data[i * types + type.typeIndex()] = 1.0;
        }
        return Nd4j.create(data, new long[] { windows.size(), types }, 'c');
    }

    /**
     * @return a {@code [values, 1]} column
     */
    public static INDArray column(double[] values) {
        return Nd4j.create(values.clone(), new long[] { values.length, 1 }, 'c');
    }

    /**
     * @return a {@code [1, values]} row
     */
    public static INDArray row(double[] values) {
        return Nd4j.create(values.clone(), new long[] { 1, values.length }, 'c');
    }

    private static void requireNonEmpty(List<Window> windows) {
        Objects.requireNonNull(windows, "Windows must not be null");
        if (windows.isEmpty()) {
            throw new IllegalArgumentException("At least one window is required");
        }
    }
}
