package com.processsentinel.core;

import com.processsentinel.core.data.RunStore;
import com.processsentinel.core.model.AnomalyCode;
import com.processsentinel.core.model.Run;
import com.processsentinel.core.model.Window;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Deterministic synthetic process runs for tests.
 *
 * <p>
 * Normal timesteps follow a per-feature sine with small noise. Inside the
 * anomaly interval FREEZE pins every feature at -3, STEP adds +3 and RAMP
 * adds a slope of 0.3 per timestep.
 * </p>
 */
public final class SyntheticRuns {

    private SyntheticRuns() {
    }

    public static Run normalRun(String runId, int length, int featureCount, long seed) {
        return run(runId, length, featureCount, AnomalyCode.NORMAL, 0, 0, seed);
    }

    /**
     * @param code          anomaly type stamped on {@code [from, to)}
     * @param from          first anomalous timestep
     * @param to            end of the anomaly, exclusive
     */
    public static Run run(String runId, int length, int featureCount, AnomalyCode code,
            int from, int to, long seed) {
        Random random = new Random(seed);
        double[] timestamps = new double[length];
        double[][] features = new double[length][featureCount];
        AnomalyCode[] codes = new AnomalyCode[length];
        for (int t = 0; t < length; t++) {
            timestamps[t] = t;
            boolean anomalous = code.isAnomalous() && t >= from && t < to;
            codes[t] = anomalous ? code : AnomalyCode.NORMAL;
            for (int f = 0; f < featureCount; f++) {
                double base = Math.sin(t / 5.0 + f) + 0.1 * random.nextGaussian();
                if (anomalous) {
                    base = switch (code) {
                        case FREEZE -> -3.0;
                        case STEP -> base + 3.0;
                        case RAMP -> base + 0.3 * (t - from);
                        default -> base;
                    };
                }
                features[t][f] = base;
            }
        }
        return new Run(runId, timestamps, features, codes);
    }

    /**
     * Build a store of {@code count} runs: every fifth run is normal, the rest
     * cycle through FREEZE, STEP and RAMP in their middle third.
     */
    public static RunStore mixedStore(int count, int length, int featureCount, long seed) {
        List<Run> runs = new ArrayList<>();
        List<AnomalyCode> types = AnomalyCode.anomalyTypes();
        for (int i = 0; i < count; i++) {
            String id = String.format("run-%02d", i);
            if (i % 5 == 4) {
                runs.add(normalRun(id, length, featureCount, seed + i));
            } else {
                runs.add(run(id, length, featureCount, types.get(i % types.size()),
                        length / 3, 2 * length / 3, seed + i));
            }
        }
        return RunStore.of(runs);
    }

    /**
     * Window whose every value is {@code value}, labelled by {@code type}.
     */
    public static Window constantWindow(String runId, int length, int featureCount, double value,
            AnomalyCode type) {
        double[][] features = new double[length][featureCount];
        for (double[] row : features) {
            Arrays.fill(row, value);
        }
        return new Window(runId, 0, features, type.isAnomalous() ? 1 : 0, type, type);
    }

    /**
     * Linearly separable windows: anomalies of each type sit at a distinct
     * constant level with noise, normal windows around -2.
     */
    public static List<Window> separableWindows(int perClass, int length, int featureCount, long seed) {
        Random random = new Random(seed);
        List<Window> windows = new ArrayList<>();
        double[] levels = { -2.0, 1.0, 2.5, 4.0 };
        for (AnomalyCode code : AnomalyCode.values()) {
            for (int i = 0; i < perClass; i++) {
                double[][] features = new double[length][featureCount];
                for (double[] row : features) {
                    for (int f = 0; f < featureCount; f++) {
                        row[f] = levels[code.getCode()] + 0.1 * random.nextGaussian();
                    }
                }
                windows.add(new Window(code.getLabel() + "-" + i, 0, features,
                        code.isAnomalous() ? 1 : 0, code, code));
            }
        }
        return windows;
    }
}
