package com.processsentinel.core.preprocessing;

import com.processsentinel.core.data.RunStore;
import com.processsentinel.core.model.AnomalyCode;
import com.processsentinel.core.model.Run;
import com.processsentinel.core.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Slides a fixed-length window over each run with a fixed stride.
 *
 * <p>
 * Windows start at offsets {@code 0, S, 2S, ...} and never cross a run
 * boundary, so a run of length {@code T} yields
 * {@code max(0, floor((T - L) / S) + 1)} windows. Extraction is a pure
 * function of the run, {@code L} and {@code S}.
 * </p>
 *
 * <h3>Labels</h3>
 * <ul>
 * <li>binary: OR over members, any non-normal code gives 1</li>
 * <li>multiclass: majority code, ties resolved to the lowest code value</li>
 * <li>anomaly type: multiclass label if anomalous, else the majority among
 * the anomalous members (same tie rule), else NORMAL</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class WindowExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(WindowExtractor.class);

    private final int length;
    private final int stride;

    /**
     * @param length window length {@code L}
     * @param stride step {@code S} between window starts
     * @throws IllegalArgumentException if either is not positive
     */
    public WindowExtractor(int length, int stride) {
        if (length <= 0) {
            throw new IllegalArgumentException("Window length must be > 0, got: " + length);
        }
        if (stride <= 0) {
            throw new IllegalArgumentException("Window stride must be > 0, got: " + stride);
        }
        this.length = length;
        this.stride = stride;
    }

    public int getLength() {
        return length;
    }

    public int getStride() {
        return stride;
    }

    /**
     * @return {@code max(0, floor((runLength - L) / S) + 1)}
     */
    public int windowCount(int runLength) {
        return runLength < length ? 0 : (runLength - length) / stride + 1;
    }

    /**
     * Verify that every run is long enough to yield at least one window.
     *
     * @throws IllegalArgumentException if the window is longer than the
     *                                  shortest run
     */
    public void requireFits(RunStore store) {
        int shortest = store.shortestRunLength();
        if (!store.isEmpty() && length > shortest) {
            throw new IllegalArgumentException("Window length " + length
                    + " exceeds the shortest run (" + shortest + " timesteps)");
        }
    }

    public List<Window> extract(Run run) {
        Objects.requireNonNull(run, "Run must not be null");
        int count = windowCount(run.length());
        if (count == 0) {
            LOG.debug("Run '{}' ({} timesteps) is shorter than the window length {}",
                    run.getRunId(), run.length(), length);
            return Collections.emptyList();
        }
        List<Window> windows = new ArrayList<>(count);
        for (int w = 0; w < count; w++) {
            int start = w * stride;
            AnomalyCode[] codes = run.codes(start, length);
            AnomalyCode majority = majorityLabel(codes);
            windows.add(new Window(
                    run.getRunId(),
                    start,
                    run.slice(start, length),
                    binaryLabel(codes),
                    majority,
                    anomalyTypeLabel(codes, majority)));
        }
        return windows;
    }

    /**
     * Extract windows from the given runs of {@code store}, in run id order.
     */
    public List<Window> extract(RunStore store, Collection<String> runIds) {
        List<Window> windows = new ArrayList<>();
        for (Run run : store.subset(runIds).runs()) {
            windows.addAll(extract(run));
        }
        return windows;
    }

    // ---------------------------------------------------------------
    // Label aggregation
    // ---------------------------------------------------------------

    /**
     * @return 1 if any code is anomalous, else 0
     */
    public static int binaryLabel(AnomalyCode[] codes) {
        for (AnomalyCode code : codes) {
            if (code.isAnomalous()) {
                return 1;
            }
        }
        return 0;
    }

    /**
     * @return the most frequent code; on a tie the lowest code value wins
     */
    public static AnomalyCode majorityLabel(AnomalyCode[] codes) {
        int[] counts = new int[AnomalyCode.values().length];
        for (AnomalyCode code : codes) {
            counts[code.getCode()]++;
        }
        return argmaxLowest(counts, 0);
    }

    static AnomalyCode anomalyTypeLabel(AnomalyCode[] codes, AnomalyCode majority) {
        if (majority.isAnomalous()) {
            return majority;
        }
        int[] counts = new int[AnomalyCode.values().length];
        for (AnomalyCode code : codes) {
            counts[code.getCode()]++;
        }
        counts[AnomalyCode.NORMAL.getCode()] = 0;
        return argmaxLowest(counts, 1);
    }

    private static AnomalyCode argmaxLowest(int[] counts, int minCount) {
        int best = 0;
        int bestCount = minCount - 1;
        for (int code = 0; code < counts.length; code++) {
            // strict '>' keeps the lowest code on ties
            if (counts[code] > bestCount && counts[code] >= minCount) {
                best = code;
                bestCount = counts[code];
            }
        }
        return AnomalyCode.fromCode(best);
    }
}
