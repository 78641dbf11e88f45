package com.processsentinel.core.data;

import com.processsentinel.core.error.DataIntegrityException;
import com.processsentinel.core.model.AnomalyCode;
import com.processsentinel.core.model.Run;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

/**
 * Immutable collection of runs keyed by run id, iterated in run id order.
 *
 * <p>
 * Built with a {@link Builder} that appends timesteps one at a time, so a
 * tabular source can be streamed row by row. The builder rejects a timestep
 * whose timestamp does not strictly increase within its run.
 * </p>
 *
 * @since 1.0.0
 */
public final class RunStore {

    private final SortedMap<String, Run> runs;
    private final int featureCount;

    private RunStore(SortedMap<String, Run> runs, int featureCount) {
        this.runs = Collections.unmodifiableSortedMap(runs);
        this.featureCount = featureCount;
    }

    /**
     * Create a store from already built runs.
     *
     * @throws DataIntegrityException if two runs share an id or differ in
     *                                feature count
     */
    public static RunStore of(Collection<Run> runs) {
        Objects.requireNonNull(runs, "Runs must not be null");
        SortedMap<String, Run> byId = new TreeMap<>();
        int width = -1;
        for (Run run : runs) {
            if (byId.put(run.getRunId(), run) != null) {
                throw new DataIntegrityException("Duplicate run id: '" + run.getRunId() + "'");
            }
            if (run.length() > 0) {
                if (width >= 0 && run.featureCount() != width) {
                    throw new DataIntegrityException("Run '" + run.getRunId() + "' has "
                            + run.featureCount() + " features, expected " + width);
                }
                width = run.featureCount();
            }
        }
        return new RunStore(byId, Math.max(width, 0));
    }

    public static Builder builder(int featureCount) {
        return new Builder(featureCount);
    }

    public SortedSet<String> runIds() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(runs.keySet()));
    }

    public Collection<Run> runs() {
        return runs.values();
    }

    public int size() {
        return runs.size();
    }

    public boolean isEmpty() {
        return runs.isEmpty();
    }

    public int featureCount() {
        return featureCount;
    }

    /**
     * @throws NoSuchElementException if the run id is unknown
     */
    public Run get(String runId) {
        Run run = runs.get(runId);
        if (run == null) {
            throw new NoSuchElementException("Unknown run id: '" + runId + "'");
        }
        return run;
    }

    /**
     * @return length of the shortest run, or 0 for an empty store
     */
    public int shortestRunLength() {
        return runs.values().stream().mapToInt(Run::length).min().orElse(0);
    }

    public long timestepCount() {
        return runs.values().stream().mapToLong(Run::length).sum();
    }

    /**
     * @return a store holding only the given runs
     * @throws NoSuchElementException if a run id is unknown
     */
    public RunStore subset(Collection<String> runIds) {
        SortedMap<String, Run> selected = new TreeMap<>();
        for (String id : runIds) {
            selected.put(id, get(id));
        }
        return new RunStore(selected, featureCount);
    }

    /**
     * Apply {@code transform} to every run, for example normalization.
     */
    public RunStore map(UnaryOperator<Run> transform) {
        SortedMap<String, Run> mapped = new TreeMap<>();
        runs.forEach((id, run) -> mapped.put(id, transform.apply(run)));
        return new RunStore(mapped, featureCount);
    }

    @Override
    public String toString() {
        return "RunStore{runs=" + runs.size() + ", timesteps=" + timestepCount()
                + ", features=" + featureCount + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Accumulates timesteps per run in arrival order.
     */
    public static final class Builder {

        private final int featureCount;
        private final Map<String, RunAccumulator> accumulators = new LinkedHashMap<>();

        private Builder(int featureCount) {
            if (featureCount <= 0) {
                throw new IllegalArgumentException("featureCount must be > 0, got: " + featureCount);
            }
            this.featureCount = featureCount;
        }

        /**
         * Append one timestep to its run.
         *
         * @throws DataIntegrityException if the feature vector has the wrong
         *                                width or the timestamp does not
         *                                increase
         */
        public Builder append(String runId, double timestamp, double[] features, AnomalyCode code) {
            Objects.requireNonNull(runId, "Run id must not be null");
            Objects.requireNonNull(features, "Features must not be null");
            Objects.requireNonNull(code, "Anomaly code must not be null");
            if (features.length != featureCount) {
                throw new DataIntegrityException("Run '" + runId + "': expected " + featureCount
                        + " features, got " + features.length);
            }
            accumulators.computeIfAbsent(runId, RunAccumulator::new).add(timestamp, features, code);
            return this;
        }

        public RunStore build() {
            List<Run> built = new ArrayList<>(accumulators.size());
            for (RunAccumulator acc : accumulators.values()) {
                built.add(acc.toRun());
            }
            SortedMap<String, Run> byId = new TreeMap<>();
            built.forEach(r -> byId.put(r.getRunId(), r));
            return new RunStore(byId, featureCount);
        }
    }

    private static final class RunAccumulator {
        private final String runId;
        private final List<Double> timestamps = new ArrayList<>();
        private final List<double[]> rows = new ArrayList<>();
        private final List<AnomalyCode> codes = new ArrayList<>();

        RunAccumulator(String runId) {
            this.runId = runId;
        }

        void add(double timestamp, double[] features, AnomalyCode code) {
            if (!timestamps.isEmpty()) {
                double previous = timestamps.get(timestamps.size() - 1);
                if (!(timestamp > previous)) {
                    throw new DataIntegrityException("Run '" + runId + "': timestamp " + timestamp
                            + " at timestep " + timestamps.size()
                            + " does not increase (previous " + previous + ")");
                }
            }
            timestamps.add(timestamp);
            rows.add(features.clone());
            codes.add(code);
        }

        Run toRun() {
            double[] ts = new double[timestamps.size()];
            for (int i = 0; i < ts.length; i++) {
                ts[i] = timestamps.get(i);
            }
            return new Run(runId, ts, rows.toArray(new double[0][]), codes.toArray(new AnomalyCode[0]));
        }
    }
}
