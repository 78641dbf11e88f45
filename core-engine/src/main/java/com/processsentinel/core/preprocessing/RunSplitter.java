package com.processsentinel.core.preprocessing;

import com.processsentinel.core.data.RunStore;
import com.processsentinel.core.model.AnomalyCode;
import com.processsentinel.core.model.Partition;
import com.processsentinel.core.model.Run;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Partitions whole runs into train and test sets.
 *
 * <p>
 * Run ids are sorted, shuffled with a seeded {@link Random} and the first
 * {@code round(testFraction * n)} become the test set. The result depends
 * only on the id set, the fraction and the seed.
 * </p>
 *
 * <h3>Stratified mode</h3>
 * <p>
 * Runs are grouped by the anomaly code of their first timestep (each input
 * file is stamped with one code) and every group contributes its own rounded
 * share to the test set.
 * </p>
 *
 * @since 1.0.0
 */
public final class RunSplitter {

    private static final Logger LOG = LoggerFactory.getLogger(RunSplitter.class);

    private final double testFraction;
    private final long seed;
    private final boolean stratified;

    /**
     * @param testFraction fraction of runs held out, in {@code (0, 1)}
     * @param seed         shuffle seed
     * @param stratified   whether to stratify by each run's first anomaly code
     * @throws IllegalArgumentException if {@code testFraction} is out of range
     */
    public RunSplitter(double testFraction, long seed, boolean stratified) {
        if (!(testFraction > 0.0 && testFraction < 1.0)) {
            throw new IllegalArgumentException("testFraction must be in (0, 1), got: " + testFraction);
        }
        this.testFraction = testFraction;
        this.seed = seed;
        this.stratified = stratified;
    }

    public RunSplitter(double testFraction, long seed) {
        this(testFraction, seed, false);
    }

    /**
     * Split a plain set of run ids (stratification is not available here).
     *
     * @throws IllegalArgumentException if the split would leave either side
     *                                  empty
     */
    public Partition split(Collection<String> runIds) {
        Objects.requireNonNull(runIds, "Run ids must not be null");
        List<String> test = pickTest(new ArrayList<>(new TreeSet<>(runIds)), new Random(seed));
        return finish(runIds, test);
    }

    /**
     * Split the runs of a store, stratifying when configured.
     *
     * @throws IllegalArgumentException if the split would leave either side
     *                                  empty
     */
    public Partition split(RunStore store) {
        Objects.requireNonNull(store, "Run store must not be null");
        if (!stratified) {
            return split(store.runIds());
        }

        Map<AnomalyCode, List<String>> strata = new TreeMap<>();
        for (Run run : store.runs()) {
            AnomalyCode key = run.length() > 0 ? run.code(0) : AnomalyCode.NORMAL;
            strata.computeIfAbsent(key, k -> new ArrayList<>()).add(run.getRunId());
        }

        Random random = new Random(seed);
        List<String> test = new ArrayList<>();
        for (Map.Entry<AnomalyCode, List<String>> stratum : strata.entrySet()) {
            List<String> ids = stratum.getValue();
            Collections.sort(ids);
            Collections.shuffle(ids, random);
            int count = (int) Math.round(testFraction * ids.size());
            test.addAll(ids.subList(0, count));
            LOG.debug("Stratum {}: {} of {} run(s) held out", stratum.getKey(), count, ids.size());
        }
        return finish(store.runIds(), test);
    }

    private List<String> pickTest(List<String> sortedIds, Random random) {
        Collections.shuffle(sortedIds, random);
        int count = (int) Math.round(testFraction * sortedIds.size());
        return new ArrayList<>(sortedIds.subList(0, Math.min(count, sortedIds.size())));
    }

    private Partition finish(Collection<String> allIds, List<String> test) {
        int total = new TreeSet<>(allIds).size();
        if (test.isEmpty() || test.size() >= total) {
            throw new IllegalArgumentException(String.format(
                    "Degenerate split: %d of %d run(s) would be held out with testFraction=%.3f; "
                            + "both partitions must be non-empty", test.size(), total, testFraction));
        }
        TreeSet<String> train = new TreeSet<>(allIds);
        test.forEach(train::remove);
        Partition partition = Partition.of(allIds, train, test);
        LOG.info("Split {} run(s): {} train, {} test (seed={}, stratified={})",
                total, train.size(), test.size(), seed, stratified);
        return partition;
    }
}
