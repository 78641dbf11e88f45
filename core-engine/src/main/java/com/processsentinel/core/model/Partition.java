package com.processsentinel.core.model;

import com.processsentinel.core.error.DataIntegrityException;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Assignment of whole runs to a train and a test set.
 *
 * <p>
 * Invariant: every run id belongs to exactly one of the two sets. Splitting
 * is done per run, never per timestep or per window, because overlapping
 * windows of one run are strongly correlated.
 * </p>
 *
 * @since 1.0.0
 */
public final class Partition {

    private final SortedSet<String> train;
    private final SortedSet<String> test;

    private Partition(Set<String> train, Set<String> test) {
        this.train = Collections.unmodifiableSortedSet(new TreeSet<>(train));
        this.test = Collections.unmodifiableSortedSet(new TreeSet<>(test));
    }

    /**
     * Create a partition and verify it covers {@code allRunIds} exactly.
     *
     * @param allRunIds every run id in the store
     * @param train     run ids assigned to training
     * @param test      run ids held out for testing
     * @return the validated partition
     * @throws DataIntegrityException if a run id is in both sets, in neither,
     *                                or unknown to the store
     */
    public static Partition of(Collection<String> allRunIds, Collection<String> train,
            Collection<String> test) {
        Objects.requireNonNull(allRunIds, "Run ids must not be null");
        Objects.requireNonNull(train, "Train run ids must not be null");
        Objects.requireNonNull(test, "Test run ids must not be null");

        Set<String> overlap = new TreeSet<>(train);
        overlap.retainAll(test);
        if (!overlap.isEmpty()) {
            throw new DataIntegrityException("Run id(s) assigned to both train and test: " + overlap);
        }

        Set<String> assigned = new HashSet<>(train);
        assigned.addAll(test);
        Set<String> unassigned = new TreeSet<>(allRunIds);
        unassigned.removeAll(assigned);
        if (!unassigned.isEmpty()) {
            throw new DataIntegrityException("Run id(s) present in no partition: " + unassigned);
        }
        Set<String> unknown = new TreeSet<>(assigned);
        unknown.removeAll(new HashSet<>(allRunIds));
        if (!unknown.isEmpty()) {
            throw new DataIntegrityException("Partition references unknown run id(s): " + unknown);
        }
        return new Partition(new HashSet<>(train), new HashSet<>(test));
    }

    public SortedSet<String> getTrain() {
        return train;
    }

    public SortedSet<String> getTest() {
        return test;
    }

    public boolean isTrain(String runId) {
        return train.contains(runId);
    }

    @Override
    public String toString() {
        return "Partition{train=" + train.size() + " runs, test=" + test.size() + " runs}";
    }
}
