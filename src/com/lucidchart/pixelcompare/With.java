package com.lucidchart.pixelcompare;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;

/** A flexible way of specifying arguments in chain for a pixel comparison
 * This enables semantic comparison calls and flexible updates of arguments without needing to maintain so many constructor alternatives.
 */
public class With {
    private Set<Region> maskHolder = new HashSet<>();
    private double maxColorDistanceHolder = MatchLevel.STRICT.maxColorDistance;
    private double maxMismatchRatioHolder = MatchLevel.STRICT.maxMismatchRatio;

    /** The number of chunks traversed concurrently. Defaults to the number of available processors. */
    private int workersHolder = ParallelPixelProcessor.defaultWorkers();

    /** The most mismatched positions kept for the result, as a failing comparison of large images may mismatch everywhere */
    private int maxRecordedDifferencesHolder = 1000;

    /** Runs the chunks of the comparison when set, instead of a pool created for each comparison */
    private Executor executorHolder;

    private With(){}

    /** Provides a With object to enable easy chaining of context options */
    public static With context() {
        return new With();
    }

    /** Specify a region to focus on, or to exclude */
    public With mask(Region region) {
        if (region != null) maskHolder.add(region);
        return this;
    }

    /** Specify regions to focus on, or to exclude */
    public With mask(Set<Region> masks) {
        if (masks != null) maskHolder.addAll(masks);
        return this;
    }

    /** Specify the max color distance allowed between corresponding pixels. */
    public With maxColorDistance(double maxColorDistance) {
        require(maxColorDistance >= 0, "Max color distance must not be negative");
        maxColorDistanceHolder = maxColorDistance;
        return this;
    }

    /** Specify the fraction of compared pixels allowed to exceed the max color distance, between 0 and 1. (Default is 0) */
    public With maxMismatchRatio(double maxMismatchRatio) {
        require(maxMismatchRatio >= 0 && maxMismatchRatio <= 1, "Max mismatch ratio must be between 0 and 1");
        maxMismatchRatioHolder = maxMismatchRatio;
        return this;
    }

    /** Specify a custom match level */
    public With matchLevel(MatchLevel matchLevel) {
        require(matchLevel != null, "A match level must be supplied");
        this.maxColorDistanceHolder = matchLevel.maxColorDistance;
        this.maxMismatchRatioHolder = matchLevel.maxMismatchRatio;
        return this;
    }

    /** Specify the worker ceiling.  Use 1 for a single threaded, ordered traversal. */
    public With workers(int workers) {
        require(workers >= 1, "Worker count must be at least 1");
        workersHolder = workers;
        return this;
    }

    /** Specify how many mismatched positions to keep.  By default 1000 are kept. */
    public With maxRecordedDifferences(int maxRecordedDifferences) {
        require(maxRecordedDifferences >= 0, "Max recorded differences must not be negative");
        maxRecordedDifferencesHolder = maxRecordedDifferences;
        return this;
    }

    /** Specify an executor to run the chunk traversals on, so repeated comparisons share its threads.
     * The executor is never shut down by the comparison. */
    public With executor(Executor executor) {
        require(executor != null, "An executor must be supplied");
        executorHolder = executor;
        return this;
    }

    public Set<Region> getMask() {
        return maskHolder;
    }

    public double getMaxColorDistance() {
        return maxColorDistanceHolder;
    }

    public double getMaxMismatchRatio() {
        return maxMismatchRatioHolder;
    }

    public int getWorkers() {
        return workersHolder;
    }

    public int getMaxRecordedDifferences() {
        return maxRecordedDifferencesHolder;
    }

    public Optional<Executor> getExecutor() {
        return Optional.ofNullable(executorHolder);
    }

    private static void require(boolean requirement, String message) {
        if (!requirement) throw new IllegalArgumentException(message);
    }
}
