package com.cityflow.traffic.util;

import com.cityflow.traffic.api.DirectedEdge;
import com.cityflow.traffic.api.TrafficListener;

import java.util.HashMap;
import java.util.Map;

/**
 * A listener that tracks work and latency of batch evaluation.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Work:</b> resolved directed edges, cache hits, and how many times
 * each individual edge was materialized.</li>
 * <li><b>Latency:</b> min, max and average time per root (nanoseconds).</li>
 * <li><b>Throughput:</b> total batches and roots.</li>
 * </ul>
 *
 * <p>
 * The per-edge counters allocate a map entry per edge, so keep this listener
 * out of very large production batches.
 */
public final class BatchStatsListener implements TrafficListener {
    private static final org.apache.logging.log4j.Logger log = org.apache.logging.log4j.LogManager
            .getLogger(BatchStatsListener.class);

    private final Map<DirectedEdge, Integer> resolutionsPerEdge = new HashMap<>();
    private long totalBatches, totalRoots, failedRoots;
    private long resolvedEdges, cacheHits;
    private long totalRootNanos;
    private long minRootNanos = Long.MAX_VALUE, maxRootNanos = Long.MIN_VALUE;
    private int lastRootsComputed;

    @Override
    public void onBatchStart(long batchId, int cityCount) {
        // No-op
    }

    @Override
    public void onEdgeResolved(DirectedEdge edge, long traffic) {
        resolvedEdges++;
        resolutionsPerEdge.merge(edge, 1, Integer::sum);
    }

    @Override
    public void onCacheHit(DirectedEdge edge, long traffic) {
        cacheHits++;
    }

    @Override
    public void onRootComputed(long batchId, long city, long maxTraffic, long durationNanos) {
        totalRoots++;
        totalRootNanos += durationNanos;
        if (durationNanos < minRootNanos)
            minRootNanos = durationNanos;
        if (durationNanos > maxRootNanos)
            maxRootNanos = durationNanos;
    }

    @Override
    public void onRootError(long batchId, long city, Throwable error) {
        failedRoots++;
        log.error(String.format("Batch %d failed at city '%s': %s", batchId, Long.toUnsignedString(city),
                error.getMessage()), error);
    }

    @Override
    public void onBatchEnd(long batchId, int rootsComputed) {
        totalBatches++;
        lastRootsComputed = rootsComputed;
    }

    /** How many times {@code edge} was computed (not served from cache). */
    public int resolutions(DirectedEdge edge) {
        return resolutionsPerEdge.getOrDefault(edge, 0);
    }

    /** Largest per-edge resolution count seen; 1 when nothing was recomputed. */
    public int maxResolutionsPerEdge() {
        int max = 0;
        for (int n : resolutionsPerEdge.values())
            max = Math.max(max, n);
        return max;
    }

    public int distinctResolvedEdges() {
        return resolutionsPerEdge.size();
    }

    public long resolvedEdges() {
        return resolvedEdges;
    }

    public long cacheHits() {
        return cacheHits;
    }

    public long totalBatches() {
        return totalBatches;
    }

    public long totalRoots() {
        return totalRoots;
    }

    public long failedRoots() {
        return failedRoots;
    }

    public int lastRootsComputed() {
        return lastRootsComputed;
    }

    public double avgRootMicros() {
        return totalRoots > 0 ? (double) totalRootNanos / totalRoots / 1000.0 : 0;
    }

    public long minRootNanos() {
        return minRootNanos == Long.MAX_VALUE ? 0 : minRootNanos;
    }

    public long maxRootNanos() {
        return maxRootNanos == Long.MIN_VALUE ? 0 : maxRootNanos;
    }

    public void reset() {
        resolutionsPerEdge.clear();
        totalBatches = 0;
        totalRoots = 0;
        failedRoots = 0;
        resolvedEdges = 0;
        cacheHits = 0;
        totalRootNanos = 0;
        minRootNanos = Long.MAX_VALUE;
        maxRootNanos = Long.MIN_VALUE;
        lastRootsComputed = 0;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-16s | %10s | %10s | %10s | %10s | %10s\n", "Metric", "Roots", "Edges",
                "Hits", "Avg (us)", "Max (us)"));
        sb.append("------------------------------------------------------------------------------\n");
        sb.append(String.format("%-16s | %10d | %10d | %10d | %10.2f | %10.2f\n",
                "Batches " + totalBatches,
                totalRoots,
                resolvedEdges,
                cacheHits,
                avgRootMicros(),
                maxRootNanos() / 1000.0));
        return sb.toString();
    }
}
