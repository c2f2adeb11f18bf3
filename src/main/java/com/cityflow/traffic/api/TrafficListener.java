package com.cityflow.traffic.api;

/**
 * Observability hook for batch evaluation.
 *
 * Implementations can be registered with a TrafficBatch to receive callbacks
 * while roots are evaluated. This is the mechanism for:
 *
 * - Profiling: timing each root and the whole batch.
 * - Debugging: tracing which directed edges are materialized and which are
 * served from the cache.
 * - Verification: counting how often each directed edge is computed.
 *
 * Callbacks run inside the traversal loop. Keep them cheap.
 */
public interface TrafficListener {

    /**
     * Called before the first root of a batch is evaluated.
     *
     * @param batchId   incrementing batch number.
     * @param cityCount number of roots that will be evaluated.
     */
    void onBatchStart(long batchId, int cityCount);

    /**
     * Called each time a directed edge is computed (cache miss) and stored.
     *
     * @param edge    the resolved edge.
     * @param traffic the aggregate that was cached for it.
     */
    void onEdgeResolved(DirectedEdge edge, long traffic);

    /**
     * Called when a directed edge is served from the cache without recursion.
     */
    void onCacheHit(DirectedEdge edge, long traffic);

    /**
     * Called after one root's maximum traffic was computed.
     *
     * @param batchId       current batch.
     * @param city          the root.
     * @param maxTraffic    the result for the root.
     * @param durationNanos wall time of the root evaluation.
     */
    void onRootComputed(long batchId, long city, long maxTraffic, long durationNanos);

    /**
     * Called when evaluating a root fails. The batch is aborted afterwards.
     */
    void onRootError(long batchId, long city, Throwable error);

    /**
     * Called when the batch finishes, successfully or not.
     *
     * @param rootsComputed number of roots evaluated successfully.
     */
    void onBatchEnd(long batchId, int rootsComputed);
}
