package com.cityflow.traffic.engine;

import com.cityflow.traffic.api.CityTraffic;
import com.cityflow.traffic.api.TrafficListener;
import com.cityflow.traffic.graph.CityGraph;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Evaluates every city of the graph as a root and collects the results.
 *
 * For each city a fresh {@link WorkingSet} pass is run through the
 * {@link RerootingEngine}; the working set is cleared right after the root's
 * maximum is read, while the {@link DirectedEdgeCache} keeps growing for the
 * whole batch. Results are returned sorted ascending by unsigned city id.
 *
 * Circuit Breaker / Fail Fast:
 * If a root fails (typically a neighbour that was never described), listeners
 * are notified, the batch is aborted and the driver is marked unhealthy.
 * Further runs are refused until {@link #resetHealth()} is called, normally
 * together with a reset of the graph and cache.
 *
 * Not thread-safe.
 */
public final class TrafficBatch {
    private static final Logger log = LogManager.getLogger(TrafficBatch.class);

    private final RerootingEngine engine;
    private final WorkingSet workingSet;
    private TrafficListener listener;

    private boolean healthy = true;
    private long batchId;
    private int lastRootCount;

    public TrafficBatch(RerootingEngine engine) {
        this(engine, 16);
    }

    public TrafficBatch(RerootingEngine engine, int expectedCities) {
        this.engine = engine;
        this.workingSet = new WorkingSet(expectedCities);
    }

    public void setListener(TrafficListener listener) {
        this.listener = listener;
        engine.setListener(listener);
    }

    /**
     * Runs one batch over all cities currently in the graph.
     *
     * @return one entry per city, ascending by unsigned city id.
     * @throws IllegalStateException         if a previous batch failed and health
     *                                       was not reset.
     * @throws TrafficComputationException if a root evaluation fails.
     */
    public List<CityTraffic> run() {
        checkHealthy();

        final CityGraph graph = engine.graph();
        final TrafficListener l = this.listener;
        final long id = ++batchId;
        final int cityCount = graph.cityCount();
        final long start = System.nanoTime();

        List<CityTraffic> results = new ArrayList<>(cityCount);
        if (l != null)
            l.onBatchStart(id, cityCount);

        long failedCity = 0L;
        Throwable failure = null;
        try {
            for (long city : graph.cities()) {
                long rootStart = System.nanoTime();
                long maxTraffic;
                try {
                    maxTraffic = engine.computeMaxTraffic(city, workingSet);
                } catch (RuntimeException e) {
                    failedCity = city;
                    failure = e;
                    if (l != null)
                        l.onRootError(id, city, e);
                    break;
                } finally {
                    workingSet.clear();
                }
                results.add(new CityTraffic(city, maxTraffic));
                if (l != null)
                    l.onRootComputed(id, city, maxTraffic, System.nanoTime() - rootStart);
                if (log.isDebugEnabled())
                    log.debug("Batch {} root {} -> {}", id, Long.toUnsignedString(city),
                            Long.toUnsignedString(maxTraffic));
            }
        } finally {
            lastRootCount = results.size();
            if (l != null)
                l.onBatchEnd(id, results.size());
        }

        if (failure != null) {
            healthy = false;
            throw new TrafficComputationException(failedCity, failure);
        }

        // List.sort is stable.
        results.sort(CityTraffic.BY_CITY);

        DirectedEdgeCache cache = engine.cache();
        log.info("Batch {} done: {} cities, {} cached edges, {} hits, {} misses in {} us", id, cityCount,
                cache.size(), cache.hits(), cache.misses(), (System.nanoTime() - start) / 1000);
        return results;
    }

    /**
     * Evaluates a single root outside of a full batch. The cache is shared
     * with batch runs.
     */
    public long computeMaxTraffic(long city) {
        checkHealthy();
        try {
            return engine.computeMaxTraffic(city, workingSet);
        } finally {
            workingSet.clear();
        }
    }

    private void checkHealthy() {
        if (!healthy) {
            throw new IllegalStateException(
                    "Traffic batch is in unhealthy state due to previous errors. Reset required.");
        }
    }

    public boolean isHealthy() {
        return healthy;
    }

    public void resetHealth() {
        this.healthy = true;
    }

    public long batchId() {
        return batchId;
    }

    public int lastRootCount() {
        return lastRootCount;
    }

    public RerootingEngine engine() {
        return engine;
    }

    /** Clears per-root state left over from an aborted root. */
    public void clearWorkingState() {
        workingSet.clear();
    }
}
