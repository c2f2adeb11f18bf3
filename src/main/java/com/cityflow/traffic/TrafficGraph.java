package com.cityflow.traffic;

import com.cityflow.traffic.api.CityTraffic;
import com.cityflow.traffic.api.TrafficListener;
import com.cityflow.traffic.engine.DirectedEdgeCache;
import com.cityflow.traffic.engine.RerootingEngine;
import com.cityflow.traffic.engine.TrafficBatch;
import com.cityflow.traffic.graph.CityGraph;
import com.cityflow.traffic.util.CompositeTrafficListener;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A high-level wrapper that owns one city graph together with its traversal
 * state.
 * <p>
 * This class handles:
 * <ul>
 * <li>Building the {@link CityGraph} through {@link #addCity(long)} and
 * {@link #addRoad(long, long)}</li>
 * <li>Holding the batch-lifetime {@link DirectedEdgeCache}</li>
 * <li>Driving the {@link TrafficBatch} over every city</li>
 * <li>Resetting everything between unrelated graphs via {@link #resetAll()}</li>
 * </ul>
 * All state is owned by the instance, so independent graphs can be evaluated
 * side by side. A single instance is not thread-safe.
 */
public class TrafficGraph {
    private static final Logger log = LogManager.getLogger(TrafficGraph.class);

    private final TrafficConfig config;
    private final CityGraph graph;
    private final DirectedEdgeCache cache;
    private final TrafficBatch batch;
    private final CompositeTrafficListener compositeListener = new CompositeTrafficListener();

    public TrafficGraph() {
        this(TrafficConfig.defaults());
    }

    public TrafficGraph(TrafficConfig config) {
        this.config = config;
        this.graph = new CityGraph(config.getExpectedCities(), config.isReserveZeroId());
        this.cache = new DirectedEdgeCache(config.getExpectedCities());
        RerootingEngine engine = new RerootingEngine(graph, cache, config.isTraceResolution());
        this.batch = new TrafficBatch(engine, config.getExpectedCities());
        this.batch.setListener(compositeListener);
        log.debug("Created traffic graph with {}", config);
    }

    /**
     * Registers a listener. Listeners are added to a composite, earlier
     * registrations stay active.
     */
    public void addListener(TrafficListener listener) {
        compositeListener.addForComposite(listener);
    }

    public TrafficGraph addCity(long city) {
        graph.addCity(city);
        return this;
    }

    /** Directional: appends {@code neighbour} to {@code city}'s list only. */
    public TrafficGraph addRoad(long city, long neighbour) {
        graph.addRoad(city, neighbour);
        return this;
    }

    /** Runs one batch over all cities. */
    public List<CityTraffic> computeAll() {
        return batch.run();
    }

    /** Maximum traffic of a single root, sharing the batch cache. */
    public long computeMaxTraffic(long city) {
        return batch.computeMaxTraffic(city);
    }

    /**
     * Clears the graph, the directed-edge cache and any leftover per-root
     * state, and restores health. Required between unrelated graphs.
     */
    public void resetAll() {
        graph.clear();
        cache.clear();
        batch.clearWorkingState();
        batch.resetHealth();
    }

    public boolean isHealthy() {
        return batch.isHealthy();
    }

    public void resetHealth() {
        batch.resetHealth();
    }

    public CityGraph getGraph() {
        return graph;
    }

    public DirectedEdgeCache getCache() {
        return cache;
    }

    public TrafficConfig getConfig() {
        return config;
    }
}
