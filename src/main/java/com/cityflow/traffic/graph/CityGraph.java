package com.cityflow.traffic.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adjacency model of a city map.
 *
 * Each city owns an ordered list of neighbour ids. Roads are stored exactly as
 * they are added: {@code addRoad(a, b)} appends {@code b} to the list of
 * {@code a} and nothing else. Producing a symmetric relation for a tree is the
 * caller's job; the traversal engine never checks it.
 *
 * City ids are unsigned 64-bit values carried in a {@code long}.
 *
 * Once traffic has been computed the graph is sealed: cached aggregates
 * describe the current roads, so further additions are rejected until
 * {@link #clear()}.
 *
 * Cities are iterated in insertion order. Not thread-safe.
 */
public final class CityGraph {
    private final Map<Long, List<Long>> roads;
    private final boolean reserveZeroId;
    private boolean sealed;

    public CityGraph() {
        this(16, false);
    }

    /**
     * @param expectedCities capacity hint.
     * @param reserveZeroId  when true, id 0 is rejected with
     *                       {@link SentinelCollisionException}.
     */
    public CityGraph(int expectedCities, boolean reserveZeroId) {
        this.roads = new LinkedHashMap<>(Math.max(16, (int) Math.min(1 << 20, expectedCities * 2L)));
        this.reserveZeroId = reserveZeroId;
    }

    /** Ensures {@code city} is present. Idempotent. */
    public CityGraph addCity(long city) {
        checkNotSealed();
        checkReserved(city, "addCity");
        roads.computeIfAbsent(city, k -> new ArrayList<>());
        return this;
    }

    /**
     * Appends {@code neighbour} to the neighbour list of {@code city}, adding
     * {@code city} first if needed. The neighbour itself is not registered.
     */
    public CityGraph addRoad(long city, long neighbour) {
        checkNotSealed();
        checkReserved(city, "addRoad source");
        checkReserved(neighbour, "addRoad target");
        roads.computeIfAbsent(city, k -> new ArrayList<>()).add(neighbour);
        return this;
    }

    /**
     * Returns the neighbours of {@code city} in insertion order.
     *
     * @throws CityNotFoundException if the city was never added.
     */
    public List<Long> neighboursOf(long city) {
        List<Long> neighbours = roads.get(city);
        if (neighbours == null)
            throw new CityNotFoundException(city);
        return Collections.unmodifiableList(neighbours);
    }

    public boolean contains(long city) {
        return roads.containsKey(city);
    }

    /** Live read-only view of all cities in insertion order. */
    public Set<Long> cities() {
        return Collections.unmodifiableSet(roads.keySet());
    }

    public int cityCount() {
        return roads.size();
    }

    public boolean isReserveZeroId() {
        return reserveZeroId;
    }

    /** Rejects further additions. Called when traffic is first computed. */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    /** Drops all cities and roads and unseals the graph. */
    public void clear() {
        roads.clear();
        sealed = false;
    }

    private void checkNotSealed() {
        if (sealed)
            throw new IllegalStateException("City graph already computed. Call resetAll() before changing roads");
    }

    private void checkReserved(long city, String context) {
        if (reserveZeroId && city == 0L)
            throw new SentinelCollisionException(context);
    }
}
