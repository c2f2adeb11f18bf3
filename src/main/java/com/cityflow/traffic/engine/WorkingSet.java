package com.cityflow.traffic.engine;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-root scratch map of city -> traffic.
 *
 * It plays two roles during one root evaluation: memo of "traffic of this
 * city as entered from the current root's direction", and re-entrancy guard
 * (a present key means the city is being visited or already resolved in this
 * pass). It must be cleared between roots; only the {@link DirectedEdgeCache}
 * survives across roots.
 */
public final class WorkingSet {
    private final Map<Long, Long> traffic;

    public WorkingSet() {
        this(16);
    }

    public WorkingSet(int expectedCities) {
        this.traffic = new HashMap<>(Math.max(16, (int) Math.min(1 << 20, expectedCities * 2L)));
    }

    /**
     * Inserts a 0 placeholder for {@code city} if it is absent.
     *
     * @return true if the placeholder was inserted, false if the city was
     *         already present.
     */
    public boolean claim(long city) {
        return traffic.putIfAbsent(city, 0L) == null;
    }

    public boolean contains(long city) {
        return traffic.containsKey(city);
    }

    /** Stored traffic, 0 when absent. */
    public long get(long city) {
        Long value = traffic.get(city);
        return value == null ? 0L : value;
    }

    public void put(long city, long value) {
        traffic.put(city, value);
    }

    public int size() {
        return traffic.size();
    }

    public void clear() {
        traffic.clear();
    }
}
