package com.cityflow.traffic.engine;

import com.cityflow.traffic.api.DirectedEdge;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Batch-lifetime memo of directed edge -> traffic.
 *
 * Every directed edge is resolved at most once per batch, so entries are never
 * invalidated while a batch runs. Cross-root reuse of these entries is what
 * keeps the total work linear in the number of edges. The cache is only
 * cleared when a new graph is loaded.
 *
 * Not thread-safe.
 */
public final class DirectedEdgeCache {
    private static final Logger log = LogManager.getLogger(DirectedEdgeCache.class);

    private final Map<DirectedEdge, Long> entries;

    private long hits, misses, overwrites;

    public DirectedEdgeCache() {
        this(16);
    }

    public DirectedEdgeCache(int expectedCities) {
        // Each tree edge has two orientations, plus one rooted entry per city.
        this.entries = new HashMap<>(Math.max(16, (int) Math.min(1 << 20, expectedCities * 4L)));
    }

    /** Returns the cached traffic, or empty on a miss. */
    public OptionalLong get(DirectedEdge edge) {
        Long value = entries.get(edge);
        if (value == null) {
            misses++;
            return OptionalLong.empty();
        }
        hits++;
        return OptionalLong.of(value);
    }

    /** Like {@link #get}, without touching the hit and miss counters. */
    public OptionalLong peek(DirectedEdge edge) {
        Long value = entries.get(edge);
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }

    /**
     * Stores the traffic of {@code edge}. An existing entry is overwritten and
     * reported, since a correct traversal never resolves an edge twice.
     */
    public void put(DirectedEdge edge, long traffic) {
        Long previous = entries.put(edge, traffic);
        if (previous != null) {
            overwrites++;
            log.warn("Directed edge {} resolved twice: {} -> {}", edge,
                    Long.toUnsignedString(previous), Long.toUnsignedString(traffic));
        }
    }

    public boolean contains(DirectedEdge edge) {
        return entries.containsKey(edge);
    }

    public int size() {
        return entries.size();
    }

    public long hits() {
        return hits;
    }

    public long misses() {
        return misses;
    }

    public long overwrites() {
        return overwrites;
    }

    /** Drops all entries and counters. */
    public void clear() {
        entries.clear();
        hits = 0;
        misses = 0;
        overwrites = 0;
    }
}
