package com.cityflow.traffic.engine;

import com.cityflow.traffic.api.DirectedEdge;
import com.cityflow.traffic.api.TrafficListener;
import com.cityflow.traffic.graph.CityGraph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.OptionalLong;

import lombok.extern.log4j.Log4j2;

/**
 * Memoized rerooting traversal over a tree-shaped {@link CityGraph}.
 *
 * The traffic of a directed edge {@code (city, excluded)} is
 *
 * <pre>
 * sum over neighbours n of city, n != excluded, n != city: n + W[n]
 * </pre>
 *
 * where {@code W} is the per-root {@link WorkingSet}. Resolving an edge works
 * as follows:
 *
 * 1. Cache hit: if the {@link DirectedEdgeCache} knows the edge, its value is
 * written to {@code W[city]} and returned. No recursion.
 *
 * 2. Descend: neighbours are visited in adjacency order. Self-loops are
 * skipped. A neighbour absent from {@code W} gets a 0 placeholder first (the
 * re-entrancy guard) and is then resolved as {@code (n, city)}.
 *
 * 3. Aggregate: the sum above is taken over every neighbour except the
 * excluded one, reading whatever {@code W} holds at that moment, including
 * values written while resolving sibling branches.
 *
 * 4. Publish: the sum is cached for the batch and written to
 * {@code W[city]}.
 *
 * The root of an evaluation is not in {@code W} when its first child is
 * resolved, so that child re-enters the root from the other side and resolves
 * the root's remaining branches with the root as their parent. The values this
 * produces are exact on trees, and the shared {@code W} is what makes them
 * match.
 *
 * Precondition: the graph is a forest. The placeholder guard only prevents
 * endless recursion on cycles; the numbers it yields there are not meaningful.
 *
 * The recursion is unrolled onto an explicit frame stack, so tree depth is not
 * limited by the thread's call stack. Visiting order is identical to the
 * recursive formulation.
 *
 * Traffic values are unsigned 64-bit and wrap on overflow.
 *
 * Not thread-safe.
 */
@Log4j2
public final class RerootingEngine {
    private final CityGraph graph;
    private final DirectedEdgeCache cache;
    private final boolean traceResolution;
    private TrafficListener listener;

    public RerootingEngine(CityGraph graph, DirectedEdgeCache cache) {
        this(graph, cache, false);
    }

    public RerootingEngine(CityGraph graph, DirectedEdgeCache cache, boolean traceResolution) {
        this.graph = graph;
        this.cache = cache;
        this.traceResolution = traceResolution;
    }

    public void setListener(TrafficListener listener) {
        this.listener = listener;
    }

    /**
     * Resolves the traffic of {@code edge}, consulting and populating the cache
     * and the working set.
     *
     * The first call seals the graph, since cached values are only valid for
     * the roads present now.
     *
     * A non-rooted edge claims its own city first, exactly as the traversal
     * does before descending into a neighbour. A rooted edge leaves the root
     * unclaimed.
     *
     * @throws com.cityflow.traffic.graph.CityNotFoundException if the traversal
     *         reaches a city that was never added to the graph.
     */
    public long resolve(DirectedEdge edge, WorkingSet workingSet) {
        final TrafficListener l = this.listener;
        final Deque<Frame> stack = new ArrayDeque<>();
        graph.seal();
        if (edge.hasExclusion())
            workingSet.claim(edge.city());
        stack.push(new Frame(edge));
        long result = 0L;

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();

            if (frame.neighbours == null) {
                OptionalLong cached = cache.get(frame.edge);
                if (cached.isPresent()) {
                    result = cached.getAsLong();
                    workingSet.put(frame.edge.city(), result);
                    stack.pop();
                    if (l != null)
                        l.onCacheHit(frame.edge, result);
                    continue;
                }
                frame.neighbours = graph.neighboursOf(frame.edge.city());
            }

            if (descend(frame, workingSet, stack))
                continue;

            result = aggregate(frame.edge, frame.neighbours, workingSet);
            cache.put(frame.edge, result);
            workingSet.put(frame.edge.city(), result);
            stack.pop();

            if (traceResolution)
                log.trace("Resolved {} = {}", frame.edge, Long.toUnsignedString(result));
            if (l != null)
                l.onEdgeResolved(frame.edge, result);
        }
        return result;
    }

    /**
     * Computes the maximum traffic reachable from {@code root} through any one
     * of its neighbours. A root without neighbours yields 0. Ties keep the
     * first neighbour in adjacency order.
     *
     * @param workingSet an empty working set; it holds the per-neighbour
     *                   contributions afterwards.
     */
    public long computeMaxTraffic(long root, WorkingSet workingSet) {
        resolve(DirectedEdge.rooted(root), workingSet);

        long maxTraffic = 0L;
        for (long neighbour : graph.neighboursOf(root)) {
            if (neighbour == root)
                continue;
            long traffic = neighbour + contribution(neighbour, root, workingSet);
            if (Long.compareUnsigned(maxTraffic, traffic) < 0)
                maxTraffic = traffic;
        }
        return maxTraffic;
    }

    /**
     * Traffic of {@code neighbour}'s subtree as seen from {@code root}. When the
     * rooted edge itself was a cache hit nothing was descended into, and the
     * cache holds the values instead of the working set.
     */
    private long contribution(long neighbour, long root, WorkingSet workingSet) {
        if (workingSet.contains(neighbour))
            return workingSet.get(neighbour);
        OptionalLong cached = cache.peek(DirectedEdge.of(neighbour, root));
        return cached.isPresent() ? cached.getAsLong() : 0L;
    }

    /**
     * Advances {@code frame} to its next unvisited neighbour and pushes a frame
     * for it.
     *
     * @return true if a child frame was pushed, false if all neighbours are
     *         done.
     */
    private static boolean descend(Frame frame, WorkingSet workingSet, Deque<Frame> stack) {
        final long city = frame.edge.city();
        final List<Long> neighbours = frame.neighbours;
        while (frame.next < neighbours.size()) {
            long neighbour = neighbours.get(frame.next++);
            if (neighbour == city)
                continue;
            if (workingSet.claim(neighbour)) {
                stack.push(new Frame(DirectedEdge.of(neighbour, city)));
                return true;
            }
        }
        return false;
    }

    private static long aggregate(DirectedEdge edge, List<Long> neighbours, WorkingSet workingSet) {
        long traffic = 0L;
        for (long neighbour : neighbours) {
            if (neighbour == edge.city() || edge.excludes(neighbour))
                continue;
            traffic += neighbour + workingSet.get(neighbour);
        }
        return traffic;
    }

    public CityGraph graph() {
        return graph;
    }

    public DirectedEdgeCache cache() {
        return cache;
    }

    /** One suspended resolve call. */
    private static final class Frame {
        final DirectedEdge edge;
        List<Long> neighbours;
        int next;

        Frame(DirectedEdge edge) {
            this.edge = edge;
        }
    }
}
