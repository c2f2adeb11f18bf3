package com.cityflow.traffic.util;

import com.cityflow.traffic.api.DirectedEdge;
import com.cityflow.traffic.api.TrafficListener;

import java.util.Arrays;

/**
 * Fans callbacks out to several {@link TrafficListener} instances, iterating a
 * plain array.
 */
public class CompositeTrafficListener implements TrafficListener {
    private TrafficListener[] listeners = new TrafficListener[0];

    public void addForComposite(TrafficListener listener) {
        TrafficListener[] old = listeners;
        TrafficListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onBatchStart(long batchId, int cityCount) {
        for (TrafficListener l : listeners)
            l.onBatchStart(batchId, cityCount);
    }

    @Override
    public void onEdgeResolved(DirectedEdge edge, long traffic) {
        for (TrafficListener l : listeners)
            l.onEdgeResolved(edge, traffic);
    }

    @Override
    public void onCacheHit(DirectedEdge edge, long traffic) {
        for (TrafficListener l : listeners)
            l.onCacheHit(edge, traffic);
    }

    @Override
    public void onRootComputed(long batchId, long city, long maxTraffic, long durationNanos) {
        for (TrafficListener l : listeners)
            l.onRootComputed(batchId, city, maxTraffic, durationNanos);
    }

    @Override
    public void onRootError(long batchId, long city, Throwable error) {
        for (TrafficListener l : listeners)
            l.onRootError(batchId, city, error);
    }

    @Override
    public void onBatchEnd(long batchId, int rootsComputed) {
        for (TrafficListener l : listeners)
            l.onBatchEnd(batchId, rootsComputed);
    }
}
