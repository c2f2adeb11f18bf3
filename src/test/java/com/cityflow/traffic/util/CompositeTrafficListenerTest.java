package com.cityflow.traffic.util;

import com.cityflow.traffic.api.DirectedEdge;
import org.junit.Test;

import static org.junit.Assert.*;

public class CompositeTrafficListenerTest {

    @Test
    public void testFansOutToAllListeners() {
        CompositeTrafficListener composite = new CompositeTrafficListener();
        BatchStatsListener a = new BatchStatsListener();
        BatchStatsListener b = new BatchStatsListener();
        composite.addForComposite(a);
        composite.addForComposite(b);

        composite.onEdgeResolved(DirectedEdge.of(1, 2), 3);
        composite.onCacheHit(DirectedEdge.of(1, 2), 3);
        composite.onRootComputed(1, 2, 3, 500);
        composite.onBatchEnd(1, 1);

        assertEquals(2, composite.size());
        for (BatchStatsListener l : new BatchStatsListener[] { a, b }) {
            assertEquals(1, l.resolvedEdges());
            assertEquals(1, l.cacheHits());
            assertEquals(1, l.totalRoots());
            assertEquals(1, l.totalBatches());
        }
    }

    @Test
    public void testEmptyCompositeIsNoOp() {
        CompositeTrafficListener composite = new CompositeTrafficListener();
        composite.onBatchStart(1, 0);
        composite.onRootError(1, 1, new RuntimeException("ignored"));
        assertEquals(0, composite.size());
    }
}
