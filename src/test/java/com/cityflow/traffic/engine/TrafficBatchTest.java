package com.cityflow.traffic.engine;

import com.cityflow.traffic.api.CityTraffic;
import com.cityflow.traffic.api.DirectedEdge;
import com.cityflow.traffic.api.TrafficListener;
import com.cityflow.traffic.graph.CityGraph;
import com.cityflow.traffic.graph.CityNotFoundException;
import com.cityflow.traffic.io.CityDescriptionParser;
import com.cityflow.traffic.io.TrafficResultSerializer;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class TrafficBatchTest {

    private CityGraph graph;
    private DirectedEdgeCache cache;
    private TrafficBatch batch;

    @Before
    public void setUp() {
        graph = new CityGraph();
        cache = new DirectedEdgeCache();
        batch = new TrafficBatch(new RerootingEngine(graph, cache));
    }

    private String run(String... descriptions) {
        CityDescriptionParser.load(List.of(descriptions), graph);
        return TrafficResultSerializer.toText(batch.run());
    }

    @Test
    public void testStar() {
        assertEquals("1:14,2:13,3:12,4:11,5:4",
                run("1:[5]", "2:[5]", "3:[5]", "4:[5]", "5:[1,2,3,4]"));
    }

    @Test
    public void testStarWithExtraLeaves() {
        assertEquals("1:44,2:25,3:30,4:41,5:20,12:33,18:27",
                run("1:[5]", "2:[5,18]", "3:[5,12]", "4:[5]", "5:[1,2,3,4]", "18:[2]", "12:[3]"));
    }

    @Test
    public void testLargerTreeWithIsolatedCity() {
        assertEquals("1:50,2:58,3:66,4:74,5:73,6:72,7:71,8:30,9:48,10:68,11:67,12:66,13:0",
                run("1:[2,7,8]", "2:[1,3,6]", "3:[2,4,5]", "4:[3]", "5:[3]", "6:[2]",
                        "7:[1]", "8:[1,9,12]", "9:[8,10,11]", "10:[9]", "11:[9]", "12:[8]", "13:[]"));
    }

    @Test
    public void testLongArm() {
        assertEquals("1:82,2:53,3:80,4:79,5:70,7:46,8:38,15:68,38:45",
                run("1:[5]", "4:[5]", "3:[5]", "5:[1,4,3,2]",
                        "2:[5,15,7]", "7:[2,8]", "8:[7,38]", "15:[2]", "38:[8]"));
    }

    @Test
    public void testResultsAreSortedByUnsignedCity() {
        long big = -2L; // 18446744073709551614
        graph.addRoad(big, 10).addRoad(10, big).addRoad(10, 3).addRoad(3, 10);

        List<CityTraffic> results = batch.run();

        assertEquals(3, results.size());
        assertEquals(3L, results.get(0).city());
        assertEquals(10L, results.get(1).city());
        assertEquals(big, results.get(2).city());
    }

    @Test
    public void testEmptyGraph() {
        assertTrue(batch.run().isEmpty());
    }

    @Test
    public void testIterationOrderDoesNotChangeResults() {
        String forward = run("1:[5]", "2:[5,18]", "3:[5,12]", "4:[5]", "5:[1,2,3,4]", "18:[2]", "12:[3]");

        graph.clear();
        cache.clear();
        String backward = run("12:[3]", "18:[2]", "5:[1,2,3,4]", "4:[5]", "3:[5,12]", "2:[5,18]", "1:[5]");

        assertEquals(forward, backward);
    }

    @Test
    public void testCacheSurvivesRootsButWorkingSetDoesNot() {
        run("1:[5]", "2:[5]", "3:[5]", "4:[5]", "5:[1,2,3,4]");

        // 4 edges x 2 orientations + 5 rooted entries
        assertEquals(13, cache.size());
        assertTrue(cache.contains(DirectedEdge.of(1, 5)));
        assertEquals(0, cache.overwrites());
    }

    @Test
    public void testListenerSeesEveryRoot() {
        List<String> events = new ArrayList<>();
        batch.setListener(new RecordingListener(events));

        run("1:[2]", "2:[1]");

        assertEquals("start:2", events.get(0));
        assertTrue(events.contains("root:1=2"));
        assertTrue(events.contains("root:2=1"));
        assertEquals("end:2", events.get(events.size() - 1));
    }

    @Test
    public void testFailureTripsCircuitBreaker() {
        List<String> events = new ArrayList<>();
        batch.setListener(new RecordingListener(events));
        graph.addRoad(1, 2).addCity(3);

        assertTrue(batch.isHealthy());
        try {
            batch.run();
            fail("Expected TrafficComputationException");
        } catch (TrafficComputationException e) {
            assertEquals(1L, e.getCity());
            assertTrue(e.getCause() instanceof CityNotFoundException);
            assertTrue(e.getMessage().contains("unhealthy"));
        }
        assertFalse(batch.isHealthy());
        assertTrue(events.contains("error:1"));
        assertEquals("end:0", events.get(events.size() - 1));

        try {
            batch.run();
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("unhealthy state"));
        }

        // Additions are refused until graph and cache are cleared
        try {
            graph.addCity(2);
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("resetAll()"));
        }

        // Fix input and retry on a clean slate
        graph.clear();
        cache.clear();
        graph.addRoad(1, 2).addCity(3).addCity(2);
        batch.resetHealth();
        List<CityTraffic> results = batch.run();
        assertTrue(batch.isHealthy());
        assertEquals(3, results.size());
    }

    @Test
    public void testBatchIdIncrements() {
        run("1:[]");
        batch.run();
        assertEquals(2, batch.batchId());
        assertEquals(1, batch.lastRootCount());
    }

    private static final class RecordingListener implements TrafficListener {
        private final List<String> events;

        RecordingListener(List<String> events) {
            this.events = events;
        }

        @Override
        public void onBatchStart(long batchId, int cityCount) {
            events.add("start:" + cityCount);
        }

        @Override
        public void onEdgeResolved(DirectedEdge edge, long traffic) {
        }

        @Override
        public void onCacheHit(DirectedEdge edge, long traffic) {
        }

        @Override
        public void onRootComputed(long batchId, long city, long maxTraffic, long durationNanos) {
            events.add("root:" + city + "=" + maxTraffic);
        }

        @Override
        public void onRootError(long batchId, long city, Throwable error) {
            events.add("error:" + city);
        }

        @Override
        public void onBatchEnd(long batchId, int rootsComputed) {
            events.add("end:" + rootsComputed);
        }
    }
}
