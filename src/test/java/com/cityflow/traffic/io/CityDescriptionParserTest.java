package com.cityflow.traffic.io;

import com.cityflow.traffic.graph.CityGraph;
import com.cityflow.traffic.graph.SentinelCollisionException;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class CityDescriptionParserTest {

    @Test
    public void testParsesNeighboursInOrder() {
        CityGraph graph = new CityGraph();
        CityDescriptionParser.load(List.of("5:[1,4,3,2]", "1:[5]", "2:[5]", "3:[5]", "4:[5]"), graph);

        assertEquals(5, graph.cityCount());
        assertEquals(List.of(1L, 4L, 3L, 2L), graph.neighboursOf(5));
    }

    @Test
    public void testEmptyNeighbourList() {
        CityGraph graph = new CityGraph();
        CityDescriptionParser.parseInto("13:[]", graph);
        assertTrue(graph.contains(13));
        assertTrue(graph.neighboursOf(13).isEmpty());
    }

    @Test
    public void testWhitespaceIsIgnored() {
        CityGraph graph = new CityGraph();
        CityDescriptionParser.parseInto("  2 : [ 1 , 3 ]  ", graph);
        assertEquals(List.of(1L, 3L), graph.neighboursOf(2));
    }

    @Test
    public void testRepeatedDescriptionAppends() {
        CityGraph graph = new CityGraph();
        CityDescriptionParser.parseInto("2:[1]", graph);
        CityDescriptionParser.parseInto("2:[3]", graph);
        assertEquals(List.of(1L, 3L), graph.neighboursOf(2));
    }

    @Test
    public void testUnsigned64BitIds() {
        CityGraph graph = new CityGraph();
        CityDescriptionParser.parseInto("18446744073709551615:[1]", graph);
        assertTrue(graph.contains(-1L));
    }

    @Test
    public void testUndescribedNeighbourIsRejected() {
        CityGraph graph = new CityGraph();
        try {
            CityDescriptionParser.load(List.of("1:[5]"), graph);
            fail("Expected CityDescriptionException");
        } catch (CityDescriptionException e) {
            assertTrue(e.getMessage().contains("undescribed neighbour 5"));
        }
    }

    @Test
    public void testMalformedDescriptions() {
        String[] bad = { "", "x:[1]", "1[2]", "1:2", "1:[2", "1:[2,]", "1:[2;3]", "1:[2] junk", "-1:[]",
                "18446744073709551616:[]" };
        for (String description : bad) {
            try {
                CityDescriptionParser.parseInto(description, new CityGraph());
                fail("Expected CityDescriptionException for '" + description + "'");
            } catch (CityDescriptionException e) {
                assertTrue(e.getMessage(), e.getMessage().contains(description));
            }
        }
    }

    @Test
    public void testReservedZeroSurfacesAsSentinelCollision() {
        CityGraph graph = new CityGraph(4, true);
        try {
            CityDescriptionParser.parseInto("0:[]", graph);
            fail("Expected SentinelCollisionException");
        } catch (SentinelCollisionException e) {
            assertFalse(graph.contains(0));
        }
    }
}
