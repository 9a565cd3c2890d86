package edu.usc.cs.spantree.graph;

import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

import static org.junit.Assert.*;

public class EdgeTest {

    @Test
    public void testCanonical() throws Exception {
        Edge edge = Edge.of(5, 2);
        assertEquals(2, edge.getFirst());
        assertEquals(5, edge.getSecond());
        assertEquals(Edge.of(2, 5), edge);
        assertEquals(Edge.of(2, 5).hashCode(), edge.hashCode());
        assertFalse(edge.isLoop());
        assertTrue(Edge.of(3, 3).isLoop());
        assertEquals("2-5", edge.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegative() throws Exception {
        Edge.of(-1, 2);
    }

    @Test
    public void testCompare() throws Exception {
        List<Edge> edges = Arrays.asList(Edge.of(2, 1), Edge.of(0, 3), Edge.of(1, 1), Edge.of(0, 1));
        assertEquals("[0-1, 0-3, 1-1, 1-2]", new TreeSet<>(edges).toString());
    }

    @Test
    public void testParse() throws Exception {
        assertEquals(Edge.of(0, 1), Edge.parse("0-1"));
        assertEquals(Edge.of(0, 1), Edge.parse("1-0"));
        assertEquals(Edge.of(12, 7), Edge.parse(" 12 - 7 "));
        assertEquals(Edge.of(4, 4), Edge.parse("4-4"));

        String[] bad = {"", "1", "1-", "-1", "a-b", "1-2-3", "-1-2", "1--2", "1,2"};
        for (String text : bad) {
            try {
                Edge.parse(text);
                fail("Expected failure for '" + text + "'");
            } catch (IllegalArgumentException e) {
                //expected
            }
        }
    }
}
