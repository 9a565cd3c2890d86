package edu.usc.cs.spantree.cmd;

import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class GraphCommandTest {

    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;
    private PrintStream out;
    private PrintStream err;

    @Before
    public void setUp() throws Exception {
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
        out = new PrintStream(outBytes, true, "UTF-8");
        err = new PrintStream(errBytes, true, "UTF-8");
    }

    private List<String> outLines() {
        return Arrays.asList(new String(outBytes.toByteArray(), StandardCharsets.UTF_8).split("\\R"));
    }

    private String errText() {
        return new String(errBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void testCycle() throws Exception {
        assertTrue(GraphCommand.execute(new CycleCommand(), "-n 3 0-1 1-2 2-0".split(" "), out, err));
        assertEquals(Arrays.asList("nodes: 3", "edges: 3", "cyclic: true"), outLines());
    }

    @Test
    public void testNoCycle() throws Exception {
        assertTrue(GraphCommand.execute(new CycleCommand(), "-n 4 0-1 1-2 1-3 3-1".split(" "), out, err));
        assertEquals(Arrays.asList("nodes: 4", "edges: 3", "cyclic: false"), outLines());
    }

    @Test
    public void testBadEdge() throws Exception {
        assertFalse(GraphCommand.execute(new CycleCommand(), "-n 3 0-1 x-2".split(" "), out, err));
        assertTrue(errText().contains("x-2"));
        assertEquals(0, outBytes.size());
    }

    @Test
    public void testEdgeOutOfRange() throws Exception {
        assertFalse(GraphCommand.execute(new CycleCommand(), "-n 3 0-3".split(" "), out, err));
        assertTrue(errText().contains("out of range"));
    }

    @Test
    public void testMissingNodes() throws Exception {
        assertFalse(GraphCommand.execute(new CycleCommand(), new String[]{"0-1"}, out, err));
        assertTrue(errText().contains("-n"));
    }

    @Test
    public void testSpanningTree() throws Exception {
        String[] args = "-n 4 -seed 1 0-1 1-2 2-3 3-0 0-2".split(" ");
        assertTrue(GraphCommand.execute(new SpanningTreeCommand(), args, out, err));
        List<String> lines = outLines();
        assertEquals("# graph edges: 5", lines.get(0));
        assertEquals(Arrays.asList("0-1", "0-2", "0-3", "1-2", "2-3"), lines.subList(1, 6));
        assertEquals("# tree edges: 3", lines.get(6));
        assertEquals(10, lines.size());
        assertTrue(Arrays.asList("0-1", "0-2", "0-3", "1-2", "2-3").containsAll(lines.subList(7, 10)));
    }

    @Test
    public void testSpanningTreeIsRepeatable() throws Exception {
        String[] args = "-n 7 -seed 42 -random 0.5".split(" ");
        assertTrue(GraphCommand.execute(new SpanningTreeCommand(), args, out, err));
        List<String> first = outLines();
        outBytes.reset();
        assertTrue(GraphCommand.execute(new SpanningTreeCommand(), args, out, err));
        assertEquals(first, outLines());
        assertTrue(first.contains("# tree edges: 6"));
    }

    @Test
    public void testRandomWithEdges() throws Exception {
        String[] args = "-n 3 -random 0.5 0-1".split(" ");
        assertFalse(GraphCommand.execute(new SpanningTreeCommand(), args, out, err));
        assertTrue(errText().contains("-random"));
    }
}
