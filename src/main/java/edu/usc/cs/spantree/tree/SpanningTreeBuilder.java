package edu.usc.cs.spantree.tree;

import com.google.common.base.Preconditions;
import edu.usc.cs.spantree.graph.Edge;
import edu.usc.cs.spantree.graph.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Draws a random spanning tree of a graph.
 * <p>
 * Edges of the source graph are tried in a random order and kept unless they
 * close a cycle. For a connected graph the result is a spanning tree; for a
 * disconnected one it is a spanning forest with one tree per component.
 * The trees are not sampled uniformly, only the edge order is.
 */
public class SpanningTreeBuilder {

    /**
     * Delay between progress updates
     */
    public static final int DELAY = 2000;
    private static final Logger LOG = LoggerFactory.getLogger(SpanningTreeBuilder.class);

    private final Random random;

    public SpanningTreeBuilder() {
        this(new Random());
    }

    public SpanningTreeBuilder(long seed) {
        this(new Random(seed));
    }

    public SpanningTreeBuilder(Random random) {
        this.random = Preconditions.checkNotNull(random, "random");
    }

    /**
     * Builds a spanning tree (or forest) of the graph. The source is not modified.
     * @param source the graph
     * @return new graph of the same size having a subset of source's edges and no cycles
     */
    public Graph build(Graph source) {
        Preconditions.checkNotNull(source, "source graph");
        List<Edge> edges = new ArrayList<>(source.edges());
        // sorted first so that a seeded random gives the same tree
        Collections.sort(edges);
        Collections.shuffle(edges, random);

        Graph tree = new Graph(source.size());
        int kept = 0;
        int count = 0;
        long st = System.currentTimeMillis();
        for (Edge edge : edges) {
            tree.addEdge(edge);
            if (tree.isCyclic()) {
                tree.removeEdge(edge);
                LOG.debug("Rejected {}", edge);
            } else {
                kept++;
                LOG.debug("Accepted {}", edge);
            }
            count++;
            if (System.currentTimeMillis() - st > DELAY) {
                LOG.info("Edge {} of {}, kept {}", count, edges.size(), kept);
                st = System.currentTimeMillis();
            }
        }
        LOG.info("Nodes : {}, Source edges : {}, Tree edges : {}", source.size(), edges.size(), kept);
        return tree;
    }
}
