package edu.usc.cs.spantree.tree;

import com.google.common.base.Preconditions;
import edu.usc.cs.spantree.graph.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * This class generates random graphs, which are used as input for spanning trees.
 */
public class GraphGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(GraphGenerator.class);

    private final Random random;

    public GraphGenerator(Random random) {
        this.random = Preconditions.checkNotNull(random, "random");
    }

    public GraphGenerator(long seed) {
        this(new Random(seed));
    }

    /**
     * Generates a graph where every pair of distinct nodes is connected
     * @param n number of nodes
     * @return complete graph
     */
    public static Graph complete(int n) {
        Graph graph = new Graph(n);
        for (int s = 0; s < n; s++) {
            for (int t = s + 1; t < n; t++) {
                graph.addEdge(s, t);
            }
        }
        return graph;
    }

    /**
     * Generates G(n, p) random graph, without self loops
     * @param n number of nodes
     * @param p probability of each edge
     * @return random graph
     */
    public Graph random(int n, double p) {
        Preconditions.checkArgument(p >= 0.0 && p <= 1.0, "Probability must be in [0, 1], was %s", p);
        Graph graph = new Graph(n);
        addRandomEdges(graph, p);
        LOG.debug("Generated random graph, Nodes : {}, Edges : {}", n, graph.countEdges());
        return graph;
    }

    /**
     * Generates a connected random graph: a path through all the nodes in random order,
     * plus the edges of G(n, p)
     * @param n number of nodes
     * @param p probability of each extra edge
     * @return connected random graph
     */
    public Graph connected(int n, double p) {
        Preconditions.checkArgument(p >= 0.0 && p <= 1.0, "Probability must be in [0, 1], was %s", p);
        Graph graph = new Graph(n);
        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            order.add(i);
        }
        Collections.shuffle(order, random);
        for (int i = 1; i < n; i++) {
            graph.addEdge(order.get(i - 1), order.get(i));
        }
        addRandomEdges(graph, p);
        LOG.debug("Generated connected graph, Nodes : {}, Edges : {}", n, graph.countEdges());
        return graph;
    }

    private void addRandomEdges(Graph graph, double p) {
        int n = graph.size();
        for (int s = 0; s < n; s++) {
            for (int t = s + 1; t < n; t++) {
                if (random.nextDouble() < p) {
                    graph.addEdge(s, t);
                }
            }
        }
    }
}
