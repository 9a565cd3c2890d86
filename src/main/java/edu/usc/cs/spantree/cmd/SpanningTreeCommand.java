package edu.usc.cs.spantree.cmd;

import com.google.common.base.Preconditions;
import edu.usc.cs.spantree.graph.Graph;
import edu.usc.cs.spantree.tree.GraphGenerator;
import edu.usc.cs.spantree.tree.SpanningTreeBuilder;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Random;

/**
 * Draws a random spanning tree of a graph. The graph is either given as edges in
 * CLI args or generated as a connected random graph.
 */
public class SpanningTreeCommand extends GraphCommand {

    private static final Logger LOG = LoggerFactory.getLogger(SpanningTreeCommand.class);

    @Option(name = "-seed", usage = "Seed for the random source, for repeatable trees")
    private Long seed;

    @Option(name = "-random", metaVar = "P",
            usage = "Generate a connected random graph, with probability P for each extra edge, instead of reading edges")
    private Double edgeProbability;

    @Override
    public void run(PrintStream out) {
        Random random = seed == null ? new Random() : new Random(seed);
        Graph graph;
        if (edgeProbability != null) {
            Preconditions.checkArgument(edges.isEmpty(), "Edges must not be given along with -random");
            Preconditions.checkArgument(numNodes >= 0, "Number of nodes must not be negative, was %s", numNodes);
            graph = new GraphGenerator(random).connected(numNodes, edgeProbability);
        } else {
            graph = readGraph();
        }
        LOG.info("Building spanning tree, Nodes : {}, Edges : {}", graph.size(), graph.countEdges());

        Graph tree = new SpanningTreeBuilder(random).build(graph);
        out.println("# graph edges: " + graph.countEdges());
        printEdges(out, graph.edges());
        out.println("# tree edges: " + tree.countEdges());
        printEdges(out, tree.edges());
    }

    public static void main(String[] args) {
        //args = "-n 4 -seed 1 0-1 1-2 2-3 3-0 0-2".split(" ");
        execute(new SpanningTreeCommand(), args, System.out, System.err);
    }
}
