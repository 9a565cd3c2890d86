package edu.usc.cs.spantree.cmd;

import com.google.common.base.Preconditions;
import edu.usc.cs.spantree.graph.Edge;
import edu.usc.cs.spantree.graph.Graph;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Base of the sub-commands which take a graph as CLI args:
 * number of nodes and a list of edges such as {@code 0-1 1-2}.
 */
public abstract class GraphCommand {

    @Option(name = "-n", aliases = {"--nodes"}, required = true, usage = "Number of nodes in the graph")
    protected int numNodes;

    @Argument(metaVar = "EDGE", multiValued = true, usage = "Edges of the graph, each as s-t")
    protected List<String> edges = new ArrayList<>();

    /**
     * Runs the command
     * @param out stream for the results
     */
    public abstract void run(PrintStream out);

    /**
     * @return graph made of the nodes and edges given in args
     * @throws IllegalArgumentException when an edge is malformed or out of range
     */
    protected Graph readGraph() {
        Preconditions.checkArgument(numNodes >= 0, "Number of nodes must not be negative, was %s", numNodes);
        Graph graph = new Graph(numNodes);
        for (String text : edges) {
            Edge edge = Edge.parse(text);
            Preconditions.checkArgument(edge.getSecond() < numNodes,
                    "Edge %s is out of range for %s nodes", edge, numNodes);
            graph.addEdge(edge);
        }
        return graph;
    }

    /**
     * Prints edges one per line, sorted
     */
    protected static void printEdges(PrintStream out, Collection<Edge> edges) {
        for (Edge edge : new TreeSet<>(edges)) {
            out.println(edge);
        }
    }

    /**
     * Parses args into the command and runs it. Errors in args are reported along with usage.
     * @param cmd the command
     * @param args CLI args
     * @param out stream for the results
     * @param err stream for errors
     * @return true if the command ran
     */
    public static boolean execute(GraphCommand cmd, String[] args, PrintStream out, PrintStream err) {
        CmdLineParser parser = new CmdLineParser(cmd);
        try {
            parser.parseArgument(args);
            cmd.run(out);
            return true;
        } catch (CmdLineException | IllegalArgumentException e) {
            err.println(e.getLocalizedMessage());
            parser.printUsage(err);
            return false;
        }
    }
}
