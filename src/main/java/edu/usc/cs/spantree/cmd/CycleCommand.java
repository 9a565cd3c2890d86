package edu.usc.cs.spantree.cmd;

import edu.usc.cs.spantree.graph.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Checks whether the graph given in CLI args has a cycle.
 */
public class CycleCommand extends GraphCommand {

    private static final Logger LOG = LoggerFactory.getLogger(CycleCommand.class);

    @Override
    public void run(PrintStream out) {
        Graph graph = readGraph();
        LOG.info("Checking for cycles, Nodes : {}, Edges : {}", graph.size(), graph.countEdges());
        out.println("nodes: " + graph.size());
        out.println("edges: " + graph.countEdges());
        out.println("cyclic: " + graph.isCyclic());
    }

    public static void main(String[] args) {
        //args = "-n 3 0-1 1-2 2-0".split(" ");
        execute(new CycleCommand(), args, System.out, System.err);
    }
}
