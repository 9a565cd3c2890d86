package edu.usc.cs.spantree.graph;

import com.google.common.base.Preconditions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Undirected graph with a fixed number of nodes, indexed from {@code 0} to {@code size() - 1}.
 * Adjacency is kept symmetric: every edge is stored at both of its ends.
 * Self loops are allowed.
 * <p>
 * Instances are not thread safe.
 */
public class Graph {

    private final List<Set<Integer>> nodes;

    /**
     * Creates a graph of isolated nodes
     * @param n number of nodes
     */
    public Graph(int n) {
        Preconditions.checkArgument(n >= 0, "Number of nodes must not be negative, was %s", n);
        this.nodes = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            nodes.add(new HashSet<>());
        }
    }

    /**
     * Copy constructor. The copy shares no state with the given graph.
     * @param other graph to copy
     */
    public Graph(Graph other) {
        Preconditions.checkNotNull(other, "graph");
        this.nodes = new ArrayList<>(other.nodes.size());
        for (Set<Integer> neighbours : other.nodes) {
            nodes.add(new HashSet<>(neighbours));
        }
    }

    /**
     * Builds a graph from the edges
     * @param n number of nodes
     * @param edges edges to add
     * @return new graph
     */
    public static Graph fromEdges(int n, Iterable<Edge> edges) {
        Graph graph = new Graph(n);
        for (Edge edge : edges) {
            graph.addEdge(edge);
        }
        return graph;
    }

    private Set<Integer> neighboursOf(int node) {
        Preconditions.checkElementIndex(node, nodes.size(), "node");
        return nodes.get(node);
    }

    /**
     * @param node the node
     * @return a copy of the neighbours of the node
     */
    public Set<Integer> getNeighbours(int node) {
        return new HashSet<>(neighboursOf(node));
    }

    public int degree(int node) {
        return neighboursOf(node).size();
    }

    /**
     * Adds an undirected edge. Adding an existing edge has no effect.
     * @param s one end
     * @param t the other end, may be same as {@code s}
     */
    public void addEdge(int s, int t) {
        Set<Integer> sNeighbours = neighboursOf(s);
        Set<Integer> tNeighbours = neighboursOf(t);
        sNeighbours.add(t);
        tNeighbours.add(s);
    }

    public void addEdge(Edge edge) {
        addEdge(edge.getFirst(), edge.getSecond());
    }

    /**
     * Removes an undirected edge. Removing a missing edge has no effect.
     * @param s one end
     * @param t the other end
     */
    public void removeEdge(int s, int t) {
        Set<Integer> sNeighbours = neighboursOf(s);
        Set<Integer> tNeighbours = neighboursOf(t);
        sNeighbours.remove(t);
        tNeighbours.remove(s);
    }

    public void removeEdge(Edge edge) {
        removeEdge(edge.getFirst(), edge.getSecond());
    }

    /**
     * Removes all the edges of a node, leaving it isolated
     * @param node the node
     */
    public void removeEdges(int node) {
        for (Integer neighbour : getNeighbours(node)) {
            removeEdge(node, neighbour);
        }
    }

    public boolean adjacent(int s, int t) {
        Preconditions.checkElementIndex(t, nodes.size(), "node");
        return neighboursOf(s).contains(t);
    }

    public boolean adjacent(Edge edge) {
        return adjacent(edge.getFirst(), edge.getSecond());
    }

    /**
     * @return number of nodes
     */
    public int size() {
        return nodes.size();
    }

    /**
     * @return distinct edges of this graph, each in canonical form
     */
    public Set<Edge> edges() {
        Set<Edge> edges = new HashSet<>();
        for (int node = 0; node < nodes.size(); node++) {
            for (Integer neighbour : nodes.get(node)) {
                edges.add(Edge.of(node, neighbour));
            }
        }
        return edges;
    }

    public int countEdges() {
        return edges().size();
    }

    /**
     * Tests whether the graph has a cycle; a self loop counts as one.
     * <p>
     * The traversal runs on a copy and removes the edges of each node it
     * expands, so reaching an already visited node through any remaining edge
     * means there are two paths to it. This graph is not modified.
     * Slow: copies the whole adjacency on every call.
     *
     * @return true if there is at least one cycle
     */
    public boolean isCyclic() {
        Graph work = new Graph(this);
        Set<Integer> visited = new HashSet<>();
        Deque<Integer> open = new ArrayDeque<>(work.size());
        for (int node = 0; node < work.size(); node++) {
            if (!visited.add(node)) {
                continue;
            }
            open.push(node);
            while (!open.isEmpty()) {
                int current = open.pop();
                Set<Integer> neighbours = work.getNeighbours(current);
                work.removeEdges(current);
                for (Integer neighbour : neighbours) {
                    if (!visited.add(neighbour)) {
                        return true;
                    }
                    open.push(neighbour);
                }
            }
            open.clear();
        }
        return false;
    }

    public boolean isAcyclic() {
        return !isCyclic();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Graph graph = (Graph) o;
        return nodes.equals(graph.nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return "Graph{size=" + size() + ", edges=" + new TreeSet<>(edges()) + "}";
    }
}
