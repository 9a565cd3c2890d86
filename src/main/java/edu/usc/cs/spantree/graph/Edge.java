package edu.usc.cs.spantree.graph;

import com.google.common.base.Preconditions;

/**
 * Undirected edge between two nodes. Always kept in canonical form,
 * so that {@code first <= second}.
 */
public final class Edge implements Comparable<Edge> {

    /**
     * Separator between the two ends in {@link #toString()} and {@link #parse(String)}
     */
    public static final char SEPARATOR = '-';

    private final int first;
    private final int second;

    private Edge(int first, int second) {
        this.first = first;
        this.second = second;
    }

    /**
     * Creates an edge between given nodes, order of the ends does not matter
     * @param s one end
     * @param t the other end
     * @return edge in canonical form
     */
    public static Edge of(int s, int t) {
        Preconditions.checkArgument(s >= 0 && t >= 0, "Negative node index in edge %s-%s", s, t);
        return new Edge(Math.min(s, t), Math.max(s, t));
    }

    /**
     * Parses an edge from its text form, such as {@code "3-7"}
     * @param text the edge text
     * @return parsed edge
     * @throws IllegalArgumentException when the text is not an edge
     */
    public static Edge parse(String text) {
        Preconditions.checkNotNull(text, "edge text");
        String trimmed = text.trim();
        int idx = trimmed.indexOf(SEPARATOR);
        if (idx <= 0 || idx == trimmed.length() - 1) {
            throw new IllegalArgumentException("Invalid edge '" + text + "', expected s" + SEPARATOR + "t");
        }
        try {
            int s = Integer.parseInt(trimmed.substring(0, idx).trim());
            int t = Integer.parseInt(trimmed.substring(idx + 1).trim());
            return of(s, t);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid edge '" + text + "', expected s" + SEPARATOR + "t", e);
        }
    }

    public int getFirst() {
        return first;
    }

    public int getSecond() {
        return second;
    }

    /**
     * @return true if both ends are the same node
     */
    public boolean isLoop() {
        return first == second;
    }

    @Override
    public int compareTo(Edge o) {
        int diff = Integer.compare(first, o.first);
        return diff != 0 ? diff : Integer.compare(second, o.second);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Edge edge = (Edge) o;
        return first == edge.first && second == edge.second;
    }

    @Override
    public int hashCode() {
        return 31 * first + second;
    }

    @Override
    public String toString() {
        return first + String.valueOf(SEPARATOR) + second;
    }
}
