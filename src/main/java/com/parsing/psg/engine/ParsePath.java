package com.parsing.psg.engine;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable snapshot of a path through a {@link StateGraph}.
 *
 * A completed path runs from the entry node to a terminal node; a path carried
 * by a dead-loop warning ends at the node where no edge could be followed. The
 * last occurrence of a snapshot has no chosen edge.
 *
 * Equality is by graph identity and the sequence of (node, edge) pairs.
 */
public final class ParsePath {
    private final StateGraph graph;
    private final int[] nodes;
    private final int[] edges;

    ParsePath(StateGraph graph, int[] nodes, int[] edges) {
        this.graph = graph;
        this.nodes = nodes;
        this.edges = edges;
    }

    public StateGraph graph() {
        return graph;
    }

    public int length() {
        return nodes.length;
    }

    public int node(int i) {
        return nodes[i];
    }

    /** Edge chosen at position i, or {@link Occurrence#NO_EDGE}. */
    public int edge(int i) {
        return edges[i];
    }

    public String nodeName(int i) {
        return graph.nodeName(nodes[i]);
    }

    public Occurrence occurrence(int i) {
        return new Occurrence(nodes[i], edges[i]);
    }

    /** Read-only view of the occurrences. */
    public List<Occurrence> occurrences() {
        return new AbstractList<>() {
            @Override
            public Occurrence get(int index) {
                return occurrence(index);
            }

            @Override
            public int size() {
                return nodes.length;
            }
        };
    }

    /** The externally visible form of a path: its node names in order. */
    public List<String> nodeNames() {
        List<String> out = new ArrayList<>(nodes.length);
        for (int node : nodes)
            out.add(graph.nodeName(node));
        return out;
    }

    /** True if the path ends at a node with no outgoing edges. */
    public boolean isComplete() {
        return nodes.length > 0 && graph.isTerminal(nodes[nodes.length - 1]);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ParsePath other))
            return false;
        return graph == other.graph && Arrays.equals(nodes, other.nodes) && Arrays.equals(edges, other.edges);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(nodes) + Arrays.hashCode(edges);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(nodes.length * 8);
        for (int node : nodes)
            sb.append(graph.nodeName(node)).append("; ");
        return sb.toString();
    }
}
