package com.parsing.psg.engine;

import java.util.Arrays;

/**
 * The single mutable path carried by a depth-first enumeration.
 *
 * Occurrences are pushed on entry to a node and popped on exit, so after every
 * recursive step the stack is back in the state its caller left it in. The
 * stack is owned by exactly one traversal and must not be shared.
 *
 * Storage is two parallel int arrays that grow on demand; no objects are
 * allocated per push.
 */
public final class PathStack {
    private final StateGraph graph;
    private int[] nodes;
    private int[] edges;
    private int size;

    public PathStack(StateGraph graph) {
        this(graph, 16);
    }

    public PathStack(StateGraph graph, int initialCapacity) {
        this.graph = graph;
        int cap = Math.max(1, initialCapacity);
        this.nodes = new int[cap];
        this.edges = new int[cap];
    }

    /** Adds a new node to the end of the path with no edge chosen yet. */
    public void push(int node) {
        if (size == nodes.length) {
            int cap = nodes.length * 2;
            nodes = Arrays.copyOf(nodes, cap);
            edges = Arrays.copyOf(edges, cap);
        }
        nodes[size] = node;
        edges[size] = Occurrence.NO_EDGE;
        size++;
    }

    /** Removes the last node from the path. */
    public void pop() {
        if (size == 0)
            throw new IllegalStateException("Pop from empty path");
        size--;
    }

    /**
     * Checks whether the edge can be followed to extend the path and, if it
     * can, registers it as the chosen edge of the last occurrence, replacing any
     * previously chosen candidate.
     * <p>
     * The edge must belong to the last node pushed. It is refused if:
     * <ul>
     * <li>it leads back to that node itself;</li>
     * <li>any occurrence of that node anywhere in the path already chose it.</li>
     * </ul>
     * Scanning every occurrence, not only the most recent, is what stops a loop
     * from being retraced once its re-entry edge has been used.
     *
     * @return true if the edge was registered
     */
    public boolean follow(int edge) {
        if (size == 0)
            throw new IllegalStateException("Follow on empty path");
        int last = nodes[size - 1];
        if (graph.source(edge) != last)
            throw new IllegalArgumentException("Edge " + edge + " does not belong to " + graph.nodeName(last));

        if (graph.target(edge) == last)
            return false;

        for (int i = 0; i < size; i++) {
            if (nodes[i] == last && edges[i] == edge)
                return false;
        }

        edges[size - 1] = edge;
        return true;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int lastNode() {
        return nodes[size - 1];
    }

    public Occurrence occurrence(int i) {
        if (i < 0 || i >= size)
            throw new IndexOutOfBoundsException("Index " + i + " out of bounds for path of " + size);
        return new Occurrence(nodes[i], edges[i]);
    }

    /** Copies the path out as an immutable snapshot. */
    public ParsePath snapshot() {
        return new ParsePath(graph, Arrays.copyOf(nodes, size), Arrays.copyOf(edges, size));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(size * 8);
        for (int i = 0; i < size; i++)
            sb.append(graph.nodeName(nodes[i])).append("; ");
        return sb.toString();
    }
}
