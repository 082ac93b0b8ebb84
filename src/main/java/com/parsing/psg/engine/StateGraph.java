package com.parsing.psg.engine;

import com.parsing.psg.api.DuplicateNodeException;
import com.parsing.psg.api.InvalidNodeNameException;
import com.parsing.psg.api.MissingEntryException;
import com.parsing.psg.api.UnresolvedReferenceException;

import java.util.*;

/**
 * StateGraph -- CSR-encoded, possibly cyclic, directed parse-state graph.
 *
 * This class represents the immutable structure of the graph after it has been
 * built. Nodes live in an arena and are addressed by a stable integer index;
 * edges are addressed by their position in a single flattened array and store
 * the index of their target, never a reference to it. Cycles in the graph are
 * therefore cycles of indices, not of object ownership.
 *
 * Data layout:
 * - names: node names, indexed by node index, in declaration order.
 * - edgeTarget: a single flattened int array holding the target node index of
 * every edge of every node.
 * - edgeOffset: edgeOffset[i] points to the start of node i's edges in
 * edgeTarget. The edges of node i are edgeTarget[edgeOffset[i]] inclusive to
 * edgeTarget[edgeOffset[i+1]] exclusive, in declared order.
 * - edgeSource: the owning node of every edge, indexed like edgeTarget.
 *
 * An edge index is the identity of an edge: two edges between the same pair of
 * nodes are still distinct edges.
 *
 * Instances are read-only once built and may be shared by any number of
 * concurrent enumerations.
 */
public final class StateGraph {
    /** Name of the mandatory entry node. */
    public static final String ENTRY = "start";

    private final String name;

    private final String[] names;

    // CSR Index: edgeOffset[i] .. edgeOffset[i+1] are node i's edges.
    private final int[] edgeOffset;

    // CSR Data: flattened target indices, one per edge.
    private final int[] edgeTarget;

    // Owning node of each edge.
    private final int[] edgeSource;

    private final Map<String, Integer> nameToIndex;

    private final int entry;

    private StateGraph(String name, String[] names, int[] edgeOffset, int[] edgeTarget, int[] edgeSource,
            Map<String, Integer> nameToIndex, int entry) {
        this.name = name;
        this.names = names;
        this.edgeOffset = edgeOffset;
        this.edgeTarget = edgeTarget;
        this.edgeSource = edgeSource;
        this.nameToIndex = nameToIndex;
        this.entry = entry;
    }

    public String name() {
        return name;
    }

    public int nodeCount() {
        return names.length;
    }

    public int edgeCount() {
        return edgeTarget.length;
    }

    /** Index of the entry node. */
    public int entry() {
        return entry;
    }

    public String nodeName(int node) {
        return names[node];
    }

    /** Resolves a node name to its index. O(1) hash lookup. */
    public int index(String nodeName) {
        Integer idx = nameToIndex.get(nodeName);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + nodeName);
        return idx;
    }

    public boolean contains(String nodeName) {
        return nameToIndex.containsKey(nodeName);
    }

    /** A terminal node has no outgoing edges. */
    public boolean isTerminal(int node) {
        return edgeOffset[node + 1] == edgeOffset[node];
    }

    public int outDegree(int node) {
        return edgeOffset[node + 1] - edgeOffset[node];
    }

    /** Edge index of the i-th outgoing edge of a node. */
    public int edge(int node, int i) {
        return edgeOffset[node] + i;
    }

    public int edgesStart(int node) {
        return edgeOffset[node];
    }

    public int edgesEnd(int node) {
        return edgeOffset[node + 1];
    }

    public int target(int edge) {
        return edgeTarget[edge];
    }

    public int source(int edge) {
        return edgeSource[edge];
    }

    /** True if the edge leads back to the node that owns it. */
    public boolean isSelfLoop(int edge) {
        return edgeTarget[edge] == edgeSource[edge];
    }

    /** Node names in declaration order. */
    public List<String> nodeNames() {
        return List.of(names);
    }

    // Internal arrays are not exposed to prevent mutation of the immutable graph.

    public static Builder builder() {
        return new Builder("graph");
    }

    public static Builder builder(String graphName) {
        return new Builder(graphName);
    }

    /**
     * Builder for constructing the StateGraph.
     * <p>
     * Nodes are registered eagerly so duplicates fail at the point of
     * declaration. Edges are recorded by name and resolved in {@link #build()},
     * so successors may be declared after the nodes that reference them.
     */
    public static final class Builder {
        private final String graphName;
        private final List<String> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final Map<Integer, List<String>> successorNames = new HashMap<>();

        private Builder(String graphName) {
            this.graphName = graphName;
        }

        public Builder addNode(String nodeName) {
            requireValidName(nodeName);
            if (nameToIdx.containsKey(nodeName))
                throw new DuplicateNodeException(nodeName);
            int idx = nodes.size();
            nodes.add(nodeName);
            nameToIdx.put(nodeName, idx);
            successorNames.put(idx, new ArrayList<>());
            return this;
        }

        /**
         * Appends an edge to the end of {@code from}'s edge list.
         * The owning node must already be declared; the target is checked and
         * resolved at build time.
         */
        public Builder addEdge(String from, String to) {
            Integer idx = nameToIdx.get(from);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + from);
            successorNames.get(idx).add(to);
            return this;
        }

        private static void requireValidName(String nodeName) {
            if (nodeName == null || nodeName.isEmpty())
                throw new InvalidNodeNameException(nodeName);
        }

        /**
         * Compiles the graph.
         * <p>
         * Resolves every edge in declaration order, then locates the entry node.
         * Nothing is allocated for the graph until validation has passed.
         *
         * @throws InvalidNodeNameException     if a successor name is null or empty
         * @throws UnresolvedReferenceException if a successor was never declared
         * @throws MissingEntryException        if no node is named {@value StateGraph#ENTRY}
         */
        public StateGraph build() {
            int n = nodes.size();

            // 1. Resolve successors and size the edge arrays
            int totalEdges = 0;
            int[] offsets = new int[n + 1];
            for (int i = 0; i < n; i++) {
                List<String> successors = successorNames.get(i);
                for (String to : successors) {
                    if (to == null || to.isEmpty())
                        throw new InvalidNodeNameException(nodes.get(i), to);
                    if (!nameToIdx.containsKey(to))
                        throw new UnresolvedReferenceException(nodes.get(i), to);
                }
                offsets[i + 1] = offsets[i] + successors.size();
                totalEdges += successors.size();
            }

            // 2. Locate the entry node
            Integer entryIdx = nameToIdx.get(ENTRY);
            if (entryIdx == null)
                throw new MissingEntryException(ENTRY);

            // 3. Build CSR structure
            int[] targets = new int[totalEdges];
            int[] sources = new int[totalEdges];
            for (int i = 0; i < n; i++) {
                List<String> successors = successorNames.get(i);
                int base = offsets[i];
                for (int j = 0; j < successors.size(); j++) {
                    targets[base + j] = nameToIdx.get(successors.get(j));
                    sources[base + j] = i;
                }
            }
            return new StateGraph(graphName, nodes.toArray(new String[0]), offsets, targets, sources,
                    Map.copyOf(nameToIdx), entryIdx);
        }
    }
}
