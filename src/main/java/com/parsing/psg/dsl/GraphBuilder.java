package com.parsing.psg.dsl;

import com.parsing.psg.api.DuplicateNodeException;
import com.parsing.psg.api.GraphBuildException;
import com.parsing.psg.engine.StateGraph;

import java.util.*;

/**
 * Graph Builder -- turns a readable graph description into a {@link StateGraph}.
 *
 * The readable form maps each state name to the ordered names of the states it
 * branches to; a state with no successors is terminal:
 *
 * <pre>
 * StateGraph g = GraphBuilder.create("parse")
 *         .state("start", "start_loop", "s1")
 *         .state("start_loop", "loop_1", "s1")
 *         .state("loop_1", "loop_2")
 *         .state("loop_2", "start_loop", "accept")
 *         .state("s1", "accept")
 *         .state("accept")
 *         .build();
 * </pre>
 *
 * Validation happens in {@link #build()}, in three passes: every state is
 * declared (duplicates rejected), every successor is resolved in declared
 * order, and the {@value StateGraph#ENTRY} state is located. Any failure throws
 * a {@link GraphBuildException}; no graph is produced.
 */
public final class GraphBuilder {
    private final String graphName;

    // Declarations in order; duplicates are kept so build() can report them
    private final List<Map.Entry<String, List<String>>> states = new ArrayList<>();

    // Flag to prevent modification after building
    private boolean built;

    private GraphBuilder(String graphName) {
        this.graphName = graphName;
    }

    /**
     * Creates a new GraphBuilder instance.
     *
     * @param graphName name used in diagnostics.
     */
    public static GraphBuilder create(String graphName) {
        return new GraphBuilder(graphName);
    }

    /**
     * Builds a graph from a mapping of state name to ordered successor names.
     * Iteration order of the map determines declaration order, so pass a
     * {@link LinkedHashMap} when node order matters for display.
     */
    public static StateGraph build(Map<String, ? extends List<String>> transitions) {
        return build("graph", transitions);
    }

    public static StateGraph build(String graphName, Map<String, ? extends List<String>> transitions) {
        GraphBuilder g = create(graphName);
        for (Map.Entry<String, ? extends List<String>> e : transitions.entrySet())
            g.state(e.getKey(), e.getValue());
        return g.build();
    }

    /**
     * Declares a state with its successors, in branch order.
     */
    public GraphBuilder state(String name, String... successors) {
        return state(name, Arrays.asList(successors));
    }

    /**
     * Declares a state with its successors, in branch order.
     * A null successor list declares a terminal state.
     */
    public GraphBuilder state(String name, List<String> successors) {
        checkNotBuilt();
        List<String> copy = successors == null ? List.of() : new ArrayList<>(successors);
        states.add(new AbstractMap.SimpleImmutableEntry<>(name, Collections.unmodifiableList(copy)));
        return this;
    }

    public int stateCount() {
        return states.size();
    }

    /**
     * Validates the declarations and compiles the graph.
     *
     * @throws DuplicateNodeException if a state is declared twice
     * @throws GraphBuildException    for any other invalid description
     */
    public StateGraph build() {
        checkNotBuilt();
        StateGraph.Builder topo = StateGraph.builder(graphName);

        // 1. One node per declared state
        for (Map.Entry<String, List<String>> s : states)
            topo.addNode(s.getKey());

        // 2. Edges, in successor order
        for (Map.Entry<String, List<String>> s : states) {
            for (String successor : s.getValue())
                topo.addEdge(s.getKey(), successor);
        }

        // 3. Successor resolution and entry lookup
        StateGraph graph = topo.build();
        built = true;
        return graph;
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Graph '" + graphName + "' already built");
    }
}
