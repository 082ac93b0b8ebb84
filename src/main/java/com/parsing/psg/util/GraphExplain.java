package com.parsing.psg.util;

import com.parsing.psg.engine.DeadLoopWarning;
import com.parsing.psg.engine.EnumerationResult;
import com.parsing.psg.engine.Occurrence;
import com.parsing.psg.engine.ParsePath;
import com.parsing.psg.engine.StateGraph;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Diagnostic utility for inspecting graph topology and enumeration results.
 *
 * <p>
 * This class generates human-readable string representations of the graph
 * structure, of individual nodes, and of the paths found through it.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, console output and logging.
 * Allocates strings freely.
 */
public final class GraphExplain {
    private final StateGraph graph;
    private final Map<String, String> descriptions;

    public GraphExplain(StateGraph graph) {
        this(graph, Collections.emptyMap());
    }

    public GraphExplain(StateGraph graph, Map<String, String> descriptions) {
        this.graph = graph;
        this.descriptions = descriptions;
    }

    /**
     * Dumps the details of a single node.
     */
    public String explainNode(String nodeName) {
        int idx = graph.index(nodeName);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeName).append('\n')
                .append("  Index: ").append(idx).append('\n')
                .append("  Entry: ").append(idx == graph.entry()).append('\n')
                .append("  Terminal: ").append(graph.isTerminal(idx)).append('\n');
        String desc = descriptions.get(nodeName);
        if (desc != null)
            sb.append("  Description: ").append(desc).append('\n');
        int degree = graph.outDegree(idx);
        sb.append("  Branches (").append(degree).append("): ");
        for (int i = 0; i < degree; i++) {
            int edge = graph.edge(idx, i);
            sb.append(graph.nodeName(graph.target(edge)));
            if (graph.isSelfLoop(edge))
                sb.append(" (self)");
            if (i < degree - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /**
     * Dumps the entire topology, one node per line, edges in branch order.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph ").append(graph.name()).append(" (").append(graph.nodeCount()).append(" nodes, ")
                .append(graph.edgeCount()).append(" edges):\n");
        for (int i = 0; i < graph.nodeCount(); i++) {
            sb.append("  [").append(i).append("] ").append(graph.nodeName(i));
            if (i == graph.entry())
                sb.append(" (ENTRY)");
            int degree = graph.outDegree(i);
            if (degree == 0) {
                sb.append(" (TERMINAL)");
            } else {
                sb.append(" -> ");
                for (int j = 0; j < degree; j++) {
                    sb.append(graph.nodeName(graph.target(graph.edge(i, j))));
                    if (j < degree - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Renders a path with the edge chosen at each occurrence, e.g.
     * {@code start -[0]-> s1 -[0]-> accept}. The bracketed number is the
     * branch position within the owning node.
     */
    public String explainPath(ParsePath path) {
        StringBuilder sb = new StringBuilder(path.length() * 16);
        for (int i = 0; i < path.length(); i++) {
            Occurrence occ = path.occurrence(i);
            sb.append(graph.nodeName(occ.node()));
            if (occ.hasEdge())
                sb.append(" -[").append(occ.edge() - graph.edgesStart(occ.node())).append("]-> ");
        }
        return sb.toString();
    }

    /**
     * Formats an enumeration result the way the console tool prints it.
     */
    public String formatResult(EnumerationResult result) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Paths found:\n");
        for (ParsePath path : result.paths())
            sb.append('\t').append(path).append('\n');
        List<DeadLoopWarning> deadLoops = result.deadLoops();
        if (!deadLoops.isEmpty()) {
            sb.append("Ignored subtrees:\n");
            for (DeadLoopWarning w : deadLoops)
                sb.append('\t').append(w.path()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram.
     * <p>
     * Renders nodes and edges in a format suitable for embedding in Markdown.
     * The entry node is drawn as a stadium and terminal nodes as circles.
     * </p>
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare nodes in declaration order
        for (int i = 0; i < graph.nodeCount(); i++) {
            String name = graph.nodeName(i);
            String safeName = sanitize(name);
            if (i == graph.entry())
                sb.append("  ").append(safeName).append("([\"").append(name).append("\"]);\n");
            else if (graph.isTerminal(i))
                sb.append("  ").append(safeName).append("((\"").append(name).append("\"));\n");
            else
                sb.append("  ").append(safeName).append("[\"").append(name).append("\"];\n");
        }

        // 2. Declare all edges afterwards, in branch order
        for (int i = 0; i < graph.nodeCount(); i++) {
            String safeName = sanitize(graph.nodeName(i));
            for (int e = graph.edgesStart(i); e < graph.edgesEnd(i); e++) {
                String safeTarget = sanitize(graph.nodeName(graph.target(e)));
                if (graph.isSelfLoop(e))
                    sb.append("  ").append(safeName).append(" -. \"ignored\" .-> ").append(safeTarget).append(";\n");
                else
                    sb.append("  ").append(safeName).append(" --> ").append(safeTarget).append(";\n");
            }
        }
        return sb.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
