package com.parsing.psg.io;

import com.parsing.psg.api.InvalidNodeNameException;
import com.parsing.psg.dsl.GraphBuilder;
import com.parsing.psg.engine.EnumerationLimits;
import com.parsing.psg.engine.StateGraph;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a JSON {@link GraphDefinition} into a {@link StateGraph}.
 */
@Log4j2
public final class JsonGraphCompiler {

    /**
     * Compiles the definition into a graph.
     *
     * @param def The graph definition.
     * @return A container holding the graph, its limits and per-node descriptions.
     * @throws com.parsing.psg.api.GraphBuildException if the definition is invalid
     */
    public CompiledGraph compile(GraphDefinition def) {
        GraphDefinition.GraphInfo graphInfo = def.getGraph();
        String name = graphInfo.getName() != null ? graphInfo.getName() : "graph";

        List<GraphDefinition.NodeDef> nodeDefs = graphInfo.getNodes() != null ? graphInfo.getNodes()
                : Collections.emptyList();

        GraphBuilder builder = GraphBuilder.create(name);
        Map<String, String> descriptions = new HashMap<>(nodeDefs.size() * 2);
        for (GraphDefinition.NodeDef nd : nodeDefs) {
            // A null entry in the nodes array declares no name at all
            if (nd == null)
                throw new InvalidNodeNameException(null);
            builder.state(nd.getName(), nd.getSuccessors());
            if (nd.getDescription() != null && nd.getName() != null)
                descriptions.putIfAbsent(nd.getName(), nd.getDescription());
        }

        StateGraph graph = builder.build();
        log.debug("Compiled graph '{}' v{}: {} nodes, {} edges", name, graphInfo.getVersion(),
                graph.nodeCount(), graph.edgeCount());

        EnumerationLimits limits = graphInfo.getLimits() != null ? graphInfo.getLimits()
                : EnumerationLimits.unbounded();
        return new CompiledGraph(name, graphInfo.getVersion(), graph, limits,
                Collections.unmodifiableMap(descriptions));
    }

    /** The result of compilation: a graph ready to enumerate. */
    public record CompiledGraph(String name, String version, StateGraph graph, EnumerationLimits limits,
            Map<String, String> descriptions) {
    }
}
