package com.parsing.psg.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.parsing.psg.engine.EnumerationLimits;

import lombok.Data;

/**
 * POJO representation of a parse-state graph.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDefinition {
    private GraphInfo graph;

    /** Meta-information about the graph. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class GraphInfo {
        private String name, version, description;
        private List<NodeDef> nodes;
        private EnumerationLimits limits;
    }

    /** Definition of a single state and the states it branches to. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class NodeDef {
        private String name, description;
        private List<String> successors;
    }
}
