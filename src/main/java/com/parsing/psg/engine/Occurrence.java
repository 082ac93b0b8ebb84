package com.parsing.psg.engine;

/**
 * One visit to a node within a path, paired with the edge chosen to leave it.
 *
 * Both fields are indices into the owning {@link StateGraph}; an occurrence
 * never copies node contents.
 *
 * @param node index of the visited node
 * @param edge index of the chosen outgoing edge, or {@link #NO_EDGE}
 */
public record Occurrence(int node, int edge) {
    /** Marker for an occurrence whose edge has not been chosen (or a terminal). */
    public static final int NO_EDGE = -1;

    public boolean hasEdge() {
        return edge != NO_EDGE;
    }
}
