package com.parsing.psg.engine;

/**
 * Side-channel for observing a path enumeration.
 *
 * Listeners are invoked synchronously from the traversal loop, at the exact
 * point an event is detected:
 *
 * - Diagnostics: dead loops are reported here rather than written to a stream,
 * so callers decide whether to log, collect or ignore them.
 * - Streaming: results are announced as they are discovered, in discovery
 * order, before enumeration finishes.
 *
 * An exception thrown from a callback aborts the enumeration and propagates to
 * the caller of {@code enumerate}.
 */
public interface EnumerationListener {

    /**
     * Called once before the first node is visited.
     *
     * @param graphName name of the graph being enumerated
     * @param entry     name of the entry node
     */
    default void onEnumerationStart(String graphName, String entry) {
    }

    /**
     * Called when a terminal node is reached and the path has been snapshotted.
     *
     * @param index zero-based discovery index of the path
     * @param path  the completed path
     */
    default void onPathFound(int index, ParsePath path) {
    }

    /**
     * Called when a node is reached from which no outgoing edge can be
     * followed. Enumeration continues with the sibling branches.
     */
    void onDeadLoop(DeadLoopWarning warning);

    /**
     * Called once after the traversal has unwound completely.
     *
     * @param pathCount     number of completed paths
     * @param deadLoopCount number of abandoned subtrees
     */
    default void onEnumerationEnd(int pathCount, int deadLoopCount) {
    }
}
