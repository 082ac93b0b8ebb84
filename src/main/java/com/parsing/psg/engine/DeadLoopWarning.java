package com.parsing.psg.engine;

/**
 * Non-fatal report of a subtree abandoned during enumeration.
 *
 * The path ends at the re-entered node whose every outgoing edge was either a
 * self-loop or already used earlier in the same path. The subtree contributes
 * no results; sibling branches are unaffected.
 *
 * @param path the partial path that led to the dead end, including the stuck node
 */
public record DeadLoopWarning(ParsePath path) {

    /** Name of the node at which no edge could be followed. */
    public String stuckNode() {
        return path.nodeName(path.length() - 1);
    }

    @Override
    public String toString() {
        return "Loop without exit or loop whose all states and branches have already been added to the path detected. "
                + "Ignoring the parse subtree: " + path;
    }
}
