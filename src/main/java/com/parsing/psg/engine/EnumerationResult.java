package com.parsing.psg.engine;


import java.util.List;

/**
 * The outcome of one enumeration.
 *
 * @param paths     completed paths, in discovery order
 * @param deadLoops abandoned subtrees, in detection order
 * @param visits    total number of node visits (pushes)
 * @param maxDepth  longest path held during the traversal
 */
public record EnumerationResult(List<ParsePath> paths, List<DeadLoopWarning> deadLoops, long visits,
        int maxDepth) {

    public EnumerationResult {
        paths = List.copyOf(paths);
        deadLoops = List.copyOf(deadLoops);
    }

    public boolean isEmpty() {
        return paths.isEmpty();
    }

    /** Every path rendered as its node names. */
    public List<List<String>> pathNames() {
        return paths.stream().map(ParsePath::nodeNames).toList();
    }
}
