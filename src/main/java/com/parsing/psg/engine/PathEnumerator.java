package com.parsing.psg.engine;


import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Enumerates every path from the entry node to a terminal node.
 *
 * The enumerator performs a single depth-first walk carrying one mutable
 * {@link PathStack}. Each visit to a node goes through the same steps:
 *
 * 1. Enter: push an occurrence for the node, with no edge chosen.
 *
 * 2. Terminal check: a node without outgoing edges completes the path. The
 * path is snapshotted into the result; this is the only place results are
 * produced.
 *
 * 3. Branch attempt: each outgoing edge is offered to the path in declared
 * order. Self-loops and edges already chosen by any occurrence of the same node
 * are refused; an accepted edge becomes the node's chosen edge and its target
 * is entered.
 *
 * 4. Dead-loop detection: a non-terminal node that accepted none of its edges
 * cannot make progress. The path so far is reported as a
 * {@link DeadLoopWarning} and the subtree yields nothing. This is not an error;
 * sibling branches continue.
 *
 * 5. Exit: pop the occurrence, restoring the path the caller expects.
 *
 * Results therefore appear in left-to-right, depth-first, pre-order discovery
 * order, and re-running on the same graph yields the same sequence.
 *
 * Termination:
 * No (node, edge) pair can be chosen twice in one path, so a path holds at most
 * edgeCount + 1 occurrences. The walk is iterative: per-depth state (next edge
 * to try, whether any edge was followed) lives in arrays sized to that bound,
 * so deep graphs cannot overflow the Java call stack.
 *
 * Instances are not thread-safe, but a {@link StateGraph} is read-only and may
 * be enumerated by several enumerators at once.
 */
public final class PathEnumerator {
    private static final Logger log = LogManager.getLogger(PathEnumerator.class);

    private static final int NONE = -1;

    private EnumerationListener listener;
    private EnumerationLimits limits = EnumerationLimits.unbounded();

    public PathEnumerator() {
    }

    public PathEnumerator(EnumerationListener listener) {
        this.listener = listener;
    }

    public void setListener(EnumerationListener listener) {
        this.listener = listener;
    }

    /** Returns a copy; changing it does not affect this enumerator. */
    public EnumerationLimits getLimits() {
        return copy(limits);
    }

    /** Installs a copy of the given limits for subsequent enumerations. */
    public void setLimits(EnumerationLimits limits) {
        this.limits = copy(Objects.requireNonNull(limits, "limits"));
    }

    private static EnumerationLimits copy(EnumerationLimits l) {
        return new EnumerationLimits(l.getMaxDepth(), l.getMaxVisits());
    }

    /**
     * Returns only the completed paths of {@link #enumerate(StateGraph)}.
     */
    public List<ParsePath> findPaths(StateGraph graph) {
        return enumerate(graph).paths();
    }

    /**
     * Runs one complete enumeration.
     *
     * @return the completed paths and dead-loop warnings, both in discovery order
     * @throws TraversalLimitExceededException if a configured limit is exceeded
     */
    public EnumerationResult enumerate(StateGraph graph) {
        Objects.requireNonNull(graph, "graph");

        final EnumerationListener l = this.listener;
        final boolean hasListener = l != null;
        final int maxDepthLimit = limits.getMaxDepth();
        final long maxVisitsLimit = limits.getMaxVisits();

        final int bound = graph.edgeCount() + 1;
        final PathStack path = new PathStack(graph, bound);
        // cursor[d]: next edge to offer at depth d; followed[d]: any edge accepted at depth d
        final int[] cursor = new int[bound];
        final boolean[] followed = new boolean[bound];

        List<ParsePath> paths = new ArrayList<>();
        List<DeadLoopWarning> deadLoops = new ArrayList<>();
        long visits = 0;
        int maxDepth = 0;

        log.debug("Enumerating paths of '{}' ({} nodes, {} edges)", graph.name(), graph.nodeCount(),
                graph.edgeCount());
        if (hasListener)
            l.onEnumerationStart(graph.name(), graph.nodeName(graph.entry()));

        int next = graph.entry();
        while (true) {
            if (next != NONE) {
                // Enter
                path.push(next);
                visits++;
                if (maxDepthLimit > 0 && path.size() > maxDepthLimit)
                    throw new TraversalLimitExceededException(
                            "Path depth limit of " + maxDepthLimit + " exceeded", path.snapshot());
                if (maxVisitsLimit > 0 && visits > maxVisitsLimit)
                    throw new TraversalLimitExceededException(
                            "Node visit limit of " + maxVisitsLimit + " exceeded", path.snapshot());
                if (path.size() > maxDepth)
                    maxDepth = path.size();

                if (graph.isTerminal(next)) {
                    ParsePath completed = path.snapshot();
                    paths.add(completed);
                    if (hasListener)
                        l.onPathFound(paths.size() - 1, completed);

                    // Exit
                    path.pop();
                    next = NONE;
                    if (path.isEmpty())
                        break;
                    continue;
                }

                int depth = path.size() - 1;
                cursor[depth] = graph.edgesStart(next);
                followed[depth] = false;
                next = NONE;
            }

            // Branch attempt: resume where this depth left off
            final int d = path.size() - 1;
            final int end = graph.edgesEnd(path.lastNode());
            while (cursor[d] < end) {
                int edge = cursor[d]++;
                if (path.follow(edge)) {
                    followed[d] = true;
                    next = graph.target(edge);
                    break;
                }
            }
            if (next != NONE)
                continue;

            // All edges attempted
            if (!followed[d]) {
                DeadLoopWarning warning = new DeadLoopWarning(path.snapshot());
                deadLoops.add(warning);
                log.debug("Dead loop at '{}': {}", graph.nodeName(path.lastNode()), path);
                if (hasListener)
                    l.onDeadLoop(warning);
            }

            // Exit
            path.pop();
            if (path.isEmpty())
                break;
        }

        log.debug("Enumeration of '{}' complete: {} paths, {} dead loops, {} visits, max depth {}",
                graph.name(), paths.size(), deadLoops.size(), visits, maxDepth);
        if (hasListener)
            l.onEnumerationEnd(paths.size(), deadLoops.size());

        return new EnumerationResult(paths, deadLoops, visits, maxDepth);
    }
}
