package com.parsing.psg.engine;

import com.parsing.psg.Fixtures;
import com.parsing.psg.dsl.GraphBuilder;
import com.parsing.psg.util.CollectingEnumerationListener;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.*;

public class PathEnumeratorTest {

    private CollectingEnumerationListener collector;
    private PathEnumerator enumerator;

    @Before
    public void setUp() {
        collector = new CollectingEnumerationListener();
        enumerator = new PathEnumerator(collector);
    }

    private static List<List<String>> names(List<ParsePath> paths) {
        return paths.stream().map(ParsePath::nodeNames).collect(Collectors.toList());
    }

    private static List<List<String>> warningNames(List<DeadLoopWarning> warnings) {
        return warnings.stream().map(w -> w.path().nodeNames()).collect(Collectors.toList());
    }

    @Test
    public void testReferenceGraph() {
        EnumerationResult result = enumerator.enumerate(Fixtures.referenceGraph());

        assertEquals(List.of(
                List.of("start", "start_loop", "loop_1", "loop_2", "start_loop", "s1", "accept"),
                List.of("start", "start_loop", "loop_1", "loop_2", "accept"),
                List.of("start", "start_loop", "s1", "accept"),
                List.of("start", "s1", "accept")), result.pathNames());
        assertTrue(result.deadLoops().isEmpty());
        assertTrue(collector.deadLoops().isEmpty());
    }

    @Test
    public void testDeadLoopGraph() {
        EnumerationResult result = enumerator.enumerate(Fixtures.deadLoopGraph());

        assertEquals(List.of(List.of("start", "s1", "accept")), result.pathNames());
        assertEquals(1, result.deadLoops().size());
        assertEquals(List.of("start", "start_loop", "loop_1", "loop_2", "start_loop"),
                result.deadLoops().get(0).path().nodeNames());
        assertEquals("start_loop", result.deadLoops().get(0).stuckNode());

        // Listener saw the same warning, synchronously
        assertEquals(result.deadLoops(), collector.deadLoops());
    }

    @Test
    public void testCrossingLoops() {
        EnumerationResult result = enumerator.enumerate(Fixtures.crossingLoopsGraph());

        assertEquals(List.of(
                List.of("start", "s1", "s3", "s2", "s3", "accept"),
                List.of("start", "s1", "s3", "accept"),
                List.of("start", "s2", "s3", "s1", "s3", "accept"),
                List.of("start", "s2", "s3", "accept")), result.pathNames());

        assertEquals(List.of(
                List.of("start", "s1", "s3", "s1"),
                List.of("start", "s1", "s3", "s2", "s3", "s1"),
                List.of("start", "s2", "s3", "s1", "s3", "s2"),
                List.of("start", "s2", "s3", "s2")), warningNames(result.deadLoops()));
    }

    @Test
    public void testTerminalEntryYieldsSinglePath() {
        StateGraph graph = GraphBuilder.create("trivial").state("start").build();
        EnumerationResult result = enumerator.enumerate(graph);

        assertEquals(List.of(List.of("start")), result.pathNames());
        assertEquals(1, result.visits());
        assertEquals(1, result.maxDepth());
    }

    @Test
    public void testSelfLoopOnlyNodeIsDeadLoop() {
        StateGraph graph = GraphBuilder.create("self")
                .state("start", "spin", "accept")
                .state("spin", "spin")
                .state("accept")
                .build();
        EnumerationResult result = enumerator.enumerate(graph);

        assertEquals(List.of(List.of("start", "accept")), result.pathNames());
        assertEquals(List.of(List.of("start", "spin")), warningNames(result.deadLoops()));
    }

    @Test
    public void testSelfLoopIsSkippedButOtherEdgesFollowed() {
        StateGraph graph = GraphBuilder.create("self")
                .state("start", "start", "accept")
                .state("accept")
                .build();
        EnumerationResult result = enumerator.enumerate(graph);

        assertEquals(List.of(List.of("start", "accept")), result.pathNames());
        assertTrue(result.deadLoops().isEmpty());
    }

    @Test
    public void testEveryReachableSubtreeDeadYieldsEmptyResult() {
        StateGraph graph = GraphBuilder.create("no_exit")
                .state("start", "a")
                .state("a", "start")
                .state("island")
                .build();
        EnumerationResult result = enumerator.enumerate(graph);

        assertTrue(result.isEmpty());
        assertEquals(List.of(List.of("start", "a", "start")), warningNames(result.deadLoops()));
    }

    @Test
    public void testParallelEdgesProduceDistinctPaths() {
        StateGraph graph = GraphBuilder.create("parallel")
                .state("start", "accept", "accept")
                .state("accept")
                .build();
        List<ParsePath> paths = enumerator.findPaths(graph);

        assertEquals(2, paths.size());
        assertEquals(paths.get(0).nodeNames(), paths.get(1).nodeNames());
        assertNotEquals(paths.get(0), paths.get(1));
    }

    @Test
    public void testLoopTraversedOncePerPath() {
        // start -> a -> b -> a is allowed once, then only the exit remains
        StateGraph graph = GraphBuilder.create("once")
                .state("start", "a")
                .state("a", "b", "accept")
                .state("b", "a")
                .state("accept")
                .build();

        assertEquals(List.of(
                List.of("start", "a", "b", "a", "accept"),
                List.of("start", "a", "accept")), names(enumerator.findPaths(graph)));
    }

    @Test
    public void testListenerLifecycle() {
        EnumerationResult result = enumerator.enumerate(Fixtures.referenceGraph());

        assertEquals(1, collector.startedCount());
        assertEquals(1, collector.endedCount());
        assertEquals(result.paths(), collector.paths());
    }

    @Test
    public void testWithoutListener() {
        EnumerationResult result = new PathEnumerator().enumerate(Fixtures.deadLoopGraph());
        assertEquals(1, result.paths().size());
        assertEquals(1, result.deadLoops().size());
    }

    @Test
    public void testDeterminism() {
        StateGraph graph = Fixtures.crossingLoopsGraph();
        EnumerationResult first = enumerator.enumerate(graph);
        EnumerationResult second = new PathEnumerator().enumerate(graph);

        assertEquals(first.paths(), second.paths());
        assertEquals(first.deadLoops(), second.deadLoops());
        assertEquals(first.visits(), second.visits());
    }

    @Test
    public void testTerminalOnlyCompletion() {
        for (StateGraph graph : graphs()) {
            for (ParsePath path : enumerator.findPaths(graph)) {
                assertTrue(path.toString(), path.isComplete());
                assertEquals(graph.entry(), path.node(0));
                assertFalse(path.occurrence(path.length() - 1).hasEdge());
            }
        }
    }

    @Test
    public void testNoSelfLoopFollowedAndEdgesChain() {
        for (StateGraph graph : graphs()) {
            for (ParsePath path : enumerator.findPaths(graph)) {
                for (int i = 0; i < path.length() - 1; i++) {
                    int edge = path.edge(i);
                    assertEquals(path.node(i), graph.source(edge));
                    assertFalse(graph.isSelfLoop(edge));
                    assertEquals(path.node(i + 1), graph.target(edge));
                }
            }
        }
    }

    @Test
    public void testNoEdgeReusedWithinPath() {
        for (StateGraph graph : graphs()) {
            for (ParsePath path : enumerator.findPaths(graph)) {
                for (int i = 0; i < path.length(); i++) {
                    for (int j = 0; j < i; j++) {
                        if (path.node(j) == path.node(i) && path.edge(i) != Occurrence.NO_EDGE)
                            assertNotEquals(path.toString(), path.edge(j), path.edge(i));
                    }
                }
            }
        }
    }

    @Test
    public void testDepthBoundedByEdgeCount() {
        for (StateGraph graph : graphs()) {
            EnumerationResult result = enumerator.enumerate(graph);
            assertTrue(result.maxDepth() <= graph.edgeCount() + 1);
        }
    }

    @Test
    public void testDeadLoopWarningsEndAtNonTerminalNodes() {
        for (StateGraph graph : graphs()) {
            for (DeadLoopWarning w : enumerator.enumerate(graph).deadLoops()) {
                int last = w.path().node(w.path().length() - 1);
                assertFalse(graph.isTerminal(last));
            }
        }
    }

    @Test
    public void testSharedGraphAcrossEnumerators() throws Exception {
        StateGraph graph = Fixtures.completeGraph(3);
        EnumerationResult expected = new PathEnumerator().enumerate(graph);

        EnumerationResult[] results = new EnumerationResult[4];
        Thread[] threads = new Thread[results.length];
        for (int i = 0; i < threads.length; i++) {
            final int slot = i;
            threads[i] = new Thread(() -> results[slot] = new PathEnumerator().enumerate(graph));
            threads[i].start();
        }
        for (Thread t : threads)
            t.join();

        for (EnumerationResult r : results)
            assertEquals(expected.paths(), r.paths());
    }

    @Test
    public void testDepthLimit() {
        enumerator.setLimits(new EnumerationLimits(4, 0));
        try {
            enumerator.enumerate(Fixtures.referenceGraph());
            fail("expected TraversalLimitExceededException");
        } catch (TraversalLimitExceededException e) {
            assertEquals(5, e.partialPath().length());
            assertEquals(List.of("start", "start_loop", "loop_1", "loop_2", "start_loop"),
                    e.partialPath().nodeNames());
        }
    }

    @Test
    public void testVisitLimit() {
        enumerator.setLimits(new EnumerationLimits(0, 3));
        try {
            enumerator.enumerate(Fixtures.referenceGraph());
            fail("expected TraversalLimitExceededException");
        } catch (TraversalLimitExceededException e) {
            assertEquals(4, e.partialPath().length());
        }
    }

    @Test
    public void testLimitsLargeEnoughDoNotInterfere() {
        StateGraph graph = Fixtures.referenceGraph();
        EnumerationResult unbounded = enumerator.enumerate(graph);

        enumerator.setLimits(new EnumerationLimits(unbounded.maxDepth(), unbounded.visits()));
        assertEquals(unbounded.paths(), enumerator.enumerate(graph).paths());
    }

    private static List<StateGraph> graphs() {
        return List.of(Fixtures.referenceGraph(), Fixtures.deadLoopGraph(), Fixtures.crossingLoopsGraph(),
                Fixtures.completeGraph(3));
    }
}
