package com.parsing.psg;

import com.parsing.psg.dsl.GraphBuilder;
import com.parsing.psg.engine.StateGraph;

/** Graph literals shared by tests. */
public final class Fixtures {
    private Fixtures() {
    }

    /** A loop that can be left through s1 or accept. */
    public static StateGraph referenceGraph() {
        return GraphBuilder.create("parse_graph")
                .state("start", "start_loop", "s1")
                .state("start_loop", "loop_1", "s1")
                .state("loop_1", "loop_2")
                .state("loop_2", "start_loop", "accept")
                .state("s1", "accept")
                .state("accept")
                .build();
    }

    /** Same topology with both loop exits removed. */
    public static StateGraph deadLoopGraph() {
        return GraphBuilder.create("dead_loop")
                .state("start", "start_loop", "s1")
                .state("start_loop", "loop_1")
                .state("loop_1", "loop_2")
                .state("loop_2", "start_loop")
                .state("s1", "accept")
                .state("accept")
                .build();
    }

    /** Two loops through s3 that can each be entered from the other. */
    public static StateGraph crossingLoopsGraph() {
        return GraphBuilder.create("crossing_loops")
                .state("start", "s1", "s2")
                .state("s1", "s3")
                .state("s2", "s3")
                .state("s3", "s1", "s2", "accept")
                .state("accept")
                .build();
    }

    /** Every node branches to every node, itself included, plus a terminal. */
    public static StateGraph completeGraph(int n) {
        GraphBuilder g = GraphBuilder.create("complete_" + n);
        String[] names = new String[n];
        names[0] = StateGraph.ENTRY;
        for (int i = 1; i < n; i++)
            names[i] = "n" + i;
        for (int i = 0; i < n; i++) {
            String[] successors = new String[n + 1];
            System.arraycopy(names, 0, successors, 0, n);
            successors[n] = "accept";
            g.state(names[i], successors);
        }
        g.state("accept");
        return g.build();
    }
}
