package com.parsing.psg;

import com.parsing.psg.api.GraphBuildException;
import com.parsing.psg.engine.EnumerationResult;
import com.parsing.psg.util.GraphExplain;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.io.UncheckedIOException;

/**
 * Console entry point: loads a graph, prints every path found through it.
 * <p>
 * Usage: {@code ParseGraphDemo [graph.json]}. Without an argument the bundled
 * reference graph is used. Exits with status 1 if the graph cannot be loaded
 * or built.
 */
public class ParseGraphDemo {
    private static final Logger log = LogManager.getLogger(ParseGraphDemo.class);

    static final String DEFAULT_GRAPH = "graphs/parse_graph.json";

    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != 0)
            System.exit(status);
    }

    /** Loads, enumerates and prints; returns the process exit status. */
    static int run(String[] args, PrintStream out) {
        String source = args.length > 0 ? args[0] : DEFAULT_GRAPH;
        ParseGraph graph;
        try {
            graph = args.length > 0 ? new ParseGraph(args[0]) : ParseGraph.fromResource(DEFAULT_GRAPH);
        } catch (GraphBuildException e) {
            log.error("Cannot build parse graph ({}): {}", e.kind(), e.getMessage());
            return 1;
        } catch (IllegalArgumentException | UncheckedIOException e) {
            log.error("Cannot load parse graph from {}: {}", source, e.getMessage());
            return 1;
        }

        EnumerationResult result = graph.enumerate();
        GraphExplain explain = graph.explain();
        log.debug("\n{}", explain.dumpTopology());
        out.print(explain.formatResult(result));
        return 0;
    }
}
