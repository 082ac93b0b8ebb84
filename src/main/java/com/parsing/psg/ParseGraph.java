package com.parsing.psg;

import com.parsing.psg.engine.EnumerationListener;
import com.parsing.psg.engine.EnumerationLimits;
import com.parsing.psg.engine.EnumerationResult;
import com.parsing.psg.engine.PathEnumerator;
import com.parsing.psg.engine.StateGraph;
import com.parsing.psg.io.GraphDefinition;
import com.parsing.psg.io.JsonGraphCompiler;
import com.parsing.psg.io.JsonGraphLoader;
import com.parsing.psg.util.CompositeEnumerationListener;
import com.parsing.psg.util.GraphExplain;
import com.parsing.psg.util.LoggingEnumerationListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.Map;

/**
 * A high-level wrapper that loads a JSON graph definition and enumerates its
 * paths.
 * <p>
 * This class handles:
 * <ul>
 * <li>Parsing JSON graph definitions</li>
 * <li>Compiling them into a {@link StateGraph} with {@link JsonGraphCompiler}</li>
 * <li>Applying the definition's {@link EnumerationLimits}</li>
 * <li>Reporting dead loops through Log4j2 by default, plus any registered
 * listeners</li>
 * </ul>
 * Construction fails with a {@link com.parsing.psg.api.GraphBuildException} if
 * the definition is invalid, so an instance always holds a usable graph.
 */
public class ParseGraph {
    private static final Logger log = LogManager.getLogger(ParseGraph.class);

    private final StateGraph graph;
    private final Map<String, String> descriptions;
    private final PathEnumerator enumerator;
    private final CompositeEnumerationListener compositeListener;

    /**
     * Creates a new ParseGraph from a JSON file path string.
     *
     * @param jsonPath relative or absolute path to the JSON graph definition.
     */
    public ParseGraph(String jsonPath) {
        this(Path.of(jsonPath));
    }

    /**
     * Creates a new ParseGraph from a JSON file path.
     *
     * @param jsonPath Path to the JSON graph definition.
     */
    public ParseGraph(Path jsonPath) {
        this(JsonGraphLoader.parseFile(jsonPath));
    }

    public ParseGraph(GraphDefinition definition) {
        var compiled = new JsonGraphCompiler().compile(definition);
        this.graph = compiled.graph();
        this.descriptions = compiled.descriptions();

        this.compositeListener = new CompositeEnumerationListener()
                .addForComposite(new LoggingEnumerationListener());
        this.enumerator = new PathEnumerator(compositeListener);
        this.enumerator.setLimits(compiled.limits());

        log.info("Loaded graph '{}' v{} ({} states)", compiled.name(), compiled.version(), graph.nodeCount());
    }

    /**
     * Loads a graph definition from the classpath.
     *
     * @param resource resource name, e.g. {@code "graphs/parse_graph.json"}.
     */
    public static ParseGraph fromResource(String resource) {
        return new ParseGraph(JsonGraphLoader.parseResource(resource));
    }

    /**
     * Registers a listener for enumeration events. Adds to, rather than
     * replaces, the default logging listener.
     */
    public void addListener(EnumerationListener listener) {
        compositeListener.addForComposite(listener);
    }

    public void setLimits(EnumerationLimits limits) {
        enumerator.setLimits(limits);
    }

    public EnumerationLimits getLimits() {
        return enumerator.getLimits();
    }

    public StateGraph getGraph() {
        return graph;
    }

    /**
     * Enumerates every path from the entry node to a terminal node.
     */
    public EnumerationResult enumerate() {
        return enumerator.enumerate(graph);
    }

    public GraphExplain explain() {
        return new GraphExplain(graph, descriptions);
    }
}
