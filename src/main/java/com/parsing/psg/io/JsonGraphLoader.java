package com.parsing.psg.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads {@link GraphDefinition}s from JSON text, files and classpath resources.
 */
public final class JsonGraphLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonGraphLoader() {
        // Utility class
    }

    /** Parses a JSON string into a GraphDefinition. */
    public static GraphDefinition parse(String json) {
        try {
            return validate(MAPPER.readValue(json, GraphDefinition.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed graph definition: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses a JSON file into a GraphDefinition. */
    public static GraphDefinition parseFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load graph definition from " + path, e);
        }
    }

    /** Parses a classpath resource, e.g. {@code "graphs/parse_graph.json"}. */
    public static GraphDefinition parseResource(String resource) {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null)
            cl = JsonGraphLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Graph resource not found: " + resource);
            return parse(in, resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load graph definition from " + resource, e);
        }
    }

    /** Serializes a definition back to indented JSON. */
    public static String toJson(GraphDefinition def) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(def);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize graph definition", e);
        }
    }

    private static GraphDefinition parse(InputStream in, String origin) throws IOException {
        try {
            return validate(MAPPER.readValue(in, GraphDefinition.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Malformed graph definition in " + origin + ": " + e.getOriginalMessage(), e);
        }
    }

    private static GraphDefinition validate(GraphDefinition def) {
        if (def == null || def.getGraph() == null)
            throw new IllegalArgumentException("Missing 'graph' key");
        return def;
    }
}
