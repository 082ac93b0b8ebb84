package com.parsing.psg.api;

import java.util.List;

/**
 * Raised when a graph description cannot be turned into a valid graph.
 *
 * A build failure is always fatal: no partially constructed graph is ever
 * returned, and callers must not attempt enumeration.
 */
public abstract class GraphBuildException extends IllegalArgumentException {
    /** The category of a build failure. */
    public enum Kind {
        DUPLICATE_NODE,
        UNRESOLVED_REFERENCE,
        MISSING_ENTRY,
        INVALID_NAME
    }

    private final Kind kind;
    private final List<String> identifiers;

    protected GraphBuildException(Kind kind, String message, String... identifiers) {
        super(message);
        this.kind = kind;
        this.identifiers = List.of(identifiers);
    }

    public Kind kind() {
        return kind;
    }

    /** The offending node name(s), in the order the concrete exception defines. */
    public List<String> identifiers() {
        return identifiers;
    }
}
