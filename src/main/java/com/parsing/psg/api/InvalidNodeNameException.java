package com.parsing.psg.api;

/** A node or successor name is null or empty. */
public final class InvalidNodeNameException extends GraphBuildException {
    public InvalidNodeNameException(String name) {
        super(Kind.INVALID_NAME, "Invalid state name: '" + name + "'", String.valueOf(name));
    }

    /** A successor of {@code from} has an invalid name. */
    public InvalidNodeNameException(String from, String name) {
        super(Kind.INVALID_NAME, "Invalid state name: '" + name + "' (referenced from " + from + ")", from,
                String.valueOf(name));
    }

    /** The invalid name, rendered as {@code "null"} when absent. */
    public String name() {
        return identifiers().get(identifiers().size() - 1);
    }
}
