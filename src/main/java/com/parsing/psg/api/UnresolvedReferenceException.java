package com.parsing.psg.api;

/** An edge names a successor that was never declared. */
public final class UnresolvedReferenceException extends GraphBuildException {
    public UnresolvedReferenceException(String from, String to) {
        super(Kind.UNRESOLVED_REFERENCE,
                to + ": Failed to find definition for state in parse graph (referenced from " + from + ").",
                from, to);
    }

    public String from() {
        return identifiers().get(0);
    }

    public String to() {
        return identifiers().get(1);
    }
}
