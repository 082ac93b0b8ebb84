package com.parsing.psg.api;

/** The mandatory entry node is not declared. */
public final class MissingEntryException extends GraphBuildException {
    public MissingEntryException(String entryName) {
        super(Kind.MISSING_ENTRY, "Failed to find state \"" + entryName + "\" in parse graph.", entryName);
    }

    public String entryName() {
        return identifiers().get(0);
    }
}
