package com.parsing.psg.api;

/** A node name was declared more than once. */
public final class DuplicateNodeException extends GraphBuildException {
    public DuplicateNodeException(String name) {
        super(Kind.DUPLICATE_NODE, name + ": Multiple states with same name in parse graph.", name);
    }

    public String name() {
        return identifiers().get(0);
    }
}
