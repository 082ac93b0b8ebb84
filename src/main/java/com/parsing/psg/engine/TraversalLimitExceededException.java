package com.parsing.psg.engine;

/**
 * Thrown when an enumeration exceeds a configured {@link EnumerationLimits}
 * budget. Results discovered so far are discarded.
 */
public final class TraversalLimitExceededException extends IllegalStateException {
    private final ParsePath partialPath;

    public TraversalLimitExceededException(String message, ParsePath partialPath) {
        super(message + " at: " + partialPath);
        this.partialPath = partialPath;
    }

    /** The path being extended when the budget ran out. */
    public ParsePath partialPath() {
        return partialPath;
    }
}
