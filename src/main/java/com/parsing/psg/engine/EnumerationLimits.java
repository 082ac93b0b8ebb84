package com.parsing.psg.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional budgets bounding a single enumeration.
 *
 * Without limits an enumeration always terminates (no (node, edge) pair can be
 * reused within one path, so depth never exceeds edgeCount + 1), but the
 * number of paths on dense graphs grows super-linearly. Limits make that cost
 * explicit for untrusted input. A value of 0 disables the corresponding check.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EnumerationLimits {
    /** Maximum number of occurrences on the path at any time. */
    private int maxDepth;

    /** Maximum number of node visits over the whole enumeration. */
    private long maxVisits;

    public static EnumerationLimits unbounded() {
        return new EnumerationLimits(0, 0);
    }

    public boolean isUnbounded() {
        return maxDepth <= 0 && maxVisits <= 0;
    }
}
