package com.phasegate.core.evidence;

import java.io.Serializable;

/**
 * Tallies of verified work for one task and phase.
 */
public record ProvenCounts(
    int realCalls,
    int mockedCalls,
    int testsRun,
    int testsPassed,
    int artifacts
) implements Serializable {

    public static final ProvenCounts ZERO = new ProvenCounts(0, 0, 0, 0, 0);
}
