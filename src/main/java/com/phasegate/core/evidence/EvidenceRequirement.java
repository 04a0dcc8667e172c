package com.phasegate.core.evidence;

import java.io.Serializable;

/**
 * Minimum proof a phase must collect before it counts as complete.
 */
public record EvidenceRequirement(
    int minTests,
    int minCalls,
    int minArtifacts
) implements Serializable {

    public static final EvidenceRequirement NONE = new EvidenceRequirement(0, 0, 0);

    public EvidenceRequirement {
        if (minTests < 0 || minCalls < 0 || minArtifacts < 0) {
            throw new IllegalArgumentException("Evidence minimums must not be negative");
        }
    }

    public EvidenceRequirement(int minTests, int minCalls) {
        this(minTests, minCalls, 0);
    }
}
