package com.phasegate.core.model;

import java.util.Set;

/**
 * Thrown at the call boundary when a {@link PhaseContext} lacks fields its phase's validator requires.
 */
public class InvalidPhaseContextException extends PhasegateException {

    private final Phase phase;
    private final Set<String> missingFields;

    public InvalidPhaseContextException(Phase phase, Set<String> missingFields) {
        super("Context for " + phase + " is missing required fields " + missingFields);
        this.phase = phase;
        this.missingFields = Set.copyOf(missingFields);
    }

    public Phase phase() {
        return phase;
    }

    public Set<String> missingFields() {
        return missingFields;
    }
}
