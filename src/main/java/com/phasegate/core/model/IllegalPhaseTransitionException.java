package com.phasegate.core.model;

/**
 * Thrown when a transition is structurally impossible, such as closing a cycle before MONITOR.
 */
public class IllegalPhaseTransitionException extends PhasegateException {
    public IllegalPhaseTransitionException(String message) {
        super(message);
    }
}
