package com.phasegate.core.model;

/**
 * Thrown for a malformed phase identifier, or a phase that cannot be requested directly.
 */
public class InvalidPhaseException extends PhasegateException {
    public InvalidPhaseException(String message) {
        super(message);
    }
}
