package com.phasegate.core.model;

/**
 * Thrown when an operation is called with a malformed task identifier.
 */
public class UnknownOperationException extends PhasegateException {
    public UnknownOperationException(String message) {
        super(message);
    }
}
