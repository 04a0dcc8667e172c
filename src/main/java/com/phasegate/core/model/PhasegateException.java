package com.phasegate.core.model;

/**
 * Root of the unchecked exceptions thrown for caller errors.
 * Recoverable rejections are never thrown; they come back as a {@link TransitionResult}.
 */
public class PhasegateException extends RuntimeException {
    public PhasegateException(String message) {
        super(message);
    }

    public PhasegateException(String message, Throwable cause) {
        super(message, cause);
    }
}
