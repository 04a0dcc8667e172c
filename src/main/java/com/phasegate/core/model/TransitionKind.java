package com.phasegate.core.model;

/**
 * How a committed history entry moved the phase pointer.
 */
public enum TransitionKind {
    START,
    ADVANCE,
    SKIP,
    BACKTRACK,
    CLOSE
}
