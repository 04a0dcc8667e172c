package com.phasegate.core.model;

/**
 * Classification of a requested transition relative to the current phase.
 */
public enum TransitionIntent {
    NO_OP,
    ADVANCE,
    SKIP,
    BACKTRACK;

    /**
     * Classifies a move from {@code current} to {@code target}.
     *
     * @param expectedNext the phase after {@code current}, or null at MONITOR
     */
    public static TransitionIntent classify(Phase current, Phase expectedNext, Phase target) {
        if (target == current) {
            return NO_OP;
        }
        if (target == expectedNext) {
            return ADVANCE;
        }
        if (target.index() < current.index()) {
            return BACKTRACK;
        }
        return SKIP;
    }

    public TransitionKind toKind() {
        return switch (this) {
            case ADVANCE -> TransitionKind.ADVANCE;
            case SKIP -> TransitionKind.SKIP;
            case BACKTRACK -> TransitionKind.BACKTRACK;
            case NO_OP -> throw new IllegalStateException("NO_OP is never committed");
        };
    }
}
