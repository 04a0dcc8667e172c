package com.phasegate.core.events;

/**
 * Kinds of {@link PhaseEvent}, each with the dotted name used in logs.
 */
public enum PhaseEventType {
    CYCLE_STARTED("cycle.started"),
    PHASE_COMMITTED("phase.committed"),
    PHASE_REJECTED("phase.rejected"),
    CYCLE_CLOSED("cycle.closed");

    private final String wireName;

    PhaseEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** True for events that moved the phase pointer. */
    public boolean committed() {
        return this != PHASE_REJECTED;
    }
}
