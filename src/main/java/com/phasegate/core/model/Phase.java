package com.phasegate.core.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The stages of a task's work cycle, in the order they must be completed.
 * <p>
 * {@link #CLOSED} is a virtual terminal state. It is not part of {@link #WORK_SEQUENCE}
 * and can only be reached from {@link #MONITOR} by closing the cycle.
 */
public enum Phase {
    STRATEGIZE,
    SPEC,
    PLAN,
    THINK,
    IMPLEMENT,
    VERIFY,
    REVIEW,
    PR,
    MONITOR,
    CLOSED;

    /** The fixed working order. Ordering decisions go through {@link #index()}, never names. */
    public static final List<Phase> WORK_SEQUENCE = List.of(
            STRATEGIZE, SPEC, PLAN, THINK, IMPLEMENT, VERIFY, REVIEW, PR, MONITOR);

    private static final Map<Phase, Integer> INDEX = new EnumMap<>(Phase.class);

    static {
        for (int i = 0; i < WORK_SEQUENCE.size(); i++) {
            INDEX.put(WORK_SEQUENCE.get(i), i);
        }
        INDEX.put(CLOSED, WORK_SEQUENCE.size());
    }

    /**
     * Position of this phase in the work order. CLOSED sorts after MONITOR.
     */
    public int index() {
        return INDEX.get(this);
    }

    public boolean isTerminal() {
        return this == CLOSED;
    }

    public boolean precedes(Phase other) {
        return index() < other.index();
    }

    /**
     * The phase immediately after this one, or empty for MONITOR and CLOSED.
     */
    public Optional<Phase> next() {
        int i = index() + 1;
        if (this == CLOSED || i >= WORK_SEQUENCE.size()) {
            return Optional.empty();
        }
        return Optional.of(WORK_SEQUENCE.get(i));
    }

    /**
     * Phases strictly between {@code from} and {@code to} in the work order.
     */
    public static List<Phase> between(Phase from, Phase to) {
        int lo = from.index() + 1;
        int hi = to.index();
        if (lo >= hi) {
            return List.of();
        }
        return WORK_SEQUENCE.subList(lo, Math.min(hi, WORK_SEQUENCE.size()));
    }

    /**
     * Case-insensitive lookup.
     *
     * @throws InvalidPhaseException when the name is blank or not a phase
     */
    public static Phase parse(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidPhaseException("Phase name is blank");
        }
        try {
            return Phase.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidPhaseException("Unknown phase: " + name);
        }
    }
}
