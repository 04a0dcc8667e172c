package com.phasegate.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A committed entry in a task's phase history.
 *
 * @param timestamp when the transition committed; strictly increasing within a cycle
 * @param fromPhase phase before the transition, null for the cycle start
 * @param toPhase   phase after the transition
 * @param outcome   how the pointer moved
 * @param reasons   advisory notes attached to the commit (e.g. medium drift)
 */
public record PhaseTransition(
    Instant timestamp,
    Phase fromPhase,
    Phase toPhase,
    TransitionKind outcome,
    List<String> reasons
) implements Serializable {

    public PhaseTransition {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
