package com.phasegate.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of an {@code advancePhase} request.
 *
 * @param accepted  whether the transition committed (or was an accepted no-op)
 * @param phase     the task's phase after the call
 * @param reasons   every failed check on rejection; advisory notes on acceptance
 * @param rejection category of the rejection, null when accepted
 */
public record TransitionResult(
    boolean accepted,
    Phase phase,
    List<String> reasons,
    RejectionCategory rejection
) implements Serializable {

    public TransitionResult {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static TransitionResult accepted(Phase phase, List<String> reasons) {
        return new TransitionResult(true, phase, reasons, null);
    }

    public static TransitionResult rejected(Phase phase, RejectionCategory category, List<String> reasons) {
        return new TransitionResult(false, phase, reasons, category);
    }
}
