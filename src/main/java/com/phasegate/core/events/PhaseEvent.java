package com.phasegate.core.events;

import com.phasegate.core.model.Phase;
import com.phasegate.core.model.PhaseTransition;
import com.phasegate.core.model.RejectionCategory;
import com.phasegate.core.model.TransitionKind;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Something that happened to a task's cycle, published after the state change is final.
 *
 * @param fromPhase          null for a cycle start
 * @param toPhase            the committed phase, or the refused target on a rejection
 * @param kind               null on a rejection
 * @param rejection          null unless {@code type} is {@link PhaseEventType#PHASE_REJECTED}
 * @param reasons            failed checks on a rejection, advisories on a commit
 * @param evidenceArtifacts  references finalized for the phase that was left
 * @param evidenceValidated  whether that evidence met its requirement
 */
public record PhaseEvent(
    PhaseEventType type,
    String taskId,
    Phase fromPhase,
    Phase toPhase,
    TransitionKind kind,
    RejectionCategory rejection,
    List<String> reasons,
    List<String> evidenceArtifacts,
    boolean evidenceValidated,
    Instant timestamp
) implements Serializable {

    public PhaseEvent {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        evidenceArtifacts = evidenceArtifacts == null ? List.of() : List.copyOf(evidenceArtifacts);
    }

    public static PhaseEvent committed(String taskId, PhaseTransition transition,
                                       List<String> evidenceArtifacts, boolean evidenceValidated) {
        PhaseEventType type = switch (transition.outcome()) {
            case START -> PhaseEventType.CYCLE_STARTED;
            case CLOSE -> PhaseEventType.CYCLE_CLOSED;
            default -> PhaseEventType.PHASE_COMMITTED;
        };
        return new PhaseEvent(type, taskId, transition.fromPhase(), transition.toPhase(), transition.outcome(),
                null, transition.reasons(), evidenceArtifacts, evidenceValidated, transition.timestamp());
    }

    public static PhaseEvent rejected(String taskId, Phase current, Phase target, RejectionCategory category,
                                      List<String> reasons, Instant at) {
        return new PhaseEvent(PhaseEventType.PHASE_REJECTED, taskId, current, target, null, category, reasons,
                List.of(), false, at);
    }

    /** The task's phase once this event has happened. */
    public Phase phase() {
        return type == PhaseEventType.PHASE_REJECTED ? fromPhase : toPhase;
    }
}
