package com.phasegate.core.state;

import com.phasegate.core.evidence.EvidenceVerdict;
import com.phasegate.core.model.Phase;
import com.phasegate.core.model.PhaseTransition;

import java.io.Serializable;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable copy of a task's cycle, safe to hand to callers.
 */
public record CycleSnapshot(
    String taskId,
    Phase currentPhase,
    boolean closed,
    List<PhaseTransition> history,
    Map<Phase, EvidenceVerdict> evidenceState,
    AttestationState attestation
) implements Serializable {

    public CycleSnapshot {
        history = List.copyOf(history);
        evidenceState = Map.copyOf(evidenceState);
    }

    public Optional<EvidenceVerdict> evidence(Phase phase) {
        return Optional.ofNullable(evidenceState.get(phase));
    }

    public Optional<PhaseTransition> lastTransition() {
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }
}
