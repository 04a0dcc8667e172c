package com.phasegate.core.state;

import com.phasegate.core.attestation.AttestationResult;
import com.phasegate.core.evidence.EvidenceVerdict;
import com.phasegate.core.model.Phase;
import com.phasegate.core.model.PhaseTransition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable cycle record. Only {@link PhaseStateTracker} mutates it; everyone else sees
 * {@link CycleSnapshot}s.
 */
final class TaskCycle {

    private final String taskId;
    private Phase currentPhase = Phase.STRATEGIZE;
    private boolean closed;
    private final List<PhaseTransition> history = new ArrayList<>();
    private final Map<Phase, EvidenceVerdict> evidenceState = new EnumMap<>(Phase.class);
    private AttestationState attestation = AttestationState.baseline(null);

    TaskCycle(String taskId) {
        this.taskId = taskId;
    }

    synchronized Phase currentPhase() {
        return currentPhase;
    }

    synchronized boolean isClosed() {
        return closed;
    }

    synchronized Instant lastTimestamp() {
        return history.isEmpty() ? null : history.get(history.size() - 1).timestamp();
    }

    synchronized void append(PhaseTransition transition) {
        history.add(transition);
        currentPhase = transition.toPhase();
        if (transition.toPhase().isTerminal()) {
            closed = true;
        }
    }

    synchronized void putEvidence(EvidenceVerdict verdict) {
        evidenceState.put(verdict.phase(), verdict);
    }

    synchronized void clearEvidenceAfter(Phase phase) {
        evidenceState.keySet().removeIf(p -> p.index() > phase.index());
    }

    synchronized void recordAttestation(AttestationResult result) {
        attestation = attestation.withCheck(result);
    }

    synchronized void setBaseline(String hash) {
        attestation = attestation.withBaseline(hash);
    }

    synchronized CycleSnapshot snapshot() {
        return new CycleSnapshot(taskId, currentPhase, closed, history, evidenceState, attestation);
    }
}
