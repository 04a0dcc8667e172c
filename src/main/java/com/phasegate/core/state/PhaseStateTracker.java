package com.phasegate.core.state;

import com.phasegate.core.attestation.AttestationResult;
import com.phasegate.core.evidence.EvidenceVerdict;
import com.phasegate.core.model.CycleClosedException;
import com.phasegate.core.model.Phase;
import com.phasegate.core.model.PhaseTransition;
import com.phasegate.core.model.TransitionKind;
import com.phasegate.core.model.UnknownTaskException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns every task's cycle for one enforcer.
 * <p>
 * Callers that read-then-write must hold {@link #lock(String)} for the task. Individual
 * mutations are atomic on their own, so snapshots taken without the lock are always consistent.
 */
public class PhaseStateTracker {

    private static final Logger log = LoggerFactory.getLogger(PhaseStateTracker.class);

    private final ConcurrentHashMap<String, TaskCycle> cycles = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Clock clock;

    public PhaseStateTracker(Clock clock) {
        this.clock = clock;
    }

    public ReentrantLock lock(String taskId) {
        return locks.computeIfAbsent(taskId, k -> new ReentrantLock());
    }

    /**
     * Creates the cycle at STRATEGIZE with a START entry. Returns the existing cycle
     * unchanged when one is already present.
     */
    public CycleSnapshot open(String taskId, String baselineHash) {
        var created = new boolean[1];
        TaskCycle cycle = cycles.computeIfAbsent(taskId, id -> {
            created[0] = true;
            return new TaskCycle(id);
        });
        if (created[0]) {
            cycle.setBaseline(baselineHash);
            cycle.append(new PhaseTransition(nextTimestamp(cycle), null, Phase.STRATEGIZE,
                    TransitionKind.START, List.of()));
            log.info("Opened cycle for task {}", taskId);
        }
        return cycle.snapshot();
    }

    public Optional<CycleSnapshot> find(String taskId) {
        TaskCycle cycle = cycles.get(taskId);
        return cycle != null ? Optional.of(cycle.snapshot()) : Optional.empty();
    }

    /**
     * @throws UnknownTaskException when the task has no cycle
     */
    public CycleSnapshot snapshot(String taskId) {
        return require(taskId).snapshot();
    }

    public Set<String> taskIds() {
        return Set.copyOf(cycles.keySet());
    }

    /**
     * Moves the cycle to {@code target} and appends the history entry.
     */
    public PhaseTransition commit(String taskId, Phase target, TransitionKind kind, List<String> reasons) {
        TaskCycle cycle = requireOpen(taskId);
        var transition = new PhaseTransition(nextTimestamp(cycle), cycle.currentPhase(), target, kind, reasons);
        cycle.append(transition);
        return transition;
    }

    public void recordEvidence(String taskId, EvidenceVerdict verdict) {
        require(taskId).putEvidence(verdict);
    }

    /**
     * Drops stored verdicts for every phase after {@code phase}.
     */
    public void clearEvidenceAfter(String taskId, Phase phase) {
        require(taskId).clearEvidenceAfter(phase);
    }

    public void recordAttestation(String taskId, AttestationResult result) {
        require(taskId).recordAttestation(result);
    }

    public void recordBaseline(String taskId, String baselineHash) {
        requireOpen(taskId).setBaseline(baselineHash);
    }

    public PhaseTransition close(String taskId) {
        TaskCycle cycle = requireOpen(taskId);
        var transition = new PhaseTransition(nextTimestamp(cycle), cycle.currentPhase(), Phase.CLOSED,
                TransitionKind.CLOSE, List.of());
        cycle.append(transition);
        log.info("Closed cycle for task {}", taskId);
        return transition;
    }

    private TaskCycle require(String taskId) {
        TaskCycle cycle = cycles.get(taskId);
        if (cycle == null) {
            throw new UnknownTaskException(taskId);
        }
        return cycle;
    }

    private TaskCycle requireOpen(String taskId) {
        TaskCycle cycle = require(taskId);
        if (cycle.isClosed()) {
            throw new CycleClosedException(taskId);
        }
        return cycle;
    }

    // Strictly increasing even when the clock is coarse or stands still
    private Instant nextTimestamp(TaskCycle cycle) {
        Instant now = clock.instant();
        Instant last = cycle.lastTimestamp();
        if (last != null && !now.isAfter(last)) {
            return last.plusNanos(1);
        }
        return now;
    }
}
