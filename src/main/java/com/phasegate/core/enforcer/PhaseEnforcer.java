package com.phasegate.core.enforcer;

import com.phasegate.core.attestation.AttestationResult;
import com.phasegate.core.attestation.AttestationStrategy;
import com.phasegate.core.attestation.DriftSeverity;
import com.phasegate.core.events.PhaseEvent;
import com.phasegate.core.events.PhaseEventBus;
import com.phasegate.core.evidence.EvidenceRequirement;
import com.phasegate.core.evidence.EvidenceStrategy;
import com.phasegate.core.evidence.EvidenceVerdict;
import com.phasegate.core.lease.LeaseContendedException;
import com.phasegate.core.lease.LeaseOutcome;
import com.phasegate.core.lease.PhaseLease;
import com.phasegate.core.lease.PhaseLeaseManager;
import com.phasegate.core.logging.MdcContext;
import com.phasegate.core.metrics.PhasegateMetrics;
import com.phasegate.core.model.AdvanceOptions;
import com.phasegate.core.model.CycleClosedException;
import com.phasegate.core.model.IllegalPhaseTransitionException;
import com.phasegate.core.model.InvalidPhaseException;
import com.phasegate.core.model.Phase;
import com.phasegate.core.model.PhaseContext;
import com.phasegate.core.model.PhaseTransition;
import com.phasegate.core.model.RejectionCategory;
import com.phasegate.core.model.TransitionIntent;
import com.phasegate.core.model.TransitionKind;
import com.phasegate.core.model.TransitionResult;
import com.phasegate.core.model.UnknownOperationException;
import com.phasegate.core.state.CycleSnapshot;
import com.phasegate.core.state.PhaseStateTracker;
import com.phasegate.core.telemetry.ActiveSpan;
import com.phasegate.core.telemetry.AuditCounters;
import com.phasegate.core.telemetry.SpanNames;
import com.phasegate.core.telemetry.SpanStatus;
import com.phasegate.core.telemetry.TelemetryEmitter;
import com.phasegate.core.validation.ValidationResult;
import com.phasegate.core.validation.ValidationStrategy;
import com.phasegate.core.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives a task through the fixed phase order and refuses transitions the task has not earned.
 * <p>
 * Every request is classified against the current phase. Forward moves must pass the phase's
 * validator and evidence requirement; skips need an explicit override plus evidence for every
 * phase jumped over; backtracks are free. Instruction drift is checked on every move and high
 * drift blocks it outright. Calls for one task are serialized; different tasks proceed in parallel.
 * When phase leases are enabled, a move is refused while another agent holds the lease on the
 * current or target phase.
 * <p>
 * Rejections are returned as {@link TransitionResult}s naming the category and every failed check.
 * Only caller errors (unknown task, bad phase, missing context, closed cycle) are thrown.
 * Every committed or refused move is published on the {@link PhaseEventBus}.
 */
public class PhaseEnforcer {

    private static final Logger log = LoggerFactory.getLogger(PhaseEnforcer.class);

    private final PhaseStateTracker tracker;
    private final ValidationStrategy validation;
    private final EvidenceStrategy evidence;
    private final AttestationStrategy attestation;
    private final TelemetryEmitter telemetry;
    private final PhaseEventBus events;
    private final PhaseLeaseManager leases;
    private final PhasegateMetrics metrics;
    private final ExecutorService gateExecutor;
    private final Duration defaultTimeout;
    private final Clock clock;

    /**
     * @param leases  nullable, phases are not leased when absent
     * @param metrics nullable
     */
    public PhaseEnforcer(PhaseStateTracker tracker,
                         ValidationStrategy validation,
                         EvidenceStrategy evidence,
                         AttestationStrategy attestation,
                         TelemetryEmitter telemetry,
                         PhaseEventBus events,
                         PhaseLeaseManager leases,
                         PhasegateMetrics metrics,
                         ExecutorService gateExecutor,
                         Duration defaultTimeout,
                         Clock clock) {
        this.tracker = tracker;
        this.validation = validation;
        this.evidence = evidence;
        this.attestation = attestation;
        this.telemetry = telemetry;
        this.events = events;
        this.leases = leases;
        this.metrics = metrics;
        this.gateExecutor = gateExecutor;
        this.defaultTimeout = defaultTimeout;
        this.clock = clock;
    }

    // --- Lifecycle ---

    public Phase startCycle(String taskId) {
        return startCycle(taskId, null);
    }

    /**
     * Opens a cycle at STRATEGIZE. Calling again on an open cycle returns its current phase
     * and records nothing.
     *
     * @param holder agent id taking the STRATEGIZE lease; null uses the lease manager's own id
     * @throws UnknownOperationException when the taskId is blank
     * @throws CycleClosedException      when the task's cycle has already been closed
     * @throws LeaseContendedException   when another agent holds the STRATEGIZE lease
     */
    public Phase startCycle(String taskId, String holder) {
        requireTaskId(taskId);
        Map<String, String> callerMdc = MdcContext.snapshot();
        ReentrantLock lock = tracker.lock(taskId);
        lock.lock();
        try {
            MdcContext.setTask(taskId);
            Optional<CycleSnapshot> existing = tracker.find(taskId);
            if (existing.isPresent()) {
                if (existing.get().closed()) {
                    throw new CycleClosedException(taskId);
                }
                log.debug("Cycle for task {} already open at {}", taskId, existing.get().currentPhase());
                return existing.get().currentPhase();
            }

            if (leases != null) {
                LeaseOutcome lease = leases.acquire(taskId, Phase.STRATEGIZE, holder);
                if (!lease.granted()) {
                    recordContention(taskId, Phase.STRATEGIZE, lease.holder());
                    throw new LeaseContendedException(taskId, lease);
                }
            }

            evidence.startCollection(Phase.STRATEGIZE, taskId);
            String baseline = establishBaseline(taskId);
            CycleSnapshot cycle = tracker.open(taskId, baseline);
            PhaseTransition start = cycle.history().get(0);

            events.publish(PhaseEvent.committed(taskId, start, List.of(), false));
            ActiveSpan span = telemetry.startSpan(SpanNames.STATE_TRANSITION, spanAttributes(taskId, start));
            span.setAttribute("outcome", "committed");
            span.end(SpanStatus.OK);
            if (metrics != null) {
                metrics.recordTransition(kindTag(TransitionKind.START));
            }
            log.info("Started work cycle for task {}", taskId);
            return Phase.STRATEGIZE;
        } finally {
            lock.unlock();
            MdcContext.restore(callerMdc);
        }
    }

    public TransitionResult advancePhase(String taskId) {
        return advancePhase(taskId, null, AdvanceOptions.DEFAULT);
    }

    public TransitionResult advancePhase(String taskId, Phase requestedPhase) {
        return advancePhase(taskId, requestedPhase, AdvanceOptions.DEFAULT);
    }

    /**
     * Requests a move to {@code requestedPhase}, or to the next phase when it is null.
     *
     * @throws UnknownOperationException    when the taskId is blank
     * @throws com.phasegate.core.model.UnknownTaskException when the task was never started
     * @throws CycleClosedException         when the cycle is closed
     * @throws InvalidPhaseException        when CLOSED is requested; use {@link #close(String)}
     * @throws com.phasegate.core.model.InvalidPhaseContextException when a validator's required field is absent
     */
    public TransitionResult advancePhase(String taskId, Phase requestedPhase, AdvanceOptions options) {
        requireTaskId(taskId);
        if (requestedPhase == Phase.CLOSED) {
            throw new InvalidPhaseException("CLOSED is reached through close(), not advancePhase");
        }
        AdvanceOptions opts = options != null ? options : AdvanceOptions.DEFAULT;

        Map<String, String> callerMdc = MdcContext.snapshot();
        ReentrantLock lock = tracker.lock(taskId);
        lock.lock();
        long startNanos = System.nanoTime();
        try {
            MdcContext.setTask(taskId);
            CycleSnapshot cycle = tracker.snapshot(taskId);
            if (cycle.closed()) {
                throw new CycleClosedException(taskId);
            }
            Phase current = cycle.currentPhase();
            MdcContext.setPhase(taskId, current.name());

            Phase expectedNext = current.next().orElse(null);
            Phase target = requestedPhase != null ? requestedPhase : expectedNext;
            if (target == null) {
                log.debug("Task {} is at {} with nothing to advance to", taskId, current);
                return TransitionResult.accepted(current, List.of());
            }

            TransitionIntent intent = TransitionIntent.classify(current, expectedNext, target);
            if (intent == TransitionIntent.NO_OP) {
                return TransitionResult.accepted(current, List.of());
            }

            TransitionResult result = evaluate(taskId, current, target, intent, opts);
            if (metrics != null) {
                metrics.recordAdvanceDuration(result.accepted() ? "accepted" : "rejected",
                        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
            }
            return result;
        } finally {
            lock.unlock();
            MdcContext.restore(callerMdc);
        }
    }

    /**
     * Closes a cycle that has reached MONITOR. The closed cycle stays queryable.
     *
     * @throws IllegalPhaseTransitionException when the cycle is not at MONITOR
     */
    public CycleSnapshot close(String taskId) {
        requireTaskId(taskId);
        Map<String, String> callerMdc = MdcContext.snapshot();
        ReentrantLock lock = tracker.lock(taskId);
        lock.lock();
        try {
            MdcContext.setTask(taskId);
            CycleSnapshot cycle = tracker.snapshot(taskId);
            if (cycle.closed()) {
                throw new CycleClosedException(taskId);
            }
            if (cycle.currentPhase() != Phase.MONITOR) {
                throw new IllegalPhaseTransitionException("Task " + taskId + " can only close from MONITOR, current phase is "
                        + cycle.currentPhase());
            }

            PhaseTransition closing = tracker.close(taskId);
            attestation.forget(taskId);
            evidence.forget(taskId);
            if (leases != null) {
                leases.releaseAll(taskId);
            }

            events.publish(PhaseEvent.committed(taskId, closing, List.of(), false));
            ActiveSpan span = telemetry.startSpan(SpanNames.STATE_TRANSITION, spanAttributes(taskId, closing));
            span.setAttribute("outcome", "committed");
            span.end(SpanStatus.OK);
            if (metrics != null) {
                metrics.recordTransition(kindTag(TransitionKind.CLOSE));
            }
            log.info("Closed work cycle for task {}", taskId);
            return tracker.snapshot(taskId);
        } finally {
            lock.unlock();
            MdcContext.restore(callerMdc);
        }
    }

    // --- Queries ---

    public Optional<Phase> currentPhase(String taskId) {
        requireTaskId(taskId);
        return tracker.find(taskId).map(CycleSnapshot::currentPhase);
    }

    public Optional<CycleSnapshot> cycle(String taskId) {
        requireTaskId(taskId);
        return tracker.find(taskId);
    }

    public List<PhaseTransition> history(String taskId) {
        requireTaskId(taskId);
        return tracker.find(taskId).map(CycleSnapshot::history).orElse(List.of());
    }

    // --- Registration ---

    public void registerValidator(Phase phase, Validator validator) {
        validation.registerValidator(phase, validator);
    }

    public void registerEvidenceRequirement(Phase phase, EvidenceRequirement requirement) {
        evidence.registerRequirement(phase, requirement);
    }

    /**
     * Operator action after a drift block: accept the task's current instructions as its baseline.
     *
     * @return the new baseline hash, empty when the instructions could not be read
     */
    public Optional<String> refreshBaseline(String taskId) {
        requireTaskId(taskId);
        ReentrantLock lock = tracker.lock(taskId);
        lock.lock();
        try {
            CycleSnapshot cycle = tracker.snapshot(taskId);
            if (cycle.closed()) {
                throw new CycleClosedException(taskId);
            }
            Optional<String> hash = attestation.refreshBaseline(taskId);
            hash.ifPresent(h -> tracker.recordBaseline(taskId, h));
            return hash;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Extends the holder's lease on the task's current phase, for work that outlasts one lease.
     */
    public LeaseOutcome renewLease(String taskId, String holder) {
        requireTaskId(taskId);
        if (leases == null) {
            return LeaseOutcome.refused("phase leases are disabled");
        }
        ReentrantLock lock = tracker.lock(taskId);
        lock.lock();
        try {
            CycleSnapshot cycle = tracker.snapshot(taskId);
            if (cycle.closed()) {
                throw new CycleClosedException(taskId);
            }
            return leases.renew(taskId, cycle.currentPhase(), holder);
        } finally {
            lock.unlock();
        }
    }

    // --- Transition evaluation ---

    private TransitionResult evaluate(String taskId, Phase current, Phase target,
                                      TransitionIntent intent, AdvanceOptions opts) {
        PhaseContext context = new PhaseContext(taskId, current, opts.context());
        List<Phase> intervening = Phase.between(current, target);
        boolean gated = intent == TransitionIntent.ADVANCE
                || (intent == TransitionIntent.SKIP && opts.override());

        // Missing context is a caller error, surfaced before any validator runs
        if (gated) {
            validation.requireContext(context);
            if (intent == TransitionIntent.SKIP) {
                intervening.forEach(p -> validation.requireContext(context.forPhase(p)));
            }
        }

        ActiveSpan span = telemetry.startSpan(SpanNames.STATE_TRANSITION, Map.of(
                "taskId", taskId,
                "fromPhase", current.name(),
                "toPhase", target.name(),
                "intent", intent.name()));

        if (leases != null) {
            Optional<PhaseLease> other = leases.heldByOther(taskId, current, opts.holder())
                    .or(() -> leases.heldByOther(taskId, target, opts.holder()));
            if (other.isPresent()) {
                PhaseLease lease = other.get();
                recordContention(taskId, lease.phase(), lease.holder());
                return reject(span, taskId, current, target, intent, RejectionCategory.LEASE_CONTENDED,
                        List.of("lease on " + lease.phase() + " held by " + lease.holder() + " until " + lease.expiresAt()));
            }
        }

        var failures = new ArrayList<String>();
        var advisories = new ArrayList<String>();
        RejectionCategory rejection = null;
        EvidenceVerdict currentVerdict = null;

        if (intent == TransitionIntent.SKIP) {
            telemetry.increment(AuditCounters.PHASE_SKIPS_ATTEMPTED, counterMetadata(taskId, current, target));
            if (!opts.override()) {
                failures.add("skip from " + current + " to " + target + " rejected, complete "
                        + intervening + " first or request an override");
                rejection = RejectionCategory.SKIP_REJECTED;
            }
        }

        if (gated) {
            List<Phase> toCheck = new ArrayList<>();
            toCheck.add(current);
            if (intent == TransitionIntent.SKIP) {
                toCheck.addAll(intervening);
            }
            GateOutcome gate = runGate(span, context, toCheck, timeoutFor(opts));
            currentVerdict = gate.verdictFor(current);

            boolean skipShortfall = false;
            for (Phase phase : toCheck) {
                List<String> problems = gate.problems(phase);
                if (phase != current && problems.isEmpty() && gate.noEvidence(phase)) {
                    // a skipped phase needs something on record even without a configured requirement
                    problems = List.of("no evidence recorded");
                }
                if (problems.isEmpty()) {
                    continue;
                }
                if (phase == current) {
                    failures.addAll(problems);
                } else {
                    skipShortfall = true;
                    failures.add("retroactive evidence missing for " + phase);
                    problems.forEach(p -> failures.add(phase + ": " + p));
                }
            }
            if (skipShortfall) {
                rejection = RejectionCategory.SKIP_REJECTED;
            } else if (!failures.isEmpty()) {
                rejection = RejectionCategory.VALIDATION_FAILURE;
            }
            if (!failures.isEmpty()) {
                telemetry.increment(AuditCounters.PHASE_VALIDATIONS_FAILED, counterMetadata(taskId, current, target));
            }
        }

        AttestationResult drift = checkDrift(taskId, target);
        if (drift != null && (drift.severity() == DriftSeverity.HIGH || drift.severity() == DriftSeverity.MEDIUM)) {
            var meta = counterMetadata(taskId, current, target);
            meta.put("severity", drift.severity().name());
            telemetry.increment(AuditCounters.PROMPT_DRIFT_DETECTED, meta);
            if (drift.severity() == DriftSeverity.HIGH) {
                failures.add("drift: " + drift.details() + " (" + drift.recommendation() + ")");
                rejection = RejectionCategory.DRIFT_BLOCKED;
            } else {
                advisories.add("drift: " + drift.details());
            }
        }

        if (rejection == null && leases != null) {
            LeaseOutcome lease = leases.acquire(taskId, target, opts.holder());
            if (!lease.granted()) {
                recordContention(taskId, target, lease.holder());
                failures.add(lease.reason());
                rejection = RejectionCategory.LEASE_CONTENDED;
            }
        }

        if (rejection != null) {
            return reject(span, taskId, current, target, intent, rejection, failures);
        }
        return commit(span, taskId, current, target, intent, advisories, currentVerdict, opts.holder());
    }

    private TransitionResult commit(ActiveSpan span, String taskId, Phase current, Phase target,
                                    TransitionIntent intent, List<String> advisories, EvidenceVerdict verdict,
                                    String holder) {
        if (intent == TransitionIntent.BACKTRACK) {
            telemetry.increment(AuditCounters.PHASE_BACKTRACKS, counterMetadata(taskId, current, target));
            tracker.clearEvidenceAfter(taskId, target);
            for (Phase phase : Phase.WORK_SEQUENCE) {
                if (phase.index() > target.index()) {
                    evidence.clear(taskId, phase);
                }
            }
        }

        TransitionKind kind = intent.toKind();
        PhaseTransition transition = tracker.commit(taskId, target, kind, advisories);
        evidence.startCollection(target, taskId);
        if (leases != null) {
            leases.release(taskId, current, holder);
        }

        List<String> artifacts = verdict != null ? verdict.artifactReferences() : List.of();
        boolean validated = verdict != null && verdict.meetsCompletionCriteria();
        events.publish(PhaseEvent.committed(taskId, transition, artifacts, validated));

        span.setAttribute("outcome", "committed");
        span.setAttribute("kind", kind.name());
        if (!advisories.isEmpty()) {
            span.setAttribute("reasons", List.copyOf(advisories));
        }
        span.end(SpanStatus.OK);
        if (metrics != null) {
            metrics.recordTransition(kindTag(kind));
        }

        log.info("Task {} moved {} -> {} ({})", taskId, current, target, kind);
        return TransitionResult.accepted(target, advisories);
    }

    private TransitionResult reject(ActiveSpan span, String taskId, Phase current, Phase target,
                                    TransitionIntent intent, RejectionCategory category, List<String> reasons) {
        events.publish(PhaseEvent.rejected(taskId, current, target, category, reasons, clock.instant()));

        span.updateName(SpanNames.PROCESS_VALIDATION);
        span.setAttribute("outcome", "rejected");
        span.setAttribute("category", category.name());
        span.setAttribute("reasons", List.copyOf(reasons));
        span.end(SpanStatus.ERROR);
        if (metrics != null) {
            metrics.recordRejection(category.name().toLowerCase(Locale.ROOT));
        }

        log.warn("Task {} refused {} -> {} ({}): {}", taskId, current, target, category, reasons);
        return TransitionResult.rejected(current, category, reasons);
    }

    /**
     * Validates and finalizes evidence for each phase on the gate executor. The whole batch shares
     * one deadline; on timeout the worker is interrupted and nothing from the batch is recorded.
     */
    private GateOutcome runGate(ActiveSpan parent, PhaseContext context, List<Phase> phases, Duration timeout) {
        ActiveSpan gateSpan = parent.child("phase.gate", Map.of("phases", phases.stream().map(Phase::name).toList()));
        String taskId = context.taskId();

        Callable<GateOutcome> gate = () -> {
            var outcome = new GateOutcome();
            for (Phase phase : phases) {
                outcome.put(phase, validateSafely(context.forPhase(phase)), evidence.finalize(taskId, phase));
            }
            return outcome;
        };
        Future<GateOutcome> future = gateExecutor.submit(MdcContext.propagate(gate));

        try {
            GateOutcome outcome = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            outcome.verdicts().forEach(v -> tracker.recordEvidence(taskId, v));
            gateSpan.end(outcome.allPassed() ? SpanStatus.OK : SpanStatus.ERROR);
            return outcome;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Validation for task {} timed out after {}ms", taskId, timeout.toMillis());
            gateSpan.setAttribute("timeout", true).end(SpanStatus.ERROR);
            return GateOutcome.failed(phases.get(0), "validation timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Evidence finalization for task {} failed: {}", taskId, cause.getMessage(), cause);
            gateSpan.end(SpanStatus.ERROR);
            return GateOutcome.failed(phases.get(0), "evidence check failed: " + cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            gateSpan.end(SpanStatus.ERROR);
            return GateOutcome.failed(phases.get(0), "validation interrupted");
        }
    }

    private ValidationResult validateSafely(PhaseContext context) {
        try {
            return validation.validate(context);
        } catch (RuntimeException e) {
            log.warn("Validator for {} threw: {}", context.phase(), e.getMessage(), e);
            return ValidationResult.fail("validator for " + context.phase() + " threw: " + e.getMessage());
        }
    }

    private AttestationResult checkDrift(String taskId, Phase target) {
        try {
            AttestationResult result = attestation.check(taskId, target);
            if (result != null) {
                tracker.recordAttestation(taskId, result);
            }
            return result;
        } catch (RuntimeException e) {
            // attestation fails open
            log.warn("Drift check for task {} entering {} failed, treating as no drift: {}",
                    taskId, target, e.getMessage());
            return null;
        }
    }

    private String establishBaseline(String taskId) {
        try {
            return attestation.establishBaseline(taskId).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Could not establish instruction baseline for task {}: {}", taskId, e.getMessage());
            return null;
        }
    }

    // --- Side channels ---

    private void recordContention(String taskId, Phase phase, String holder) {
        var meta = new LinkedHashMap<String, Object>();
        meta.put("taskId", taskId);
        meta.put("phase", phase.name());
        if (holder != null) {
            meta.put("holder", holder);
        }
        telemetry.increment(AuditCounters.PHASE_LEASE_CONTENTION, meta);
    }

    private Duration timeoutFor(AdvanceOptions opts) {
        return opts.timeout() != null ? opts.timeout() : defaultTimeout;
    }

    private static Map<String, Object> spanAttributes(String taskId, PhaseTransition transition) {
        var attributes = new LinkedHashMap<String, Object>();
        attributes.put("taskId", taskId);
        if (transition.fromPhase() != null) {
            attributes.put("fromPhase", transition.fromPhase().name());
        }
        attributes.put("toPhase", transition.toPhase().name());
        attributes.put("kind", transition.outcome().name());
        return attributes;
    }

    private static Map<String, Object> counterMetadata(String taskId, Phase from, Phase to) {
        var meta = new LinkedHashMap<String, Object>();
        meta.put("taskId", taskId);
        meta.put("fromPhase", from.name());
        meta.put("toPhase", to.name());
        return meta;
    }

    private static String kindTag(TransitionKind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }

    private static void requireTaskId(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new UnknownOperationException("taskId must not be blank");
        }
    }
}
