package com.phasegate.core.enforcer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phasegate.core.attestation.AttestationMonitor;
import com.phasegate.core.attestation.AttestationResult;
import com.phasegate.core.attestation.AttestationStrategy;
import com.phasegate.core.attestation.DriftSeverity;
import com.phasegate.core.attestation.InstructionSource;
import com.phasegate.core.attestation.StructuralDriftClassifier;
import com.phasegate.core.events.PhaseEvent;
import com.phasegate.core.events.PhaseEventBus;
import com.phasegate.core.events.PhaseEventType;
import com.phasegate.core.evidence.EvidenceCollector;
import com.phasegate.core.evidence.EvidenceRequirement;
import com.phasegate.core.evidence.EvidenceStrategy;
import com.phasegate.core.evidence.EvidenceVerdict;
import com.phasegate.core.evidence.ProvenCounts;
import com.phasegate.core.lease.LeaseContendedException;
import com.phasegate.core.lease.LeaseOutcome;
import com.phasegate.core.lease.PhaseLeaseManager;
import com.phasegate.core.ledger.LedgerEntry;
import com.phasegate.core.ledger.LedgerRecorder;
import com.phasegate.core.ledger.PhaseLedger;
import com.phasegate.core.metrics.PhasegateMetrics;
import com.phasegate.core.model.AdvanceOptions;
import com.phasegate.core.model.CycleClosedException;
import com.phasegate.core.model.IllegalPhaseTransitionException;
import com.phasegate.core.model.InvalidPhaseContextException;
import com.phasegate.core.model.InvalidPhaseException;
import com.phasegate.core.model.Phase;
import com.phasegate.core.model.PhaseTransition;
import com.phasegate.core.model.RejectionCategory;
import com.phasegate.core.model.TransitionKind;
import com.phasegate.core.model.TransitionResult;
import com.phasegate.core.model.UnknownOperationException;
import com.phasegate.core.model.UnknownTaskException;
import com.phasegate.core.state.CycleSnapshot;
import com.phasegate.core.state.PhaseStateTracker;
import com.phasegate.core.telemetry.AuditCounters;
import com.phasegate.core.telemetry.JsonlTelemetryEmitter;
import com.phasegate.core.telemetry.SpanNames;
import com.phasegate.core.telemetry.SpanRecord;
import com.phasegate.core.telemetry.SpanStatus;
import com.phasegate.core.telemetry.TelemetryEmitter;
import com.phasegate.core.telemetry.TelemetryReader;
import com.phasegate.core.util.JsonMappers;
import com.phasegate.core.validation.ValidationGate;
import com.phasegate.core.validation.ValidationResult;
import com.phasegate.core.validation.ValidationStrategy;
import com.phasegate.core.validation.Validator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Behavioural tests for {@link PhaseEnforcer}, wired with real collaborators except the
 * instruction source, which each test controls.
 */
class PhaseEnforcerTest {

    private static final String TASK = "T1";
    private static final String INSTRUCTIONS = """
            You must record evidence for every phase.
            Never skip the review.
            Run the test suite before opening a PR.
            """;

    @TempDir
    Path dir;

    private final ObjectMapper mapper = JsonMappers.jsonl();
    private final Clock clock = Clock.systemUTC();

    private InstructionSource instructions;
    private PhaseStateTracker tracker;
    private ValidationGate gate;
    private EvidenceCollector collector;
    private AttestationMonitor attestation;
    private JsonlTelemetryEmitter telemetry;
    private TelemetryReader reader;
    private PhaseEventBus events;
    private PhaseLedger ledger;
    private SimpleMeterRegistry registry;
    private ExecutorService executor;
    private PhaseEnforcer enforcer;

    @BeforeEach
    void setUp() throws Exception {
        instructions = mock(InstructionSource.class);
        when(instructions.effectiveInstructions(anyString())).thenReturn(INSTRUCTIONS);

        tracker = new PhaseStateTracker(clock);
        gate = new ValidationGate();
        collector = new EvidenceCollector(Map.of(), clock);
        attestation = new AttestationMonitor(instructions, new StructuralDriftClassifier(), clock);
        registry = new SimpleMeterRegistry();
        telemetry = new JsonlTelemetryEmitter(dir.resolve("traces.jsonl"), dir.resolve("counters.jsonl"),
                mapper, clock, new PhasegateMetrics(registry));
        reader = new TelemetryReader(mapper);
        events = new PhaseEventBus();
        ledger = new PhaseLedger(dir.resolve("ledger.jsonl"), mapper, clock);
        executor = Executors.newFixedThreadPool(4);
        enforcer = newEnforcer(gate, collector, attestation, telemetry, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private PhaseEnforcer newEnforcer(ValidationStrategy validation, EvidenceStrategy evidence,
                                      AttestationStrategy attestationStrategy, TelemetryEmitter emitter,
                                      Duration timeout) {
        return newEnforcer(validation, evidence, attestationStrategy, emitter, timeout, executor, null);
    }

    private PhaseEnforcer newEnforcer(ValidationStrategy validation, EvidenceStrategy evidence,
                                      AttestationStrategy attestationStrategy, TelemetryEmitter emitter,
                                      Duration timeout, ExecutorService gateExecutor, PhaseLeaseManager leases) {
        return new PhaseEnforcer(tracker, validation, evidence, attestationStrategy, emitter, events, leases,
                new PhasegateMetrics(registry), gateExecutor, timeout, clock);
    }

    private void passEverywhere() {
        for (Phase phase : Phase.WORK_SEQUENCE) {
            enforcer.registerValidator(phase, ctx -> ValidationResult.pass());
        }
    }

    private void advanceTo(Phase target) {
        while (enforcer.currentPhase(TASK).orElseThrow() != target) {
            TransitionResult result = enforcer.advancePhase(TASK);
            assertTrue(result.accepted(), () -> "advance refused: " + result.reasons());
        }
    }

    private long counter(String name) throws IOException {
        return reader.readCounters(telemetry.countersFile()).stream()
                .filter(c -> c.counter().equals(name))
                .count();
    }

    private List<SpanRecord> spans(String name) throws IOException {
        return reader.readSpans(telemetry.spansFile()).stream()
                .filter(s -> s.name().equals(name))
                .toList();
    }

    private static AttestationResult drift(DriftSeverity severity) {
        return new AttestationResult(TASK, Phase.SPEC, severity, "base", "curr",
                severity.recommendation(), "guardrail keywords removed: never (1 -> 0)", Instant.now());
    }

    // -- startCycle -----------------------------------------------------------

    @Nested
    @DisplayName("startCycle")
    class StartCycleTests {

        @Test
        @DisplayName("puts the task at STRATEGIZE")
        void startsAtStrategize() {
            assertEquals(Phase.STRATEGIZE, enforcer.startCycle(TASK));
            assertEquals(Phase.STRATEGIZE, enforcer.currentPhase(TASK).orElseThrow());
            assertEquals(TransitionKind.START, enforcer.history(TASK).get(0).outcome());
        }

        @Test
        @DisplayName("is idempotent on an open cycle")
        void idempotent() {
            passEverywhere();
            enforcer.startCycle(TASK);
            enforcer.advancePhase(TASK);

            assertEquals(Phase.SPEC, enforcer.startCycle(TASK));
            assertEquals(2, enforcer.history(TASK).size());
        }

        @Test
        @DisplayName("records the instruction baseline")
        void recordsBaseline() {
            enforcer.startCycle(TASK);
            CycleSnapshot cycle = enforcer.cycle(TASK).orElseThrow();
            assertNotNull(cycle.attestation().baselineHash());
            assertEquals(attestation.baselineHash(TASK).orElseThrow(), cycle.attestation().baselineHash());
        }

        @Test
        @DisplayName("rejects a blank taskId")
        void blankTaskId() {
            assertThrows(UnknownOperationException.class, () -> enforcer.startCycle(""));
            assertThrows(UnknownOperationException.class, () -> enforcer.startCycle("   "));
            assertThrows(UnknownOperationException.class, () -> enforcer.advancePhase(null));
        }

        @Test
        @DisplayName("emits a committed transition span")
        void span() throws Exception {
            enforcer.startCycle(TASK);
            List<SpanRecord> transitions = spans(SpanNames.STATE_TRANSITION);
            assertEquals(1, transitions.size());
            assertEquals(SpanStatus.OK, transitions.get(0).status());
            assertEquals("START", transitions.get(0).attributes().get("kind"));
        }
    }

    // -- Fail-closed default ---------------------------------------------------

    @Nested
    @DisplayName("with nothing registered")
    class FailClosedTests {

        @Test
        @DisplayName("every advance is refused and counted once")
        void failsClosed() throws Exception {
            enforcer.startCycle(TASK);

            for (int i = 1; i <= 3; i++) {
                TransitionResult result = enforcer.advancePhase(TASK);
                assertFalse(result.accepted());
                assertEquals(RejectionCategory.VALIDATION_FAILURE, result.rejection());
                assertEquals(List.of("no validator registered for STRATEGIZE"), result.reasons());
                assertEquals(Phase.STRATEGIZE, enforcer.currentPhase(TASK).orElseThrow());
                assertEquals(i, counter(AuditCounters.PHASE_VALIDATIONS_FAILED));
            }
            assertEquals(1, enforcer.history(TASK).size());
        }

        @Test
        @DisplayName("a refused advance emits an error span with the reasons")
        void rejectionSpan() throws Exception {
            enforcer.startCycle(TASK);
            enforcer.advancePhase(TASK);

            List<SpanRecord> rejected = spans(SpanNames.PROCESS_VALIDATION);
            assertEquals(1, rejected.size());
            assertEquals(SpanStatus.ERROR, rejected.get(0).status());
            assertEquals("rejected", rejected.get(0).attributes().get("outcome"));
            assertEquals("VALIDATION_FAILURE", rejected.get(0).attributes().get("category"));
            assertEquals(List.of("no validator registered for STRATEGIZE"), rejected.get(0).attributes().get("reasons"));
        }
    }

    // -- Advance --------------------------------------------------------------

    @Nested
    @DisplayName("advance")
    class AdvanceTests {

        @Test
        @DisplayName("moves to the next phase when validation and evidence pass")
        void advances() throws Exception {
            passEverywhere();
            enforcer.startCycle(TASK);
            int before = enforcer.history(TASK).size();

            TransitionResult result = enforcer.advancePhase(TASK);

            assertTrue(result.accepted());
            assertEquals(Phase.SPEC, result.phase());
            assertNull(result.rejection());
            assertEquals(before + 1, enforcer.history(TASK).size());
            SpanRecord last = spans(SpanNames.STATE_TRANSITION).get(1);
            assertEquals(SpanStatus.OK, last.status());
            assertEquals("committed", last.attributes().get("outcome"));
        }

        @Test
        @DisplayName("naming the next phase explicitly is the same as advancing")
        void explicitNext() {
            passEverywhere();
            enforcer.startCycle(TASK);
            TransitionResult result = enforcer.advancePhase(TASK, Phase.SPEC);
            assertTrue(result.accepted());
            assertEquals(TransitionKind.ADVANCE, enforcer.history(TASK).get(1).outcome());
        }

        @Test
        @DisplayName("IMPLEMENT without a real tool call is refused")
        void missingRealToolCall() {
            passEverywhere();
            enforcer.registerEvidenceRequirement(Phase.IMPLEMENT, new EvidenceRequirement(0, 1));
            enforcer.startCycle(TASK);
            advanceTo(Phase.IMPLEMENT);

            EvidenceVerdict verdict = collector.finalize(TASK, Phase.IMPLEMENT);
            assertFalse(verdict.meetsCompletionCriteria());
            assertEquals(0, verdict.provenCounts().realCalls());

            TransitionResult result = enforcer.advancePhase(TASK);
            assertFalse(result.accepted());
            assertEquals(RejectionCategory.VALIDATION_FAILURE, result.rejection());
            assertTrue(result.reasons().contains("missing: real tool call"));
            assertEquals(Phase.IMPLEMENT, enforcer.currentPhase(TASK).orElseThrow());

            collector.recordToolCall(TASK, Phase.IMPLEMENT, "edit_file", false);
            assertTrue(enforcer.advancePhase(TASK).accepted());
        }

        @Test
        @DisplayName("validator errors and evidence shortfalls are all reported")
        void reportsEveryFailure() {
            enforcer.registerValidator(Phase.STRATEGIZE, ctx -> ValidationResult.fail("no goals", "no risks"));
            enforcer.registerEvidenceRequirement(Phase.STRATEGIZE, new EvidenceRequirement(0, 0, 1));
            enforcer.startCycle(TASK);

            TransitionResult result = enforcer.advancePhase(TASK);
            assertEquals(List.of("no goals", "no risks", "missing: artifact"), result.reasons());
        }

        @Test
        @DisplayName("the stored verdict reflects the last gate run")
        void storesVerdict() {
            passEverywhere();
            enforcer.startCycle(TASK);
            collector.recordArtifact(TASK, Phase.STRATEGIZE, "docs/strategy.md");
            enforcer.advancePhase(TASK);

            EvidenceVerdict stored = enforcer.cycle(TASK).orElseThrow().evidence(Phase.STRATEGIZE).orElseThrow();
            assertTrue(stored.meetsCompletionCriteria());
            assertEquals(List.of("docs/strategy.md"), stored.artifactReferences());
        }

        @Test
        @DisplayName("at MONITOR with no target the call is an accepted no-op")
        void noTargetAtMonitor() {
            passEverywhere();
            enforcer.startCycle(TASK);
            advanceTo(Phase.MONITOR);
            int before = enforcer.history(TASK).size();

            TransitionResult result = enforcer.advancePhase(TASK);
            assertTrue(result.accepted());
            assertEquals(Phase.MONITOR, result.phase());
            assertEquals(before, enforcer.history(TASK).size());
        }

        @Test
        @DisplayName("requesting the current phase is a no-op that runs no validator")
        void sameTarget() {
            var called = new AtomicBoolean();
            enforcer.registerValidator(Phase.STRATEGIZE, ctx -> {
                called.set(true);
                return ValidationResult.pass();
            });
            enforcer.startCycle(TASK);

            assertTrue(enforcer.advancePhase(TASK, Phase.STRATEGIZE).accepted());
            assertFalse(called.get());
            assertEquals(1, enforcer.history(TASK).size());
        }
    }

    // -- Skip -----------------------------------------------------------------

    @Nested
    @DisplayName("skip")
    class SkipTests {

        @Test
        @DisplayName("without override it is refused and counted")
        void refused() throws Exception {
            passEverywhere();
            enforcer.startCycle(TASK);
            advanceTo(Phase.SPEC);

            TransitionResult result = enforcer.advancePhase(TASK, Phase.IMPLEMENT);

            assertFalse(result.accepted());
            assertEquals(RejectionCategory.SKIP_REJECTED, result.rejection());
            assertEquals(Phase.SPEC, enforcer.currentPhase(TASK).orElseThrow());
            assertEquals(1, counter(AuditCounters.PHASE_SKIPS_ATTEMPTED));
        }

        @Test
        @DisplayName("with override a skipped phase with no evidence at all is refused")
        void overrideNeedsRetroactiveEvidence() throws Exception {
            passEverywhere();

            assertEquals(Phase.STRATEGIZE, enforcer.startCycle(TASK));
            assertTrue(enforcer.advancePhase(TASK).accepted());
            assertTrue(enforcer.advancePhase(TASK).accepted());
            assertEquals(Phase.PLAN, enforcer.currentPhase(TASK).orElseThrow());

            TransitionResult result = enforcer.advancePhase(TASK, Phase.IMPLEMENT, AdvanceOptions.withOverride());

            assertFalse(result.accepted());
            assertEquals(RejectionCategory.SKIP_REJECTED, result.rejection());
            assertEquals(List.of("retroactive evidence missing for THINK", "THINK: no evidence recorded"),
                    result.reasons());
            assertEquals(Phase.PLAN, enforcer.currentPhase(TASK).orElseThrow());
            assertEquals(1, counter(AuditCounters.PHASE_SKIPS_ATTEMPTED));
        }

        @Test
        @DisplayName("with override a configured requirement on a skipped phase is still enforced")
        void overrideChecksSkippedRequirement() {
            passEverywhere();
            enforcer.registerEvidenceRequirement(Phase.THINK, new EvidenceRequirement(0, 0, 2));
            enforcer.startCycle(TASK);
            advanceTo(Phase.PLAN);
            collector.recordArtifact(TASK, Phase.THINK, "notes/think.md");

            TransitionResult result = enforcer.advancePhase(TASK, Phase.IMPLEMENT, AdvanceOptions.withOverride());

            assertEquals(RejectionCategory.SKIP_REJECTED, result.rejection());
            assertTrue(result.reasons().contains("retroactive evidence missing for THINK"));
        }

        @Test
        @DisplayName("with override any recorded evidence satisfies a skipped phase with no requirement")
        void overrideWithAnyEvidence() {
            passEverywhere();
            enforcer.startCycle(TASK);
            advanceTo(Phase.PLAN);
            collector.recordToolCall(TASK, Phase.THINK, "search_docs", false);

            assertTrue(enforcer.advancePhase(TASK, Phase.IMPLEMENT, AdvanceOptions.withOverride()).accepted());
        }

        @Test
        @DisplayName("with override and complete evidence it commits a SKIP")
        void overrideWithEvidence() {
            passEverywhere();
            enforcer.registerEvidenceRequirement(Phase.THINK, new EvidenceRequirement(0, 0, 1));
            enforcer.startCycle(TASK);
            advanceTo(Phase.PLAN);
            collector.recordArtifact(TASK, Phase.THINK, "notes/think.md");

            TransitionResult result = enforcer.advancePhase(TASK, Phase.IMPLEMENT, AdvanceOptions.withOverride());

            assertTrue(result.accepted(), () -> "refused: " + result.reasons());
            assertEquals(Phase.IMPLEMENT, enforcer.currentPhase(TASK).orElseThrow());
            PhaseTransition last = enforcer.history(TASK).get(enforcer.history(TASK).size() - 1);
            assertEquals(TransitionKind.SKIP, last.outcome());
            assertEquals(Phase.PLAN, last.fromPhase());
        }

        @Test
        @DisplayName("with override a failing current phase is a validation failure")
        void overrideCurrentPhaseFails() {
            passEverywhere();
            enforcer.startCycle(TASK);
            advanceTo(Phase.PLAN);
            collector.recordArtifact(TASK, Phase.THINK, "notes/think.md");
            enforcer.registerValidator(Phase.PLAN, ctx -> ValidationResult.fail("plan has no milestones"));

            TransitionResult result = enforcer.advancePhase(TASK, Phase.IMPLEMENT, AdvanceOptions.withOverride());
            assertEquals(RejectionCategory.VALIDATION_FAILURE, result.rejection());
            assertEquals(List.of("plan has no milestones"), result.reasons());
        }
    }

    // -- Backtrack ------------------------------------------------------------

    @Nested
    @DisplayName("backtrack")
    class BacktrackTests {

        @Test
        @DisplayName("is accepted, counted, and clears evidence after the target")
        void clearsLaterEvidence() throws Exception {
            passEverywhere();
            enforcer.startCycle(TASK);
            advanceTo(Phase.PLAN);
            collector.recordArtifact(TASK, Phase.PLAN, "plan.md");
            advanceTo(Phase.THINK);
            collector.recordArtifact(TASK, Phase.THINK, "think.md");
            advanceTo(Phase.IMPLEMENT);
            collector.recordArtifact(TASK, Phase.IMPLEMENT, "Main.java");

            CycleSnapshot before = enforcer.cycle(TASK).orElseThrow();
            assertTrue(before.evidence(Phase.PLAN).isPresent());
            assertTrue(before.evidence(Phase.THINK).isPresent());

            TransitionResult result = enforcer.advancePhase(TASK, Phase.SPEC);

            assertTrue(result.accepted());
            assertEquals(Phase.SPEC, enforcer.currentPhase(TASK).orElseThrow());
            assertEquals(1, counter(AuditCounters.PHASE_BACKTRACKS));

            CycleSnapshot after = enforcer.cycle(TASK).orElseThrow();
            assertTrue(after.evidence(Phase.SPEC).isPresent());
            assertTrue(after.evidence(Phase.PLAN).isEmpty());
            assertTrue(after.evidence(Phase.THINK).isEmpty());
            assertTrue(after.evidence(Phase.IMPLEMENT).isEmpty());
            for (Phase phase : List.of(Phase.PLAN, Phase.THINK, Phase.IMPLEMENT)) {
                assertEquals(0, collector.finalize(TASK, phase).provenCounts().artifacts(), phase.name());
            }
        }

        @Test
        @DisplayName("is not validation-gated")
        void notGated() {
            passEverywhere();
            enforcer.startCycle(TASK);
            advanceTo(Phase.VERIFY);
            enforcer.registerValidator(Phase.VERIFY, ctx -> ValidationResult.fail("tests are red"));

            assertTrue(enforcer.advancePhase(TASK, Phase.IMPLEMENT).accepted());
            assertEquals(TransitionKind.BACKTRACK,
                    enforcer.history(TASK).get(enforcer.history(TASK).size() - 1).outcome());
        }
    }

    // -- Drift ----------------------------------------------------------------

    @Nested
    @DisplayName("instruction drift")
    class DriftTests {

        @Test
        @DisplayName("high drift blocks an otherwise valid advance")
        void highBlocks() throws Exception {
            passEverywhere();
            enforcer.startCycle(TASK);
            when(instructions.effectiveInstructions(TASK)).thenReturn("Record evidence when convenient.");

            TransitionResult result = enforcer.advancePhase(TASK);

            assertFalse(result.accepted());
            assertEquals(RejectionCategory.DRIFT_BLOCKED, result.rejection());
            assertTrue(result.reasons().stream().anyMatch(r -> r.startsWith("drift: ")));
            assertEquals(Phase.STRATEGIZE, enforcer.currentPhase(TASK).orElseThrow());
            assertEquals(1, counter(AuditCounters.PROMPT_DRIFT_DETECTED));
            assertEquals(DriftSeverity.HIGH, enforcer.cycle(TASK).orElseThrow().attestation().lastSeverity());
        }

        @Test
        @DisplayName("high drift takes precedence over validation failures")
        void highTakesPrecedence() throws Exception {
            enforcer.startCycle(TASK);
            when(instructions.effectiveInstructions(TASK)).thenReturn("Do whatever.");

            TransitionResult result = enforcer.advancePhase(TASK);
            assertEquals(RejectionCategory.DRIFT_BLOCKED, result.rejection());
            assertTrue(result.reasons().contains("no validator registered for STRATEGIZE"));
        }

        @Test
        @DisplayName("high drift blocks backtracks and skips too")
        void highBlocksEverything() throws Exception {
            passEverywhere();
            enforcer.startCycle(TASK);
            advanceTo(Phase.PLAN);
            when(instructions.effectiveInstructions(TASK)).thenReturn("Do whatever.");

            assertEquals(RejectionCategory.DRIFT_BLOCKED, enforcer.advancePhase(TASK, Phase.SPEC).rejection());
            assertEquals(RejectionCategory.DRIFT_BLOCKED, enforcer.advancePhase(TASK, Phase.VERIFY).rejection());
            assertEquals(Phase.PLAN, enforcer.currentPhase(TASK).orElseThrow());
        }

        @Test
        @DisplayName("medium drift is accepted with a drift reason")
        void mediumAdvisory() throws Exception {
            passEverywhere();
            enforcer.startCycle(TASK);
            when(instructions.effectiveInstructions(TASK)).thenReturn(INSTRUCTIONS + "Prefer small commits.\n");

            TransitionResult result = enforcer.advancePhase(TASK);

            assertTrue(result.accepted());
            assertEquals(List.of("drift: instructional content changed"), result.reasons());
            assertEquals(1, counter(AuditCounters.PROMPT_DRIFT_DETECTED));
            assertEquals(result.reasons(), enforcer.history(TASK).get(1).reasons());
        }

        @Test
        @DisplayName("formatting-only changes have no effect")
        void lowIgnored() throws Exception {
            passEverywhere();
            enforcer.startCycle(TASK);
            when(instructions.effectiveInstructions(TASK)).thenReturn("# heading\n" + INSTRUCTIONS);

            TransitionResult result = enforcer.advancePhase(TASK);
            assertTrue(result.accepted());
            assertTrue(result.reasons().isEmpty());
            assertEquals(0, counter(AuditCounters.PROMPT_DRIFT_DETECTED));
        }

        @Test
        @DisplayName("refreshing the baseline unblocks the task")
        void refreshUnblocks() throws Exception {
            passEverywhere();
            enforcer.startCycle(TASK);
            String rewritten = "Do whatever.";
            when(instructions.effectiveInstructions(TASK)).thenReturn(rewritten);
            assertFalse(enforcer.advancePhase(TASK).accepted());

            String hash = enforcer.refreshBaseline(TASK).orElseThrow();

            assertEquals(hash, enforcer.cycle(TASK).orElseThrow().attestation().baselineHash());
            assertTrue(enforcer.advancePhase(TASK).accepted());
        }

        @Test
        @DisplayName("an unreadable instruction source fails open")
        void failOpen() throws Exception {
            passEverywhere();
            enforcer.startCycle(TASK);
            when(instructions.effectiveInstructions(TASK)).thenThrow(new IOException("share unavailable"));

            assertTrue(enforcer.advancePhase(TASK).accepted());
        }

        @Test
        @DisplayName("high drift from any strategy wins over passing validation and evidence")
        void injectedStrategies() {
            ValidationStrategy validation = mock(ValidationStrategy.class);
            EvidenceStrategy evidence = mock(EvidenceStrategy.class);
            AttestationStrategy monitor = mock(AttestationStrategy.class);
            when(validation.validate(any())).thenReturn(ValidationResult.pass());
            when(evidence.finalize(anyString(), any())).thenAnswer(inv -> new EvidenceVerdict(
                    inv.getArgument(0), inv.getArgument(1), List.of(), ProvenCounts.ZERO, true, List.of()));
            when(monitor.establishBaseline(anyString())).thenReturn(Optional.of("base"));
            when(monitor.check(anyString(), any())).thenReturn(drift(DriftSeverity.HIGH));

            PhaseEnforcer isolated = newEnforcer(validation, evidence, monitor, telemetry, Duration.ofSeconds(5));
            isolated.startCycle("T-ISO");

            for (Phase target : List.of(Phase.SPEC, Phase.PLAN)) {
                TransitionResult result = isolated.advancePhase("T-ISO", target, AdvanceOptions.withOverride());
                assertEquals(RejectionCategory.DRIFT_BLOCKED, result.rejection(), target.name());
            }
            verify(evidence, never()).startCollection(eq(Phase.SPEC), anyString());
        }
    }

    // -- Boundaries and errors --------------------------------------------------

    @Nested
    @DisplayName("caller errors")
    class CallerErrorTests {

        @Test
        @DisplayName("unknown tasks throw")
        void unknownTask() {
            assertThrows(UnknownTaskException.class, () -> enforcer.advancePhase("never-started"));
            assertThrows(UnknownTaskException.class, () -> enforcer.close("never-started"));
            assertTrue(enforcer.currentPhase("never-started").isEmpty());
            assertTrue(enforcer.history("never-started").isEmpty());
        }

        @Test
        @DisplayName("CLOSED cannot be requested through advancePhase")
        void closedTarget() {
            enforcer.startCycle(TASK);
            assertThrows(InvalidPhaseException.class, () -> enforcer.advancePhase(TASK, Phase.CLOSED));
        }

        @Test
        @DisplayName("a missing required context field throws before the validator runs")
        void missingContext() {
            var called = new AtomicBoolean();
            enforcer.registerValidator(Phase.STRATEGIZE, Validator.requiring(Set.of("goal"), ctx -> {
                called.set(true);
                return ValidationResult.pass();
            }));
            enforcer.startCycle(TASK);

            var e = assertThrows(InvalidPhaseContextException.class, () -> enforcer.advancePhase(TASK));
            assertEquals(Set.of("goal"), e.missingFields());
            assertFalse(called.get());

            TransitionResult ok = enforcer.advancePhase(TASK, null,
                    AdvanceOptions.DEFAULT.withContext(Map.of("goal", "ship the parser")));
            assertTrue(ok.accepted());
            assertTrue(called.get());
        }

        @Test
        @DisplayName("validators see the caller's context")
        void contextReachesValidator() {
            enforcer.registerValidator(Phase.STRATEGIZE, ctx -> ctx.field("ticket").isPresent()
                    ? ValidationResult.pass()
                    : ValidationResult.fail("no ticket"));
            enforcer.startCycle(TASK);

            assertFalse(enforcer.advancePhase(TASK).accepted());
            assertTrue(enforcer.advancePhase(TASK, Phase.SPEC,
                    AdvanceOptions.DEFAULT.withContext(Map.of("ticket", "PG-12"))).accepted());
        }
    }

    // -- Timeout and failures --------------------------------------------------

    @Nested
    @DisplayName("slow and failing validators")
    class TimeoutTests {

        @Test
        @DisplayName("a validator past the timeout is a validation failure with no state change")
        void timeout() throws Exception {
            var release = new CountDownLatch(1);
            enforcer.registerValidator(Phase.STRATEGIZE, ctx -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return ValidationResult.pass();
            });
            enforcer.startCycle(TASK);

            try {
                TransitionResult result = enforcer.advancePhase(TASK, null,
                        AdvanceOptions.DEFAULT.withTimeout(Duration.ofMillis(100)));

                assertFalse(result.accepted());
                assertEquals(RejectionCategory.VALIDATION_FAILURE, result.rejection());
                assertEquals(List.of("validation timed out after 100ms"), result.reasons());
                assertEquals(Phase.STRATEGIZE, enforcer.currentPhase(TASK).orElseThrow());
                assertEquals(1, enforcer.history(TASK).size());
                assertTrue(enforcer.cycle(TASK).orElseThrow().evidence(Phase.STRATEGIZE).isEmpty());
                assertEquals(1, counter(AuditCounters.PHASE_VALIDATIONS_FAILED));
            } finally {
                release.countDown();
            }
        }

        @Test
        @DisplayName("a timed-out validator is interrupted so the gate pool is free for the next request")
        void timeoutInterruptsWorker() throws Exception {
            ExecutorService single = Executors.newSingleThreadExecutor();
            try {
                var interrupted = new CountDownLatch(1);
                var never = new CountDownLatch(1);
                PhaseEnforcer narrow = newEnforcer(gate, collector, attestation, telemetry,
                        Duration.ofSeconds(5), single, null);
                narrow.registerValidator(Phase.STRATEGIZE, ctx -> {
                    if (ctx.taskId().equals("T-SLOW")) {
                        try {
                            never.await();
                        } catch (InterruptedException e) {
                            interrupted.countDown();
                            Thread.currentThread().interrupt();
                            return ValidationResult.fail("interrupted");
                        }
                    }
                    return ValidationResult.pass();
                });
                narrow.startCycle("T-SLOW");
                narrow.startCycle("T-FAST");

                TransitionResult slow = narrow.advancePhase("T-SLOW", null,
                        AdvanceOptions.DEFAULT.withTimeout(Duration.ofMillis(100)));
                assertEquals(List.of("validation timed out after 100ms"), slow.reasons());
                assertTrue(interrupted.await(5, TimeUnit.SECONDS), "worker was never interrupted");

                TransitionResult fast = narrow.advancePhase("T-FAST", null,
                        AdvanceOptions.DEFAULT.withTimeout(Duration.ofSeconds(2)));
                assertTrue(fast.accepted(), () -> "refused: " + fast.reasons());
            } finally {
                single.shutdownNow();
            }
        }

        @Test
        @DisplayName("validators run with the task's MDC and the caller's MDC survives the call")
        void mdcOnGateThread() {
            var seen = new AtomicReference<String>();
            enforcer.registerValidator(Phase.STRATEGIZE, ctx -> {
                seen.set(MDC.get("taskId") + "/" + MDC.get("phase"));
                return ValidationResult.pass();
            });
            enforcer.startCycle(TASK);

            MDC.put("taskId", "PARENT");
            MDC.put("requestId", "r-9");
            try {
                assertTrue(enforcer.advancePhase(TASK).accepted());
                assertEquals(TASK + "/STRATEGIZE", seen.get());
                assertEquals("PARENT", MDC.get("taskId"));
                assertEquals("r-9", MDC.get("requestId"));
                assertNull(MDC.get("phase"));
            } finally {
                MDC.clear();
            }
        }

        @Test
        @DisplayName("a throwing validator is a validation failure")
        void throwingValidator() {
            enforcer.registerValidator(Phase.STRATEGIZE, ctx -> {
                throw new IllegalStateException("lint server down");
            });
            enforcer.startCycle(TASK);

            TransitionResult result = enforcer.advancePhase(TASK);
            assertEquals(RejectionCategory.VALIDATION_FAILURE, result.rejection());
            assertEquals(List.of("validator for STRATEGIZE threw: lint server down"), result.reasons());
        }

        @Test
        @DisplayName("telemetry failures never block a transition")
        void telemetryFailure() throws Exception {
            Path blocked = dir.resolve("blocked");
            Files.createDirectories(blocked);
            var broken = new JsonlTelemetryEmitter(blocked, blocked, mapper, clock, new PhasegateMetrics(registry));
            PhaseEnforcer degraded = newEnforcer(gate, collector, attestation, broken, Duration.ofSeconds(5));
            passEverywhere();

            degraded.startCycle("T-DEG");
            assertTrue(degraded.advancePhase("T-DEG").accepted());
            assertTrue(registry.find("phasegate.telemetry.write_failures").counter().count() > 0);
        }
    }

    // -- Close -----------------------------------------------------------------

    @Nested
    @DisplayName("close")
    class CloseTests {

        @Test
        @DisplayName("only from MONITOR")
        void onlyFromMonitor() {
            passEverywhere();
            enforcer.startCycle(TASK);
            assertThrows(IllegalPhaseTransitionException.class, () -> enforcer.close(TASK));

            advanceTo(Phase.MONITOR);
            CycleSnapshot closed = enforcer.close(TASK);

            assertTrue(closed.closed());
            assertEquals(Phase.CLOSED, closed.currentPhase());
            assertEquals(TransitionKind.CLOSE, closed.lastTransition().orElseThrow().outcome());
        }

        @Test
        @DisplayName("a closed cycle stays queryable and refuses further use")
        void closedIsFinal() {
            passEverywhere();
            enforcer.startCycle(TASK);
            advanceTo(Phase.MONITOR);
            enforcer.close(TASK);

            assertEquals(Phase.CLOSED, enforcer.currentPhase(TASK).orElseThrow());
            assertEquals(10, enforcer.history(TASK).size());
            assertThrows(CycleClosedException.class, () -> enforcer.advancePhase(TASK));
            assertThrows(CycleClosedException.class, () -> enforcer.startCycle(TASK));
            assertThrows(CycleClosedException.class, () -> enforcer.close(TASK));
            assertTrue(attestation.baselineHash(TASK).isEmpty());
        }
    }

    // -- Side channels ---------------------------------------------------------

    @Nested
    @DisplayName("events, ledger and metrics")
    class SideChannelTests {

        @Test
        @DisplayName("publishes lifecycle events")
        void events() {
            List<PhaseEvent> received = new CopyOnWriteArrayList<>();
            events.subscribe(TASK, received::add);
            enforcer.registerValidator(Phase.STRATEGIZE, ctx -> ValidationResult.pass());

            enforcer.startCycle(TASK);
            enforcer.advancePhase(TASK);
            enforcer.advancePhase(TASK);

            assertEquals(List.of(PhaseEventType.CYCLE_STARTED, PhaseEventType.PHASE_COMMITTED,
                            PhaseEventType.PHASE_REJECTED),
                    received.stream().map(PhaseEvent::type).toList());
            assertEquals(Phase.SPEC, received.get(1).toPhase());
            assertEquals(TransitionKind.ADVANCE, received.get(1).kind());
            assertEquals(RejectionCategory.VALIDATION_FAILURE, received.get(2).rejection());
            assertEquals(Phase.SPEC, received.get(2).phase());
        }

        @Test
        @DisplayName("writes a verifiable ledger entry per committed transition")
        void ledger() throws Exception {
            var recorder = new LedgerRecorder(ledger).attach(events);
            passEverywhere();
            enforcer.startCycle(TASK);
            collector.recordArtifact(TASK, Phase.STRATEGIZE, "docs/strategy.md");
            advanceTo(Phase.PLAN);
            enforcer.advancePhase(TASK, Phase.VERIFY);

            List<LedgerEntry> entries = ledger.entries(TASK);
            assertEquals(enforcer.history(TASK).size(), entries.size());
            assertEquals(List.of("docs/strategy.md"), entries.get(1).evidenceArtifacts());
            assertTrue(entries.get(1).evidenceValidated());
            assertTrue(ledger.verify().valid());
            recorder.detach();
        }

        @Test
        @DisplayName("records Micrometer transitions and rejections")
        void metrics() {
            enforcer.registerValidator(Phase.STRATEGIZE, ctx -> ValidationResult.pass());
            enforcer.startCycle(TASK);
            enforcer.advancePhase(TASK);
            enforcer.advancePhase(TASK);

            assertEquals(1.0, registry.find("phasegate.transitions.total").tag("kind", "start").counter().count());
            assertEquals(1.0, registry.find("phasegate.transitions.total").tag("kind", "advance").counter().count());
            assertEquals(1.0, registry.find("phasegate.rejections.total")
                    .tag("category", "validation_failure").counter().count());
            assertNotNull(registry.find("phasegate.advance.duration").tag("outcome", "accepted").timer());
        }
    }

    // -- Phase leases -----------------------------------------------------------

    @Nested
    @DisplayName("phase leases")
    class LeaseTests {

        private PhaseLeaseManager leases;
        private PhaseEnforcer leased;

        @BeforeEach
        void setUpLeases() {
            leases = new PhaseLeaseManager(clock, Duration.ofMinutes(5), 2, "agent-a");
            leased = newEnforcer(gate, collector, attestation, telemetry, Duration.ofSeconds(5), executor, leases);
            for (Phase phase : Phase.WORK_SEQUENCE) {
                leased.registerValidator(phase, ctx -> ValidationResult.pass());
            }
        }

        @Test
        @DisplayName("the lease follows the task from phase to phase")
        void leaseMovesWithPhase() {
            leased.startCycle(TASK);
            assertEquals("agent-a", leases.current(TASK, Phase.STRATEGIZE).orElseThrow().holder());

            assertTrue(leased.advancePhase(TASK).accepted());
            assertTrue(leases.current(TASK, Phase.STRATEGIZE).isEmpty());
            assertEquals("agent-a", leases.current(TASK, Phase.SPEC).orElseThrow().holder());
        }

        @Test
        @DisplayName("another agent cannot start a cycle someone else is driving")
        void startContended() throws Exception {
            leases.acquire(TASK, Phase.STRATEGIZE, "agent-b");

            var e = assertThrows(LeaseContendedException.class, () -> leased.startCycle(TASK, "agent-a"));
            assertEquals("agent-b", e.outcome().holder());
            assertTrue(leased.currentPhase(TASK).isEmpty());
            assertEquals(1, counter(AuditCounters.PHASE_LEASE_CONTENTION));
        }

        @Test
        @DisplayName("an advance by a second agent is refused without running validators")
        void advanceContended() throws Exception {
            var called = new AtomicBoolean();
            leased.registerValidator(Phase.STRATEGIZE, ctx -> {
                called.set(true);
                return ValidationResult.pass();
            });
            leased.startCycle(TASK, "agent-a");

            TransitionResult result = leased.advancePhase(TASK, null, AdvanceOptions.DEFAULT.withHolder("agent-b"));

            assertFalse(result.accepted());
            assertEquals(RejectionCategory.LEASE_CONTENDED, result.rejection());
            assertTrue(result.reasons().get(0).startsWith("lease on STRATEGIZE held by agent-a"));
            assertFalse(called.get());
            assertEquals(Phase.STRATEGIZE, leased.currentPhase(TASK).orElseThrow());
            assertEquals(1, counter(AuditCounters.PHASE_LEASE_CONTENTION));

            assertTrue(leased.advancePhase(TASK, null, AdvanceOptions.DEFAULT.withHolder("agent-a")).accepted());
        }

        @Test
        @DisplayName("a target phase leased by another agent blocks the move")
        void targetContended() {
            leased.startCycle(TASK);
            leases.acquire(TASK, Phase.SPEC, "agent-b");

            TransitionResult result = leased.advancePhase(TASK);
            assertEquals(RejectionCategory.LEASE_CONTENDED, result.rejection());
            assertEquals("agent-a", leases.current(TASK, Phase.STRATEGIZE).orElseThrow().holder());
        }

        @Test
        @DisplayName("renewals extend the current phase's lease up to the cap")
        void renew() {
            leased.startCycle(TASK);
            assertTrue(leased.renewLease(TASK, null).granted());
            assertTrue(leased.renewLease(TASK, null).granted());
            LeaseOutcome capped = leased.renewLease(TASK, null);
            assertFalse(capped.granted());
            assertEquals("max renewals (2) exceeded", capped.reason());
            assertFalse(leased.renewLease(TASK, "agent-b").granted());
        }

        @Test
        @DisplayName("closing releases every lease on the task")
        void closeReleases() {
            leased.startCycle(TASK);
            while (leased.currentPhase(TASK).orElseThrow() != Phase.MONITOR) {
                assertTrue(leased.advancePhase(TASK).accepted());
            }
            leased.close(TASK);
            assertEquals(0, leases.stats().totalLeases());
        }

        @Test
        @DisplayName("without a lease manager renewals are refused")
        void disabled() {
            enforcer.startCycle(TASK);
            assertFalse(enforcer.renewLease(TASK, null).granted());
        }
    }

    // -- Concurrency -----------------------------------------------------------

    @Nested
    @DisplayName("concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("concurrent advances on one task are serialized")
        void serializedPerTask() throws Exception {
            passEverywhere();
            enforcer.startCycle(TASK);
            ExecutorService callers = Executors.newFixedThreadPool(8);
            try {
                var start = new CountDownLatch(1);
                List<Future<TransitionResult>> futures = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    futures.add(callers.submit(() -> {
                        start.await();
                        return enforcer.advancePhase(TASK);
                    }));
                }
                start.countDown();
                for (Future<TransitionResult> f : futures) {
                    assertTrue(f.get(10, TimeUnit.SECONDS).accepted());
                }
            } finally {
                callers.shutdownNow();
            }

            assertEquals(Phase.MONITOR, enforcer.currentPhase(TASK).orElseThrow());
            List<PhaseTransition> history = enforcer.history(TASK);
            assertEquals(9, history.size());
            for (int i = 1; i < history.size(); i++) {
                assertTrue(history.get(i).timestamp().isAfter(history.get(i - 1).timestamp()));
                assertEquals(history.get(i - 1).toPhase(), history.get(i).fromPhase());
            }
        }

        @Test
        @DisplayName("independent tasks proceed in parallel")
        void independentTasks() throws Exception {
            passEverywhere();
            ExecutorService callers = Executors.newFixedThreadPool(4);
            try {
                List<Future<Phase>> futures = new ArrayList<>();
                for (int i = 0; i < 4; i++) {
                    String taskId = "T-PAR-" + i;
                    futures.add(callers.submit(() -> {
                        enforcer.startCycle(taskId);
                        for (int step = 0; step < 3; step++) {
                            enforcer.advancePhase(taskId);
                        }
                        return enforcer.currentPhase(taskId).orElseThrow();
                    }));
                }
                for (Future<Phase> f : futures) {
                    assertEquals(Phase.THINK, f.get(10, TimeUnit.SECONDS));
                }
            } finally {
                callers.shutdownNow();
            }
        }

        @Test
        @DisplayName("separate enforcers keep separate state")
        void separateEnforcers() {
            passEverywhere();
            enforcer.startCycle(TASK);
            enforcer.advancePhase(TASK);

            tracker = new PhaseStateTracker(clock);
            PhaseEnforcer other = newEnforcer(new ValidationGate(), new EvidenceCollector(), attestation, telemetry,
                    Duration.ofSeconds(5));
            assertTrue(other.currentPhase(TASK).isEmpty());
            assertEquals(Phase.SPEC, enforcer.currentPhase(TASK).orElseThrow());
        }
    }
}
