package com.phasegate.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phasegate.core.attestation.AttestationMonitor;
import com.phasegate.core.attestation.DriftClassifier;
import com.phasegate.core.attestation.FileInstructionSource;
import com.phasegate.core.attestation.InstructionSource;
import com.phasegate.core.attestation.StructuralDriftClassifier;
import com.phasegate.core.enforcer.PhaseEnforcer;
import com.phasegate.core.events.PhaseEventBus;
import com.phasegate.core.evidence.EvidenceCollector;
import com.phasegate.core.lease.PhaseLeaseManager;
import com.phasegate.core.ledger.LedgerRecorder;
import com.phasegate.core.ledger.PhaseLedger;
import com.phasegate.core.metrics.PhasegateMetrics;
import com.phasegate.core.state.PhaseStateTracker;
import com.phasegate.core.telemetry.JsonlTelemetryEmitter;
import com.phasegate.core.telemetry.NoopTelemetryEmitter;
import com.phasegate.core.telemetry.TelemetryEmitter;
import com.phasegate.core.telemetry.TelemetryReader;
import com.phasegate.core.util.JsonMappers;
import com.phasegate.core.validation.ValidationGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PhasegateConfig {

    private static final Logger log = LoggerFactory.getLogger(PhasegateConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return JsonMappers.jsonl();
    }

    @Bean
    public PhaseStateTracker phaseStateTracker(Clock clock) {
        return new PhaseStateTracker(clock);
    }

    @Bean
    public ValidationGate validationGate() {
        return new ValidationGate();
    }

    @Bean
    public EvidenceCollector evidenceCollector(PhasegateProperties properties, Clock clock) {
        return new EvidenceCollector(properties.getEvidence().toRequirements(), clock);
    }

    @Bean
    public InstructionSource instructionSource(PhasegateProperties properties) {
        return new FileInstructionSource(Path.of(properties.getAttestation().getInstructionsDir()));
    }

    @Bean
    public DriftClassifier driftClassifier(PhasegateProperties properties) {
        var attestation = properties.getAttestation();
        return new StructuralDriftClassifier(attestation.getGuardrailKeywords(), attestation.getCommentPrefixes());
    }

    @Bean
    public AttestationMonitor attestationMonitor(InstructionSource instructionSource,
                                                 DriftClassifier driftClassifier, Clock clock) {
        return new AttestationMonitor(instructionSource, driftClassifier, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "phasegate.telemetry.enabled", havingValue = "true", matchIfMissing = true)
    public TelemetryEmitter jsonlTelemetryEmitter(PhasegateProperties properties, ObjectMapper objectMapper,
                                                  Clock clock,
                                                  @Autowired(required = false) PhasegateMetrics metrics) {
        var telemetry = properties.getTelemetry();
        Path dir = Path.of(telemetry.getDir());
        log.info("Telemetry streams under {}", dir.toAbsolutePath());
        return new JsonlTelemetryEmitter(dir.resolve(telemetry.getSpansFile()), dir.resolve(telemetry.getCountersFile()),
                objectMapper, clock, metrics);
    }

    @Bean
    @ConditionalOnProperty(name = "phasegate.telemetry.enabled", havingValue = "false")
    public TelemetryEmitter noopTelemetryEmitter() {
        log.info("Telemetry disabled");
        return new NoopTelemetryEmitter();
    }

    @Bean
    public TelemetryReader telemetryReader(ObjectMapper objectMapper) {
        return new TelemetryReader(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "phasegate.ledger.enabled", havingValue = "true")
    public PhaseLedger phaseLedger(PhasegateProperties properties, ObjectMapper objectMapper, Clock clock) {
        return new PhaseLedger(Path.of(properties.getLedger().getPath()), objectMapper, clock);
    }

    /**
     * Appends every committed transition published by the enforcer to the ledger.
     */
    @Bean(destroyMethod = "detach")
    @ConditionalOnProperty(name = "phasegate.ledger.enabled", havingValue = "true")
    public LedgerRecorder ledgerRecorder(PhaseLedger phaseLedger, PhaseEventBus eventBus) {
        return new LedgerRecorder(phaseLedger).attach(eventBus);
    }

    @Bean
    @ConditionalOnProperty(name = "phasegate.lease.enabled", havingValue = "true")
    public PhaseLeaseManager phaseLeaseManager(PhasegateProperties properties, Clock clock) {
        var lease = properties.getLease();
        log.info("Phase leases enabled: {} per lease, {} renewals", lease.getDuration(), lease.getMaxRenewals());
        return new PhaseLeaseManager(clock, lease.getDuration(), lease.getMaxRenewals(), lease.getHolder());
    }

    /**
     * Runs validators and evidence finalization so a slow check can be abandoned at the advance timeout.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService phaseGateExecutor(PhasegateProperties properties) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getEnforcement().getGateThreads(), r -> {
            Thread t = new Thread(r, "phase-gate-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public PhaseEnforcer phaseEnforcer(PhaseStateTracker tracker,
                                       ValidationGate validationGate,
                                       EvidenceCollector evidenceCollector,
                                       AttestationMonitor attestationMonitor,
                                       TelemetryEmitter telemetryEmitter,
                                       PhaseEventBus eventBus,
                                       @Autowired(required = false) PhaseLeaseManager leaseManager,
                                       @Autowired(required = false) PhasegateMetrics metrics,
                                       ExecutorService phaseGateExecutor,
                                       PhasegateProperties properties,
                                       Clock clock) {
        return new PhaseEnforcer(tracker, validationGate, evidenceCollector, attestationMonitor, telemetryEmitter,
                eventBus, leaseManager, metrics, phaseGateExecutor, properties.getEnforcement().getAdvanceTimeout(), clock);
    }
}
