package com.phasegate.core.attestation;

import com.phasegate.core.model.Phase;
import com.phasegate.core.util.Hashes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Detects drift in the instructions an agent is working under.
 * <p>
 * The baseline is captured once per cycle when the task enters STRATEGIZE. Every later
 * phase entry hashes the effective instructions again and, when the hash differs, asks the
 * {@link DriftClassifier} how serious the difference is. Failures to read the instructions
 * fail open with severity NONE.
 */
public class AttestationMonitor implements AttestationStrategy {

    private static final Logger log = LoggerFactory.getLogger(AttestationMonitor.class);

    private final InstructionSource instructionSource;
    private final DriftClassifier classifier;
    private final Clock clock;

    private final ConcurrentHashMap<String, Baseline> baselines = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<AttestationResult>> history = new ConcurrentHashMap<>();

    public AttestationMonitor(InstructionSource instructionSource, DriftClassifier classifier, Clock clock) {
        this.instructionSource = instructionSource;
        this.classifier = classifier;
        this.clock = clock;
    }

    @Override
    public Optional<String> establishBaseline(String taskId) {
        Baseline existing = baselines.get(taskId);
        if (existing != null) {
            return Optional.of(existing.hash());
        }
        return capture(taskId).map(b -> {
            Baseline stored = baselines.putIfAbsent(taskId, b);
            Baseline effective = stored != null ? stored : b;
            log.info("Instruction baseline for task {} established: {}", taskId, Hashes.shortHash(effective.hash()));
            return effective.hash();
        });
    }

    @Override
    public Optional<String> refreshBaseline(String taskId) {
        return capture(taskId).map(b -> {
            Baseline previous = baselines.put(taskId, b);
            log.warn("Instruction baseline for task {} refreshed by operator: {} -> {}",
                    taskId, previous != null ? Hashes.shortHash(previous.hash()) : "-", Hashes.shortHash(b.hash()));
            return b.hash();
        });
    }

    @Override
    public AttestationResult check(String taskId, Phase phase) {
        String current;
        try {
            current = nullToEmpty(instructionSource.effectiveInstructions(taskId));
        } catch (Exception e) {
            log.warn("Could not read instructions for task {} at {}, skipping drift check: {}",
                    taskId, phase, e.getMessage());
            Baseline baseline = baselines.get(taskId);
            return record(new AttestationResult(taskId, phase, DriftSeverity.NONE,
                    baseline != null ? baseline.hash() : null, null,
                    DriftSeverity.NONE.recommendation(), "instructions unavailable: " + e.getMessage(), clock.instant()));
        }

        String currentHash = Hashes.sha256(current);
        Baseline baseline = baselines.get(taskId);
        if (baseline == null) {
            baseline = new Baseline(current, currentHash, clock.instant());
            Baseline raced = baselines.putIfAbsent(taskId, baseline);
            if (raced != null) {
                baseline = raced;
            }
        }

        DriftSeverity severity;
        String details;
        if (baseline.hash().equals(currentHash)) {
            severity = DriftSeverity.NONE;
            details = "unchanged";
        } else {
            DriftClassifier.Classification c = classifier.classify(baseline.text(), current);
            severity = c.severity();
            details = c.details();
        }

        if (severity == DriftSeverity.HIGH) {
            log.error("High instruction drift for task {} entering {}: {}", taskId, phase, details);
        } else if (severity == DriftSeverity.MEDIUM) {
            log.warn("Instruction drift for task {} entering {}: {}", taskId, phase, details);
        } else if (severity == DriftSeverity.LOW) {
            log.debug("Formatting-only instruction change for task {} entering {}", taskId, phase);
        }

        return record(new AttestationResult(taskId, phase, severity, baseline.hash(), currentHash,
                severity.recommendation(), details, clock.instant()));
    }

    @Override
    public void forget(String taskId) {
        baselines.remove(taskId);
        history.remove(taskId);
    }

    public Optional<String> baselineHash(String taskId) {
        return Optional.ofNullable(baselines.get(taskId)).map(Baseline::hash);
    }

    public List<AttestationResult> history(String taskId) {
        return List.copyOf(history.getOrDefault(taskId, List.of()));
    }

    public DriftStats driftStats() {
        var counts = new EnumMap<DriftSeverity, Long>(DriftSeverity.class);
        long total = 0;
        long drift = 0;
        for (List<AttestationResult> results : history.values()) {
            for (AttestationResult r : results) {
                total++;
                if (r.hasDrift()) drift++;
                counts.merge(r.severity(), 1L, Long::sum);
            }
        }
        double rate = total > 0 ? (double) drift / total : 0.0;
        return new DriftStats(total, drift, rate, Map.copyOf(counts));
    }

    private Optional<Baseline> capture(String taskId) {
        try {
            String text = nullToEmpty(instructionSource.effectiveInstructions(taskId));
            return Optional.of(new Baseline(text, Hashes.sha256(text), clock.instant()));
        } catch (Exception e) {
            log.warn("Could not read instructions for task {}, no baseline recorded: {}", taskId, e.getMessage());
            return Optional.empty();
        }
    }

    private AttestationResult record(AttestationResult result) {
        history.computeIfAbsent(result.taskId(), k -> new CopyOnWriteArrayList<>()).add(result);
        return result;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private record Baseline(String text, String hash, Instant establishedAt) {}
}
