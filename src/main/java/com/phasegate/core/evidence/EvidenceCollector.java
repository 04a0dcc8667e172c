package com.phasegate.core.evidence;

import com.phasegate.core.model.InvalidPhaseException;
import com.phasegate.core.model.Phase;
import com.phasegate.core.validation.TestOutputParser;
import com.phasegate.core.validation.TestRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Accumulates proof of work per task and phase and decides whether it meets the
 * phase's {@link EvidenceRequirement}.
 * <p>
 * Producers may record evidence for any phase of a started task, including phases
 * the task has not reached yet; an overridden skip relies on that retroactive evidence.
 */
public class EvidenceCollector implements EvidenceStrategy {

    private static final Logger log = LoggerFactory.getLogger(EvidenceCollector.class);

    private final Map<Phase, EvidenceRequirement> requirements = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Key, Accumulator> accumulators = new ConcurrentHashMap<>();
    private final Clock clock;

    public EvidenceCollector() {
        this(Map.of(), Clock.systemUTC());
    }

    public EvidenceCollector(Map<Phase, EvidenceRequirement> defaults, Clock clock) {
        this.clock = clock;
        var initial = new EnumMap<Phase, EvidenceRequirement>(Phase.class);
        initial.putAll(defaults);
        initial.forEach(this::registerRequirement);
    }

    @Override
    public void registerRequirement(Phase phase, EvidenceRequirement requirement) {
        if (phase == null || phase.isTerminal()) {
            throw new InvalidPhaseException("Cannot register an evidence requirement for " + phase);
        }
        requirements.put(phase, requirement);
        log.debug("Evidence requirement for {}: {}", phase, requirement);
    }

    public EvidenceRequirement requirementFor(Phase phase) {
        return requirements.getOrDefault(phase, EvidenceRequirement.NONE);
    }

    @Override
    public void startCollection(Phase phase, String taskId) {
        accumulators.put(new Key(taskId, phase), new Accumulator());
        log.debug("Started evidence collection for task {} at {}", taskId, phase);
    }

    public void recordArtifact(String taskId, Phase phase, String reference) {
        accumulator(taskId, phase).add(new EvidenceArtifact(EvidenceKind.ARTIFACT, reference, true, clock.instant()));
    }

    public void recordToolCall(String taskId, Phase phase, String tool, boolean mocked) {
        if (mocked) {
            log.warn("Tool call {} for task {} used mock data and does not count as real evidence", tool, taskId);
        }
        accumulator(taskId, phase).add(new EvidenceArtifact(EvidenceKind.TOOL_CALL, tool, !mocked, clock.instant()));
    }

    public void recordTestRun(String taskId, Phase phase, String command, String output, int exitCode) {
        TestRunSummary summary = TestOutputParser.parse(output, exitCode);
        log.info("Test run for task {} at {}: passed={}, {} tests, {} failed",
                taskId, phase, summary.passed(), summary.totalTests(), summary.failedTests());
        accumulator(taskId, phase).add(new EvidenceArtifact(EvidenceKind.TEST_RUN, command, summary.passed(), clock.instant()));
    }

    /**
     * Judges what has been recorded so far. Does not reset the accumulator.
     */
    @Override
    public EvidenceVerdict finalize(String taskId, Phase phase) {
        Accumulator acc = accumulators.get(new Key(taskId, phase));
        List<EvidenceArtifact> collected = acc != null ? acc.snapshot() : List.of();
        ProvenCounts counts = count(collected);
        EvidenceRequirement requirement = requirementFor(phase);

        var missing = new ArrayList<String>();
        if (counts.testsRun() < requirement.minTests()) {
            missing.add(shortfall("test run", counts.testsRun(), requirement.minTests()));
        }
        if (counts.realCalls() < requirement.minCalls()) {
            missing.add(shortfall("real tool call", counts.realCalls(), requirement.minCalls()));
            if (counts.mockedCalls() > 0) {
                missing.add(counts.mockedCalls() + " tool call(s) used mock data");
            }
        }
        if (counts.artifacts() < requirement.minArtifacts()) {
            missing.add(shortfall("artifact", counts.artifacts(), requirement.minArtifacts()));
        }
        int failedRuns = counts.testsRun() - counts.testsPassed();
        if (failedRuns > 0) {
            missing.add(failedRuns + " test run(s) failed");
        }

        boolean meets = counts.testsRun() >= requirement.minTests()
                && counts.realCalls() >= requirement.minCalls()
                && counts.artifacts() >= requirement.minArtifacts()
                && missing.isEmpty();

        if (!meets) {
            log.info("Evidence for task {} at {} incomplete: {}", taskId, phase, missing);
        }
        return new EvidenceVerdict(taskId, phase, collected, counts, meets, missing);
    }

    @Override
    public void clear(String taskId, Phase phase) {
        accumulators.remove(new Key(taskId, phase));
    }

    @Override
    public void forget(String taskId) {
        accumulators.keySet().removeIf(k -> k.taskId().equals(taskId));
    }

    private Accumulator accumulator(String taskId, Phase phase) {
        if (phase == null || phase.isTerminal()) {
            throw new InvalidPhaseException("Cannot record evidence for " + phase);
        }
        return accumulators.computeIfAbsent(new Key(taskId, phase), k -> new Accumulator());
    }

    private static ProvenCounts count(List<EvidenceArtifact> collected) {
        int real = 0;
        int mocked = 0;
        int tests = 0;
        int testsPassed = 0;
        int artifacts = 0;
        for (EvidenceArtifact a : collected) {
            switch (a.kind()) {
                case TOOL_CALL -> {
                    if (a.verified()) real++; else mocked++;
                }
                case TEST_RUN -> {
                    tests++;
                    if (a.verified()) testsPassed++;
                }
                case ARTIFACT -> artifacts++;
            }
        }
        return new ProvenCounts(real, mocked, tests, testsPassed, artifacts);
    }

    private static String shortfall(String what, int have, int need) {
        if (need == 1) {
            return "missing: " + what;
        }
        return "missing: " + what + " (" + have + " of " + need + ")";
    }

    private record Key(String taskId, Phase phase) {}

    private static final class Accumulator {
        private final List<EvidenceArtifact> items = new ArrayList<>();

        synchronized void add(EvidenceArtifact artifact) {
            items.add(artifact);
        }

        synchronized List<EvidenceArtifact> snapshot() {
            return List.copyOf(items);
        }
    }
}
