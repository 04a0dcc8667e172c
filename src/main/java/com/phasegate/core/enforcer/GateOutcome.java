package com.phasegate.core.enforcer;

import com.phasegate.core.evidence.EvidenceVerdict;
import com.phasegate.core.model.Phase;
import com.phasegate.core.validation.ValidationResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Validation and evidence results for the phases one transition request had to check.
 */
final class GateOutcome {

    private final Map<Phase, ValidationResult> validations = new EnumMap<>(Phase.class);
    private final Map<Phase, EvidenceVerdict> verdicts = new EnumMap<>(Phase.class);
    private final Map<Phase, List<String>> failures = new EnumMap<>(Phase.class);

    static GateOutcome failed(Phase phase, String reason) {
        var outcome = new GateOutcome();
        outcome.failures.put(phase, List.of(reason));
        return outcome;
    }

    void put(Phase phase, ValidationResult validation, EvidenceVerdict verdict) {
        validations.put(phase, validation);
        verdicts.put(phase, verdict);
    }

    /**
     * Every reason the phase is not complete, validator errors first. Empty when it passed.
     */
    List<String> problems(Phase phase) {
        var problems = new ArrayList<String>(failures.getOrDefault(phase, List.of()));
        ValidationResult validation = validations.get(phase);
        if (validation != null && !validation.passed()) {
            problems.addAll(validation.errors().isEmpty()
                    ? List.of("validation failed for " + phase)
                    : validation.errors());
        }
        EvidenceVerdict verdict = verdicts.get(phase);
        if (verdict != null && !verdict.meetsCompletionCriteria()) {
            problems.addAll(verdict.missingEvidence().isEmpty()
                    ? List.of("evidence incomplete for " + phase)
                    : verdict.missingEvidence());
        }
        return problems;
    }

    /** True when the phase was finalized without a single artifact, tool call or test run. */
    boolean noEvidence(Phase phase) {
        EvidenceVerdict verdict = verdicts.get(phase);
        return verdict != null && verdict.collected().isEmpty();
    }

    boolean allPassed() {
        return failures.isEmpty()
                && validations.values().stream().allMatch(ValidationResult::passed)
                && verdicts.values().stream().allMatch(EvidenceVerdict::meetsCompletionCriteria);
    }

    EvidenceVerdict verdictFor(Phase phase) {
        return verdicts.get(phase);
    }

    Collection<EvidenceVerdict> verdicts() {
        return verdicts.values();
    }
}
