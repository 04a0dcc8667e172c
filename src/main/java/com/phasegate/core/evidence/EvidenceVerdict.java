package com.phasegate.core.evidence;

import com.phasegate.core.model.Phase;

import java.io.Serializable;
import java.util.List;

/**
 * Result of finalizing evidence collection for a task and phase.
 *
 * @param missingEvidence human-readable shortfalls; empty when the criteria are met
 */
public record EvidenceVerdict(
    String taskId,
    Phase phase,
    List<EvidenceArtifact> collected,
    ProvenCounts provenCounts,
    boolean meetsCompletionCriteria,
    List<String> missingEvidence
) implements Serializable {

    public EvidenceVerdict {
        collected = collected == null ? List.of() : List.copyOf(collected);
        missingEvidence = missingEvidence == null ? List.of() : List.copyOf(missingEvidence);
    }

    public List<String> artifactReferences() {
        return collected.stream()
                .filter(a -> a.kind() == EvidenceKind.ARTIFACT)
                .map(EvidenceArtifact::reference)
                .distinct()
                .toList();
    }
}
