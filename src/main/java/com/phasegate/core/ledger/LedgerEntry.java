package com.phasegate.core.ledger;

import com.phasegate.core.model.Phase;
import com.phasegate.core.model.TransitionKind;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * One hash-chained line of the phase ledger.
 *
 * @param previousHash {@link PhaseLedger#GENESIS} for the first entry
 * @param entryHash    SHA-256 of this entry's canonical form without {@code entryHash}
 * @param fromPhase    null for a cycle start
 */
public record LedgerEntry(
    String entryId,
    Instant timestamp,
    String previousHash,
    String entryHash,
    String taskId,
    Phase fromPhase,
    Phase toPhase,
    TransitionKind kind,
    List<String> evidenceArtifacts,
    boolean evidenceValidated
) implements Serializable {

    public LedgerEntry {
        evidenceArtifacts = evidenceArtifacts == null ? List.of() : List.copyOf(evidenceArtifacts);
    }

    LedgerEntry withEntryHash(String hash) {
        return new LedgerEntry(entryId, timestamp, previousHash, hash, taskId, fromPhase, toPhase, kind,
                evidenceArtifacts, evidenceValidated);
    }
}
