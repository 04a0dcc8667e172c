package com.phasegate.core.attestation;

import com.phasegate.core.model.Phase;

import java.io.Serializable;
import java.time.Instant;

/**
 * Outcome of comparing a task's current instructions against its baseline.
 */
public record AttestationResult(
    String taskId,
    Phase phase,
    DriftSeverity severity,
    String baselineHash,
    String currentHash,
    String recommendation,
    String details,
    Instant checkedAt
) implements Serializable {

    public boolean hasDrift() {
        return severity != DriftSeverity.NONE;
    }
}
