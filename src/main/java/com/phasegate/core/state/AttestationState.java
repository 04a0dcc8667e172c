package com.phasegate.core.state;

import com.phasegate.core.attestation.AttestationResult;
import com.phasegate.core.attestation.DriftSeverity;

import java.io.Serializable;

/**
 * Drift tracking for one cycle.
 *
 * @param baselineHash    set at cycle start; changes only when an operator refreshes the baseline
 * @param lastCheckedHash hash seen by the most recent check, null before the first one
 * @param lastSeverity    severity of the most recent check
 */
public record AttestationState(
    String baselineHash,
    String lastCheckedHash,
    DriftSeverity lastSeverity
) implements Serializable {

    public static AttestationState baseline(String hash) {
        return new AttestationState(hash, null, DriftSeverity.NONE);
    }

    public AttestationState withCheck(AttestationResult result) {
        String base = baselineHash != null ? baselineHash : result.baselineHash();
        String checked = result.currentHash() != null ? result.currentHash() : lastCheckedHash;
        return new AttestationState(base, checked, result.severity());
    }

    public AttestationState withBaseline(String hash) {
        return new AttestationState(hash, lastCheckedHash, lastSeverity);
    }
}
