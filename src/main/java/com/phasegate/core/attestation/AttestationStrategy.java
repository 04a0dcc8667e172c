package com.phasegate.core.attestation;

import com.phasegate.core.model.Phase;

import java.util.Optional;

/**
 * Seam through which the enforcer detects instruction drift.
 */
public interface AttestationStrategy {

    /**
     * Records the baseline for a task at STRATEGIZE entry. Does nothing when one exists.
     *
     * @return the baseline hash, empty when the instructions could not be read
     */
    Optional<String> establishBaseline(String taskId);

    AttestationResult check(String taskId, Phase phase);

    /**
     * Operator action: accept the current instructions as the new baseline.
     */
    Optional<String> refreshBaseline(String taskId);

    void forget(String taskId);
}
