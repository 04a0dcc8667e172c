package com.phasegate.core.evidence;

import com.phasegate.core.model.Phase;

/**
 * Seam through which the enforcer collects and judges proof of work.
 */
public interface EvidenceStrategy {

    void startCollection(Phase phase, String taskId);

    EvidenceVerdict finalize(String taskId, Phase phase);

    void clear(String taskId, Phase phase);

    void forget(String taskId);

    void registerRequirement(Phase phase, EvidenceRequirement requirement);
}
