package com.phasegate.core.lease;

import com.phasegate.core.model.PhasegateException;

/**
 * Thrown when a cycle cannot start because another holder leases its first phase.
 */
public class LeaseContendedException extends PhasegateException {

    private final LeaseOutcome outcome;

    public LeaseContendedException(String taskId, LeaseOutcome outcome) {
        super("Cannot start cycle for task " + taskId + ": " + outcome.reason());
        this.outcome = outcome;
    }

    public LeaseOutcome outcome() {
        return outcome;
    }
}
