package com.phasegate.core.model;

/**
 * Why a transition was refused. Each category tells the driver what to do next.
 */
public enum RejectionCategory {
    /** Produce more evidence or fix the failing checks, then retry. */
    VALIDATION_FAILURE,
    /** Stop skipping, or supply evidence for every intervening phase. */
    SKIP_REJECTED,
    /** Instructions drifted in a way that weakens guardrails; an operator must refresh the baseline. */
    DRIFT_BLOCKED,
    /** Another agent holds the lease on the current or target phase; wait for it to finish or expire. */
    LEASE_CONTENDED
}
