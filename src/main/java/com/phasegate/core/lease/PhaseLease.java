package com.phasegate.core.lease;

import com.phasegate.core.model.Phase;

import java.io.Serializable;
import java.time.Instant;

/**
 * Time-bounded claim by one holder on a task's phase.
 *
 * @param holder       agent id that owns the lease
 * @param renewedCount how many times the lease has been extended
 */
public record PhaseLease(
    String leaseId,
    String taskId,
    Phase phase,
    String holder,
    Instant acquiredAt,
    Instant expiresAt,
    int renewedCount
) implements Serializable {

    public boolean liveAt(Instant now) {
        return now.isBefore(expiresAt);
    }

    PhaseLease renewedUntil(Instant newExpiry) {
        return new PhaseLease(leaseId, taskId, phase, holder, acquiredAt, newExpiry, renewedCount + 1);
    }
}
