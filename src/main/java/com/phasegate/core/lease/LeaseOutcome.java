package com.phasegate.core.lease;

import java.time.Duration;

/**
 * Result of acquiring or renewing a {@link PhaseLease}.
 *
 * @param granted   whether the caller holds the lease after the call
 * @param lease     the caller's lease when granted
 * @param holder    the current holder when refused because someone else holds it
 * @param expiresIn time left on the other holder's lease when refused
 * @param reason    why the request was refused
 */
public record LeaseOutcome(
    boolean granted,
    PhaseLease lease,
    String holder,
    Duration expiresIn,
    String reason
) {

    static LeaseOutcome granted(PhaseLease lease) {
        return new LeaseOutcome(true, lease, lease.holder(), null, null);
    }

    static LeaseOutcome contended(PhaseLease other, Duration expiresIn) {
        return new LeaseOutcome(false, null, other.holder(), expiresIn,
                "lease on " + other.phase() + " held by " + other.holder() + " for another " + expiresIn.toSeconds() + "s");
    }

    public static LeaseOutcome refused(String reason) {
        return new LeaseOutcome(false, null, null, null, reason);
    }
}
