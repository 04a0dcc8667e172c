package com.phasegate.core.lease;

import com.phasegate.core.model.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Grants expiring, renewable leases on a task's phases so two agents cannot drive the same
 * task at once.
 * <p>
 * A lease is keyed by task and phase. The holder can re-acquire or renew its own lease; anyone
 * else is refused until the lease is released or expires. Renewals are capped. Leases live in
 * process memory and do not survive a restart.
 */
public class PhaseLeaseManager {

    private static final Logger log = LoggerFactory.getLogger(PhaseLeaseManager.class);

    private record LeaseKey(String taskId, Phase phase) {}

    private final Map<LeaseKey, PhaseLease> leases = new HashMap<>();
    private final Clock clock;
    private final Duration leaseDuration;
    private final int maxRenewals;
    private final String defaultHolder;
    private long contentionEvents;

    /**
     * @param defaultHolder used when a caller names no holder; generated when blank
     */
    public PhaseLeaseManager(Clock clock, Duration leaseDuration, int maxRenewals, String defaultHolder) {
        if (leaseDuration.isNegative() || leaseDuration.isZero()) {
            throw new IllegalArgumentException("lease duration must be positive: " + leaseDuration);
        }
        this.clock = clock;
        this.leaseDuration = leaseDuration;
        this.maxRenewals = maxRenewals;
        this.defaultHolder = defaultHolder == null || defaultHolder.isBlank() ? generateHolder() : defaultHolder;
    }

    public String defaultHolder() {
        return defaultHolder;
    }

    public Duration leaseDuration() {
        return leaseDuration;
    }

    public synchronized LeaseOutcome acquire(String taskId, Phase phase, String holder) {
        String who = resolve(holder);
        Instant now = clock.instant();
        LeaseKey key = new LeaseKey(taskId, phase);
        PhaseLease existing = leases.get(key);

        if (existing != null && existing.liveAt(now)) {
            if (existing.holder().equals(who)) {
                return LeaseOutcome.granted(existing);
            }
            contentionEvents++;
            Duration left = Duration.between(now, existing.expiresAt());
            log.warn("Lease on task {} phase {} refused to {}, held by {} for another {}s",
                    taskId, phase, who, existing.holder(), left.toSeconds());
            return LeaseOutcome.contended(existing, left);
        }
        if (existing != null) {
            log.info("Lease on task {} phase {} held by {} expired, reassigning to {}",
                    taskId, phase, existing.holder(), who);
        }

        var lease = new PhaseLease(UUID.randomUUID().toString(), taskId, phase, who, now, now.plus(leaseDuration), 0);
        leases.put(key, lease);
        log.debug("Lease {} on task {} phase {} granted to {}", lease.leaseId(), taskId, phase, who);
        return LeaseOutcome.granted(lease);
    }

    /**
     * Extends the holder's lease by a full lease duration. An expired lease nobody else took
     * can still be renewed.
     */
    public synchronized LeaseOutcome renew(String taskId, Phase phase, String holder) {
        String who = resolve(holder);
        LeaseKey key = new LeaseKey(taskId, phase);
        PhaseLease existing = leases.get(key);
        if (existing == null || !existing.holder().equals(who)) {
            return LeaseOutcome.refused("lease on " + phase + " not held by " + who);
        }
        if (existing.renewedCount() >= maxRenewals) {
            return LeaseOutcome.refused("max renewals (" + maxRenewals + ") exceeded");
        }
        PhaseLease renewed = existing.renewedUntil(clock.instant().plus(leaseDuration));
        leases.put(key, renewed);
        log.debug("Lease on task {} phase {} renewed by {} ({} renewals)", taskId, phase, who, renewed.renewedCount());
        return LeaseOutcome.granted(renewed);
    }

    /**
     * @return false when the lease is absent or belongs to someone else
     */
    public synchronized boolean release(String taskId, Phase phase, String holder) {
        String who = resolve(holder);
        LeaseKey key = new LeaseKey(taskId, phase);
        PhaseLease existing = leases.get(key);
        if (existing == null || !existing.holder().equals(who)) {
            log.debug("Lease on task {} phase {} not held by {}, nothing released", taskId, phase, who);
            return false;
        }
        leases.remove(key);
        return true;
    }

    /** Drops every lease on the task regardless of holder. */
    public synchronized int releaseAll(String taskId) {
        int before = leases.size();
        leases.keySet().removeIf(k -> k.taskId().equals(taskId));
        return before - leases.size();
    }

    /** The live lease on a phase, if any. */
    public synchronized Optional<PhaseLease> current(String taskId, Phase phase) {
        PhaseLease lease = leases.get(new LeaseKey(taskId, phase));
        return lease != null && lease.liveAt(clock.instant()) ? Optional.of(lease) : Optional.empty();
    }

    /** A live lease on the phase held by someone other than {@code holder}. */
    public Optional<PhaseLease> heldByOther(String taskId, Phase phase, String holder) {
        String who = resolve(holder);
        return current(taskId, phase).filter(l -> !l.holder().equals(who));
    }

    public synchronized LeaseStats stats() {
        Instant now = clock.instant();
        int active = (int) leases.values().stream().filter(l -> l.liveAt(now)).count();
        int maxRenewed = leases.values().stream().mapToInt(PhaseLease::renewedCount).max().orElse(0);
        return new LeaseStats(leases.size(), active, leases.size() - active, maxRenewed, contentionEvents);
    }

    private String resolve(String holder) {
        return holder == null || holder.isBlank() ? defaultHolder : holder;
    }

    private static String generateHolder() {
        return "phasegate-" + ProcessHandle.current().pid() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
