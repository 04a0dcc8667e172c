package com.phasegate.core.lease;

/**
 * @param contentionEvents acquisitions refused because another holder had a live lease
 */
public record LeaseStats(
    int totalLeases,
    int activeLeases,
    int expiredLeases,
    int maxRenewals,
    long contentionEvents
) {}
