package com.phasegate.core.attestation;

import java.util.Map;

/**
 * Aggregate drift figures across all attestation checks.
 */
public record DriftStats(
    long totalChecks,
    long driftDetections,
    double driftRate,
    Map<DriftSeverity, Long> severityCounts
) {}
