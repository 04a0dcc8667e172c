package com.phasegate.core.telemetry;

import java.util.List;

/**
 * Counter names downstream audit tooling depends on. Do not rename.
 */
public final class AuditCounters {

    public static final String PHASE_SKIPS_ATTEMPTED = "phase_skips_attempted";
    public static final String PHASE_VALIDATIONS_FAILED = "phase_validations_failed";
    public static final String PHASE_BACKTRACKS = "phase_backtracks";
    public static final String PROMPT_DRIFT_DETECTED = "prompt_drift_detected";
    public static final String PHASE_LEASE_CONTENTION = "phase_lease_contention";

    public static final List<String> ALL = List.of(
            PHASE_SKIPS_ATTEMPTED, PHASE_VALIDATIONS_FAILED, PHASE_BACKTRACKS, PROMPT_DRIFT_DETECTED,
            PHASE_LEASE_CONTENTION);

    private AuditCounters() {}
}
