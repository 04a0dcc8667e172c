package com.phasegate.core.telemetry;

public final class SpanNames {

    /** A committed change of phase, including cycle start and close. */
    public static final String STATE_TRANSITION = "agent.state.transition";

    /** A rejected transition request. */
    public static final String PROCESS_VALIDATION = "process.validation";

    private SpanNames() {}
}
