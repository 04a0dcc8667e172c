package com.phasegate.core.model;

import java.time.Duration;
import java.util.Map;

/**
 * Caller options for {@code advancePhase}.
 *
 * @param override allow a skip when every intervening phase already has evidence
 * @param context  string facts handed to the phase validator as a {@link PhaseContext}
 * @param timeout  bound on validation and evidence finalization; null uses the configured default
 * @param holder   agent id for phase leases; null uses the lease manager's own id
 */
public record AdvanceOptions(
    boolean override,
    Map<String, String> context,
    Duration timeout,
    String holder
) {

    public static final AdvanceOptions DEFAULT = new AdvanceOptions(false, Map.of(), null, null);

    public AdvanceOptions {
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public static AdvanceOptions withOverride() {
        return new AdvanceOptions(true, Map.of(), null, null);
    }

    public AdvanceOptions withContext(Map<String, String> fields) {
        return new AdvanceOptions(override, fields, timeout, holder);
    }

    public AdvanceOptions withTimeout(Duration limit) {
        return new AdvanceOptions(override, context, limit, holder);
    }

    public AdvanceOptions withHolder(String agentId) {
        return new AdvanceOptions(override, context, timeout, agentId);
    }
}
