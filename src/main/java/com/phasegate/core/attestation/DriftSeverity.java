package com.phasegate.core.attestation;

/**
 * How far a task's effective instructions have moved from their baseline.
 */
public enum DriftSeverity {
    /** Identical instructions. */
    NONE,
    /** Only comments or formatting changed. */
    LOW,
    /** Instructional content changed. */
    MEDIUM,
    /** A guardrail was removed or weakened. */
    HIGH;

    public String recommendation() {
        return switch (this) {
            case NONE -> "Instructions match baseline";
            case LOW -> "Formatting-only change; no action needed";
            case MEDIUM -> "Instructions changed; verify the change was intentional";
            case HIGH -> "Guardrails weakened; an operator must review and refresh the baseline";
        };
    }
}
