package com.phasegate.core.evidence;

/**
 * Type of proof reported by an evidence producer.
 */
public enum EvidenceKind {
    ARTIFACT,
    TOOL_CALL,
    TEST_RUN
}
