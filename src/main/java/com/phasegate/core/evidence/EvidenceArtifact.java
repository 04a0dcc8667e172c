package com.phasegate.core.evidence;

import java.io.Serializable;
import java.time.Instant;

/**
 * One piece of recorded proof.
 *
 * @param kind       what was recorded
 * @param reference  opaque reference owned by the producer: a file path, tool name or test command
 * @param verified   false for mocked tool calls and failed test runs
 * @param recordedAt when the producer reported it
 */
public record EvidenceArtifact(
    EvidenceKind kind,
    String reference,
    boolean verified,
    Instant recordedAt
) implements Serializable {}
