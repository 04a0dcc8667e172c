package com.phasegate.core.telemetry;

import java.time.Instant;
import java.util.Map;

/**
 * One line of the span stream.
 *
 * @param parentSpanId null for root spans
 */
public record SpanRecord(
    String traceId,
    String spanId,
    String parentSpanId,
    String name,
    SpanStatus status,
    Instant startTime,
    long durationMs,
    Map<String, Object> attributes
) {}
