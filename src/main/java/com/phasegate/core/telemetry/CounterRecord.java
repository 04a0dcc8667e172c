package com.phasegate.core.telemetry;

import java.time.Instant;
import java.util.Map;

/**
 * One line of the counter stream.
 */
public record CounterRecord(
    Instant timestamp,
    String counter,
    double value,
    Map<String, Object> metadata
) {}
