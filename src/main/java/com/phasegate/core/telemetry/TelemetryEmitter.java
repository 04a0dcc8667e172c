package com.phasegate.core.telemetry;

import java.util.Map;

/**
 * Append-only sink for spans and counters.
 * <p>
 * Implementations must never throw from these methods: telemetry is fire-and-forget
 * relative to the work it describes.
 */
public interface TelemetryEmitter {

    void emit(SpanRecord span);

    void counter(String name, double value, Map<String, Object> metadata);

    default void increment(String name, Map<String, Object> metadata) {
        counter(name, 1, metadata);
    }

    default ActiveSpan startSpan(String name, Map<String, Object> attributes) {
        return ActiveSpan.root(this, name, attributes);
    }
}
