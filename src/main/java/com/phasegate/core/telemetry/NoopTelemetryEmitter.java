package com.phasegate.core.telemetry;

import java.util.Map;

/**
 * Discards everything. Used when telemetry is disabled.
 */
public class NoopTelemetryEmitter implements TelemetryEmitter {

    @Override
    public void emit(SpanRecord span) {
    }

    @Override
    public void counter(String name, double value, Map<String, Object> metadata) {
    }
}
