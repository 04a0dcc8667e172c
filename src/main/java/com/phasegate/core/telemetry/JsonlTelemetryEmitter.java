package com.phasegate.core.telemetry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phasegate.core.metrics.PhasegateMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

/**
 * Writes spans and counters to two line-delimited JSON files.
 * <p>
 * Write failures put the emitter in degraded mode for that record: the failure is logged
 * and counted, and the caller carries on.
 */
public class JsonlTelemetryEmitter implements TelemetryEmitter {

    private static final Logger log = LoggerFactory.getLogger(JsonlTelemetryEmitter.class);

    private final JsonlWriter spans;
    private final JsonlWriter counters;
    private final Clock clock;
    private final PhasegateMetrics metrics;

    public JsonlTelemetryEmitter(Path spansFile, Path countersFile, ObjectMapper mapper,
                                 Clock clock, PhasegateMetrics metrics) {
        this.spans = new JsonlWriter(spansFile, mapper);
        this.counters = new JsonlWriter(countersFile, mapper);
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public void emit(SpanRecord span) {
        write(spans, span, span.name());
    }

    @Override
    public void counter(String name, double value, Map<String, Object> metadata) {
        var record = new CounterRecord(clock.instant(), name, value, metadata != null ? metadata : Map.of());
        write(counters, record, name);
        if (metrics != null) {
            metrics.recordAuditCounter(name, value);
        }
    }

    public Path spansFile() {
        return spans.path();
    }

    public Path countersFile() {
        return counters.path();
    }

    private void write(JsonlWriter writer, Object record, String what) {
        try {
            writer.append(record);
        } catch (TelemetryWriteException e) {
            log.warn("Telemetry degraded, dropped {}: {}", what, e.getMessage());
            if (metrics != null) {
                metrics.recordTelemetryWriteFailure(writer == spans ? "span" : "counter");
            }
        } catch (RuntimeException e) {
            log.warn("Telemetry degraded, could not serialize {}: {}", what, e.getMessage(), e);
            if (metrics != null) {
                metrics.recordTelemetryWriteFailure(writer == spans ? "span" : "counter");
            }
        }
    }
}
