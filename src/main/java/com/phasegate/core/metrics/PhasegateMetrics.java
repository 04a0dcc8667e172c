package com.phasegate.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for phase enforcement.
 * <p>
 * These mirror the audit counters written to the JSONL stream so a scraping backend sees
 * the same signal without tailing files.
 */
@Service
public class PhasegateMetrics {

    private final MeterRegistry registry;

    public PhasegateMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransition(String kind) {
        Counter.builder("phasegate.transitions.total")
                .description("Committed phase transitions")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordRejection(String category) {
        Counter.builder("phasegate.rejections.total")
                .description("Rejected transition requests")
                .tag("category", category)
                .register(registry)
                .increment();
    }

    public void recordAuditCounter(String counter, double value) {
        Counter.builder("phasegate.audit.counters")
                .tag("counter", counter)
                .register(registry)
                .increment(value);
    }

    /**
     * @param outcome "accepted" or "rejected"
     */
    public void recordAdvanceDuration(String outcome, long ms) {
        Timer.builder("phasegate.advance.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTelemetryWriteFailure(String stream) {
        Counter.builder("phasegate.telemetry.write_failures")
                .description("Telemetry records dropped after a failed append")
                .tag("stream", stream)
                .register(registry)
                .increment();
    }
}
