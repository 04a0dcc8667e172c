package com.phasegate.core.telemetry;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * A span that has started but not yet been written. Ending it emits exactly one {@link SpanRecord}.
 */
public final class ActiveSpan {

    private final TelemetryEmitter emitter;
    private final String traceId;
    private final String spanId;
    private final String parentSpanId;
    private String name;
    private final Instant startTime;
    private final long startNanos;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private boolean ended;

    private ActiveSpan(TelemetryEmitter emitter, String traceId, String parentSpanId,
                       String name, Map<String, Object> attributes) {
        this.emitter = emitter;
        this.traceId = traceId;
        this.spanId = randomHex(8);
        this.parentSpanId = parentSpanId;
        this.name = name;
        this.startTime = Instant.now();
        this.startNanos = System.nanoTime();
        if (attributes != null) {
            this.attributes.putAll(attributes);
        }
    }

    static ActiveSpan root(TelemetryEmitter emitter, String name, Map<String, Object> attributes) {
        return new ActiveSpan(emitter, randomHex(16), null, name, attributes);
    }

    public ActiveSpan child(String childName, Map<String, Object> childAttributes) {
        return new ActiveSpan(emitter, traceId, spanId, childName, childAttributes);
    }

    public synchronized ActiveSpan setAttribute(String key, Object value) {
        attributes.put(key, value);
        return this;
    }

    public String traceId() {
        return traceId;
    }

    public String spanId() {
        return spanId;
    }

    public synchronized String name() {
        return name;
    }

    /**
     * Renames the span before it ends, for spans whose outcome decides what they describe.
     */
    public synchronized ActiveSpan updateName(String newName) {
        if (!ended) {
            this.name = newName;
        }
        return this;
    }

    /**
     * Writes the span. Later calls are ignored.
     */
    public void end(SpanStatus status) {
        SpanRecord record;
        synchronized (this) {
            if (ended) {
                return;
            }
            ended = true;
            long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
            record = new SpanRecord(traceId, spanId, parentSpanId, name, status, startTime,
                    durationMs, Map.copyOf(nullSafe(attributes)));
        }
        emitter.emit(record);
    }

    // Map.copyOf rejects null values
    private static Map<String, Object> nullSafe(Map<String, Object> source) {
        var copy = new LinkedHashMap<String, Object>();
        source.forEach((k, v) -> copy.put(k, v != null ? v : ""));
        return copy;
    }

    private static String randomHex(int bytes) {
        var sb = new StringBuilder(bytes * 2);
        var random = ThreadLocalRandom.current();
        for (int i = 0; i < bytes; i++) {
            sb.append(String.format("%02x", random.nextInt(256)));
        }
        return sb.toString();
    }
}
