package com.phasegate.core.telemetry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SpanStatus {
    OK,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SpanStatus fromWire(String value) {
        return SpanStatus.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
