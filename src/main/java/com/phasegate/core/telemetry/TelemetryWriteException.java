package com.phasegate.core.telemetry;

import java.nio.file.Path;

/**
 * A telemetry record could not be appended. Caught inside the emitter; never reaches callers.
 */
public class TelemetryWriteException extends Exception {

    private final Path target;

    public TelemetryWriteException(Path target, Throwable cause) {
        super("Failed to append telemetry to " + target + ": " + cause.getMessage(), cause);
        this.target = target;
    }

    public Path target() {
        return target;
    }
}
