package com.phasegate.core.telemetry;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends one JSON document per line. Each record goes out in a single write so
 * concurrent appenders never interleave partial lines.
 */
public class JsonlWriter {

    private final Path path;
    private final ObjectMapper mapper;
    private final Object lock = new Object();

    public JsonlWriter(Path path, ObjectMapper mapper) {
        this.path = path;
        this.mapper = mapper;
    }

    public Path path() {
        return path;
    }

    public void append(Object record) throws TelemetryWriteException {
        try {
            byte[] json = mapper.writeValueAsBytes(record);
            byte[] line = new byte[json.length + 1];
            System.arraycopy(json, 0, line, 0, json.length);
            line[json.length] = '\n';
            synchronized (lock) {
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.write(path, line, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
        } catch (IOException e) {
            throw new TelemetryWriteException(path, e);
        }
    }
}
