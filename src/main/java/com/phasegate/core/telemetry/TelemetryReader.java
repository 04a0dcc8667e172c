package com.phasegate.core.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the span and counter streams back.
 * <p>
 * A trailing line with no newline, or one that does not parse, is what a crash mid-append
 * leaves behind and is treated as absent. A malformed line anywhere else is an error.
 */
public class TelemetryReader {

    private static final Logger log = LoggerFactory.getLogger(TelemetryReader.class);

    private final ObjectMapper mapper;

    public TelemetryReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<SpanRecord> readSpans(Path file) throws IOException {
        return read(file, SpanRecord.class);
    }

    public List<CounterRecord> readCounters(Path file) throws IOException {
        return read(file, CounterRecord.class);
    }

    <T> List<T> read(Path file, Class<T> type) throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        String content = Files.readString(file, StandardCharsets.UTF_8);
        if (content.isEmpty()) {
            return List.of();
        }
        boolean terminated = content.endsWith("\n");
        String[] lines = content.split("\n", -1);
        // split leaves an empty tail after the final newline
        int last = terminated ? lines.length - 2 : lines.length - 1;

        var records = new ArrayList<T>();
        for (int i = 0; i <= last; i++) {
            String line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }
            boolean trailing = i == last;
            if (trailing && !terminated) {
                log.warn("Ignoring unterminated trailing line in {}", file);
                break;
            }
            try {
                records.add(mapper.readValue(line, type));
            } catch (JsonProcessingException e) {
                if (trailing) {
                    log.warn("Ignoring unparseable trailing line in {}", file);
                    break;
                }
                throw new IOException("Malformed record at line " + (i + 1) + " of " + file, e);
            }
        }
        return records;
    }
}
