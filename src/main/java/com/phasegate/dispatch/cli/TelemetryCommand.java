package com.phasegate.dispatch.cli;

import com.phasegate.core.config.PhasegateProperties;
import com.phasegate.core.telemetry.CounterRecord;
import com.phasegate.core.telemetry.SpanRecord;
import com.phasegate.core.telemetry.SpanStatus;
import com.phasegate.core.telemetry.TelemetryReader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * CLI command: phasegate telemetry
 * <p>
 * Summarizes the span and counter streams: span counts by name and status, counter totals.
 */
@Command(name = "telemetry", mixinStandardHelpOptions = true, description = "Summarize spans and audit counters")
@Component
public class TelemetryCommand implements Callable<Integer> {

    @Option(names = {"--dir", "-d"}, description = "Telemetry directory (defaults to phasegate.telemetry.dir)")
    private Path dir;

    private final PhasegateProperties properties;
    private final TelemetryReader reader;

    public TelemetryCommand(PhasegateProperties properties, TelemetryReader reader) {
        this.properties = properties;
        this.reader = reader;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        var telemetry = properties.getTelemetry();
        Path root = dir != null ? dir : Path.of(telemetry.getDir());

        List<SpanRecord> spans;
        List<CounterRecord> counters;
        try {
            spans = reader.readSpans(root.resolve(telemetry.getSpansFile()));
            counters = reader.readCounters(root.resolve(telemetry.getCountersFile()));
        } catch (IOException e) {
            ConsoleOutput.error("Could not read telemetry under " + root + ": " + e.getMessage());
            return 1;
        }

        if (spans.isEmpty() && counters.isEmpty()) {
            ConsoleOutput.info("No telemetry under " + root);
            return 0;
        }

        ConsoleOutput.info("Spans (" + spans.size() + "):");
        Map<String, long[]> byName = new TreeMap<>();
        for (SpanRecord span : spans) {
            long[] tally = byName.computeIfAbsent(span.name(), k -> new long[2]);
            tally[span.status() == SpanStatus.OK ? 0 : 1]++;
        }
        byName.forEach((name, tally) -> ConsoleOutput.spanLine(name, tally[0], tally[1]));

        System.out.println();
        ConsoleOutput.info("Counters:");
        Map<String, Double> totals = new TreeMap<>();
        for (CounterRecord counter : counters) {
            totals.merge(counter.counter(), counter.value(), Double::sum);
        }
        totals.forEach(ConsoleOutput::counterLine);
        return 0;
    }
}
