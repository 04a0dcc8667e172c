package com.phasegate.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phasegate.core.config.PhasegateProperties;
import com.phasegate.core.ledger.LedgerEntry;
import com.phasegate.core.ledger.PhaseLedger;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: phasegate ledger history &lt;taskId&gt;
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "Show recorded transitions for one task")
@Component
public class LedgerHistoryCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--path", "-p"}, description = "Ledger file (defaults to phasegate.ledger.path)")
    private Path path;

    private final PhasegateProperties properties;
    private final ObjectMapper objectMapper;

    public LedgerHistoryCommand(PhasegateProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Path file = path != null ? path : Path.of(properties.getLedger().getPath());

        List<LedgerEntry> entries;
        try {
            entries = new PhaseLedger(file, objectMapper, Clock.systemUTC()).entries(taskId);
        } catch (IOException e) {
            ConsoleOutput.error("Could not read ledger " + file + ": " + e.getMessage());
            return 1;
        }

        if (entries.isEmpty()) {
            ConsoleOutput.info("No transitions recorded for task " + taskId);
            return 0;
        }
        ConsoleOutput.info("Task " + taskId + " (" + entries.size() + " transitions):");
        entries.forEach(ConsoleOutput::ledgerEntry);
        return 0;
    }
}
