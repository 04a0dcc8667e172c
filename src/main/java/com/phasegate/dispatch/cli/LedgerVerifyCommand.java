package com.phasegate.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phasegate.core.config.PhasegateProperties;
import com.phasegate.core.ledger.LedgerVerification;
import com.phasegate.core.ledger.PhaseLedger;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Callable;

/**
 * CLI command: phasegate ledger verify
 * <p>
 * Walks the hash chain from genesis. Exits 1 when the chain is broken.
 */
@Command(name = "verify", mixinStandardHelpOptions = true, description = "Check the ledger hash chain for tampering")
@Component
public class LedgerVerifyCommand implements Callable<Integer> {

    @Option(names = {"--path", "-p"}, description = "Ledger file (defaults to phasegate.ledger.path)")
    private Path path;

    private final PhasegateProperties properties;
    private final ObjectMapper objectMapper;

    public LedgerVerifyCommand(PhasegateProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Path file = path != null ? path : Path.of(properties.getLedger().getPath());
        if (!Files.exists(file)) {
            ConsoleOutput.info("No ledger at " + file);
            return 0;
        }

        LedgerVerification result;
        try {
            result = new PhaseLedger(file, objectMapper, Clock.systemUTC()).verify();
        } catch (IOException e) {
            ConsoleOutput.error("Could not read ledger " + file + ": " + e.getMessage());
            return 1;
        }

        if (result.valid()) {
            ConsoleOutput.success("Ledger intact: " + result.entriesChecked() + " entries verified");
            return 0;
        }
        ConsoleOutput.error("Ledger broken at line " + result.brokenAt() + ": " + result.reason());
        return 1;
    }
}
