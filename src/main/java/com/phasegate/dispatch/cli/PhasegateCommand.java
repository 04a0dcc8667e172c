package com.phasegate.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Phasegate.
 * Routes to subcommands: telemetry, ledger, phases.
 */
@Command(
        name = "phasegate",
        mixinStandardHelpOptions = true,
        version = "Phasegate 0.1.0",
        description = "Inspect phase enforcement telemetry and the transition ledger",
        subcommands = {
                TelemetryCommand.class,
                LedgerCommand.class,
                PhasesCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PhasegateCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
