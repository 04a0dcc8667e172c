package com.phasegate.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * CLI command group: phasegate ledger verify|history
 */
@Command(
        name = "ledger",
        mixinStandardHelpOptions = true,
        description = "Verify or browse the hash-chained transition ledger",
        subcommands = {
                LedgerVerifyCommand.class,
                LedgerHistoryCommand.class
        }
)
@Component
public class LedgerCommand implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }
}
