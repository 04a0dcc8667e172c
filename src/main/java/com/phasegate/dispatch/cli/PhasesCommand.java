package com.phasegate.dispatch.cli;

import com.phasegate.core.evidence.EvidenceCollector;
import com.phasegate.core.evidence.EvidenceRequirement;
import com.phasegate.core.model.Phase;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: phasegate phases
 * <p>
 * Prints the work order with each phase's configured evidence requirement.
 */
@Command(name = "phases", mixinStandardHelpOptions = true, description = "Show the phase order and evidence requirements")
@Component
public class PhasesCommand implements Runnable {

    private final EvidenceCollector evidenceCollector;

    public PhasesCommand(EvidenceCollector evidenceCollector) {
        this.evidenceCollector = evidenceCollector;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        System.out.printf("  %-3s %-12s %-6s %-6s %s%n", "#", "PHASE", "TESTS", "CALLS", "ARTIFACTS");
        System.out.println("  " + "-".repeat(44));
        for (Phase phase : Phase.WORK_SEQUENCE) {
            EvidenceRequirement r = evidenceCollector.requirementFor(phase);
            System.out.printf("  %-3d %-12s %-6d %-6d %d%n",
                    phase.index() + 1, phase.name(), r.minTests(), r.minCalls(), r.minArtifacts());
        }
        System.out.println();
        ConsoleOutput.info("A cycle closes from " + Phase.MONITOR + " only.");
    }
}
