package com.phasegate.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for PhaseGate.
 * Routes to subcommands: run, status, log, export, phases.
 */
@Command(
        name = "phasegate",
        mixinStandardHelpOptions = true,
        version = "PhaseGate 0.1.0",
        description = "Human-gated phase workflow with an append-only audit trail",
        subcommands = {
                RunCommand.class,
                StatusCommand.class,
                LogCommand.class,
                ExportCommand.class,
                PhasesCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PhaseGateCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
