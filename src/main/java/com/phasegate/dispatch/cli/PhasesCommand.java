package com.phasegate.dispatch.cli;

import com.phasegate.core.config.WorkflowPaths;
import com.phasegate.core.engine.WorkflowFactory;
import com.phasegate.core.model.PhaseCatalog;
import com.phasegate.core.model.WorkflowState;
import com.phasegate.core.persistence.PersistenceException;
import com.phasegate.core.persistence.PhaseAgentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * CLI command: phasegate phases
 * <p>
 * Lists all phases with their assigned agents and marks approved phases and
 * the phase currently awaiting its gate.
 */
@Command(name = "phases", mixinStandardHelpOptions = true, description = "List phases and assigned agents")
@Component
public class PhasesCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PhasesCommand.class);

    @Mixin
    private WorkflowFileOptions files = new WorkflowFileOptions();

    private final WorkflowFactory workflowFactory;

    public PhasesCommand(WorkflowFactory workflowFactory) {
        this.workflowFactory = workflowFactory;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        WorkflowPaths paths = files.resolve(workflowFactory.defaultPaths());

        WorkflowState state;
        PhaseAgentMap agents;
        try {
            state = workflowFactory.stateStore(paths).load();
            agents = workflowFactory.phaseAgentMap(paths);
        } catch (PersistenceException e) {
            log.error("Failed to read workflow files: {}", e.getMessage(), e);
            ConsoleOutput.error(ConsoleOutput.rootCauseMessage(e));
            return 1;
        }

        System.out.println();
        System.out.printf("     %-3s %-42s %-22s %s%n", "#", "PHASE", "AGENT", "ARTIFACT");
        System.out.println("  " + "-".repeat(90));
        for (var phase : PhaseCatalog.phases()) {
            String marker;
            if (phase.number() < state.currentPhase()) {
                marker = "@|fg(green) +|@";
            } else if (phase.number() == state.currentPhase()) {
                marker = "@|bold,fg(yellow) >|@";
            } else {
                marker = " ";
            }
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("  %s  %-3d %-42s %-22s %s",
                    marker, phase.number(), phase.name(),
                    ConsoleOutput.truncate(agents.agentFor(phase.number()), 22), phase.artifact())));
        }
        return 0;
    }
}
