package com.phasegate.dispatch.cli;

import com.phasegate.core.config.WorkflowPaths;
import com.phasegate.core.engine.WorkflowFactory;
import com.phasegate.core.model.AuditLogEntry;
import com.phasegate.core.model.PhaseCatalog;
import com.phasegate.core.model.WorkflowState;
import com.phasegate.core.model.WorkflowStatus;
import com.phasegate.core.persistence.PersistenceException;
import com.phasegate.core.persistence.PhaseAgentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: phasegate status
 * <p>
 * Shows where the workflow stands without prompting or writing anything.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show workflow status")
@Component
public class StatusCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(StatusCommand.class);

    @Mixin
    private WorkflowFileOptions files = new WorkflowFileOptions();

    private final WorkflowFactory workflowFactory;

    public StatusCommand(WorkflowFactory workflowFactory) {
        this.workflowFactory = workflowFactory;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        WorkflowPaths paths = files.resolve(workflowFactory.defaultPaths());

        WorkflowState state;
        List<AuditLogEntry> entries;
        PhaseAgentMap agents;
        try {
            state = workflowFactory.stateStore(paths).load();
            entries = workflowFactory.auditLog(paths).entries();
            agents = workflowFactory.phaseAgentMap(paths);
        } catch (PersistenceException e) {
            log.error("Failed to read workflow files: {}", e.getMessage(), e);
            ConsoleOutput.error(ConsoleOutput.rootCauseMessage(e));
            return 1;
        }

        System.out.println();
        System.out.println("State file: " + paths.stateFile());
        System.out.printf("Phase: %d / %d  %s%n", state.currentPhase(), PhaseCatalog.LAST_PHASE, state.phaseName());
        if (PhaseCatalog.isGated(state.currentPhase())) {
            System.out.println("Agent: " + agents.agentFor(state.currentPhase()));
            System.out.println("Artifact: " + PhaseCatalog.info(state.currentPhase()).artifact());
        }

        WorkflowStatus status = state.status();
        if (status == WorkflowStatus.COMPLETED) {
            ConsoleOutput.success("Status: " + status.wireName());
        } else if (status == WorkflowStatus.PAUSED) {
            ConsoleOutput.warn("Status: " + status.wireName());
        } else {
            ConsoleOutput.info("Status: " + status.wireName());
        }
        if (!state.lastAction().isEmpty()) {
            System.out.println("Last action: " + state.lastAction());
        }
        System.out.println("Audit entries: " + entries.size());
        return 0;
    }
}
