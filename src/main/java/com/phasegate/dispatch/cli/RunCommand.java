package com.phasegate.dispatch.cli;

import com.phasegate.core.config.WorkflowPaths;
import com.phasegate.core.engine.WorkflowFactory;
import com.phasegate.core.model.LoopOutcome;
import com.phasegate.core.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

/**
 * CLI command: phasegate run
 * <p>
 * Resumes the workflow at its persisted phase and asks for confirmation at each
 * gate until the operator pauses or the last phase is approved. Exits 0 in both
 * cases and 1 when the workflow files cannot be read or written or operator input fails.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run the gated workflow from its current phase")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Mixin
    private WorkflowFileOptions files = new WorkflowFileOptions();

    private final WorkflowFactory workflowFactory;

    public RunCommand(WorkflowFactory workflowFactory) {
        this.workflowFactory = workflowFactory;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        WorkflowPaths paths = files.resolve(workflowFactory.defaultPaths());
        ConsoleOutput.info("State file: " + paths.stateFile());

        // reader wraps System.in and is not closed here
        var operator = new ConsoleOperator(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        LoopOutcome outcome;
        try {
            outcome = workflowFactory.newLoop(paths, operator).run();
        } catch (PersistenceException e) {
            log.error("Workflow aborted: {}", e.getMessage(), e);
            ConsoleOutput.error("Workflow aborted: " + ConsoleOutput.rootCauseMessage(e));
            return 1;
        } catch (UncheckedIOException e) {
            log.error("Operator input failed: {}", e.getMessage(), e);
            ConsoleOutput.error("Workflow aborted: " + ConsoleOutput.rootCauseMessage(e));
            return 1;
        }

        System.out.println();
        if (outcome == LoopOutcome.PAUSED) {
            ConsoleOutput.info("State saved. Resume with: phasegate run");
        } else {
            ConsoleOutput.success("Workflow completed.");
        }
        return 0;
    }
}
