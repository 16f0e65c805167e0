package com.phasegate.dispatch.cli;

import com.phasegate.core.config.WorkflowPaths;
import com.phasegate.core.engine.WorkflowFactory;
import com.phasegate.core.model.AuditLogEntry;
import com.phasegate.core.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: phasegate log
 * <p>
 * Prints the audit trail in chronological order, most recent entries last.
 */
@Command(name = "log", mixinStandardHelpOptions = true, description = "Show the audit trail")
@Component
public class LogCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LogCommand.class);

    @Option(names = {"--limit", "-n"}, description = "Show only the last N entries (0 = all, default: ${DEFAULT-VALUE})",
            defaultValue = "0")
    private int limit;

    @Mixin
    private WorkflowFileOptions files = new WorkflowFileOptions();

    private final WorkflowFactory workflowFactory;

    public LogCommand(WorkflowFactory workflowFactory) {
        this.workflowFactory = workflowFactory;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        WorkflowPaths paths = files.resolve(workflowFactory.defaultPaths());

        List<AuditLogEntry> entries;
        try {
            entries = workflowFactory.auditLog(paths).entries();
        } catch (PersistenceException e) {
            log.error("Failed to read audit trail: {}", e.getMessage(), e);
            ConsoleOutput.error(ConsoleOutput.rootCauseMessage(e));
            return 1;
        }
        if (entries.isEmpty()) {
            ConsoleOutput.info("No audit entries in " + paths.auditFile());
            return 0;
        }

        int from = limit > 0 && entries.size() > limit ? entries.size() - limit : 0;
        ConsoleOutput.info("Audit trail (" + (entries.size() - from) + " of " + entries.size() + "):");
        System.out.println();
        System.out.printf("  %4s  %-21s %-5s %-10s %-22s %s%n", "#", "TIMESTAMP", "PHASE", "ACTION", "AGENT", "COMMENT");
        System.out.println("  " + "-".repeat(84));
        for (int i = from; i < entries.size(); i++) {
            ConsoleOutput.auditRow(i + 1, entries.get(i));
        }
        return 0;
    }
}
