package com.phasegate.dispatch.cli;

import com.phasegate.core.config.PhaseGateProperties;
import com.phasegate.core.config.WorkflowPaths;
import com.phasegate.core.engine.WorkflowFactory;
import com.phasegate.core.persistence.AuditCsvExporter;
import com.phasegate.core.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: phasegate export
 * <p>
 * Writes the audit trail as CSV. The JSON trail is left untouched.
 */
@Command(name = "export", mixinStandardHelpOptions = true, description = "Export the audit trail as CSV")
@Component
public class ExportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    @Option(names = {"--output", "-o"}, paramLabel = "FILE",
            description = "CSV destination (default: phasegate.files.audit-csv)")
    private Path output;

    @Mixin
    private WorkflowFileOptions files = new WorkflowFileOptions();

    private final WorkflowFactory workflowFactory;
    private final AuditCsvExporter exporter;
    private final PhaseGateProperties properties;

    public ExportCommand(WorkflowFactory workflowFactory, AuditCsvExporter exporter, PhaseGateProperties properties) {
        this.workflowFactory = workflowFactory;
        this.exporter = exporter;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        WorkflowPaths paths = files.resolve(workflowFactory.defaultPaths());
        Path target = output != null ? output : properties.getAuditCsvFile();
        try {
            int rows = exporter.export(workflowFactory.auditLog(paths).entries(), target);
            ConsoleOutput.success("Exported " + rows + " audit entr" + (rows == 1 ? "y" : "ies") + " to " + target);
            return 0;
        } catch (PersistenceException e) {
            log.error("Failed to export audit trail: {}", e.getMessage(), e);
            ConsoleOutput.error(ConsoleOutput.rootCauseMessage(e));
            return 1;
        }
    }
}
