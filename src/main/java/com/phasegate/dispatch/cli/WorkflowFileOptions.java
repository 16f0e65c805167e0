package com.phasegate.dispatch.cli;

import com.phasegate.core.config.WorkflowPaths;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Per-invocation overrides of the configured workflow files, shared by all
 * subcommands through {@code @Mixin}.
 */
public class WorkflowFileOptions {

    @Option(names = "--state-file", paramLabel = "FILE", description = "Workflow state JSON (overrides phasegate.files.state)")
    Path stateFile;

    @Option(names = "--audit-file", paramLabel = "FILE", description = "Audit trail JSON (overrides phasegate.files.audit)")
    Path auditFile;

    @Option(names = "--phase-map-file", paramLabel = "FILE", description = "Phase-agent map JSON (overrides phasegate.files.phase-map)")
    Path phaseMapFile;

    public WorkflowPaths resolve(WorkflowPaths defaults) {
        return defaults.withOverrides(stateFile, auditFile, phaseMapFile);
    }
}
