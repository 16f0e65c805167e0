package com.phasegate.core.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Backing locations of one workflow. Passed explicitly to the orchestration
 * loop so that separate workflows (and tests) never share files by accident.
 *
 * @param stateFile    persisted {@code WorkflowState}
 * @param auditFile    append-only audit trail
 * @param phaseMapFile read-only phase-agent map
 */
public record WorkflowPaths(Path stateFile, Path auditFile, Path phaseMapFile) {

    public WorkflowPaths {
        Objects.requireNonNull(stateFile, "stateFile");
        Objects.requireNonNull(auditFile, "auditFile");
        Objects.requireNonNull(phaseMapFile, "phaseMapFile");
    }

    public static WorkflowPaths from(PhaseGateProperties properties) {
        return new WorkflowPaths(properties.getStateFile(), properties.getAuditFile(), properties.getPhaseMapFile());
    }

    /** Conventional layout under a single directory, as used by the default configuration. */
    public static WorkflowPaths under(Path home) {
        return new WorkflowPaths(
                home.resolve("state").resolve("state_schema.json"),
                home.resolve("logs").resolve("audit_trail.json"),
                home.resolve("config").resolve("phase_agent_map.json"));
    }

    /** Replaces the non-null arguments, keeping the current value for nulls. */
    public WorkflowPaths withOverrides(Path state, Path audit, Path phaseMap) {
        return new WorkflowPaths(
                state != null ? state : stateFile,
                audit != null ? audit : auditFile,
                phaseMap != null ? phaseMap : phaseMapFile);
    }
}
