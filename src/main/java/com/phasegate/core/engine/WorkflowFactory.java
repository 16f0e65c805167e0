package com.phasegate.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phasegate.core.config.PhaseGateProperties;
import com.phasegate.core.config.WorkflowPaths;
import com.phasegate.core.persistence.AuditLog;
import com.phasegate.core.persistence.JsonFileAuditLog;
import com.phasegate.core.persistence.JsonFileStateStore;
import com.phasegate.core.persistence.PhaseAgentMap;
import com.phasegate.core.persistence.StateStore;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Builds loops and read-side views over the files of one workflow. CLI commands
 * go through here so that path overrides apply to every component alike.
 */
@Service
public class WorkflowFactory {

    private final PhaseGateProperties properties;
    private final ObjectMapper mapper;
    private final Clock clock;

    public WorkflowFactory(PhaseGateProperties properties, ObjectMapper mapper, Clock clock) {
        this.properties = properties;
        this.mapper = mapper;
        this.clock = clock;
    }

    public WorkflowPaths defaultPaths() {
        return WorkflowPaths.from(properties);
    }

    public OrchestrationLoop newLoop(WorkflowPaths paths, OperatorConsole operator) {
        return new OrchestrationLoop(paths, operator, mapper, clock);
    }

    public StateStore stateStore(WorkflowPaths paths) {
        return new JsonFileStateStore(paths.stateFile(), mapper);
    }

    public AuditLog auditLog(WorkflowPaths paths) {
        return new JsonFileAuditLog(paths.auditFile(), mapper);
    }

    public PhaseAgentMap phaseAgentMap(WorkflowPaths paths) {
        return PhaseAgentMap.load(paths.phaseMapFile(), mapper);
    }
}
