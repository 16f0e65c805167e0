package com.phasegate.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phasegate.core.config.WorkflowPaths;
import com.phasegate.core.model.LoopOutcome;
import com.phasegate.core.model.TransitionResult;
import com.phasegate.core.persistence.JsonFileAuditLog;
import com.phasegate.core.persistence.JsonFileStateStore;
import com.phasegate.core.persistence.PhaseAgentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Drives the {@link GateController} gate by gate until the operator pauses or the
 * last phase is approved. Holds no workflow logic of its own.
 */
public class OrchestrationLoop {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationLoop.class);

    private final WorkflowPaths paths;
    private final OperatorConsole operator;
    private final ObjectMapper mapper;
    private final Clock clock;

    public OrchestrationLoop(WorkflowPaths paths, OperatorConsole operator, ObjectMapper mapper, Clock clock) {
        this.paths = paths;
        this.operator = operator;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Runs the workflow from its persisted position.
     *
     * @return {@link LoopOutcome#PAUSED} when the operator declined a gate,
     *         {@link LoopOutcome#COMPLETED} when every phase is approved (immediately,
     *         without prompting, for a workflow that was already completed)
     * @throws com.phasegate.core.persistence.PersistenceException on malformed storage or a failed write
     */
    public LoopOutcome run() {
        GateController controller = openController();
        operator.onStart(controller.state());

        if (controller.isCompleted()) {
            log.info("Workflow in {} is already completed; nothing to do", paths.stateFile());
            return LoopOutcome.COMPLETED;
        }

        var pending = controller.completeIfDue();
        if (pending.isPresent()) {
            operator.onTransition(pending.get());
            return LoopOutcome.COMPLETED;
        }

        TransitionResult result;
        do {
            result = controller.submitDecision(operator.decide(controller.prompt()));
            operator.onTransition(result);
        } while (!result.haltsLoop());

        return switch (result.outcome()) {
            case PAUSED -> LoopOutcome.PAUSED;
            case COMPLETED -> LoopOutcome.COMPLETED;
            case ADVANCED -> throw new IllegalStateException("Loop halted on an advancing transition");
        };
    }

    GateController openController() {
        log.debug("Opening workflow: state={}, audit={}, phaseMap={}",
                paths.stateFile(), paths.auditFile(), paths.phaseMapFile());
        return new GateController(
                new JsonFileStateStore(paths.stateFile(), mapper),
                new JsonFileAuditLog(paths.auditFile(), mapper),
                PhaseAgentMap.load(paths.phaseMapFile(), mapper),
                clock);
    }

    public WorkflowPaths paths() {
        return paths;
    }
}
