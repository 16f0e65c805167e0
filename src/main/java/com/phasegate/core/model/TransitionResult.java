package com.phasegate.core.model;

import java.util.List;

/**
 * Outcome of a committed gate decision.
 *
 * @param outcome       kind of transition
 * @param decidedPhase  phase the decision applied to
 * @param state         state as persisted after the transition
 * @param appended      audit entries appended by the transition, in order
 */
public record TransitionResult(
    Outcome outcome,
    int decidedPhase,
    WorkflowState state,
    List<AuditLogEntry> appended
) {

    public TransitionResult {
        appended = List.copyOf(appended);
    }

    public boolean haltsLoop() {
        return outcome != Outcome.ADVANCED;
    }

    public enum Outcome {
        ADVANCED,
        PAUSED,
        COMPLETED
    }
}
