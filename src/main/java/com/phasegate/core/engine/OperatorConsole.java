package com.phasegate.core.engine;

import com.phasegate.core.model.Decision;
import com.phasegate.core.model.GatePrompt;
import com.phasegate.core.model.TransitionResult;
import com.phasegate.core.model.WorkflowState;

/**
 * The human side of a confirmation gate. The interactive terminal is one
 * implementation; scripted or remote callers can supply their own.
 */
public interface OperatorConsole {

    /** Called once before the first gate of a run. */
    default void onStart(WorkflowState state) {}

    /**
     * Shows {@code prompt} and blocks until the operator decides.
     */
    Decision decide(GatePrompt prompt);

    /** Called after each committed transition. */
    default void onTransition(TransitionResult result) {}
}
