package com.phasegate.core.model;

/**
 * Why the orchestration loop stopped.
 */
public enum LoopOutcome {
    /** Operator declined a gate; re-running resumes at the same phase. */
    PAUSED,
    /** All phases approved. Terminal. */
    COMPLETED
}
