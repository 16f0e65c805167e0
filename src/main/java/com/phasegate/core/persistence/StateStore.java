package com.phasegate.core.persistence;

import com.phasegate.core.model.WorkflowState;

/**
 * Durable holder of the single {@link WorkflowState} of a workflow.
 */
public interface StateStore {

    /**
     * Returns the persisted state, or {@link WorkflowState#initial()} when nothing
     * has been persisted yet.
     *
     * @throws PersistenceException if the persisted state is unreadable or malformed
     */
    WorkflowState load();

    /**
     * Replaces the persisted state. A subsequent {@link #load()} observes either
     * the previous or the new state in full.
     *
     * @throws PersistenceException if the write fails
     */
    void save(WorkflowState state);
}
