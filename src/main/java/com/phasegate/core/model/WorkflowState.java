package com.phasegate.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Durable progress of the single workflow governed by one state file.
 * <p>
 * {@code nextPhase} is kept redundantly for readers of the persisted file and is
 * always {@code currentPhase + 1}. Instances are validated on construction, so a
 * state read from disk is either well-formed or rejected.
 *
 * @param currentPhase phase awaiting its gate, {@link PhaseCatalog#COMPLETED_PHASE} once all phases are approved
 * @param nextPhase    {@code currentPhase + 1}
 * @param status       lifecycle status
 * @param phaseName    display label of {@code currentPhase}
 * @param lastAction   display description of the latest transition
 */
@JsonPropertyOrder({"current_phase", "next_phase", "status", "phase_name", "last_action"})
public record WorkflowState(
    @JsonProperty("current_phase") int currentPhase,
    @JsonProperty("next_phase") int nextPhase,
    @JsonProperty("status") WorkflowStatus status,
    @JsonProperty("phase_name") String phaseName,
    @JsonProperty("last_action") String lastAction
) {

    public WorkflowState {
        if (currentPhase < PhaseCatalog.FIRST_PHASE || currentPhase > PhaseCatalog.COMPLETED_PHASE) {
            throw new IllegalArgumentException("current_phase out of range [0, 14]: " + currentPhase);
        }
        if (nextPhase != currentPhase + 1) {
            throw new IllegalArgumentException(
                    "next_phase must be current_phase + 1, got " + nextPhase + " for phase " + currentPhase);
        }
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        if (status == WorkflowStatus.COMPLETED && currentPhase <= PhaseCatalog.LAST_PHASE) {
            throw new IllegalArgumentException("status completed is only valid past phase 13, got phase " + currentPhase);
        }
        if (currentPhase > PhaseCatalog.LAST_PHASE
                && status != WorkflowStatus.COMPLETED && status != WorkflowStatus.IN_PROGRESS) {
            throw new IllegalArgumentException("phase 14 cannot have status " + status.wireName());
        }
        phaseName = phaseName != null ? phaseName : "";
        lastAction = lastAction != null ? lastAction : "";
    }

    /**
     * Reads the persisted form, where {@code next_phase} may be omitted.
     */
    @JsonCreator
    public static WorkflowState fromJson(
            @JsonProperty(value = "current_phase", required = true) int currentPhase,
            @JsonProperty("next_phase") Integer nextPhase,
            @JsonProperty(value = "status", required = true) WorkflowStatus status,
            @JsonProperty("phase_name") String phaseName,
            @JsonProperty("last_action") String lastAction) {
        return new WorkflowState(currentPhase,
                nextPhase != null ? nextPhase : currentPhase + 1,
                status, phaseName, lastAction);
    }

    /** State of a workflow that has never been run. */
    public static WorkflowState initial() {
        return new WorkflowState(PhaseCatalog.FIRST_PHASE, PhaseCatalog.FIRST_PHASE + 1,
                WorkflowStatus.NOT_STARTED, PhaseCatalog.nameOf(PhaseCatalog.FIRST_PHASE), "");
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == WorkflowStatus.COMPLETED;
    }

    /** True when every phase is approved but the completion has not been committed yet. */
    @JsonIgnore
    public boolean isCompletionPending() {
        return currentPhase > PhaseCatalog.LAST_PHASE && status != WorkflowStatus.COMPLETED;
    }

    public WorkflowState advanced(String action) {
        int phase = currentPhase + 1;
        return new WorkflowState(phase, phase + 1, WorkflowStatus.IN_PROGRESS, PhaseCatalog.nameOf(phase), action);
    }

    public WorkflowState paused(String action) {
        return new WorkflowState(currentPhase, nextPhase, WorkflowStatus.PAUSED, phaseName, action);
    }

    public WorkflowState completed(String action) {
        return new WorkflowState(PhaseCatalog.COMPLETED_PHASE, PhaseCatalog.COMPLETED_PHASE + 1,
                WorkflowStatus.COMPLETED, PhaseCatalog.nameOf(PhaseCatalog.COMPLETED_PHASE), action);
    }
}
