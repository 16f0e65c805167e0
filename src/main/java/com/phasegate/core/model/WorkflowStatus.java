package com.phasegate.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of the gated workflow.
 * Persisted in its lowercase wire form ({@code not_started}, {@code in_progress}, ...).
 */
public enum WorkflowStatus {
    NOT_STARTED("not_started"),
    IN_PROGRESS("in_progress"),
    PAUSED("paused"),        // operator declined the gate, awaiting re-run
    COMPLETED("completed");  // terminal

    private final String wireName;

    WorkflowStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static WorkflowStatus fromWireName(String value) {
        for (WorkflowStatus status : values()) {
            if (status.wireName.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown workflow status: " + value);
    }
}
