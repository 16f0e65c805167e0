package com.phasegate.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of transition recorded in the audit trail.
 */
public enum AuditAction {
    APPROVED("approved"),
    PAUSED("paused"),
    COMPLETED("completed");

    private final String wireName;

    AuditAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static AuditAction fromWireName(String value) {
        for (AuditAction action : values()) {
            if (action.wireName.equals(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown audit action: " + value);
    }
}
