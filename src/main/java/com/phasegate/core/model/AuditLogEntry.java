package com.phasegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Objects;

/**
 * One record of the append-only audit trail.
 *
 * @param timestamp UTC instant of the action
 * @param agent     agent owning {@code phase} at the time, or a sentinel
 * @param phase     phase active when the action occurred
 * @param action    what happened
 * @param comment   operator comment, or the canned default for the action
 */
@JsonPropertyOrder({"timestamp", "agent", "phase", "action", "comment"})
public record AuditLogEntry(
    @JsonProperty(value = "timestamp", required = true) Instant timestamp,
    @JsonProperty(value = "agent", required = true) String agent,
    @JsonProperty(value = "phase", required = true) int phase,
    @JsonProperty(value = "action", required = true) AuditAction action,
    @JsonProperty("comment") String comment
) {

    public AuditLogEntry {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(agent, "agent");
        Objects.requireNonNull(action, "action");
        comment = comment != null ? comment : "";
    }
}
