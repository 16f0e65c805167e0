package com.phasegate.core.persistence;

import com.phasegate.core.model.AuditLogEntry;

import java.util.List;

/**
 * Append-only, durable record of every gate decision.
 */
public interface AuditLog {

    /**
     * Adds {@code entry} after all existing entries and persists immediately.
     *
     * @throws PersistenceException if the existing log is malformed or the write fails
     */
    void append(AuditLogEntry entry);

    /**
     * All entries in insertion (chronological) order. Empty when nothing has been logged.
     *
     * @throws PersistenceException if the log is unreadable or malformed
     */
    List<AuditLogEntry> entries();
}
