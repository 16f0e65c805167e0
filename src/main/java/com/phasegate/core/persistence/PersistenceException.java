package com.phasegate.core.persistence;

/**
 * Thrown when workflow state, the audit trail or the phase-agent map cannot be
 * read or written. Always fatal for the current run.
 */
public class PersistenceException extends RuntimeException {
    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
