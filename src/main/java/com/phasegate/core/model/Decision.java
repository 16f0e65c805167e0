package com.phasegate.core.model;

/**
 * Operator response to a confirmation gate.
 *
 * @param approved true to approve the phase, false to pause the workflow
 * @param comment  optional free text, may be blank
 */
public record Decision(boolean approved, String comment) {

    public static Decision approve(String comment) {
        return new Decision(true, comment);
    }

    public static Decision pause() {
        return new Decision(false, "");
    }
}
