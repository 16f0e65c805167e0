package com.phasegate.core.model;

/**
 * What the operator is shown at a confirmation gate.
 *
 * @param phase        phase awaiting confirmation
 * @param phaseName    display name of the phase
 * @param agent        agent assigned to the phase
 * @param artifact     artifact the agent is expected to produce
 * @param instructions completion instructions for the operator
 */
public record GatePrompt(
    int phase,
    String phaseName,
    String agent,
    String artifact,
    String instructions
) {}
