package com.phasegate.dispatch.cli;

import com.phasegate.core.engine.OperatorConsole;
import com.phasegate.core.model.Decision;
import com.phasegate.core.model.GatePrompt;
import com.phasegate.core.model.TransitionResult;
import com.phasegate.core.model.WorkflowState;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;

/**
 * {@link OperatorConsole} for an operator at a terminal. Blocks on each gate with
 * no timeout. End of input counts as declining the gate.
 */
public class ConsoleOperator implements OperatorConsole {

    private final BufferedReader in;

    public ConsoleOperator(BufferedReader in) {
        this.in = in;
    }

    @Override
    public void onStart(WorkflowState state) {
        ConsoleOutput.info("Current phase: " + state.currentPhase() + " (" + state.phaseName() + ")");
        ConsoleOutput.info("Status: " + state.status().wireName());
        if (state.isCompleted()) {
            ConsoleOutput.success("Workflow already completed. Nothing to do.");
        }
    }

    @Override
    public Decision decide(GatePrompt prompt) {
        ConsoleOutput.gate(prompt);
        System.out.print("Confirm completion (y/n)? ");
        System.out.flush();
        String answer = readLine();
        if (!isYes(answer)) {
            return Decision.pause();
        }
        System.out.print("Optional comment: ");
        System.out.flush();
        String comment = readLine();
        return Decision.approve(comment != null ? comment.strip() : "");
    }

    @Override
    public void onTransition(TransitionResult result) {
        switch (result.outcome()) {
            case ADVANCED -> ConsoleOutput.success("Phase " + result.decidedPhase()
                    + " approved. Moving to phase " + result.state().currentPhase()
                    + " (" + result.state().phaseName() + ")...");
            case PAUSED -> ConsoleOutput.warn("Workflow paused at phase " + result.decidedPhase()
                    + ". Complete the artifact and rerun to resume.");
            case COMPLETED -> ConsoleOutput.success("All phases complete! Workflow finished.");
        }
    }

    static boolean isYes(String answer) {
        if (answer == null) {
            return false;
        }
        String normalized = answer.strip().toLowerCase(Locale.ROOT);
        return normalized.equals("y") || normalized.equals("yes");
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read operator input", e);
        }
    }
}
