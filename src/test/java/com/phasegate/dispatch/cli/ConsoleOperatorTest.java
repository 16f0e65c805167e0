package com.phasegate.dispatch.cli;

import com.phasegate.core.model.GatePrompt;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleOperatorTest {

    private static final GatePrompt PROMPT = new GatePrompt(
            5, "Pain Extraction & Tagging", "Market Intelligence", "pains_tagged.json",
            "Complete the artifact for this phase before continuing.");

    private final ByteArrayOutputStream capture = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureOut() {
        originalOut = System.out;
        System.setOut(new PrintStream(capture, true));
    }

    @AfterEach
    void restoreOut() {
        System.setOut(originalOut);
    }

    private static ConsoleOperator operator(String input) {
        return new ConsoleOperator(new BufferedReader(new StringReader(input)));
    }

    @Test
    @DisplayName("'y' approves and reads the comment")
    void approveWithComment() {
        var decision = operator("y\n  evidence archived  \n").decide(PROMPT);
        assertTrue(decision.approved());
        assertEquals("evidence archived", decision.comment());
    }

    @Test
    @DisplayName("'YES' approves with an empty comment at end of input")
    void approveWithoutComment() {
        var decision = operator("YES\n").decide(PROMPT);
        assertTrue(decision.approved());
        assertEquals("", decision.comment());
    }

    @Test
    @DisplayName("anything else pauses")
    void otherAnswersPause() {
        assertFalse(operator("n\n").decide(PROMPT).approved());
        assertFalse(operator("maybe\n").decide(PROMPT).approved());
        assertFalse(operator("\n").decide(PROMPT).approved());
    }

    @Test
    @DisplayName("end of input pauses")
    void endOfInputPauses() {
        assertFalse(operator("").decide(PROMPT).approved());
    }

    @Test
    @DisplayName("gate shows phase, agent and artifact")
    void rendersGate() {
        operator("n\n").decide(PROMPT);
        String output = capture.toString();
        assertTrue(output.contains("[Phase 5]"), output);
        assertTrue(output.contains("Pain Extraction & Tagging"), output);
        assertTrue(output.contains("Market Intelligence"), output);
        assertTrue(output.contains("pains_tagged.json"), output);
        assertTrue(output.contains("Confirm completion (y/n)?"), output);
    }

    @Test
    void isYes() {
        assertTrue(ConsoleOperator.isYes(" y "));
        assertTrue(ConsoleOperator.isYes("Yes"));
        assertFalse(ConsoleOperator.isYes(null));
        assertFalse(ConsoleOperator.isYes("s"));
    }
}
