package com.phasegate.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phasegate.core.model.AuditAction;
import com.phasegate.core.model.AuditLogEntry;
import com.phasegate.core.model.Decision;
import com.phasegate.core.model.TransitionResult.Outcome;
import com.phasegate.core.model.WorkflowState;
import com.phasegate.core.model.WorkflowStatus;
import com.phasegate.core.persistence.AuditLog;
import com.phasegate.core.persistence.JsonFileAuditLog;
import com.phasegate.core.persistence.JsonFileStateStore;
import com.phasegate.core.persistence.PersistenceException;
import com.phasegate.core.persistence.PhaseAgentMap;
import com.phasegate.core.persistence.StateStore;
import com.phasegate.core.persistence.WorkflowJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InOrder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the phase state machine against real JSON files in a temp directory.
 */
class GateControllerTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = WorkflowJson.newMapper();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final PhaseAgentMap agents = new PhaseAgentMap(Map.of(
            0, "Planner",
            5, "Market Intelligence",
            13, "Documentation"));

    private JsonFileStateStore stateStore;
    private JsonFileAuditLog auditLog;

    @BeforeEach
    void setUp() {
        stateStore = new JsonFileStateStore(tempDir.resolve("state.json"), mapper);
        auditLog = new JsonFileAuditLog(tempDir.resolve("audit.json"), mapper);
    }

    private GateController controllerAt(int phase, WorkflowStatus status) {
        stateStore.save(new WorkflowState(phase, phase + 1, status, "", ""));
        return new GateController(stateStore, auditLog, agents, clock);
    }

    @Test
    @DisplayName("first run starts at phase 0, not started, without writing")
    void firstRun() {
        var controller = new GateController(stateStore, auditLog, agents, clock);
        assertEquals(WorkflowState.initial(), controller.state());
        assertTrue(auditLog.entries().isEmpty());
    }

    @Test
    @DisplayName("prompt shows phase, name, agent and artifact")
    void prompt() {
        var prompt = controllerAt(5, WorkflowStatus.IN_PROGRESS).prompt();
        assertEquals(5, prompt.phase());
        assertEquals("Pain Extraction & Tagging", prompt.phaseName());
        assertEquals("Market Intelligence", prompt.agent());
        assertEquals("pains_tagged.json", prompt.artifact());
        assertFalse(prompt.instructions().isBlank());
    }

    @Nested
    @DisplayName("Approve")
    class ApproveTests {

        @ParameterizedTest(name = "approving phase {0} advances to the next phase")
        @ValueSource(ints = {0, 1, 5, 12})
        void approveAdvances(int phase) {
            var controller = controllerAt(phase, WorkflowStatus.IN_PROGRESS);
            int before = auditLog.entries().size();

            var result = controller.submitDecision(true, "done");

            assertEquals(Outcome.ADVANCED, result.outcome());
            assertEquals(phase, result.decidedPhase());
            var persisted = stateStore.load();
            assertEquals(phase + 1, persisted.currentPhase());
            assertEquals(phase + 2, persisted.nextPhase());
            assertEquals(WorkflowStatus.IN_PROGRESS, persisted.status());
            assertEquals("Phase " + phase + " approved", persisted.lastAction());
            assertEquals(persisted, controller.state());

            var entries = auditLog.entries();
            assertEquals(before + 1, entries.size());
            var entry = entries.get(entries.size() - 1);
            assertEquals(AuditAction.APPROVED, entry.action());
            assertEquals(phase, entry.phase());
            assertEquals(NOW, entry.timestamp());
            assertEquals("done", entry.comment());
        }

        @Test
        @DisplayName("approving from not_started moves to in_progress")
        void approveFromNotStarted() {
            var controller = new GateController(stateStore, auditLog, agents, clock);
            controller.submitDecision(Decision.approve(""));
            assertEquals(WorkflowStatus.IN_PROGRESS, stateStore.load().status());
            assertEquals("Hypothesis & Scope", stateStore.load().phaseName());
        }

        @Test
        @DisplayName("approving a paused phase resumes the workflow")
        void approveFromPaused() {
            var controller = controllerAt(3, WorkflowStatus.PAUSED);
            controller.submitDecision(true, null);
            assertEquals(4, stateStore.load().currentPhase());
            assertEquals(WorkflowStatus.IN_PROGRESS, stateStore.load().status());
        }

        @Test
        @DisplayName("blank comment is replaced by the canned default")
        void blankCommentDefaults() {
            controllerAt(0, WorkflowStatus.NOT_STARTED).submitDecision(true, "   ");
            assertEquals(GateController.DEFAULT_APPROVAL_COMMENT, auditLog.entries().get(0).comment());
        }

        @Test
        @DisplayName("entry agent comes from the phase-agent map")
        void mappedAgent() {
            controllerAt(0, WorkflowStatus.NOT_STARTED).submitDecision(true, "");
            assertEquals("Planner", auditLog.entries().get(0).agent());
        }

        @Test
        @DisplayName("unmapped phase still advances and logs Unknown Agent")
        void unmappedAgent() {
            var controller = controllerAt(7, WorkflowStatus.IN_PROGRESS);
            var result = controller.submitDecision(true, "");

            assertEquals(Outcome.ADVANCED, result.outcome());
            assertEquals(8, stateStore.load().currentPhase());
            assertEquals(PhaseAgentMap.UNKNOWN_AGENT, auditLog.entries().get(0).agent());
        }
    }

    @Nested
    @DisplayName("Pause")
    class PauseTests {

        @Test
        @DisplayName("declining keeps the phase and records a paused entry")
        void declinePauses() {
            var controller = controllerAt(5, WorkflowStatus.IN_PROGRESS);

            var result = controller.submitDecision(false, "ignored");

            assertEquals(Outcome.PAUSED, result.outcome());
            assertTrue(result.haltsLoop());
            var persisted = stateStore.load();
            assertEquals(5, persisted.currentPhase());
            assertEquals(WorkflowStatus.PAUSED, persisted.status());

            var entries = auditLog.entries();
            assertEquals(1, entries.size());
            assertEquals(AuditAction.PAUSED, entries.get(0).action());
            assertEquals(5, entries.get(0).phase());
            assertEquals("Market Intelligence", entries.get(0).agent());
            assertEquals(GateController.PAUSE_COMMENT, entries.get(0).comment());
        }

        @Test
        @DisplayName("a new controller over the same files resumes at the paused phase")
        void resumeAfterPause() {
            controllerAt(5, WorkflowStatus.IN_PROGRESS).submitDecision(false, "");

            var resumed = new GateController(stateStore, auditLog, agents, clock);

            assertEquals(5, resumed.prompt().phase());
            assertEquals(WorkflowStatus.PAUSED, resumed.state().status());
        }
    }

    @Nested
    @DisplayName("Completion")
    class CompletionTests {

        @Test
        @DisplayName("approving phase 13 appends approved then completed and finishes")
        void approveLastPhase() {
            var controller = controllerAt(13, WorkflowStatus.IN_PROGRESS);

            var result = controller.submitDecision(true, "final review");

            assertEquals(Outcome.COMPLETED, result.outcome());
            assertEquals(2, result.appended().size());
            var persisted = stateStore.load();
            assertEquals(14, persisted.currentPhase());
            assertEquals(WorkflowStatus.COMPLETED, persisted.status());

            var entries = auditLog.entries();
            assertEquals(2, entries.size());
            assertEquals(AuditAction.APPROVED, entries.get(0).action());
            assertEquals("Documentation", entries.get(0).agent());
            assertEquals(AuditAction.COMPLETED, entries.get(1).action());
            assertEquals(GateController.ORCHESTRATOR_AGENT, entries.get(1).agent());
            assertEquals(13, entries.get(1).phase());
            assertEquals(GateController.COMPLETION_COMMENT, entries.get(1).comment());
        }

        @Test
        @DisplayName("completed is terminal: decisions are rejected and nothing is written")
        void completedIsTerminal() {
            var controller = controllerAt(13, WorkflowStatus.IN_PROGRESS);
            controller.submitDecision(true, "");
            int entries = auditLog.entries().size();

            assertThrows(IllegalStateException.class, () -> controller.submitDecision(true, ""));
            assertThrows(IllegalStateException.class, () -> controller.submitDecision(false, ""));
            assertThrows(IllegalStateException.class, controller::prompt);
            assertEquals(entries, auditLog.entries().size());
            assertTrue(controller.completeIfDue().isEmpty());
        }

        @Test
        @DisplayName("a state at phase 14 still in progress is completed on request")
        void completeIfDue() {
            var controller = controllerAt(14, WorkflowStatus.IN_PROGRESS);

            var result = controller.completeIfDue();

            assertTrue(result.isPresent());
            assertEquals(Outcome.COMPLETED, result.get().outcome());
            assertEquals(WorkflowStatus.COMPLETED, stateStore.load().status());
            assertEquals(1, auditLog.entries().size());
            assertEquals(AuditAction.COMPLETED, auditLog.entries().get(0).action());
        }

        @Test
        @DisplayName("completeIfDue is a no-op mid-workflow")
        void completeIfDueMidWorkflow() {
            assertTrue(controllerAt(4, WorkflowStatus.IN_PROGRESS).completeIfDue().isEmpty());
            assertTrue(auditLog.entries().isEmpty());
        }
    }

    @Nested
    @DisplayName("Write ordering and failures")
    class FailureTests {

        @Test
        @DisplayName("the audit entry is written before the state")
        void auditBeforeState() {
            StateStore store = mock(StateStore.class);
            AuditLog log = mock(AuditLog.class);
            when(store.load()).thenReturn(WorkflowState.initial());

            new GateController(store, log, agents, clock).submitDecision(true, "");

            InOrder inOrder = inOrder(log, store);
            inOrder.verify(log).append(any(AuditLogEntry.class));
            inOrder.verify(store).save(any(WorkflowState.class));
        }

        @Test
        @DisplayName("failed audit append leaves state untouched")
        void auditFailure() {
            StateStore store = mock(StateStore.class);
            AuditLog log = mock(AuditLog.class);
            when(store.load()).thenReturn(WorkflowState.initial());
            doThrow(new PersistenceException("disk full")).when(log).append(any());

            var controller = new GateController(store, log, agents, clock);

            assertThrows(PersistenceException.class, () -> controller.submitDecision(true, ""));
            verify(store, never()).save(any());
            assertEquals(WorkflowState.initial(), controller.state());
        }

        @Test
        @DisplayName("failed state save keeps the previous in-memory state")
        void stateFailure() {
            StateStore store = mock(StateStore.class);
            AuditLog log = mock(AuditLog.class);
            when(store.load()).thenReturn(WorkflowState.initial());
            doThrow(new PersistenceException("read-only")).when(store).save(any());

            var controller = new GateController(store, log, agents, clock);

            assertThrows(PersistenceException.class, () -> controller.submitDecision(true, ""));
            assertEquals(0, controller.state().currentPhase());
        }

        @Test
        @DisplayName("malformed audit trail fails construction")
        void malformedAuditTrail() throws Exception {
            Files.writeString(tempDir.resolve("audit.json"), "not json");
            assertThrows(PersistenceException.class,
                    () -> new GateController(stateStore, auditLog, agents, clock));
        }

        @Test
        @DisplayName("malformed persisted state fails construction")
        void malformedState() throws Exception {
            Files.writeString(tempDir.resolve("state.json"), "{not json");
            assertThrows(PersistenceException.class,
                    () -> new GateController(stateStore, auditLog, agents, clock));
        }
    }
}
