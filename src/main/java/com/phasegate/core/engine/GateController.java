package com.phasegate.core.engine;

import com.phasegate.core.logging.MdcContext;
import com.phasegate.core.model.AuditAction;
import com.phasegate.core.model.AuditLogEntry;
import com.phasegate.core.model.Decision;
import com.phasegate.core.model.GatePrompt;
import com.phasegate.core.model.PhaseCatalog;
import com.phasegate.core.model.TransitionResult;
import com.phasegate.core.model.TransitionResult.Outcome;
import com.phasegate.core.model.WorkflowState;
import com.phasegate.core.persistence.AuditLog;
import com.phasegate.core.persistence.PhaseAgentMap;
import com.phasegate.core.persistence.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The phase state machine.
 * <p>
 * Holds the current {@link WorkflowState}, renders the gate for the current phase
 * and commits operator decisions. Every transition appends its audit entries
 * before saving the new state, and the in-memory state only moves once both
 * writes have succeeded. A crash between the two writes therefore leaves the
 * phase un-advanced on the next load and the gate is asked again.
 * <p>
 * Transitions:
 * <pre>
 *   phase p &lt; 13, approve  -&gt; approved(p)               ; {p+1, in_progress}
 *   phase 13,     approve  -&gt; approved(13), completed(13) ; {14, completed}
 *   phase p,      decline  -&gt; paused(p)                 ; {p, paused}  (loop halts)
 *   completed,    any      -&gt; IllegalStateException, nothing written
 * </pre>
 */
public class GateController {

    private static final Logger log = LoggerFactory.getLogger(GateController.class);

    public static final String ORCHESTRATOR_AGENT = "Orchestrator";
    public static final String DEFAULT_APPROVAL_COMMENT = "Phase approved.";
    public static final String PAUSE_COMMENT = "User chose to pause.";
    public static final String COMPLETION_COMMENT = "Workflow finished.";

    private static final String INSTRUCTIONS = "Complete the artifact for this phase before continuing.";

    private final StateStore stateStore;
    private final AuditLog auditLog;
    private final PhaseAgentMap agents;
    private final Clock clock;

    private WorkflowState state;

    /**
     * Loads the persisted state and reads the audit trail once, so that a corrupt
     * trail is reported before any gate is shown.
     *
     * @throws com.phasegate.core.persistence.PersistenceException if the persisted state
     *         or the audit trail is malformed
     */
    public GateController(StateStore stateStore, AuditLog auditLog, PhaseAgentMap agents, Clock clock) {
        this.stateStore = stateStore;
        this.auditLog = auditLog;
        this.agents = agents;
        this.clock = clock;
        this.state = stateStore.load();
        int recorded = auditLog.entries().size();
        log.info("Workflow at phase {} ({}), status {}, {} audit entries",
                state.currentPhase(), state.phaseName(), state.status().wireName(), recorded);
    }

    public WorkflowState state() {
        return state;
    }

    public boolean isCompleted() {
        return state.isCompleted();
    }

    /** Agent for {@code phase}, or {@link PhaseAgentMap#UNKNOWN_AGENT} when unmapped. */
    public String agentFor(int phase) {
        return agents.agentFor(phase);
    }

    /**
     * The gate shown to the operator for the current phase.
     *
     * @throws IllegalStateException when every phase has already been approved
     */
    public GatePrompt prompt() {
        int phase = state.currentPhase();
        if (!PhaseCatalog.isGated(phase)) {
            throw new IllegalStateException("No gate past phase " + PhaseCatalog.LAST_PHASE + "; workflow is finished");
        }
        var info = PhaseCatalog.info(phase);
        return new GatePrompt(phase, info.name(), agentFor(phase), info.artifact(), INSTRUCTIONS);
    }

    public TransitionResult submitDecision(Decision decision) {
        return submitDecision(decision.approved(), decision.comment());
    }

    /**
     * Commits the operator's decision for the current phase.
     *
     * @param approved true to approve, false to pause
     * @param comment  optional operator comment; blank means the canned default
     * @return the committed transition
     * @throws IllegalStateException if the workflow is already completed or awaiting completion
     * @throws com.phasegate.core.persistence.PersistenceException if either write fails; the
     *         controller then keeps its previous state
     */
    public TransitionResult submitDecision(boolean approved, String comment) {
        if (state.isCompleted() || state.isCompletionPending()) {
            throw new IllegalStateException("Workflow already completed; no further transitions are possible");
        }
        int phase = state.currentPhase();
        String agent = agentFor(phase);
        MdcContext.setPhase(phase, agent);
        try {
            return approved ? approve(phase, agent, comment) : pause(phase, agent);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Commits the completion of a state that reached phase 14 without being marked
     * completed, e.g. one written by an older tool. No-op otherwise.
     */
    public Optional<TransitionResult> completeIfDue() {
        if (!state.isCompletionPending()) {
            return Optional.empty();
        }
        log.warn("State is past phase {} but not completed; committing completion", PhaseCatalog.LAST_PHASE);
        return Optional.of(complete(new ArrayList<>()));
    }

    private TransitionResult approve(int phase, String agent, String comment) {
        List<AuditLogEntry> appended = new ArrayList<>();
        appended.add(append(agent, phase, AuditAction.APPROVED,
                comment == null || comment.isBlank() ? DEFAULT_APPROVAL_COMMENT : comment.strip()));
        log.info("Phase {} approved by operator (agent={})", phase, agent);

        if (phase == PhaseCatalog.LAST_PHASE) {
            return complete(appended);
        }
        WorkflowState next = state.advanced("Phase " + phase + " approved");
        commit(next);
        log.info("Advanced to phase {} ({})", next.currentPhase(), next.phaseName());
        return new TransitionResult(Outcome.ADVANCED, phase, next, appended);
    }

    private TransitionResult pause(int phase, String agent) {
        AuditLogEntry entry = append(agent, phase, AuditAction.PAUSED, PAUSE_COMMENT);
        WorkflowState next = state.paused("Phase " + phase + " paused");
        commit(next);
        log.info("Workflow paused at phase {} (agent={})", phase, agent);
        return new TransitionResult(Outcome.PAUSED, phase, next, List.of(entry));
    }

    private TransitionResult complete(List<AuditLogEntry> appended) {
        appended.add(append(ORCHESTRATOR_AGENT, PhaseCatalog.LAST_PHASE, AuditAction.COMPLETED, COMPLETION_COMMENT));
        WorkflowState next = state.completed("Workflow finished");
        commit(next);
        log.info("All {} phases approved; workflow completed", PhaseCatalog.LAST_PHASE + 1);
        return new TransitionResult(Outcome.COMPLETED, PhaseCatalog.LAST_PHASE, next, appended);
    }

    private AuditLogEntry append(String agent, int phase, AuditAction action, String comment) {
        AuditLogEntry entry = new AuditLogEntry(clock.instant(), agent, phase, action, comment);
        auditLog.append(entry);
        return entry;
    }

    private void commit(WorkflowState next) {
        stateStore.save(next);
        state = next;
    }
}
