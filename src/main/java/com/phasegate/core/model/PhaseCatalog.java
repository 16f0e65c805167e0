package com.phasegate.core.model;

import java.util.List;

/**
 * Built-in display names and expected artifacts of the fourteen phases.
 * Display only: nothing in the catalog gates advancement.
 */
public final class PhaseCatalog {

    public static final int FIRST_PHASE = 0;
    public static final int LAST_PHASE = 13;
    /** Value of {@code current_phase} once phase 13 has been approved. */
    public static final int COMPLETED_PHASE = LAST_PHASE + 1;

    private static final List<PhaseInfo> PHASES = List.of(
            new PhaseInfo(0, "Intake & Ownership", "idea_intake.json"),
            new PhaseInfo(1, "Hypothesis & Scope", "scope.yaml"),
            new PhaseInfo(2, "Research Plan", "research_plan.md"),
            new PhaseInfo(3, "Evidence Collection", "data/raw/"),
            new PhaseInfo(4, "Cleaning & Chain-of-Custody", "data/clean/"),
            new PhaseInfo(5, "Pain Extraction & Tagging", "pains_tagged.json"),
            new PhaseInfo(6, "Pain Quantification", "pain_scores.json"),
            new PhaseInfo(7, "Market & Competition", "market_competition.md"),
            new PhaseInfo(8, "Unit Economics", "unit_economics.json"),
            new PhaseInfo(9, "Feasibility & Risk", "feasibility_risk.md"),
            new PhaseInfo(10, "GTM Options & Prioritisation", "gtm_options.md"),
            new PhaseInfo(11, "Synthesis (ADSR Report)", "report_ADSR.md"),
            new PhaseInfo(12, "Decision & Logging", "decision_log.json"),
            new PhaseInfo(13, "Cross-Variant Comparison & Hybridisation", "reports/")
    );

    private PhaseCatalog() {}

    public static List<PhaseInfo> phases() {
        return PHASES;
    }

    public static boolean isGated(int phase) {
        return phase >= FIRST_PHASE && phase <= LAST_PHASE;
    }

    public static PhaseInfo info(int phase) {
        if (!isGated(phase)) {
            throw new IllegalArgumentException("No such phase: " + phase);
        }
        return PHASES.get(phase);
    }

    public static String nameOf(int phase) {
        if (phase == COMPLETED_PHASE) {
            return "Workflow complete";
        }
        return isGated(phase) ? PHASES.get(phase).name() : "Phase " + phase;
    }

    /**
     * One catalog row.
     *
     * @param number   phase number
     * @param name     display name
     * @param artifact file or directory the assigned agent is expected to produce
     */
    public record PhaseInfo(int number, String name, String artifact) {}
}
