package com.testconductor.executor;

import com.testconductor.model.TestStep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-run mutable state for each step, keyed by step number, kept apart from
 * the immutable {@link com.testconductor.model.TestPlan}.
 *
 * Retry counters only grow: a step revisited through {@code goto} keeps the
 * count it already accumulated, so a revisited step that fails again escalates
 * immediately.
 */
public class StepStateTable {

    private static final class StepState {
        int retryCount;
        int unansweredInterventions;
        final List<String> guidance = new ArrayList<>();
        List<String> replacedActions;   // null until a modify response arrives
    }

    private final Map<Integer, StepState> states = new HashMap<>();

    // ── Retry counter ─────────────────────────────────────────────────────────

    public int retryCount(int stepNumber) {
        StepState state = states.get(stepNumber);
        return state != null ? state.retryCount : 0;
    }

    /** @return the counter after incrementing */
    public int incrementRetry(int stepNumber) {
        return stateFor(stepNumber).retryCount += 1;
    }

    // ── Operator input ────────────────────────────────────────────────────────

    public void appendGuidance(int stepNumber, String text) {
        if (text == null || text.isBlank()) return;
        stateFor(stepNumber).guidance.add(text.strip());
    }

    public List<String> guidance(int stepNumber) {
        StepState state = states.get(stepNumber);
        return state != null ? Collections.unmodifiableList(state.guidance) : List.of();
    }

    /** Replaces the step's action list with a single instruction for the rest of the run. */
    public void replaceActions(int stepNumber, String instruction) {
        stateFor(stepNumber).replacedActions = List.of(instruction.strip());
    }

    /** The actions to execute: the replacement if one was given, the plan's actions otherwise. */
    public List<String> effectiveActions(TestStep step) {
        StepState state = states.get(step.getStepNumber());
        return state != null && state.replacedActions != null ? state.replacedActions : step.getActions();
    }

    public boolean hasReplacedActions(int stepNumber) {
        StepState state = states.get(stepNumber);
        return state != null && state.replacedActions != null;
    }

    // ── Unanswered interventions ──────────────────────────────────────────────

    /** @return consecutive unanswered interventions for the step, including this one */
    public int recordUnanswered(int stepNumber) {
        return stateFor(stepNumber).unansweredInterventions += 1;
    }

    public void resetUnanswered(int stepNumber) {
        StepState state = states.get(stepNumber);
        if (state != null) state.unansweredInterventions = 0;
    }

    private StepState stateFor(int stepNumber) {
        return states.computeIfAbsent(stepNumber, n -> new StepState());
    }
}
