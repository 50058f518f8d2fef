package com.testconductor.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.List;

/**
 * One unit of work in a {@link TestPlan}, as produced by the plan parser.
 *
 * Immutable. Anything that changes while a run is in progress (retry counters,
 * operator guidance, replaced actions) is tracked by the engine in
 * {@link com.testconductor.executor.StepStateTable}, never on the step itself.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TestStep {

    private final int stepNumber;
    private final String title;
    private final String description;
    private final List<String> actions;
    private final String expectedResult;   // null when the step states none

    public TestStep(int stepNumber, String title, String description,
                    List<String> actions, String expectedResult) {
        if (stepNumber < 1) throw new IllegalArgumentException("stepNumber must be >= 1, got " + stepNumber);
        this.stepNumber     = stepNumber;
        this.title          = title != null ? title : "";
        this.description    = description != null ? description : "";
        this.actions        = actions != null ? List.copyOf(actions) : Collections.emptyList();
        this.expectedResult = expectedResult;
    }

    public TestStep(int stepNumber, String title, List<String> actions) {
        this(stepNumber, title, "", actions, null);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public int getStepNumber()        { return stepNumber; }
    public String getTitle()          { return title; }
    public String getDescription()    { return description; }
    public List<String> getActions()  { return actions; }
    public String getExpectedResult() { return expectedResult; }

    public boolean hasExpectedResult() { return expectedResult != null && !expectedResult.isBlank(); }

    @Override
    public String toString() {
        return String.format("TestStep{number=%d, title='%s', actions=%d}", stepNumber, title, actions.size());
    }
}
