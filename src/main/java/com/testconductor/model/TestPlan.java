package com.testconductor.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An ordered, already-validated sequence of {@link TestStep}s driving one run.
 *
 * Step numbers are unique, contiguous from 1 and increase in plan order; the
 * constructor rejects anything else so the engine can map step number N to
 * index N-1 without searching.
 *
 * Use the nested Builder for construction:
 * <pre>
 *   TestPlan plan = TestPlan.builder("Checkout flow")
 *       .objective("Buy one item as a guest")
 *       .step("Open the shop", "Navigate to https://shop.example.com")
 *       .step("Add to cart", "Click the first product", "Click 'Add to cart'")
 *       .build();
 * </pre>
 */
public final class TestPlan {

    private final PlanMetadata metadata;
    private final String objective;
    private final List<TestStep> steps;

    public TestPlan(PlanMetadata metadata, String objective, List<TestStep> steps) {
        if (metadata == null) throw new IllegalArgumentException("metadata is required");
        if (steps == null) throw new IllegalArgumentException("steps are required");
        for (int i = 0; i < steps.size(); i++) {
            int expected = i + 1;
            if (steps.get(i).getStepNumber() != expected) {
                throw new IllegalArgumentException("Step at position " + i + " has number "
                    + steps.get(i).getStepNumber() + "; expected " + expected);
            }
        }
        this.metadata  = metadata;
        this.objective = objective != null ? objective : "";
        this.steps     = List.copyOf(steps);
    }

    public PlanMetadata getMetadata() { return metadata; }
    public String getTestName()       { return metadata.testName(); }
    public String getObjective()      { return objective; }
    public List<TestStep> getSteps()  { return steps; }
    public int size()                 { return steps.size(); }
    public TestStep stepAt(int index) { return steps.get(index); }

    /** Returns the step with the given 1-based number, if it lies inside the plan. */
    public Optional<TestStep> findStep(int stepNumber) {
        if (stepNumber < 1 || stepNumber > steps.size()) return Optional.empty();
        return Optional.of(steps.get(stepNumber - 1));
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder(String testName) { return new Builder(testName); }

    public static class Builder {
        private final String testName;
        private String environment = PlanMetadata.DEFAULT_ENVIRONMENT;
        private String objective = "";
        private final List<TestStep> steps = new ArrayList<>();

        private Builder(String testName) { this.testName = testName; }

        public Builder environment(String environment) { this.environment = environment; return this; }
        public Builder objective(String objective)     { this.objective = objective; return this; }

        /** Appends a step numbered after the steps already added. */
        public Builder step(String title, String... actions) {
            steps.add(new TestStep(steps.size() + 1, title, List.of(actions)));
            return this;
        }

        public Builder step(TestStep step) { steps.add(step); return this; }

        public TestPlan build() {
            return new TestPlan(new PlanMetadata(testName, environment), objective, steps);
        }
    }
}
