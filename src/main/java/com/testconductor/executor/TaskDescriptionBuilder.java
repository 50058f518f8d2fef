package com.testconductor.executor;

import com.testconductor.model.TestPlan;
import com.testconductor.model.TestStep;

import java.util.List;

/**
 * Renders the natural-language task handed to the agent for one step.
 *
 * <pre>
 *   ## Step 2: Add to cart
 *
 *   ### Objective:
 *   Buy one item as a guest
 *
 *   ### Current step:
 *   - Click the first product
 *
 *   ### Expected result:
 *   The cart badge shows 1
 *
 *   ### Operator guidance:
 *   The product grid loads below the fold
 *
 *   ### Reminders:
 *   - ...
 * </pre>
 */
public class TaskDescriptionBuilder {

    static final List<String> REMINDERS = List.of(
        "Look at the page carefully and make sure you identify the right elements",
        "If the page is still loading, wait until it has fully loaded",
        "If an action fails, try a different approach",
        "Keep a natural conversational style when using chat features");

    public String build(TestPlan plan, TestStep step, StepStateTable state) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Step ").append(step.getStepNumber()).append(": ").append(step.getTitle()).append('\n');

        sb.append("\n### Objective:\n").append(plan.getObjective()).append('\n');

        if (!step.getDescription().isBlank()) {
            sb.append("\n### Description:\n").append(step.getDescription()).append('\n');
        }

        sb.append("\n### Current step:\n");
        for (String action : state.effectiveActions(step)) {
            sb.append("- ").append(action).append('\n');
        }

        if (step.hasExpectedResult()) {
            sb.append("\n### Expected result:\n").append(step.getExpectedResult()).append('\n');
        }

        List<String> guidance = state.guidance(step.getStepNumber());
        if (!guidance.isEmpty()) {
            sb.append("\n### Operator guidance:\n");
            guidance.forEach(g -> sb.append(g).append('\n'));
        }

        sb.append("\n### Reminders:\n");
        REMINDERS.forEach(r -> sb.append("- ").append(r).append('\n'));
        return sb.toString();
    }
}
