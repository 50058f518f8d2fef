package com.testconductor.executor;

import com.testconductor.model.TestPlan;
import com.testconductor.model.TestStep;
import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class TaskDescriptionBuilderTest {

    private final TaskDescriptionBuilder builder = new TaskDescriptionBuilder();

    private static TestPlan checkoutPlan() {
        return TestPlan.builder("checkout")
            .objective("Buy one item as a guest")
            .step(new TestStep(1, "Add to cart", "Use the product grid",
                List.of("Click the first product", "Click 'Add to cart'"), "The cart badge shows 1"))
            .step("Pay", "Open the cart")
            .build();
    }

    @Test
    public void rendersSectionsInOrder() {
        TestPlan plan = checkoutPlan();

        String task = builder.build(plan, plan.stepAt(0), new StepStateTable());

        assertThat(task).startsWith("## Step 1: Add to cart\n");
        assertThat(task).containsSubsequence(
            "### Objective:", "Buy one item as a guest",
            "### Description:", "Use the product grid",
            "### Current step:", "- Click the first product", "- Click 'Add to cart'",
            "### Expected result:", "The cart badge shows 1",
            "### Reminders:");
        assertThat(task).doesNotContain("### Operator guidance:");
    }

    @Test
    public void optionalSectionsAreOmittedWhenEmpty() {
        TestPlan plan = checkoutPlan();

        String task = builder.build(plan, plan.stepAt(1), new StepStateTable());

        assertThat(task)
            .contains("## Step 2: Pay")
            .contains("- Open the cart")
            .doesNotContain("### Description:")
            .doesNotContain("### Expected result:");
    }

    @Test
    public void guidanceAccumulatesAndReplacedActionsWin() {
        TestPlan plan = checkoutPlan();
        StepStateTable state = new StepStateTable();
        state.appendGuidance(1, "The grid loads below the fold");
        state.appendGuidance(1, "  Scroll first  ");
        state.replaceActions(1, "Search for 'mug' and add the first hit");

        String task = builder.build(plan, plan.stepAt(0), state);

        assertThat(task)
            .containsSubsequence("### Operator guidance:", "The grid loads below the fold", "Scroll first")
            .contains("- Search for 'mug' and add the first hit")
            .doesNotContain("- Click the first product");
    }
}
