package com.testconductor.model;

import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestPlanTest {

    @Test
    public void builderNumbersStepsContiguouslyFromOne() {
        TestPlan plan = TestPlan.builder("search")
            .environment("staging")
            .objective("Find a product")
            .step("Open", "Go to the home page")
            .step("Search", "Type 'mug'", "Press enter")
            .build();

        assertThat(plan.getSteps()).extracting(TestStep::getStepNumber).containsExactly(1, 2);
        assertThat(plan.stepAt(1).getActions()).containsExactly("Type 'mug'", "Press enter");
        assertThat(plan.getMetadata().environment()).isEqualTo("staging");
        assertThat(plan.getTestName()).isEqualTo("search");
    }

    @Test
    public void findStep_onlyInsideThePlan() {
        TestPlan plan = TestPlan.builder("t").step("a", "x").step("b", "y").build();

        assertThat(plan.findStep(2)).map(TestStep::getTitle).contains("b");
        assertThat(plan.findStep(0)).isEmpty();
        assertThat(plan.findStep(3)).isEmpty();
    }

    @Test
    public void rejectsGapsAndOutOfOrderNumbers() {
        List<TestStep> gap = List.of(new TestStep(1, "a", List.of("x")), new TestStep(3, "c", List.of("z")));

        assertThatThrownBy(() -> new TestPlan(new PlanMetadata("t", "dev"), "", gap))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("expected 2");
        assertThatThrownBy(() -> new TestStep(0, "zero", List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void stepsAreImmutable() {
        TestPlan plan = TestPlan.builder("t").step("a", "x").build();

        assertThatThrownBy(() -> plan.getSteps().add(new TestStep(2, "b", List.of())))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
