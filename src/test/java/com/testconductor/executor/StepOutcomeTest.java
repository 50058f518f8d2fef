package com.testconductor.executor;

import org.testng.annotations.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

public class StepOutcomeTest {

    @Test
    public void timeout_reportsSubSecondLimitsInMillis() {
        StepOutcome outcome = StepOutcome.timeout(2, Duration.ofMillis(300));

        assertThat(outcome.getDetail()).isEqualTo("Step 2 timed out after 300ms");
        assertThat(outcome.screenshotSuffix()).isEqualTo("timeout");
    }

    @Test
    public void timeout_reportsLongerLimitsInSeconds() {
        assertThat(StepOutcome.timeout(4, Duration.ofSeconds(30)).getDetail())
            .isEqualTo("Step 4 timed out after 30s");
        assertThat(StepOutcome.describe(Duration.ofMillis(1000))).isEqualTo("1s");
    }

    @Test
    public void executionError_fallsBackToTheExceptionType() {
        StepOutcome outcome = StepOutcome.executionError(3, new NullPointerException());

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getDetail()).isEqualTo("Step 3 failed: NullPointerException");
        assertThat(outcome.screenshotSuffix()).isEqualTo("error");
    }

    @Test
    public void success_hasNoScreenshot() {
        assertThat(StepOutcome.success("ok").screenshotSuffix()).isNull();
    }
}
