package com.testconductor.core;

import org.testng.annotations.Test;

import java.nio.file.Paths;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestConductorConfigTest {

    @Test
    public void defaults() {
        TestConductorConfig config = TestConductorConfig.builder().build();

        assertThat(config.getMaxRetries()).isEqualTo(3);
        assertThat(config.getStepTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getInterventionTimeout()).isEqualTo(Duration.ofSeconds(600));
        assertThat(config.isInterventionEnabled()).isTrue();
        assertThat(config.isUseVision()).isTrue();
        assertThat(config.isHeadless()).isFalse();
        assertThat(config.getScreenshotsDir()).isEqualTo(Paths.get("test_screenshots"));
        assertThat(config.getSessionAttempts()).isEqualTo(3);
        assertThat(config.getSessionStartupTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getSessionRetryDelay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getMemoryThresholdPercent()).isEqualTo(90);
        assertThat(config.isRemoteInterventionEnabled()).isFalse();
        assertThat(config.getMaxUnansweredInterventions()).isEqualTo(3);
        assertThat(config.isInterventionLogEnabled()).isFalse();
        assertThat(config.getAgentCancelGrace()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    public void builderOverrides() {
        TestConductorConfig config = TestConductorConfig.builder()
            .maxRetries(0)
            .stepTimeoutSeconds(5)
            .interventionTimeout(Duration.ofMillis(1500))
            .headless(true)
            .useVision(false)
            .interventionUrl("  http://localhost:9000/hook ")
            .interventionLogPath(Paths.get("target/interventions.json"))
            .build();

        assertThat(config.getMaxRetries()).isZero();
        assertThat(config.getStepTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getInterventionTimeout()).isEqualTo(Duration.ofMillis(1500));
        assertThat(config.isHeadless()).isTrue();
        assertThat(config.isUseVision()).isFalse();
        assertThat(config.getInterventionUrl()).isEqualTo("http://localhost:9000/hook");
        assertThat(config.isRemoteInterventionEnabled()).isTrue();
        assertThat(config.isInterventionLogEnabled()).isTrue();
        assertThat(config.toString()).contains("maxRetries=0").contains("http://localhost:9000/hook");
    }

    @Test
    public void blankInterventionUrl_meansConsole() {
        assertThat(TestConductorConfig.builder().interventionUrl("   ").build().isRemoteInterventionEnabled()).isFalse();
    }

    @Test
    public void rejectsInvalidValues() {
        assertThatThrownBy(() -> TestConductorConfig.builder().maxRetries(-1).build())
            .isInstanceOf(IllegalStateException.class).hasMessageContaining("maxRetries");
        assertThatThrownBy(() -> TestConductorConfig.builder().stepTimeout(Duration.ZERO).build())
            .isInstanceOf(IllegalStateException.class).hasMessageContaining("stepTimeout");
        assertThatThrownBy(() -> TestConductorConfig.builder().interventionTimeoutSeconds(-5).build())
            .isInstanceOf(IllegalStateException.class).hasMessageContaining("interventionTimeout");
        assertThatThrownBy(() -> TestConductorConfig.builder().sessionAttempts(0).build())
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> TestConductorConfig.builder().sessionRetryDelay(Duration.ofSeconds(-1)).build())
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> TestConductorConfig.builder().maxUnansweredInterventions(-1).build())
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> TestConductorConfig.builder().agentCancelGrace(Duration.ofMillis(-1)).build())
            .isInstanceOf(IllegalStateException.class).hasMessageContaining("agentCancelGrace");
    }

    @Test
    public void fromEnvironment_producesAValidConfig() {
        TestConductorConfig config = TestConductorConfig.fromEnvironment();

        assertThat(config.getStepTimeout()).isPositive();
        assertThat(config.getInterventionTimeout()).isPositive();
        assertThat(config.getMaxRetries()).isGreaterThanOrEqualTo(0);
    }
}
