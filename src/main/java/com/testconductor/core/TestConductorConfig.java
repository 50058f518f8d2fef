package com.testconductor.core;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Configuration for a TestConductor run.
 *
 * Load from environment variables or construct programmatically.
 *
 * Recognised environment variables:
 *   TESTCONDUCTOR_MAX_RETRIES                - Automatic retries per step before escalation (default: 3)
 *   TESTCONDUCTOR_STEP_TIMEOUT               - Seconds allowed for one agent invocation (default: 30)
 *   TESTCONDUCTOR_INTERVENTION_TIMEOUT       - Seconds to wait for an operator (default: 600)
 *   TESTCONDUCTOR_AGENT_CANCEL_GRACE         - Seconds to wait for a timed-out agent call to stop before the
 *                                              next attempt (default: 10)
 *   TESTCONDUCTOR_INTERVENTION_ENABLED       - Escalate to a human when retries run out (default: true)
 *   TESTCONDUCTOR_USE_VISION                 - Invoke the agent with visual perception (default: true)
 *   TESTCONDUCTOR_HEADLESS                   - Start the browser without a visible window (default: false)
 *   TESTCONDUCTOR_SCREENSHOTS_DIR            - Where step screenshots go (default: test_screenshots)
 *   TESTCONDUCTOR_SESSION_ATTEMPTS           - Browser start attempts before giving up (default: 3)
 *   TESTCONDUCTOR_SESSION_STARTUP_TIMEOUT    - Seconds allowed for one browser start (default: 60)
 *   TESTCONDUCTOR_SESSION_RETRY_DELAY        - Seconds between browser start attempts (default: 5)
 *   TESTCONDUCTOR_MEMORY_THRESHOLD           - Memory use (%) above which stray browsers are cleaned (default: 90)
 *   TESTCONDUCTOR_INTERVENTION_URL           - Remote intervention endpoint; omit to use the console
 *   TESTCONDUCTOR_MAX_UNANSWERED_INTERVENTIONS - Consecutive timed-out escalations per step before the run
 *                                              is abandoned; 0 = never abandon (default: 3)
 *   TESTCONDUCTOR_INTERVENTION_LOG_PATH      - File to write the intervention history to (optional)
 */
public class TestConductorConfig {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_STEP_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_INTERVENTION_TIMEOUT_SECONDS = 600;
    public static final int DEFAULT_AGENT_CANCEL_GRACE_SECONDS = 10;
    public static final int DEFAULT_SESSION_ATTEMPTS = 3;
    public static final int DEFAULT_SESSION_STARTUP_TIMEOUT_SECONDS = 60;
    public static final int DEFAULT_SESSION_RETRY_DELAY_SECONDS = 5;
    public static final int DEFAULT_MEMORY_THRESHOLD_PERCENT = 90;
    public static final int DEFAULT_MAX_UNANSWERED_INTERVENTIONS = 3;
    public static final Path DEFAULT_SCREENSHOTS_DIR = Paths.get("test_screenshots");

    private final int maxRetries;
    private final Duration stepTimeout;
    private final Duration interventionTimeout;
    private final Duration agentCancelGrace;
    private final boolean interventionEnabled;
    private final boolean useVision;
    private final boolean headless;
    private final Path screenshotsDir;
    private final int sessionAttempts;
    private final Duration sessionStartupTimeout;
    private final Duration sessionRetryDelay;
    private final int memoryThresholdPercent;
    private final String interventionUrl;           // null = console transport
    private final int maxUnansweredInterventions;   // 0 = unlimited
    private final Path interventionLogPath;         // null = history kept in memory only

    private TestConductorConfig(Builder b) {
        this.maxRetries                 = b.maxRetries;
        this.stepTimeout                = b.stepTimeout;
        this.interventionTimeout        = b.interventionTimeout;
        this.agentCancelGrace           = b.agentCancelGrace;
        this.interventionEnabled        = b.interventionEnabled;
        this.useVision                  = b.useVision;
        this.headless                   = b.headless;
        this.screenshotsDir             = b.screenshotsDir;
        this.sessionAttempts            = b.sessionAttempts;
        this.sessionStartupTimeout      = b.sessionStartupTimeout;
        this.sessionRetryDelay          = b.sessionRetryDelay;
        this.memoryThresholdPercent     = b.memoryThresholdPercent;
        this.interventionUrl            = b.interventionUrl;
        this.maxUnansweredInterventions = b.maxUnansweredInterventions;
        this.interventionLogPath        = b.interventionLogPath;
    }

    // ── Static factory: load from environment variables ───────────────────────

    public static TestConductorConfig fromEnvironment() {
        return builder()
            .maxRetries(intEnvOrDefault("TESTCONDUCTOR_MAX_RETRIES", DEFAULT_MAX_RETRIES))
            .stepTimeoutSeconds(intEnvOrDefault("TESTCONDUCTOR_STEP_TIMEOUT", DEFAULT_STEP_TIMEOUT_SECONDS))
            .interventionTimeoutSeconds(intEnvOrDefault("TESTCONDUCTOR_INTERVENTION_TIMEOUT",
                DEFAULT_INTERVENTION_TIMEOUT_SECONDS))
            .agentCancelGraceSeconds(intEnvOrDefault("TESTCONDUCTOR_AGENT_CANCEL_GRACE",
                DEFAULT_AGENT_CANCEL_GRACE_SECONDS))
            .interventionEnabled(boolEnvOrDefault("TESTCONDUCTOR_INTERVENTION_ENABLED", true))
            .useVision(boolEnvOrDefault("TESTCONDUCTOR_USE_VISION", true))
            .headless(boolEnvOrDefault("TESTCONDUCTOR_HEADLESS", false))
            .screenshotsDir(pathEnvOrDefault("TESTCONDUCTOR_SCREENSHOTS_DIR", DEFAULT_SCREENSHOTS_DIR))
            .sessionAttempts(intEnvOrDefault("TESTCONDUCTOR_SESSION_ATTEMPTS", DEFAULT_SESSION_ATTEMPTS))
            .sessionStartupTimeoutSeconds(intEnvOrDefault("TESTCONDUCTOR_SESSION_STARTUP_TIMEOUT",
                DEFAULT_SESSION_STARTUP_TIMEOUT_SECONDS))
            .sessionRetryDelaySeconds(intEnvOrDefault("TESTCONDUCTOR_SESSION_RETRY_DELAY",
                DEFAULT_SESSION_RETRY_DELAY_SECONDS))
            .memoryThresholdPercent(intEnvOrDefault("TESTCONDUCTOR_MEMORY_THRESHOLD",
                DEFAULT_MEMORY_THRESHOLD_PERCENT))
            .interventionUrl(envOrDefault("TESTCONDUCTOR_INTERVENTION_URL", null))
            .maxUnansweredInterventions(intEnvOrDefault("TESTCONDUCTOR_MAX_UNANSWERED_INTERVENTIONS",
                DEFAULT_MAX_UNANSWERED_INTERVENTIONS))
            .interventionLogPath(pathEnvOrDefault("TESTCONDUCTOR_INTERVENTION_LOG_PATH", null))
            .build();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public int getMaxRetries()                     { return maxRetries; }
    public Duration getStepTimeout()               { return stepTimeout; }
    public Duration getInterventionTimeout()       { return interventionTimeout; }
    public Duration getAgentCancelGrace()          { return agentCancelGrace; }
    public boolean isInterventionEnabled()         { return interventionEnabled; }
    public boolean isUseVision()                   { return useVision; }
    public boolean isHeadless()                    { return headless; }
    public Path getScreenshotsDir()                { return screenshotsDir; }
    public int getSessionAttempts()                { return sessionAttempts; }
    public Duration getSessionStartupTimeout()     { return sessionStartupTimeout; }
    public Duration getSessionRetryDelay()         { return sessionRetryDelay; }
    public int getMemoryThresholdPercent()         { return memoryThresholdPercent; }
    public String getInterventionUrl()             { return interventionUrl; }
    public boolean isRemoteInterventionEnabled()   { return interventionUrl != null; }
    public int getMaxUnansweredInterventions()     { return maxUnansweredInterventions; }
    public Path getInterventionLogPath()           { return interventionLogPath; }
    public boolean isInterventionLogEnabled()      { return interventionLogPath != null; }

    @Override
    public String toString() {
        return String.format("TestConductorConfig{maxRetries=%d, stepTimeout=%ss, interventionTimeout=%ss, "
                + "interventionEnabled=%b, useVision=%b, headless=%b, transport=%s}",
            maxRetries, stepTimeout.toSeconds(), interventionTimeout.toSeconds(),
            interventionEnabled, useVision, headless,
            interventionUrl != null ? interventionUrl : "console");
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration stepTimeout = Duration.ofSeconds(DEFAULT_STEP_TIMEOUT_SECONDS);
        private Duration interventionTimeout = Duration.ofSeconds(DEFAULT_INTERVENTION_TIMEOUT_SECONDS);
        private Duration agentCancelGrace = Duration.ofSeconds(DEFAULT_AGENT_CANCEL_GRACE_SECONDS);
        private boolean interventionEnabled = true;
        private boolean useVision = true;
        private boolean headless = false;
        private Path screenshotsDir = DEFAULT_SCREENSHOTS_DIR;
        private int sessionAttempts = DEFAULT_SESSION_ATTEMPTS;
        private Duration sessionStartupTimeout = Duration.ofSeconds(DEFAULT_SESSION_STARTUP_TIMEOUT_SECONDS);
        private Duration sessionRetryDelay = Duration.ofSeconds(DEFAULT_SESSION_RETRY_DELAY_SECONDS);
        private int memoryThresholdPercent = DEFAULT_MEMORY_THRESHOLD_PERCENT;
        private String interventionUrl = null;
        private int maxUnansweredInterventions = DEFAULT_MAX_UNANSWERED_INTERVENTIONS;
        private Path interventionLogPath = null;

        public Builder maxRetries(int n)                         { this.maxRetries = n; return this; }
        public Builder stepTimeout(Duration d)                   { this.stepTimeout = d; return this; }
        public Builder stepTimeoutSeconds(int s)                 { this.stepTimeout = Duration.ofSeconds(s); return this; }
        public Builder interventionTimeout(Duration d)           { this.interventionTimeout = d; return this; }
        public Builder interventionTimeoutSeconds(int s)         { this.interventionTimeout = Duration.ofSeconds(s); return this; }
        public Builder agentCancelGrace(Duration d)              { this.agentCancelGrace = d; return this; }
        public Builder agentCancelGraceSeconds(int s)            { this.agentCancelGrace = Duration.ofSeconds(s); return this; }
        public Builder interventionEnabled(boolean b)            { this.interventionEnabled = b; return this; }
        public Builder useVision(boolean b)                      { this.useVision = b; return this; }
        public Builder headless(boolean b)                       { this.headless = b; return this; }
        public Builder screenshotsDir(Path dir)                  { this.screenshotsDir = dir; return this; }
        public Builder sessionAttempts(int n)                    { this.sessionAttempts = n; return this; }
        public Builder sessionStartupTimeout(Duration d)         { this.sessionStartupTimeout = d; return this; }
        public Builder sessionStartupTimeoutSeconds(int s)       { this.sessionStartupTimeout = Duration.ofSeconds(s); return this; }
        public Builder sessionRetryDelay(Duration d)             { this.sessionRetryDelay = d; return this; }
        public Builder sessionRetryDelaySeconds(int s)           { this.sessionRetryDelay = Duration.ofSeconds(s); return this; }
        public Builder memoryThresholdPercent(int pct)           { this.memoryThresholdPercent = pct; return this; }
        public Builder maxUnansweredInterventions(int n)         { this.maxUnansweredInterventions = n; return this; }
        public Builder interventionLogPath(Path path)            { this.interventionLogPath = path; return this; }
        public Builder interventionUrl(String url) {
            this.interventionUrl = (url != null && !url.isBlank()) ? url.trim() : null;
            return this;
        }

        public TestConductorConfig build() {
            if (maxRetries < 0) throw new IllegalStateException("maxRetries must be >= 0, got " + maxRetries);
            requirePositive("stepTimeout", stepTimeout);
            requirePositive("interventionTimeout", interventionTimeout);
            requirePositive("sessionStartupTimeout", sessionStartupTimeout);
            if (agentCancelGrace == null || agentCancelGrace.isNegative()) {
                throw new IllegalStateException("agentCancelGrace must not be negative");
            }
            if (sessionRetryDelay == null || sessionRetryDelay.isNegative()) {
                throw new IllegalStateException("sessionRetryDelay must not be negative");
            }
            if (sessionAttempts < 1) throw new IllegalStateException("sessionAttempts must be >= 1, got " + sessionAttempts);
            if (maxUnansweredInterventions < 0) {
                throw new IllegalStateException("maxUnansweredInterventions must be >= 0, got " + maxUnansweredInterventions);
            }
            if (screenshotsDir == null) screenshotsDir = DEFAULT_SCREENSHOTS_DIR;
            return new TestConductorConfig(this);
        }

        private static void requirePositive(String name, Duration d) {
            if (d == null || d.isZero() || d.isNegative()) {
                throw new IllegalStateException(name + " must be positive, got " + d);
            }
        }
    }

    // ── Env helpers ───────────────────────────────────────────────────────────

    private static String envOrDefault(String key, String defaultValue) {
        String val = System.getenv(key);
        return (val != null && !val.isBlank()) ? val : defaultValue;
    }

    private static int intEnvOrDefault(String key, int defaultValue) {
        try {
            String val = System.getenv(key);
            return (val != null && !val.isBlank()) ? Integer.parseInt(val.trim()) : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static boolean boolEnvOrDefault(String key, boolean defaultValue) {
        String val = System.getenv(key);
        if (val == null || val.isBlank()) return defaultValue;
        return "true".equalsIgnoreCase(val.trim()) || "1".equals(val.trim());
    }

    private static Path pathEnvOrDefault(String key, Path defaultValue) {
        String val = System.getenv(key);
        return (val != null && !val.isBlank()) ? Paths.get(val.trim()) : defaultValue;
    }
}
