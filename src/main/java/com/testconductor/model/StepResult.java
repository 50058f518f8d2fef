package com.testconductor.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome record of one physical execution attempt of a step.
 *
 * A step retried twice before it succeeds leaves three StepResults sharing the
 * same step number. Immutable: {@link #withIntervention} returns a copy, which
 * the engine uses to mark the attempt that triggered an escalation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StepResult {

    private final int stepNumber;
    private final boolean success;
    private final Duration executionTime;
    private final String errorMessage;
    private final String screenshotPath;
    private final boolean interventionUsed;
    private final Map<String, Object> interventionDetails;
    private final String agentOutput;

    private StepResult(int stepNumber, boolean success, Duration executionTime, String errorMessage,
                       String screenshotPath, boolean interventionUsed,
                       Map<String, Object> interventionDetails, String agentOutput) {
        this.stepNumber          = stepNumber;
        this.success             = success;
        this.executionTime       = executionTime != null ? executionTime : Duration.ZERO;
        this.errorMessage        = errorMessage;
        this.screenshotPath      = screenshotPath;
        this.interventionUsed    = interventionUsed;
        this.interventionDetails = interventionDetails != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(interventionDetails)) : null;
        this.agentOutput         = agentOutput;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static StepResult passed(int stepNumber, Duration executionTime,
                                    String screenshotPath, String agentOutput) {
        return new StepResult(stepNumber, true, executionTime, null, screenshotPath, false, null, agentOutput);
    }

    public static StepResult failed(int stepNumber, Duration executionTime,
                                    String errorMessage, String screenshotPath) {
        return new StepResult(stepNumber, false, executionTime, errorMessage, screenshotPath, false, null, null);
    }

    /** Copy of this result marked as having triggered the given intervention. */
    public StepResult withIntervention(Map<String, Object> details) {
        return new StepResult(stepNumber, success, executionTime, errorMessage,
            screenshotPath, true, details, agentOutput);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public int getStepNumber()                         { return stepNumber; }
    public boolean isSuccess()                         { return success; }
    public Duration getExecutionTime()                 { return executionTime; }
    public String getErrorMessage()                    { return errorMessage; }
    public String getScreenshotPath()                  { return screenshotPath; }
    public boolean isInterventionUsed()                { return interventionUsed; }
    public Map<String, Object> getInterventionDetails() { return interventionDetails; }
    public String getAgentOutput()                     { return agentOutput; }

    @Override
    public String toString() {
        return success
            ? String.format("StepResult{step=%d, success=true, time=%dms}", stepNumber, executionTime.toMillis())
            : String.format("StepResult{step=%d, success=false, time=%dms, error='%s', intervention=%b}",
                stepNumber, executionTime.toMillis(), errorMessage, interventionUsed);
    }
}
