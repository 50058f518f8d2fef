package com.testconductor.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Aggregate outcome of one plan execution, handed read-only to the reporter.
 *
 * {@code success} is the logical AND over every recorded attempt.
 *
 * @param testName            plan test name
 * @param success             AND of {@link StepResult#isSuccess()} over {@code stepResults}
 * @param totalTime           wall-clock duration of the run
 * @param stepResults         one entry per physical attempt, in execution order
 * @param finalMessage        human-readable summary
 * @param screenshotsDir      where step screenshots were written
 * @param interventionHistory every escalation issued during the run
 * @param conversationHistory agent conversation entries, empty when the agent keeps none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResult(
        String testName,
        boolean success,
        Duration totalTime,
        List<StepResult> stepResults,
        String finalMessage,
        Path screenshotsDir,
        List<InterventionRecord> interventionHistory,
        List<Map<String, Object>> conversationHistory) {

    public RunResult {
        stepResults         = stepResults != null ? List.copyOf(stepResults) : List.of();
        interventionHistory = interventionHistory != null ? List.copyOf(interventionHistory) : List.of();
        conversationHistory = conversationHistory != null
            ? conversationHistory.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList())
            : List.of();
    }

    public long passedAttempts() { return stepResults.stream().filter(StepResult::isSuccess).count(); }
    public long failedAttempts() { return stepResults.size() - passedAttempts(); }
}
