package com.testconductor.report;

import com.testconductor.model.InterventionRecord;
import com.testconductor.model.RunResult;
import com.testconductor.model.StepResult;
import com.testconductor.model.TestPlan;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Folds the per-attempt results of a run into the {@link RunResult} handed to the
 * reporter. Pure: no I/O, no logging, no state.
 *
 * A run succeeds when it was not aborted and every recorded attempt succeeded,
 * so a step that needed retries still marks the run as failed.
 */
public class ResultAggregator {

    public static final String COMPLETED_MESSAGE = "Test run completed";
    public static final String FAILED_MESSAGE    = "Test run failed";

    /**
     * @param abortReason why the run stopped early, or null if it ran to the end of the plan
     */
    public RunResult aggregate(TestPlan plan,
                               List<StepResult> stepResults,
                               Duration totalTime,
                               String abortReason,
                               Path screenshotsDir,
                               List<InterventionRecord> interventionHistory,
                               List<Map<String, Object>> conversationHistory) {
        boolean allPassed = stepResults.stream().allMatch(StepResult::isSuccess);
        boolean success = abortReason == null && allPassed;

        String finalMessage;
        if (abortReason != null) {
            finalMessage = abortReason;
        } else {
            finalMessage = success ? COMPLETED_MESSAGE : FAILED_MESSAGE;
        }

        return new RunResult(plan.getTestName(), success, totalTime, stepResults, finalMessage,
            screenshotsDir, interventionHistory, conversationHistory);
    }
}
