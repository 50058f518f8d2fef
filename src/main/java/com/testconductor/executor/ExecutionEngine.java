package com.testconductor.executor;

import com.testconductor.core.TestConductorConfig;
import com.testconductor.intervention.InterventionGateway;
import com.testconductor.model.InterventionContext;
import com.testconductor.model.InterventionRecord;
import com.testconductor.model.InterventionResponse;
import com.testconductor.model.RunResult;
import com.testconductor.model.StepResult;
import com.testconductor.model.TestPlan;
import com.testconductor.model.TestStep;
import com.testconductor.report.ResultAggregator;
import com.testconductor.session.FatalSessionErrors;
import com.testconductor.session.ProtectionToken;
import com.testconductor.session.SessionCreationException;
import com.testconductor.session.SessionHandle;
import com.testconductor.session.SessionHealth;
import com.testconductor.session.SessionManager;
import com.testconductor.util.DeadlineRunner;
import com.testconductor.util.ScreenshotRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Drives a {@link TestPlan} through the execution agent one step at a time.
 *
 * ## Step loop
 *
 *   1. Acquire the shared session (a {@link SessionCreationException} aborts the run).
 *   2. Render the task and invoke the agent under the step timeout. Every attempt
 *      appends exactly one {@link StepResult}.
 *   3. Success advances to the next step.
 *   4. Failure re-runs the same step while its retry counter is below
 *      {@code maxRetries}, incrementing the counter each time.
 *   5. Once the budget is spent the step escalates to the {@link InterventionGateway}.
 *      The session stays protected from teardown until the response has been applied.
 *
 * ## Response mapping
 * <pre>
 *   continue [guidance]   re-run the step (retry counter not checked), guidance added to the task
 *   skip                  advance by one
 *   modify "text"         replace the step's actions with text, re-run
 *   goto N                next step is N; a target outside the plan ends the run as failed
 *   retry / status / ...  advance by one without guidance
 * </pre>
 *
 * Consecutive unanswered escalations of one step are capped by
 * {@code maxUnansweredInterventions}; reaching the cap ends the run as failed.
 * When interventions are disabled, an exhausted step is skipped.
 *
 * Not thread-safe; one run at a time.
 */
public class ExecutionEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final TestConductorConfig config;
    private final SessionManager sessionManager;
    private final ExecutionAgentFactory agentFactory;
    private final InterventionGateway gateway;
    private final TaskDescriptionBuilder taskBuilder = new TaskDescriptionBuilder();
    private final ResultAggregator aggregator = new ResultAggregator();
    private final ScreenshotRecorder screenshots;
    private final DeadlineRunner agentRunner = new DeadlineRunner("agent");

    private ExecutionAgent currentAgent;   // bound to the current session; dropped when it closes

    public ExecutionEngine(TestConductorConfig config,
                           SessionManager sessionManager,
                           ExecutionAgentFactory agentFactory,
                           InterventionGateway gateway) {
        this.config         = config;
        this.sessionManager = sessionManager;
        this.agentFactory   = agentFactory;
        this.gateway        = gateway;
        this.screenshots    = new ScreenshotRecorder(config.getScreenshotsDir());
        sessionManager.onRelease(() -> currentAgent = null);
    }

    /** The outcome of applying an intervention response. */
    private record Transition(int nextIndex, String abortReason) {
        static Transition moveTo(int index)     { return new Transition(index, null); }
        static Transition abort(String reason)  { return new Transition(-1, reason); }
        boolean aborts()                        { return abortReason != null; }
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * Executes {@code plan} to completion. Never throws for step, agent or
     * intervention failures; those are reflected in the returned result.
     */
    public RunResult run(TestPlan plan) {
        Instant start = Instant.now();
        List<StepResult> results = new ArrayList<>();
        StepStateTable state = new StepStateTable();
        String abortReason = null;
        List<Map<String, Object>> conversation = List.of();
        int historyBefore = gateway.getHistory().size();

        log.info("ExecutionEngine: ===== Starting test run '{}' ({} step(s), maxRetries={}, stepTimeout={}s) =====",
            plan.getTestName(), plan.size(), config.getMaxRetries(), config.getStepTimeout().toSeconds());

        try {
            int index = 0;
            while (index < plan.size()) {
                TestStep step = plan.stepAt(index);
                int stepNumber = step.getStepNumber();

                SessionHandle session = sessionManager.acquire();
                StepResult result = executeAttempt(plan, step, state, session);
                results.add(result);

                if (result.isSuccess()) {
                    log.info("ExecutionEngine: Step {} passed in {}ms", stepNumber, result.getExecutionTime().toMillis());
                    index++;
                    continue;
                }

                log.warn("ExecutionEngine: Step {} failed: {}", stepNumber, result.getErrorMessage());

                if (state.retryCount(stepNumber) < config.getMaxRetries()) {
                    int retry = state.incrementRetry(stepNumber);
                    log.info("ExecutionEngine: Retrying step {} ({}/{})", stepNumber, retry, config.getMaxRetries());
                    continue;
                }

                if (!config.isInterventionEnabled()) {
                    log.warn("ExecutionEngine: Step {} exhausted its retries and interventions are disabled; skipping",
                        stepNumber);
                    index++;
                    continue;
                }

                Transition transition = escalate(plan, index, step, result, results, state);
                if (transition.aborts()) {
                    abortReason = transition.abortReason();
                    log.error("ExecutionEngine: {}", abortReason);
                    break;
                }
                index = transition.nextIndex();
            }
        } catch (SessionCreationException e) {
            abortReason = "Test run aborted: " + e.getMessage();
            log.error("ExecutionEngine: {}", abortReason);
        } catch (RuntimeException e) {
            abortReason = "Test run aborted by an unexpected error: " + e.getMessage();
            log.error("ExecutionEngine: Unexpected failure in the step loop", e);
        } finally {
            conversation = currentConversation();
            sessionManager.release();
        }

        Duration total = Duration.between(start, Instant.now());
        List<InterventionRecord> history =
            gateway.getHistory().subList(historyBefore, gateway.getHistory().size());
        RunResult runResult;
        try {
            runResult = aggregator.aggregate(plan, results, total, abortReason,
                screenshots.getDirectory(), history, conversation);
        } catch (RuntimeException e) {
            log.error("ExecutionEngine: Could not assemble the run result", e);
            runResult = aggregator.aggregate(plan, results, total,
                "Test run aborted by an unexpected error: " + e.getMessage(),
                screenshots.getDirectory(), history, List.of());
        }

        log.info("ExecutionEngine: ===== Test run '{}' finished: success={}, attempts={}, failed={}, time={}ms -- {} =====",
            plan.getTestName(), runResult.success(), results.size(), runResult.failedAttempts(),
            total.toMillis(), runResult.finalMessage());
        return runResult;
    }

    /** Stops the agent worker pool. The session manager is owned by the caller. */
    @Override
    public void close() {
        agentRunner.close();
    }

    // ── One attempt ───────────────────────────────────────────────────────────

    private StepResult executeAttempt(TestPlan plan, TestStep step, StepStateTable state, SessionHandle session) {
        int stepNumber = step.getStepNumber();
        String task = taskBuilder.build(plan, step, state);

        log.info("ExecutionEngine: Executing step {}: {} (retry {})", stepNumber, step.getTitle(),
            state.retryCount(stepNumber));
        log.debug("ExecutionEngine: Task for step {}:\n{}", stepNumber, task);
        logPageState("before", stepNumber, session);

        Instant started = Instant.now();
        StepOutcome outcome = invokeAgent(stepNumber, task, session);
        Duration elapsed = Duration.between(started, Instant.now());

        logPageState("after", stepNumber, session);
        String screenshot = screenshots.capture(session, stepNumber, outcome.screenshotSuffix())
            .map(Path::toString)
            .orElse(null);

        if (outcome.isSuccess()) {
            return StepResult.passed(stepNumber, elapsed, screenshot, outcome.getOutput());
        }

        if (outcome.getType() == StepOutcome.Type.EXECUTION_ERROR && FatalSessionErrors.isFatal(outcome.getCause())) {
            sessionManager.invalidate(outcome.getDetail());
        }
        return StepResult.failed(stepNumber, elapsed, outcome.getDetail(), screenshot);
    }

    private StepOutcome invokeAgent(int stepNumber, String task, SessionHandle session) {
        try {
            ExecutionAgent agent = agentFor(session);
            String output = agentRunner.call(() -> agent.invoke(task, config.isUseVision()), config.getStepTimeout());
            return StepOutcome.success(output);
        } catch (TimeoutException e) {
            StepOutcome timedOut = StepOutcome.timeout(stepNumber, config.getStepTimeout());
            log.warn("ExecutionEngine: {}", timedOut.getDetail());
            detachTimedOutAgent(stepNumber);
            return timedOut;
        } catch (ExecutionException e) {
            return StepOutcome.executionError(stepNumber, e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StepOutcome.executionError(stepNumber, e);
        } catch (Exception e) {
            log.error("ExecutionEngine: Could not create an agent for step {}: {}", stepNumber, e.getMessage());
            return StepOutcome.executionError(stepNumber, e);
        }
    }

    /**
     * Drops the agent whose invocation was cancelled and waits, up to the configured
     * grace, for that invocation to return, so the next attempt starts with a fresh
     * agent and nothing else in flight.
     */
    private void detachTimedOutAgent(int stepNumber) {
        currentAgent = null;
        try {
            if (!agentRunner.awaitAbandoned(config.getAgentCancelGrace())) {
                log.warn("ExecutionEngine: Cancelled agent call for step {} still running after {}ms; continuing without it",
                    stepNumber, config.getAgentCancelGrace().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private ExecutionAgent agentFor(SessionHandle session) throws Exception {
        if (currentAgent == null) {
            currentAgent = agentFactory.create(session);
            log.debug("ExecutionEngine: Created a new agent for the current session");
        }
        return currentAgent;
    }

    // ── Escalation ────────────────────────────────────────────────────────────

    private Transition escalate(TestPlan plan, int index, TestStep step, StepResult failed,
                                List<StepResult> results, StepStateTable state) {
        int stepNumber = step.getStepNumber();
        InterventionContext context = new InterventionContext(
            stepNumber,
            step.getTitle(),
            failed.getErrorMessage(),
            failed.getScreenshotPath(),
            currentUrl(),
            state.retryCount(stepNumber));

        Transition transition;
        try (ProtectionToken ignored = sessionManager.protect()) {
            log.info("ExecutionEngine: Escalating step {} to an operator; session protected", stepNumber);
            InterventionResponse response = gateway.requestIntervention(context);
            results.set(results.size() - 1, failed.withIntervention(response.toDetails()));

            transition = applyResponse(plan, index, step, response, state);

            SessionHealth health = sessionManager.verifyHealth();
            if (health.healthy()) {
                log.info("ExecutionEngine: Session health after intervention: {}", health.description());
            } else {
                log.warn("ExecutionEngine: Session health after intervention: {}", health.description());
            }
        }
        log.info("ExecutionEngine: Intervention for step {} complete; session protection lifted", stepNumber);
        return transition;
    }

    private Transition applyResponse(TestPlan plan, int index, TestStep step,
                                     InterventionResponse response, StepStateTable state) {
        int stepNumber = step.getStepNumber();

        if (gateway.wasLastUnanswered()) {
            int unanswered = state.recordUnanswered(stepNumber);
            int cap = config.getMaxUnansweredInterventions();
            if (cap > 0 && unanswered >= cap) {
                return Transition.abort("Test run aborted: step " + stepNumber + " escalated "
                    + unanswered + " time(s) without an operator response");
            }
        } else {
            state.resetUnanswered(stepNumber);
        }

        switch (response.getAction()) {
            case CONTINUE:
                if (response.hasInstructions()) {
                    state.appendGuidance(stepNumber, response.getAdditionalInstructions());
                    log.info("ExecutionEngine: Re-running step {} with operator guidance", stepNumber);
                } else {
                    log.info("ExecutionEngine: Re-running step {}", stepNumber);
                }
                return Transition.moveTo(index);

            case SKIP:
                log.info("ExecutionEngine: Operator skipped step {}", stepNumber);
                return Transition.moveTo(index + 1);

            case MODIFY:
                if (response.hasMessage()) {
                    state.replaceActions(stepNumber, response.getMessage());
                    log.info("ExecutionEngine: Step {} actions replaced; re-running", stepNumber);
                }
                return Transition.moveTo(index);

            case GOTO:
                if (response.hasTargetStep()) {
                    int target = response.getTargetStep();
                    if (plan.findStep(target).isEmpty()) {
                        return Transition.abort("Test run aborted: goto target " + target
                            + " is outside steps 1.." + plan.size());
                    }
                    log.info("ExecutionEngine: Jumping from step {} to step {}", stepNumber, target);
                    return Transition.moveTo(target - 1);
                }
                log.warn("ExecutionEngine: goto without a target for step {}; moving on", stepNumber);
                return Transition.moveTo(index + 1);

            default:
                log.warn("ExecutionEngine: Response '{}' for step {} is not re-run; moving on",
                    response.getAction().wireName(), stepNumber);
                return Transition.moveTo(index + 1);
        }
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private String currentUrl() {
        return sessionManager.current().map(handle -> {
            try {
                return handle.currentUrl();
            } catch (RuntimeException e) {
                log.debug("ExecutionEngine: Could not read the page URL: {}", e.getMessage());
                return null;
            }
        }).orElse(null);
    }

    private void logPageState(String phase, int stepNumber, SessionHandle session) {
        try {
            log.info("ExecutionEngine: Step {} {}: url={}, title='{}'", stepNumber, phase,
                session.currentUrl(), session.title());
        } catch (RuntimeException e) {
            log.debug("ExecutionEngine: Could not read page state {} step {}: {}", phase, stepNumber, e.getMessage());
        }
    }

    /** The current agent's conversation with null entries dropped; empty when there is none. */
    private List<Map<String, Object>> currentConversation() {
        if (currentAgent == null) return List.of();
        try {
            List<Map<String, Object>> history = currentAgent.conversationHistory();
            if (history == null) return List.of();
            return history.stream().filter(Objects::nonNull).collect(Collectors.toList());
        } catch (RuntimeException e) {
            log.warn("ExecutionEngine: Could not read the agent conversation: {}", e.getMessage());
            return List.of();
        }
    }
}
