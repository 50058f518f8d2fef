package com.testconductor.executor;

import java.time.Duration;

/**
 * Tagged result of one agent invocation. Agent exceptions are folded into this
 * value at the attempt boundary and never travel further as control flow.
 *
 * Immutable; use the static factories.
 */
public final class StepOutcome {

    /**
     *   SUCCESS          : the agent returned an output
     *   TIMEOUT          : the invocation exceeded the step deadline and was cancelled
     *   EXECUTION_ERROR  : the agent raised a failure
     */
    public enum Type { SUCCESS, TIMEOUT, EXECUTION_ERROR }

    private final Type type;
    private final String output;    // SUCCESS only
    private final String detail;    // failure text for TIMEOUT / EXECUTION_ERROR
    private final Throwable cause;  // EXECUTION_ERROR only, may be null

    private StepOutcome(Type type, String output, String detail, Throwable cause) {
        this.type   = type;
        this.output = output;
        this.detail = detail;
        this.cause  = cause;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static StepOutcome success(String output) {
        return new StepOutcome(Type.SUCCESS, output, null, null);
    }

    public static StepOutcome timeout(int stepNumber, Duration limit) {
        return new StepOutcome(Type.TIMEOUT, null,
            "Step " + stepNumber + " timed out after " + describe(limit), null);
    }

    /** "300ms" below one second, whole seconds ("30s") otherwise. */
    static String describe(Duration limit) {
        return limit.compareTo(Duration.ofSeconds(1)) < 0 ? limit.toMillis() + "ms" : limit.toSeconds() + "s";
    }

    public static StepOutcome executionError(int stepNumber, Throwable cause) {
        String reason = cause != null && cause.getMessage() != null
            ? cause.getMessage()
            : cause != null ? cause.getClass().getSimpleName() : "unknown failure";
        return new StepOutcome(Type.EXECUTION_ERROR, null,
            "Step " + stepNumber + " failed: " + reason, cause);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public Type getType()       { return type; }
    public boolean isSuccess()  { return type == Type.SUCCESS; }
    public String getOutput()   { return output; }
    public String getDetail()   { return detail; }
    public Throwable getCause() { return cause; }

    /** Screenshot file-name suffix for this outcome, or null for success. */
    public String screenshotSuffix() {
        switch (type) {
            case TIMEOUT:         return "timeout";
            case EXECUTION_ERROR: return "error";
            default:              return null;
        }
    }

    @Override
    public String toString() {
        return isSuccess() ? "StepOutcome{SUCCESS}" : "StepOutcome{" + type + ", '" + detail + "'}";
    }
}
