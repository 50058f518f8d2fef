package com.testconductor.intervention;

import java.time.Duration;

/**
 * No operator response arrived within the intervention wait window.
 */
public class InterventionTimeoutException extends Exception {

    private final Duration waited;

    public InterventionTimeoutException(Duration waited) {
        super("No intervention response within " + waited.toSeconds() + "s");
        this.waited = waited;
    }

    public InterventionTimeoutException(Duration waited, Throwable cause) {
        this(waited);
        initCause(cause);
    }

    public Duration getWaited() { return waited; }
}
