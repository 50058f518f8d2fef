package com.testconductor.session;

/**
 * Raised when no browser session could be started within the bounded number of
 * attempts. The only failure that aborts a whole run.
 */
public class SessionCreationException extends RuntimeException {

    private final int attempts;

    public SessionCreationException(int attempts, Throwable lastFailure) {
        super("Could not create a browser session after " + attempts + " attempt(s)"
            + (lastFailure != null ? ": " + lastFailure.getMessage() : ""), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() { return attempts; }
}
