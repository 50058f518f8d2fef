package com.testconductor.session;

/**
 * Proof that the session is protected from teardown. Obtained from
 * {@link SessionManager#protect()}; closing it lifts the protection.
 *
 * <pre>
 *   try (ProtectionToken ignored = sessionManager.protect()) {
 *       response = gateway.requestIntervention(context);
 *       applyResponse(response);
 *   }
 * </pre>
 *
 * Closing is idempotent. Closing a token that has been superseded by a newer
 * one has no effect on the newer one.
 */
public final class ProtectionToken implements AutoCloseable {

    private final SessionManager owner;
    private final long generation;
    private boolean released;

    ProtectionToken(SessionManager owner, long generation) {
        this.owner = owner;
        this.generation = generation;
    }

    long generation() { return generation; }

    public boolean isReleased() { return released; }

    @Override
    public void close() {
        if (released) return;
        released = true;
        owner.unprotect(this);
    }
}
