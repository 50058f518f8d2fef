package com.testconductor.session;

import com.testconductor.core.TestConductorConfig;
import com.testconductor.util.DeadlineRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Owns the shared browser session for the whole run.
 *
 * ## Lifecycle
 *
 *   1. {@link #acquire()} starts a session lazily on first need, retrying a bounded
 *      number of times with a fixed delay; each start is bounded by a start-up
 *      deadline. Stray browsers are cleaned up first when memory is tight.
 *   2. The same handle is reused across steps, step timeouts and interventions.
 *   3. {@link #invalidate(String)} drops a session that suffered a fatal error; the
 *      next {@link #acquire()} starts a fresh one.
 *   4. {@link #release()} closes the session once at the end of the run.
 *
 * ## Protection
 * While a {@link ProtectionToken} is outstanding, every path that would close or
 * replace the session (release, invalidate, close) is a logged no-op. The engine
 * holds a token for the whole span of an intervention: from the request being
 * issued until its response has been applied.
 *
 * Not thread-safe: only the engine thread drives it.
 */
public class SessionManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    static final int MIN_VISIBLE_TEXT = 50;

    private final SessionFactory factory;
    private final ResourceMonitor resourceMonitor;
    private final ProcessJanitor janitor;
    private final int maxAttempts;
    private final Duration startupTimeout;
    private final Duration retryDelay;
    private final DeadlineRunner startupRunner = new DeadlineRunner("session-start");
    private final List<Runnable> releaseListeners = new CopyOnWriteArrayList<>();

    private SessionHandle handle;
    private boolean isProtected;
    private long protectionGeneration;
    private int sessionsCreated;

    public SessionManager(SessionFactory factory, ResourceMonitor resourceMonitor, ProcessJanitor janitor,
                          int maxAttempts, Duration startupTimeout, Duration retryDelay) {
        this.factory         = factory;
        this.resourceMonitor = resourceMonitor;
        this.janitor         = janitor;
        this.maxAttempts     = maxAttempts;
        this.startupTimeout  = startupTimeout;
        this.retryDelay      = retryDelay;
    }

    public SessionManager(SessionFactory factory, TestConductorConfig config) {
        this(factory,
            new ResourceMonitor(config.getMemoryThresholdPercent()),
            new ProcessJanitor(),
            config.getSessionAttempts(),
            config.getSessionStartupTimeout(),
            config.getSessionRetryDelay());
    }

    // ── Acquisition ───────────────────────────────────────────────────────────

    /**
     * Returns the live session, starting one if none exists.
     *
     * @throws SessionCreationException when every start attempt failed
     */
    public SessionHandle acquire() {
        if (handle != null) return handle;

        Throwable lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            log.info("SessionManager: Starting browser session (attempt {}/{})", attempt, maxAttempts);

            if (resourceMonitor.isUnderPressure()) {
                log.warn("SessionManager: Memory pressure detected, cleaning up stray browsers");
                janitor.cleanupStrayBrowsers();
            }

            try {
                handle = startupRunner.call(factory::create, startupTimeout, SessionManager::closeQuietly);
                if (handle == null) {
                    throw new IllegalStateException("Session factory returned no session");
                }
                sessionsCreated++;
                log.info("SessionManager: Browser session started (session #{})", sessionsCreated);
                return handle;
            } catch (TimeoutException e) {
                lastFailure = new TimeoutException("Browser start-up exceeded " + startupTimeout.toSeconds() + "s");
                log.error("SessionManager: Browser start-up timed out after {}s (attempt {})",
                    startupTimeout.toSeconds(), attempt);
            } catch (ExecutionException e) {
                lastFailure = e.getCause() != null ? e.getCause() : e;
                log.error("SessionManager: Browser start-up failed (attempt {}): {}", attempt, lastFailure.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SessionCreationException(attempt, e);
            } catch (RuntimeException e) {
                lastFailure = e;
                log.error("SessionManager: Browser start-up failed (attempt {}): {}", attempt, e.getMessage());
            }

            if (attempt < maxAttempts && !retryDelay.isZero()) {
                log.info("SessionManager: Waiting {}ms before the next attempt", retryDelay.toMillis());
                try {
                    Thread.sleep(retryDelay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new SessionCreationException(attempt, e);
                }
            }
        }
        throw new SessionCreationException(maxAttempts, lastFailure);
    }

    public Optional<SessionHandle> current() {
        return Optional.ofNullable(handle);
    }

    // ── Health ────────────────────────────────────────────────────────────────

    /**
     * Best-effort check that the page is usable: visible text longer than 50
     * characters, or at least a title. Never throws.
     */
    public SessionHealth verifyHealth() {
        if (handle == null) return SessionHealth.unhealthy("No browser session");
        try {
            String url = handle.currentUrl();
            String title = handle.title();
            int textLength = handle.visibleTextLength();
            if (textLength > MIN_VISIBLE_TEXT) {
                return SessionHealth.healthy("Page loaded - title: " + title + ", text length: " + textLength);
            }
            if (title != null && !title.isBlank()) {
                return SessionHealth.healthy("Page may still be loading - title: " + title);
            }
            return SessionHealth.unhealthy("Page looks blank - url: " + url + ", text length: " + textLength);
        } catch (Exception e) {
            log.warn("SessionManager: Health check failed: {}", e.getMessage());
            return SessionHealth.unhealthy("Health check failed: " + e.getMessage());
        }
    }

    // ── Protection ────────────────────────────────────────────────────────────

    /** Protects the session until the returned token is closed. */
    public ProtectionToken protect() {
        protectionGeneration++;
        isProtected = true;
        log.info("SessionManager: Session protection ON");
        return new ProtectionToken(this, protectionGeneration);
    }

    /**
     * Raw toggle for the protection flag. Prefer {@link #protect()}; turning protection
     * off here also invalidates any outstanding token.
     */
    public void setProtected(boolean value) {
        if (value) {
            protect();
        } else if (isProtected) {
            protectionGeneration++;
            isProtected = false;
            log.info("SessionManager: Session protection OFF");
        }
    }

    public boolean isProtected() { return isProtected; }

    void unprotect(ProtectionToken token) {
        if (token.generation() != protectionGeneration || !isProtected) return;
        isProtected = false;
        log.info("SessionManager: Session protection OFF");
    }

    // ── Teardown ──────────────────────────────────────────────────────────────

    /**
     * Registers a callback run whenever the session is closed, so holders of objects
     * bound to it (the agent) can drop them.
     */
    public void onRelease(Runnable listener) {
        releaseListeners.add(listener);
    }

    /**
     * Closes the session unless it is protected. Idempotent.
     *
     * @return true if a session was closed by this call
     */
    public boolean release() {
        if (isProtected) {
            log.info("SessionManager: Intervention in progress; keeping the browser session open");
            return false;
        }
        if (handle == null) {
            log.debug("SessionManager: No browser session to close");
            return false;
        }
        SessionHandle closing = handle;
        handle = null;
        closeQuietly(closing);
        releaseListeners.forEach(Runnable::run);
        log.info("SessionManager: Browser session closed");
        return true;
    }

    /**
     * Drops a session that suffered a fatal error so the next {@link #acquire()}
     * starts a fresh one. A no-op while protected.
     */
    public boolean invalidate(String reason) {
        if (isProtected) {
            log.warn("SessionManager: Fatal browser error ({}) while protected; session kept", reason);
            return false;
        }
        log.warn("SessionManager: Fatal browser error ({}); the session will be recreated", reason);
        return release();
    }

    public int getSessionsCreated() { return sessionsCreated; }

    /** Releases the session (subject to protection) and stops the start-up worker. */
    @Override
    public void close() {
        release();
        startupRunner.close();
    }

    private static void closeQuietly(SessionHandle session) {
        try {
            session.close();
        } catch (Exception e) {
            log.warn("SessionManager: Exception while closing browser session: {}", e.getMessage());
        }
    }
}
