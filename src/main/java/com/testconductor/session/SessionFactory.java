package com.testconductor.session;

/**
 * Starts a new browser session. Called by {@link SessionManager}, which owns
 * retries, start-up deadlines and cleanup between attempts.
 */
@FunctionalInterface
public interface SessionFactory {

    /**
     * Starts a browser and returns a live handle.
     *
     * @throws Exception any start-up failure; the manager logs it and retries
     */
    SessionHandle create() throws Exception;
}
