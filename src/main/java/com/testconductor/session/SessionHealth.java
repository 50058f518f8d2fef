package com.testconductor.session;

/**
 * Result of {@link SessionManager#verifyHealth()}.
 *
 * @param healthy     true when the page looks usable
 * @param description what was observed, for the log
 */
public record SessionHealth(boolean healthy, String description) {

    public static SessionHealth healthy(String description)   { return new SessionHealth(true, description); }
    public static SessionHealth unhealthy(String description) { return new SessionHealth(false, description); }
}
