package com.testconductor.session;

import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.SessionNotCreatedException;

import java.util.List;
import java.util.Locale;

/**
 * Separates failures that mean the browser itself is gone (crash, refused
 * connection, closed target) from ordinary step failures.
 *
 * Only fatal failures cause the session to be recreated; everything else leaves
 * the browser untouched so the operator can inspect it.
 */
public final class FatalSessionErrors {

    static final List<String> FATAL_KEYWORDS = List.of(
        "browser crashed",
        "connection refused",
        "target closed",
        "browser process exited",
        "browser has been closed"
    );

    private FatalSessionErrors() {}

    public static boolean isFatal(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof NoSuchSessionException || t instanceof SessionNotCreatedException) {
                return true;
            }
            if (isFatalMessage(t.getMessage())) {
                return true;
            }
            if (t.getCause() == t) break;
        }
        return false;
    }

    public static boolean isFatalMessage(String message) {
        if (message == null) return false;
        String lower = message.toLowerCase(Locale.ROOT);
        return FATAL_KEYWORDS.stream().anyMatch(lower::contains);
    }
}
