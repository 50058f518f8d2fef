package com.testconductor.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Best-effort cleanup of stray browser processes left behind by crashed sessions.
 *
 * Runs {@code pkill -f <pattern>} for each pattern. Every failure is logged and
 * ignored: cleanup is an aid to the next start attempt, never a precondition.
 */
public class ProcessJanitor {

    private static final Logger log = LoggerFactory.getLogger(ProcessJanitor.class);

    public static final List<String> DEFAULT_PATTERNS = List.of("chromedriver", "chrome");

    private static final long PKILL_TIMEOUT_SECONDS = 5;
    private static final long SETTLE_MILLIS = 1000;

    private final List<String> patterns;

    public ProcessJanitor() {
        this(DEFAULT_PATTERNS);
    }

    public ProcessJanitor(List<String> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    public void cleanupStrayBrowsers() {
        for (String pattern : patterns) {
            kill(pattern);
        }
        try {
            Thread.sleep(SETTLE_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void kill(String pattern) {
        try {
            Process process = new ProcessBuilder("pkill", "-f", pattern)
                .redirectErrorStream(true)
                .start();
            if (!process.waitFor(PKILL_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.warn("ProcessJanitor: pkill -f {} did not finish in {}s", pattern, PKILL_TIMEOUT_SECONDS);
                return;
            }
            log.debug("ProcessJanitor: pkill -f {} exited with {}", pattern, process.exitValue());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("ProcessJanitor: Interrupted while cleaning '{}'", pattern);
        } catch (Exception e) {
            log.debug("ProcessJanitor: Could not clean '{}': {}", pattern, e.getMessage());
        }
    }
}
