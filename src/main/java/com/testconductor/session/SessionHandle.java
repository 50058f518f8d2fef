package com.testconductor.session;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Handle to the shared, expensive browser session a run drives.
 *
 * Only the engine thread issues commands against it. Closing goes through
 * {@link SessionManager#release()}, which refuses while an intervention holds
 * the session protected; code outside the session package should never call
 * {@link #close()} directly.
 */
public interface SessionHandle {

    /** URL of the page currently shown. */
    String currentUrl();

    /** Title of the page currently shown; may be empty. */
    String title();

    /** Length of the trimmed visible body text of the current page. */
    int visibleTextLength();

    /** Writes a PNG of the current viewport to {@code target}. */
    void saveScreenshot(Path target) throws IOException;

    /** Cheap liveness probe; never throws. */
    boolean isAlive();

    /** Terminates the underlying browser. */
    void close();
}
