package com.testconductor.util;

import com.testconductor.session.SessionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Saves one screenshot per step attempt into the run's screenshots directory.
 *
 * File names follow {@code step_NN_<epochSeconds>[_<attempt>][_<suffix>].png}, e.g.
 * {@code step_03_1718000000_timeout.png}. The attempt ordinal is added from a step's
 * second capture on, so repeated attempts within the same second keep separate
 * files. Capture is best-effort: a failure is logged and reported as an empty
 * result, never thrown.
 */
public class ScreenshotRecorder {

    private static final Logger log = LoggerFactory.getLogger(ScreenshotRecorder.class);

    private final Path directory;
    private final Clock clock;
    private final Map<Integer, Integer> capturesPerStep = new HashMap<>();

    public ScreenshotRecorder(Path directory) {
        this(directory, Clock.systemUTC());
    }

    public ScreenshotRecorder(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
    }

    public static String fileName(int stepNumber, long epochSeconds, String suffix) {
        return fileName(stepNumber, epochSeconds, 1, suffix);
    }

    /** @param attempt 1-based capture ordinal for the step; only values above 1 appear in the name */
    public static String fileName(int stepNumber, long epochSeconds, int attempt, String suffix) {
        StringBuilder name = new StringBuilder(String.format("step_%02d_%d", stepNumber, epochSeconds));
        if (attempt > 1) name.append('_').append(attempt);
        if (suffix != null && !suffix.isBlank()) name.append('_').append(suffix);
        return name.append(".png").toString();
    }

    /**
     * Captures the session's viewport for {@code stepNumber}.
     *
     * @param suffix "timeout", "error" or null
     * @return the written file, or empty when no session was given or capture failed
     */
    public Optional<Path> capture(SessionHandle session, int stepNumber, String suffix) {
        if (session == null) return Optional.empty();
        int attempt = capturesPerStep.merge(stepNumber, 1, Integer::sum);
        Path target = directory.resolve(fileName(stepNumber, clock.instant().getEpochSecond(), attempt, suffix));
        try {
            Files.createDirectories(directory);
            session.saveScreenshot(target);
            log.debug("ScreenshotRecorder: Saved {}", target);
            return Optional.of(target);
        } catch (IOException | RuntimeException e) {
            log.warn("ScreenshotRecorder: Could not capture screenshot for step {}: {}", stepNumber, e.getMessage());
            return Optional.empty();
        }
    }

    public Path getDirectory() { return directory; }
}
