package com.testconductor.intervention;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.testconductor.core.TestConductorConfig;
import com.testconductor.model.InterventionContext;
import com.testconductor.model.InterventionRecord;
import com.testconductor.model.InterventionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Single entry point the engine uses to escalate a failing step.
 *
 * Delegates the conversation to an {@link InterventionTransport} and guarantees a
 * response: when nobody answers within the window, or the channel fails, the
 * fallback {@code continue} response is returned instead. Every request is
 * appended to the history whatever its outcome.
 *
 * ## History file
 * When a history path is configured the full history is rewritten there as a
 * pretty-printed JSON array after each intervention, using a temp file and an
 * atomic rename.
 */
public class InterventionGateway {

    private static final Logger log = LoggerFactory.getLogger(InterventionGateway.class);

    public static final String TIMEOUT_MESSAGE = "Intervention timed out";

    private final InterventionTransport transport;
    private final Duration timeout;
    private final Path historyPath;     // null = keep history in memory only
    private final ObjectMapper mapper;
    private final List<InterventionRecord> history = new ArrayList<>();
    private boolean lastUnanswered;

    public InterventionGateway(InterventionTransport transport, Duration timeout) {
        this(transport, timeout, null);
    }

    public InterventionGateway(InterventionTransport transport, Duration timeout, Path historyPath) {
        if (transport == null) throw new IllegalArgumentException("transport is required");
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.transport   = transport;
        this.timeout     = timeout;
        this.historyPath = historyPath;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Picks the remote channel when an intervention URL is configured, the
     * operator console otherwise.
     */
    public static InterventionGateway fromConfig(TestConductorConfig config) {
        InterventionTransport transport = config.isRemoteInterventionEnabled()
            ? new HttpInterventionTransport(config.getInterventionUrl())
            : new ConsoleInterventionTransport();
        return new InterventionGateway(transport, config.getInterventionTimeout(), config.getInterventionLogPath());
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * Presents {@code context} to the operator and returns their decision. Never
     * throws: timeouts and channel failures yield the fallback response.
     */
    public InterventionResponse requestIntervention(InterventionContext context) {
        Instant requestedAt = Instant.now();
        log.warn("InterventionGateway: Step {} ('{}') needs intervention via {} -- {}",
            context.stepNumber(), context.stepTitle(), transport.name(), context.errorMessage());

        InterventionResponse response;
        String error = null;
        boolean timedOut = false;
        try {
            response = transport.await(context, timeout);
            log.info("InterventionGateway: Step {} resolved with '{}'",
                context.stepNumber(), response.getAction().wireName());
        } catch (InterventionTimeoutException e) {
            timedOut = true;
            response = InterventionResponse.timeoutFallback(TIMEOUT_MESSAGE);
            log.warn("InterventionGateway: No response within {}s for step {}; continuing",
                timeout.toSeconds(), context.stepNumber());
        } catch (IOException | RuntimeException e) {
            timedOut = true;
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            response = InterventionResponse.timeoutFallback(TIMEOUT_MESSAGE);
            log.error("InterventionGateway: {} channel failed for step {}: {}; continuing",
                transport.name(), context.stepNumber(), error);
        }

        lastUnanswered = timedOut;
        history.add(new InterventionRecord(requestedAt, Instant.now(), context, response.toDetails(), timedOut, error));
        if (historyPath != null) persist();
        return response;
    }

    /** True when the most recent request ended in the fallback response. */
    public boolean wasLastUnanswered() { return lastUnanswered; }

    public List<InterventionRecord> getHistory() { return Collections.unmodifiableList(history); }

    public Duration getTimeout() { return timeout; }

    public InterventionTransport getTransport() { return transport; }

    /** Writes the history to {@code path} as a pretty-printed JSON array. */
    public void saveHistory(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), history);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("InterventionGateway: {} intervention(s) written to {}", history.size(), path);
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private void persist() {
        try {
            saveHistory(historyPath);
        } catch (IOException e) {
            log.error("InterventionGateway: Failed to save intervention history to {}: {}",
                historyPath, e.getMessage());
        }
    }
}
