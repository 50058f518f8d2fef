package com.testconductor.intervention;

import com.testconductor.model.InterventionContext;
import com.testconductor.model.InterventionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Line-oriented operator console over a reader/writer pair (stdin/stdout by default).
 *
 * A single daemon thread reads lines into a queue for the lifetime of the
 * transport, because a blocked {@code readLine()} cannot be cancelled; each
 * intervention then polls that queue against one fixed deadline. Invalid input
 * and {@code help} reprompt without extending the deadline. Lines typed between
 * two interventions are discarded when the next one starts.
 */
public class ConsoleInterventionTransport implements InterventionTransport {

    private static final Logger log = LoggerFactory.getLogger(ConsoleInterventionTransport.class);

    private static final String RULE = "=".repeat(60);
    private static final String PROMPT = "command > ";

    private final BufferedReader in;
    private final PrintStream out;
    private final InterventionCommandParser parser = new InterventionCommandParser();
    private final BlockingQueue<Optional<String>> lines = new LinkedBlockingQueue<>();
    private Thread readerThread;
    private volatile boolean endOfInput;

    public ConsoleInterventionTransport() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public ConsoleInterventionTransport(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public String name() { return "console"; }

    @Override
    public InterventionResponse await(InterventionContext context, Duration timeout)
            throws InterventionTimeoutException, IOException {
        if (!startReader()) {
            discardStaleInput();
        }
        render(context);

        long deadlineNanos = System.nanoTime() + timeout.toNanos();
        while (true) {
            out.print(PROMPT);
            out.flush();

            Optional<String> line = nextLine(deadlineNanos, timeout);
            if (line.isEmpty()) {
                throw new IOException("Operator console input closed");
            }

            InterventionCommandParser.ParsedCommand parsed = parser.parse(line.get());
            if (parsed.isResponse()) {
                log.info("ConsoleInterventionTransport: Operator answered '{}'", line.get().strip());
                return parsed.response();
            }
            out.println(parsed.feedback());
        }
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private Optional<String> nextLine(long deadlineNanos, Duration timeout)
            throws InterventionTimeoutException, IOException {
        if (endOfInput && lines.isEmpty()) return Optional.empty();
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            out.println();
            throw new InterventionTimeoutException(timeout);
        }
        try {
            Optional<String> line = lines.poll(remaining, TimeUnit.NANOSECONDS);
            if (line == null) {
                out.println();
                throw new InterventionTimeoutException(timeout);
            }
            return line;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for the operator", e);
        }
    }

    /** @return true if the reader was started by this call */
    private synchronized boolean startReader() {
        if (readerThread != null) return false;
        readerThread = new Thread(this::pumpLines, "intervention-console-reader");
        readerThread.setDaemon(true);
        readerThread.start();
        return true;
    }

    private void pumpLines() {
        try {
            String line;
            while ((line = in.readLine()) != null) {
                lines.add(Optional.of(line));
            }
        } catch (IOException e) {
            log.warn("ConsoleInterventionTransport: Console read failed: {}", e.getMessage());
        } finally {
            endOfInput = true;
            lines.add(Optional.empty());
        }
    }

    private void discardStaleInput() {
        Optional<String> stale;
        while ((stale = lines.peek()) != null && stale.isPresent()) {
            lines.poll();
            log.debug("ConsoleInterventionTransport: Discarded stale input '{}'", stale.get());
        }
    }

    private void render(InterventionContext context) {
        out.println();
        out.println(RULE);
        out.println("HUMAN INTERVENTION REQUIRED");
        out.println(RULE);
        out.println("Step       : " + context.stepNumber() + " - " + context.stepTitle());
        out.println("Error      : " + context.errorMessage());
        out.println("Retries    : " + context.retryCount());
        if (context.pageUrl() != null) {
            out.println("Page       : " + context.pageUrl());
        }
        if (context.screenshotPath() != null) {
            out.println("Screenshot : " + context.screenshotPath());
        }
        out.println();
        out.println(InterventionCommandParser.HELP_TEXT);
        out.println("-".repeat(60));
        out.flush();
    }
}
