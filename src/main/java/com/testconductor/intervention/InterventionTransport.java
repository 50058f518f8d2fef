package com.testconductor.intervention;

import com.testconductor.model.InterventionContext;
import com.testconductor.model.InterventionResponse;

import java.io.IOException;
import java.time.Duration;

/**
 * A channel to the human (or remote responder) who decides what happens after a
 * step has exhausted its retries.
 *
 * Implementations receive the same {@link InterventionContext} and must produce
 * the same {@link InterventionResponse} shape, so the engine never knows which
 * channel answered. Timeout fallback and history are handled by
 * {@link InterventionGateway}, not by transports.
 */
public interface InterventionTransport {

    /**
     * Presents the context and blocks until a response arrives or {@code timeout} passes.
     * The window is not extended by invalid input.
     *
     * @throws InterventionTimeoutException nobody answered in time
     * @throws IOException                  the channel failed
     */
    InterventionResponse await(InterventionContext context, Duration timeout)
            throws InterventionTimeoutException, IOException;

    /** Short name for logs. */
    String name();
}
