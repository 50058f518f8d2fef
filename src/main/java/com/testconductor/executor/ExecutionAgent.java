package com.testconductor.executor;

import java.util.List;
import java.util.Map;

/**
 * The autonomous agent that performs one step's task against the live session.
 *
 * An agent is bound to the session it was created for; when that session is
 * closed the engine drops the agent and asks the factory for a new one.
 */
public interface ExecutionAgent {

    /**
     * Performs {@code task}. Implementations should respond to thread interruption,
     * which is how the engine cancels an invocation that exceeded the step timeout.
     *
     * @param task      the rendered task description
     * @param useVision whether the agent may use visual perception
     * @return the agent's output, possibly null; returning at all marks the attempt successful
     * @throws Exception any failure; classified by the engine as an execution error
     */
    String invoke(String task, boolean useVision) throws Exception;

    /** Conversation entries accumulated by this agent, for the run report. */
    default List<Map<String, Object>> conversationHistory() {
        return List.of();
    }
}
