package com.testconductor.executor;

import com.testconductor.session.SessionHandle;

/** Creates an agent bound to a live session. */
@FunctionalInterface
public interface ExecutionAgentFactory {

    ExecutionAgent create(SessionHandle session) throws Exception;
}
