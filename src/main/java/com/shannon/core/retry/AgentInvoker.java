package com.shannon.core.retry;

import com.shannon.core.model.AttemptResult;

import java.util.function.Consumer;

/**
 * Runs one autonomous agent attempt against a workspace.
 * <p>
 * Implementations stream what the agent does to {@code events} as it happens and return once the agent
 * stops. A failure is either an unsuccessful {@link AttemptResult} or an exception; an
 * {@link com.shannon.core.error.AgentExecutionException} carries an explicit retry decision. When the
 * invocation's cancellation token fires, implementations stop the agent and return promptly.
 */
public interface AgentInvoker {

    AttemptResult run(AgentInvocation invocation, Consumer<AgentEvent> events) throws Exception;
}
