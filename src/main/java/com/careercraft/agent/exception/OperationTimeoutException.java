package com.careercraft.agent.exception;

import java.time.Duration;

/**
 * A model call or tool execution exceeded its configured budget.
 */
public class OperationTimeoutException extends AgentException {

    private final String operation;
    private final Duration timeout;

    public OperationTimeoutException(String operation, Duration timeout) {
        super(operation + " timed out after " + timeout.toSeconds() + " seconds");
        this.operation = operation;
        this.timeout = timeout;
    }

    public String getOperation() {
        return operation;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
