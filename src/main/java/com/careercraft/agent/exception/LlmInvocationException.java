package com.careercraft.agent.exception;

/**
 * The model provider failed in a way the client could not recover from.
 */
public class LlmInvocationException extends AgentException {

    public LlmInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
