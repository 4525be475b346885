package com.careercraft.agent.exception;

/**
 * Base runtime exception for the engine.
 *
 * Model-client configuration problems (bad key, decommissioned model, other 4xx)
 * are thrown as plain AgentException; Resilience4j ignores this type, so they are
 * neither retried nor counted as circuit-breaker failures.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
