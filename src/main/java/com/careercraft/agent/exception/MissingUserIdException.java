package com.careercraft.agent.exception;

/**
 * A role that reads or writes user data ran without a user id.
 */
public class MissingUserIdException extends AgentException {

    private final String agentType;

    public MissingUserIdException(String agentType) {
        super("User ID is required but was not provided");
        this.agentType = agentType;
    }

    public String getAgentType() {
        return agentType;
    }
}
