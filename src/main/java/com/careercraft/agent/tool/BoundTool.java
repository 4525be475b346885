package com.careercraft.agent.tool;

import java.util.Map;

/**
 * A {@link CareerTool} with its user id fixed for the duration of a turn.
 */
final class BoundTool implements AgentTool {

    private final CareerTool delegate;
    private final String userId;

    BoundTool(CareerTool delegate, String userId) {
        this.delegate = delegate;
        this.userId = userId;
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public String getDescription() {
        return delegate.getDescription();
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return delegate.getInputSchema();
    }

    @Override
    public String execute(Map<String, Object> arguments) throws Exception {
        return delegate.execute(userId, arguments);
    }

    @Override
    public String toString() {
        return "BoundTool[" + delegate.getName() + "]";
    }
}
