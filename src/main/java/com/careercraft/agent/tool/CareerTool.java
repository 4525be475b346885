package com.careercraft.agent.tool;

import java.util.Map;

/**
 * Contract every tool component implements. Spring discovers the beans and
 * the {@link ToolRegistry} binds them to a user per turn.
 *
 * The user id never travels through the model: it is supplied by the engine
 * from the conversation state, so the schema must not declare it.
 */
public interface CareerTool {

    String getName();

    /**
     * Human-readable description. This is the primary signal the LLM uses
     * to decide when to call this tool. Be specific and include example use-cases.
     */
    String getDescription();

    Map<String, Object> getInputSchema();

    String execute(String userId, Map<String, Object> arguments) throws Exception;

    default AgentTool bindTo(String userId) {
        return new BoundTool(this, userId);
    }
}
