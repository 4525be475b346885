package com.careercraft.agent.tool;

import java.util.Map;

/**
 * An invocable tool as an agent sees it: already bound to the current user.
 *
 * The {@link #getInputSchema()} return value is serialized as JSON Schema
 * and sent to the LLM so it knows exactly how to invoke the tool.
 *
 * Failures are thrown. The executor turns them into an inline
 * "Error executing ..." result so sibling calls and the turn carry on.
 */
public interface AgentTool {

    /** Unique snake_case name the LLM uses to invoke this tool */
    String getName();

    String getDescription();

    /**
     * JSON Schema (as a Map) describing the tool's input parameters.
     * Plain JSON Schema: type, properties, required, descriptions.
     */
    Map<String, Object> getInputSchema();

    String execute(Map<String, Object> arguments) throws Exception;
}
