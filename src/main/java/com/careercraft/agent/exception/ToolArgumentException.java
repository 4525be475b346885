package com.careercraft.agent.exception;

import java.util.List;

/**
 * Tool arguments failed schema validation and could not be repaired.
 */
public class ToolArgumentException extends AgentException {

    private final String toolName;
    private final List<String> issues;

    public ToolArgumentException(String toolName, List<String> issues) {
        super("Invalid arguments for " + toolName + ": " + String.join(", ", issues));
        this.toolName = toolName;
        this.issues = List.copyOf(issues);
    }

    public String getToolName() {
        return toolName;
    }

    public List<String> getIssues() {
        return issues;
    }
}
