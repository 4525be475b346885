package com.careercraft.agent.agent.processor;

/**
 * Optional per-role hook that turns a batch of tool outcomes into one
 * consolidated, human-readable summary in place of per-tool messages.
 *
 * Implementations format what already happened; they must not run tools.
 * Anything they throw makes the agent fall back to per-tool messages.
 */
@FunctionalInterface
public interface ToolResultProcessor {

    String process(ProcessingContext context);
}
