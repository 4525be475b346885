package com.careercraft.agent.agent;

import com.careercraft.agent.agent.processor.ToolResultProcessor;
import com.careercraft.agent.graph.GraphNode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Everything that distinguishes one specialized agent from another.
 * {@link AgentNodeFactory} turns a config into a node; adding a role means
 * adding a config, not a class.
 */
@Value
@Builder
public class AgentRoleConfig {

    @NonNull
    GraphNode role;

    @NonNull
    String systemMessage;

    /** Registry names of the tools bound for this role, in presentation order */
    @Builder.Default
    List<String> toolNames = List.of();

    /** Null when per-tool messages are wanted */
    ToolResultProcessor resultProcessor;

    @Builder.Default
    boolean requiresUserId = true;

    public String agentType() {
        return role.wireName();
    }

    public Optional<ToolResultProcessor> resultProcessor() {
        return Optional.ofNullable(resultProcessor);
    }
}
