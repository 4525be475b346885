package com.careercraft.agent.control;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Turn-scoped counters checked by the {@link LoopLimitGovernor}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LoopMetrics {

    int agentSwitches;
    @Builder.Default
    Map<String, Integer> toolCallsPerAgent = Map.of();
    int clarificationRounds;
    /** Null until the first agent ran in this turn */
    String lastAgentType;

    public static LoopMetrics empty() {
        return LoopMetrics.builder().build();
    }

    public int toolCallsFor(String agentType) {
        return toolCallsPerAgent.getOrDefault(agentType, 0);
    }

    public int totalToolCalls() {
        return toolCallsPerAgent.values().stream().mapToInt(Integer::intValue).sum();
    }

    public String summary() {
        return String.format("Agent switches: %d, Total tool calls: %d, Clarification rounds: %d, Last agent: %s",
                agentSwitches, totalToolCalls(), clarificationRounds,
                lastAgentType != null ? lastAgentType : "none");
    }
}
