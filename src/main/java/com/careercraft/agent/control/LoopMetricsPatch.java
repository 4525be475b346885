package com.careercraft.agent.control;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Partial loop-metrics update produced by a node.
 * Scalars replace the prior value when non-null; tool-call counts are deltas
 * summed key-wise into the prior counts.
 */
@Value
@Builder
public class LoopMetricsPatch {

    Integer agentSwitches;
    @Builder.Default
    Map<String, Integer> toolCallDeltas = Map.of();
    Integer clarificationRounds;
    String lastAgentType;
}
