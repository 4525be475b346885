package com.careercraft.agent.graph;

import com.careercraft.agent.control.LoopMetrics;
import com.careercraft.agent.control.LoopMetricsPatch;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-field merge rules for folding a {@link StatePatch} into a {@link ConversationState}:
 * messages and completed actions append, per-agent tool-call counts sum key-wise,
 * every scalar takes the incoming value when present.
 */
public final class StateReducer {

    private StateReducer() {
    }

    public static ConversationState merge(ConversationState prev, StatePatch patch) {
        if (patch == null) {
            return prev;
        }

        PendingClarification clarification = prev.getPendingClarification();
        if (patch.getPendingClarification() != null) {
            clarification = patch.getPendingClarification();
        } else if (patch.isClearClarification()) {
            clarification = null;
        }

        return prev.toBuilder()
                .messages(append(prev.getMessages(), patch.getMessages()))
                .next(patch.getNext() != null ? patch.getNext() : prev.getNext())
                .completedActions(append(prev.getCompletedActions(), patch.getCompletedActions()))
                .pendingClarification(clarification)
                .loopMetrics(mergeMetrics(prev.getLoopMetrics(), patch.getLoopMetrics()))
                .outcome(patch.getOutcome() != null ? patch.getOutcome() : prev.getOutcome())
                .build();
    }

    public static LoopMetrics mergeMetrics(LoopMetrics prev, LoopMetricsPatch patch) {
        if (patch == null) {
            return prev;
        }

        Map<String, Integer> toolCalls = new HashMap<>(prev.getToolCallsPerAgent());
        patch.getToolCallDeltas().forEach((agent, delta) -> toolCalls.merge(agent, delta, Integer::sum));

        return LoopMetrics.builder()
                .agentSwitches(patch.getAgentSwitches() != null
                        ? patch.getAgentSwitches() : prev.getAgentSwitches())
                .toolCallsPerAgent(Map.copyOf(toolCalls))
                .clarificationRounds(patch.getClarificationRounds() != null
                        ? patch.getClarificationRounds() : prev.getClarificationRounds())
                .lastAgentType(patch.getLastAgentType() != null
                        ? patch.getLastAgentType() : prev.getLastAgentType())
                .build();
    }

    private static <T> List<T> append(List<T> prev, List<T> added) {
        if (added == null || added.isEmpty()) {
            return prev;
        }
        List<T> merged = new ArrayList<>(prev.size() + added.size());
        merged.addAll(prev);
        merged.addAll(added);
        return List.copyOf(merged);
    }
}
