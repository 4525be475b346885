package com.careercraft.agent.graph;

import com.careercraft.agent.control.CompletedAction;
import com.careercraft.agent.control.LoopMetricsPatch;
import com.careercraft.agent.model.Message;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Partial state returned by a node. Absent fields leave the running state untouched.
 */
@Value
@Builder(toBuilder = true)
public class StatePatch {

    @Builder.Default
    List<Message> messages = List.of();

    /** Routing signal; null means "no opinion" */
    GraphNode next;

    @Builder.Default
    List<CompletedAction> completedActions = List.of();

    /** Replaces the pending clarification wholesale */
    PendingClarification pendingClarification;

    /** Drops the pending clarification; ignored when a new one is set in the same patch */
    boolean clearClarification;

    LoopMetricsPatch loopMetrics;

    TurnOutcome outcome;

    int promptTokens;
    int completionTokens;

    /** Single assistant message that ends the turn */
    public static StatePatch terminal(Message message, TurnOutcome outcome) {
        return StatePatch.builder()
                .messages(List.of(message))
                .next(GraphNode.END)
                .outcome(outcome)
                .build();
    }
}
