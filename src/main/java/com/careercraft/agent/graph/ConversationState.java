package com.careercraft.agent.graph;

import com.careercraft.agent.control.CompletedAction;
import com.careercraft.agent.control.LoopMetrics;
import com.careercraft.agent.model.Message;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Data threaded through every node of one turn.
 *
 * Instances are immutable. Nodes never modify the state they receive; they
 * return a {@link StatePatch} and the {@link GraphRouter} folds it in with
 * {@link StateReducer#merge}.
 */
@Value
@Builder(toBuilder = true)
public class ConversationState {

    /** Append-only during a turn */
    @Builder.Default
    List<Message> messages = List.of();

    @Builder.Default
    GraphNode next = GraphNode.SUPERVISOR;

    /** Read-only for the whole turn; may be null */
    String userId;

    @Builder.Default
    List<CompletedAction> completedActions = List.of();

    PendingClarification pendingClarification;

    @Builder.Default
    LoopMetrics loopMetrics = LoopMetrics.empty();

    /** Set once a node decides why the turn ends */
    TurnOutcome outcome;

    /**
     * Start-of-turn state with fresh loop metrics. Rounds already spent on a
     * still-pending clarification live on the clarification itself.
     */
    public static ConversationState initial(String userId,
                                            List<Message> messages,
                                            List<CompletedAction> carriedActions,
                                            PendingClarification pendingClarification) {
        return ConversationState.builder()
                .userId(userId)
                .messages(List.copyOf(messages))
                .completedActions(carriedActions == null ? List.of() : List.copyOf(carriedActions))
                .pendingClarification(pendingClarification)
                .loopMetrics(LoopMetrics.empty())
                .next(GraphNode.SUPERVISOR)
                .build();
    }

    public boolean hasUserId() {
        return userId != null && !userId.isBlank();
    }

    /** Last message of the conversation, or null when empty */
    public Message lastMessage() {
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }
}
