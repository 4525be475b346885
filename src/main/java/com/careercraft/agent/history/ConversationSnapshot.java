package com.careercraft.agent.history;

import com.careercraft.agent.control.CompletedAction;
import com.careercraft.agent.graph.PendingClarification;
import com.careercraft.agent.model.Message;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * What survives between turns of one conversation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSnapshot {

    private String userId;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private List<CompletedAction> completedActions = new ArrayList<>();

    private PendingClarification pendingClarification;

    private Instant updatedAt;

    public static ConversationSnapshot empty() {
        return ConversationSnapshot.builder().build();
    }
}
