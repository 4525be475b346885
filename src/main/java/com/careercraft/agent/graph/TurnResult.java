package com.careercraft.agent.graph;

import com.careercraft.agent.model.Message;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What the router hands back once the terminal sentinel is reached.
 */
@Value
@Builder
public class TurnResult {

    ConversationState finalState;

    /** Wire names of the nodes in execution order */
    List<String> nodesVisited;

    TurnOutcome outcome;

    int promptTokens;
    int completionTokens;

    /** Text of the last assistant message, or empty when the turn produced none */
    public String finalMessage() {
        List<Message> messages = finalState.getMessages();
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message m = messages.get(i);
            if (m.getRole() == Message.Role.assistant && !m.text().isBlank()) {
                return m.text();
            }
        }
        return "";
    }
}
