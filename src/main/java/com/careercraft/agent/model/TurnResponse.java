package com.careercraft.agent.model;

import com.careercraft.agent.graph.TurnOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnResponse {

    private String conversationId;

    /** Text of the last assistant message of the turn */
    private String finalMessage;

    @Builder.Default
    private List<ChatMessage> messages = new ArrayList<>();

    @Builder.Default
    private List<String> nodesVisited = new ArrayList<>();

    private int toolCallsExecuted;

    private TurnOutcome terminatedBy;
}
