package com.careercraft.agent.observability;

import com.careercraft.agent.graph.TurnOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One document per turn, written after the turn finishes.
 *
 * Captures:
 * - Input and final message
 * - Node path and outcome
 * - Tool calls attempted, by agent
 * - Latency and token usage
 * - Failure details if the turn errored
 */
@Document(collection = "turn_traces")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnTrace {

    @Id
    private String id;

    @Indexed
    private String conversationId;

    @Indexed
    private String userId;

    private String userInput;

    private String finalMessage;

    /** How the turn ended; ERROR as well when it failed outside the graph */
    private TurnOutcome status;

    @Builder.Default
    private List<String> nodesVisited = new ArrayList<>();

    @Builder.Default
    private List<ToolCallSummary> toolCalls = new ArrayList<>();

    private int totalToolCalls;

    private long totalLatencyMs;

    private int promptTokens;
    private int completionTokens;
    private int totalTokens;

    /** Error message if status = ERROR */
    private String errorMessage;

    @CreatedDate
    @Indexed
    private Instant createdAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolCallSummary {
        private String agentType;
        private String toolName;
        private String resultPreview;
    }
}
