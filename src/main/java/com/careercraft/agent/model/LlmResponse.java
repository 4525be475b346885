package com.careercraft.agent.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class LlmResponse {

    /**
     * Either a plain string, a list of typed parts ({@code {"type":"text","text":...}}),
     * or some other object. Normalized before it becomes a message.
     */
    private Object content;

    /** Structured tool calls, possibly malformed */
    @Builder.Default
    private List<RawToolCall> toolCalls = new ArrayList<>();

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
