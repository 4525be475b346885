package com.careercraft.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A tool call that survived validation: non-blank name and id, the
 * {@value #KIND} discriminator, and arguments parsed into a map.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    public static final String KIND = "tool_call";

    /** Provider-assigned or synthetic id, echoed back in the tool result message */
    private String id;

    private String toolName;

    private Map<String, Object> arguments;
}
