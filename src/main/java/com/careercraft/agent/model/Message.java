package com.careercraft.agent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One role-tagged entry of the conversation.
 *
 * Roles map onto the conversation vocabulary as: user = human turn,
 * assistant = ai turn, tool = tool result, system = instructions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public enum Role {
        system, user, assistant, tool
    }

    private Role role;

    /** Single-text content. Null when the message carries several text parts instead. */
    private String content;

    /** Present when a model response normalized to more than one text part. */
    private List<String> contentParts;

    /** Present when role = tool: links back to the assistant's tool call id */
    private String toolCallId;

    /** Present when role = tool: the name of the tool that produced this result */
    private String name;

    /**
     * Present when role = assistant and the model requested tool calls.
     * Echoed back on later model calls so results can be correlated.
     */
    private List<ToolCall> toolCalls;

    @JsonIgnore
    public String text() {
        if (content != null) {
            return content;
        }
        if (contentParts != null && !contentParts.isEmpty()) {
            return String.join("\n", contentParts);
        }
        return "";
    }

    @JsonIgnore
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public static Message user(String content) {
        return Message.builder().role(Role.user).content(content).build();
    }

    public static Message system(String content) {
        return Message.builder().role(Role.system).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(Role.assistant).content(content).build();
    }

    public static Message toolResult(ToolCall call, String content) {
        return Message.builder()
                .role(Role.tool)
                .toolCallId(call.getId())
                .name(call.getToolName())
                .content(content)
                .build();
    }
}
