package com.careercraft.agent.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Caller-facing message shape: {@code {role, content}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    @NotBlank(message = "role must not be blank")
    private String role;

    @NotNull(message = "content must not be null")
    private String content;

    public static ChatMessage from(Message message) {
        return new ChatMessage(message.getRole().name(), message.text());
    }
}
