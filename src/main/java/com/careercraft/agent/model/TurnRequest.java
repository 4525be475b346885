package com.careercraft.agent.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnRequest {

    /**
     * Optional. If provided, persisted history for this conversation is
     * rehydrated. If null, a new conversation is started.
     */
    private String conversationId;

    /** Threaded read-only to every tool. Roles that need it refuse to run without it. */
    private String userId;

    /** The new user message, appended to the rehydrated history. */
    private String input;

    /**
     * Full history supplied by the caller. When present it replaces the
     * persisted history and {@link #input} is ignored.
     */
    @Valid
    private List<ChatMessage> messages;

    @AssertTrue(message = "either input or messages must be provided")
    public boolean isInputPresent() {
        return (input != null && !input.isBlank()) || (messages != null && !messages.isEmpty());
    }
}
