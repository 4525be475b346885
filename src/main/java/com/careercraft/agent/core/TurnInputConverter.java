package com.careercraft.agent.core;

import com.careercraft.agent.model.ChatMessage;
import com.careercraft.agent.model.Message;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps caller-supplied {@code {role, content}} entries onto engine messages
 * and makes sure every conversation starts with instructions.
 */
@Component
public class TurnInputConverter {

    static final String DEFAULT_SYSTEM_MESSAGE =
            "You are CareerCraft, an AI assistant that helps with resume writing, cover letters, "
                    + "and job applications. Be helpful, concise, and professional.";

    /**
     * @throws IllegalArgumentException for a role outside system, user, assistant, tool
     *                                  (human and ai are accepted as aliases)
     */
    public List<Message> convert(List<ChatMessage> input) {
        List<Message> messages = new ArrayList<>(input.size() + 1);
        for (ChatMessage entry : input) {
            messages.add(Message.builder()
                    .role(roleOf(entry.getRole()))
                    .content(entry.getContent())
                    .build());
        }
        return withSystemMessage(messages);
    }

    /** Prepends the default system message when the conversation has none */
    public List<Message> withSystemMessage(List<Message> messages) {
        boolean hasSystem = messages.stream().anyMatch(m -> m.getRole() == Message.Role.system);
        if (hasSystem) {
            return messages;
        }
        List<Message> result = new ArrayList<>(messages.size() + 1);
        result.add(Message.system(DEFAULT_SYSTEM_MESSAGE));
        result.addAll(messages);
        return result;
    }

    static Message.Role roleOf(String role) {
        String r = role == null ? "" : role.strip().toLowerCase(Locale.ROOT);
        return switch (r) {
            case "system" -> Message.Role.system;
            case "user", "human" -> Message.Role.user;
            case "assistant", "ai" -> Message.Role.assistant;
            case "tool" -> Message.Role.tool;
            default -> throw new IllegalArgumentException("Unsupported message role: " + role);
        };
    }
}
