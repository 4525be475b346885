package com.careercraft.agent.parsing;

import com.careercraft.agent.model.Message;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Renderable model output: a single text, or several text parts kept in order.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NormalizedContent {

    private static final NormalizedContent EMPTY = new NormalizedContent("", List.of());

    String text;
    List<String> parts;

    public static NormalizedContent empty() {
        return EMPTY;
    }

    public static NormalizedContent of(String text) {
        return text == null || text.isEmpty() ? EMPTY : new NormalizedContent(text, List.of());
    }

    /** Zero parts is empty, one part is that text verbatim, more stay a sequence */
    public static NormalizedContent ofParts(List<String> parts) {
        if (parts.isEmpty()) {
            return EMPTY;
        }
        if (parts.size() == 1) {
            return of(parts.get(0));
        }
        return new NormalizedContent(null, List.copyOf(parts));
    }

    public boolean isMultipart() {
        return !parts.isEmpty();
    }

    public boolean isBlank() {
        return asText().isBlank();
    }

    public String asText() {
        return isMultipart() ? String.join("\n", parts) : text;
    }

    public Message toAssistantMessage() {
        return isMultipart()
                ? Message.builder().role(Message.Role.assistant).contentParts(parts).build()
                : Message.assistant(text);
    }
}
