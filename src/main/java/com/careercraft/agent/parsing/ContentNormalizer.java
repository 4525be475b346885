package com.careercraft.agent.parsing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns whatever the model put in {@code content} into something a message can carry.
 *
 * <ul>
 *   <li>a string that is really a serialized parts array is reparsed, keeping text parts</li>
 *   <li>a parts list keeps only {@code {"type":"text"}} parts</li>
 *   <li>any other object is serialized to JSON</li>
 * </ul>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ContentNormalizer {

    private static final Pattern TEXT_PART_MARKER = Pattern.compile("\"type\"\\s*:\\s*\"text\"");
    private static final String FUNCTION_CALL_MARKER = "\"functionCall\"";

    private final ObjectMapper objectMapper;

    public NormalizedContent normalize(Object content) {
        if (content == null) {
            return NormalizedContent.empty();
        }
        if (content instanceof String s) {
            return normalizeString(s);
        }
        if (content instanceof List<?> list) {
            return NormalizedContent.ofParts(textParts(list));
        }
        return NormalizedContent.of(toJson(content));
    }

    /**
     * Flat string view of raw content, used when scanning for embedded calls and
     * when appending model commentary to summaries. Map content exposes its
     * {@code text}, {@code content} or {@code message} field when one is a string.
     */
    public String toText(Object content) {
        if (content == null) {
            return "";
        }
        if (content instanceof String s) {
            return s;
        }
        if (content instanceof List<?> list) {
            List<String> items = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item instanceof String s) {
                    items.add(s);
                } else if (item instanceof Map<?, ?> part && part.get("text") instanceof String text) {
                    items.add(text);
                } else {
                    items.add(toJson(item));
                }
            }
            return String.join(" ", items);
        }
        if (content instanceof Map<?, ?> map) {
            for (String key : List.of("text", "content", "message")) {
                if (map.get(key) instanceof String s && !s.isEmpty()) {
                    return s;
                }
            }
            return toJson(map);
        }
        return String.valueOf(content);
    }

    private NormalizedContent normalizeString(String raw) {
        String trimmed = raw.trim();
        boolean looksLikeParts = trimmed.startsWith("[") && trimmed.endsWith("]")
                && (TEXT_PART_MARKER.matcher(trimmed).find() || trimmed.contains(FUNCTION_CALL_MARKER));
        if (!looksLikeParts) {
            return NormalizedContent.of(raw);
        }

        try {
            List<Object> parts = objectMapper.readValue(trimmed, new TypeReference<>() {});
            return NormalizedContent.ofParts(textParts(parts));
        } catch (JsonProcessingException e) {
            log.debug("Content looked like a parts array but did not parse: {}", e.getOriginalMessage());
            return trimmed.contains(FUNCTION_CALL_MARKER) ? NormalizedContent.empty() : NormalizedContent.of(raw);
        }
    }

    private List<String> textParts(List<?> parts) {
        List<String> texts = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Map<?, ?> map
                    && "text".equals(map.get("type"))
                    && map.get("text") instanceof String text) {
                texts.add(text);
            }
        }
        return texts;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize content of type {}", value.getClass().getSimpleName());
            return String.valueOf(value);
        }
    }
}
