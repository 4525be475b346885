package com.careercraft.agent.parsing;

import com.careercraft.agent.model.RawToolCall;
import com.careercraft.agent.model.ToolCall;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers tool calls that a provider serialized into the text content instead
 * of the structured {@code tool_calls} field.
 *
 * Recognized shapes:
 * <pre>
 *   {"functionCall":{"name":"x","args":{...}}}
 *   {"name":"x","args":{...},"type":"tool_call"}
 *   "tool_call":{"name":"x","args":{...}}
 *   &lt;function=x{...}&gt;  /  &lt;function=x({...})&lt;/function&gt;
 * </pre>
 *
 * Stateless and never throws. Argument fragments that do not parse degrade to a
 * naive key:value split, then to an empty map.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ContentToolCallExtractor {

    private static final List<Pattern> JSON_SHAPES = List.of(
            Pattern.compile("\\{\"functionCall\":\\{\"name\":\"([^\"]+)\",\"args\":\\{([^}]*)\\}\\}\\}"),
            Pattern.compile("\\{\"name\":\"([^\"]+)\",\"args\":\\{([^}]*)\\},\"type\":\"tool_call\"\\}"),
            Pattern.compile("\"tool_call\":\\{\"name\":\"([^\"]+)\",\"args\":\\{([^}]*)\\}\\}")
    );

    // Both variants one OpenAI-compatible provider emits: with and without parens around the JSON
    private static final Pattern FUNCTION_TAG_SHAPE =
            Pattern.compile("<function=(\\w+)\\(?(\\{.+?\\})\\)?(?:</function>|>)", Pattern.DOTALL);

    private final ObjectMapper objectMapper;
    private final ContentNormalizer normalizer;

    /**
     * @return recovered calls in order of appearance; empty when nothing matched
     */
    public List<RawToolCall> extract(Object content) {
        String text = normalizer.toText(content);
        if (!mayContainCall(text)) {
            return List.of();
        }

        try {
            List<RawToolCall> calls = new ArrayList<>();
            for (Pattern shape : JSON_SHAPES) {
                Matcher m = shape.matcher(text);
                while (m.find()) {
                    calls.add(recovered(m.group(1), parseArguments("{" + m.group(2) + "}", m.group(2))));
                }
            }

            Matcher tag = FUNCTION_TAG_SHAPE.matcher(text);
            while (tag.find()) {
                String body = tag.group(2);
                calls.add(recovered(tag.group(1), parseArguments(body, body.substring(1, body.length() - 1))));
            }

            if (!calls.isEmpty()) {
                log.info("Recovered {} tool call(s) from text content: {}",
                        calls.size(), calls.stream().map(RawToolCall::getName).toList());
            }
            return calls;
        } catch (RuntimeException e) {
            log.warn("Tool-call extraction failed, treating content as text: {}", e.getMessage());
            return List.of();
        }
    }

    private boolean mayContainCall(String text) {
        return text.contains("functionCall") || text.contains("tool_call") || text.contains("<function=");
    }

    private RawToolCall recovered(String name, Map<String, Object> args) {
        return RawToolCall.builder()
                .name(name)
                .args(args)
                .id("extracted_" + name + "_" + UUID.randomUUID().toString().substring(0, 8))
                .type(ToolCall.KIND)
                .build();
    }

    private Map<String, Object> parseArguments(String json, String fragment) {
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, new TypeReference<>() {});
            return parsed != null ? parsed : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            log.debug("Argument fragment is not JSON, splitting naively: {}", fragment);
            return splitPairs(fragment);
        }
    }

    /** "a":"b","c":"d" → {a=b, c=d}; quotes stripped, pairs without a key dropped */
    private Map<String, Object> splitPairs(String fragment) {
        Map<String, Object> args = new LinkedHashMap<>();
        for (String pair : fragment.split(",")) {
            int colon = pair.indexOf(':');
            if (colon > 0) {
                String key = pair.substring(0, colon).trim().replace("\"", "");
                String value = pair.substring(colon + 1).trim().replace("\"", "");
                if (!key.isEmpty()) {
                    args.put(key, value);
                }
            }
        }
        return args;
    }
}
