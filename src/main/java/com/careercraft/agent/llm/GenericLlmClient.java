package com.careercraft.agent.llm;

import com.careercraft.agent.exception.AgentException;
import com.careercraft.agent.model.LlmResponse;
import com.careercraft.agent.model.Message;
import com.careercraft.agent.model.RawToolCall;
import com.careercraft.agent.model.ToolCall;
import com.careercraft.agent.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * OpenAI-compatible LLM client. Works with Groq, OpenAI, and Gemini.
 *
 * The client does not judge what the model said: content is handed over as
 * received (string or list of parts) and every structured tool call is passed on
 * as a {@link RawToolCall} with its arguments still a JSON string. Validation and
 * recovery happen in the engine.
 *
 * Error handling strategy:
 *
 * | Error                    | Action                                              |
 * |--------------------------|-----------------------------------------------------|
 * | 401 invalid_api_key      | AgentException (not retried, not CB failure)        |
 * | 400 model_decommissioned | AgentException with loud guidance message           |
 * | 400 tool_use_failed      | failed_generation returned as content, recovered    |
 * |                          | later by the content tool-call extractor            |
 * | 400 other                | AgentException (not retried, not CB failure)        |
 * | 429 / 5xx                | RuntimeException (retried, counts as failure)       |
 * | network error            | ResourceAccessException (retried)                   |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props,
                            ObjectMapper objectMapper,
                            String providerName,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools, double temperature) {
        Map<String, Object> requestBody = buildRequestBody(messages, tools, temperature);

        log.debug("Sending {} messages to {} [model={}, tools={}, temperature={}]",
                messages.size(), providerName, props.getModel(), tools.size(), temperature);

        try {
            Map<String, Object> response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                        handle4xxError(body, res.getStatusCode().value());
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                        // 5xx is retryable: RuntimeException, not AgentException
                        throw new RuntimeException(
                                providerName + " server error [" + res.getStatusCode() + "]: " + body);
                    })
                    .body(new ParameterizedTypeReference<>() {});

            return parseResponse(response);

        } catch (ToolUseFailedException e) {
            return recoverFromToolUseFailure(e.getErrorBody());
        }
    }

    /**
     * Central 4xx error handler. Maps error codes to exception types so the
     * circuit breaker and retry behave correctly for each case.
     */
    private void handle4xxError(String body, int statusCode) {
        if (body.contains("model_decommissioned")) {
            log.error("================================================================");
            log.error("  MODEL DECOMMISSIONED: {} is no longer supported.", props.getModel());
            log.error("  Update the model in application.yml or set the provider's *_MODEL env var");
            log.error("================================================================");
            throw new AgentException("Model '" + props.getModel() + "' is decommissioned. "
                    + "Configure a supported model for provider " + providerName + ".");
        }

        // The provider rejected its own malformed tool call; the raw generation is in the body
        if (body.contains("tool_use_failed")) {
            throw new ToolUseFailedException(body);
        }

        if (statusCode == 401) {
            throw new AgentException(providerName + " API key is invalid. Check your "
                    + providerName.toUpperCase() + "_API_KEY environment variable.");
        }

        if (statusCode == 429) {
            throw new RuntimeException(providerName + " rate limit exceeded. Will retry.");
        }

        throw new AgentException(providerName + " client error [" + statusCode + "]: " + body);
    }

    /**
     * A tool_use_failed error carries the model's broken generation in
     * "failed_generation" (typically {@code <function=name{...}>}). It is returned
     * as plain content so the engine's extractor can recover the call.
     */
    @SuppressWarnings("unchecked")
    private LlmResponse recoverFromToolUseFailure(String errorBody) {
        try {
            Map<String, Object> errorMap = objectMapper.readValue(errorBody, new TypeReference<>() {});
            Map<String, Object> error = (Map<String, Object>) errorMap.get("error");
            String failedGeneration = error != null ? (String) error.get("failed_generation") : null;

            if (failedGeneration == null || failedGeneration.isBlank()) {
                log.warn("{} tool_use_failed with no failed_generation, returning empty content", providerName);
                return LlmResponse.builder().content("").build();
            }

            log.info("Passing {} failed_generation through for content recovery [length={}]",
                    providerName, failedGeneration.length());
            return LlmResponse.builder().content(failedGeneration).build();

        } catch (JsonProcessingException | ClassCastException e) {
            log.error("Unreadable tool_use_failed body from {}: {}", providerName, e.getMessage());
            return LlmResponse.builder().content("").build();
        }
    }

    private Map<String, Object> buildRequestBody(List<Message> messages, List<ToolDefinition> tools,
                                                 double temperature) {
        // Only tool calls that have a matching tool result may be echoed back
        Set<String> answeredCallIds = messages.stream()
                .filter(m -> m.getRole() == Message.Role.tool)
                .map(Message::getToolCallId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        List<Map<String, Object>> formattedMessages = messages.stream()
                .map(m -> formatMessage(m, answeredCallIds))
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", temperature);
        body.put("messages", formattedMessages);

        if (!tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDefinition::toOpenAiSchema).toList());
            body.put("tool_choice", "auto");
        }

        return body;
    }

    private Map<String, Object> formatMessage(Message msg, Set<String> answeredCallIds) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());

        if (msg.getRole() == Message.Role.tool && msg.getToolCallId() == null) {
            // Tool output supplied by the caller has no call to answer
            m.put("role", Message.Role.user.name());
            m.put("content", "Tool result: " + msg.text());
        } else if (msg.getRole() == Message.Role.tool) {
            m.put("tool_call_id", msg.getToolCallId());
            m.put("content", msg.text());
        } else if (msg.getRole() == Message.Role.assistant) {
            List<ToolCall> echoed = msg.hasToolCalls()
                    ? msg.getToolCalls().stream().filter(tc -> answeredCallIds.contains(tc.getId())).toList()
                    : List.of();

            if (!echoed.isEmpty()) {
                // null content is valid alongside tool_calls
                m.put("content", msg.text().isEmpty() ? null : msg.text());
                m.put("tool_calls", echoed.stream().map(this::formatToolCall).toList());
            } else {
                m.put("content", formatContent(msg));
            }
        } else {
            m.put("content", formatContent(msg));
        }
        return m;
    }

    private Object formatContent(Message msg) {
        if (msg.getContent() == null && msg.getContentParts() != null && !msg.getContentParts().isEmpty()) {
            return msg.getContentParts().stream()
                    .map(text -> Map.of("type", "text", "text", text))
                    .toList();
        }
        return msg.text();
    }

    private Map<String, Object> formatToolCall(ToolCall tc) {
        Map<String, Object> fn = new HashMap<>();
        fn.put("name", tc.getToolName());
        try {
            fn.put("arguments", objectMapper.writeValueAsString(
                    tc.getArguments() != null ? tc.getArguments() : Map.of()));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize arguments of tool call {}: {}", tc.getId(), e.getMessage());
            fn.put("arguments", "{}");
        }

        Map<String, Object> tcMap = new HashMap<>();
        tcMap.put("id", tc.getId());
        tcMap.put("type", "function");
        tcMap.put("function", fn);
        return tcMap;
    }

    @SuppressWarnings("unchecked")
    LlmResponse parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new AgentException(providerName + " returned no choices in response");
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> choice = choices.get(0);
        Map<String, Object> message = choice.get("message") instanceof Map<?, ?> msg
                ? (Map<String, Object>) msg : Map.of();

        log.debug("{} finish_reason: {}", providerName, choice.get("finish_reason"));

        List<RawToolCall> toolCalls = new ArrayList<>();
        if (message.get("tool_calls") instanceof List<?> calls) {
            for (Object entry : calls) {
                if (entry instanceof Map<?, ?> call) {
                    toolCalls.add(toRawToolCall((Map<String, Object>) call));
                }
            }
        }

        return LlmResponse.builder()
                .content(message.get("content"))
                .toolCalls(toolCalls)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }

    private static RawToolCall toRawToolCall(Map<String, Object> call) {
        Map<?, ?> function = call.get("function") instanceof Map<?, ?> f ? f : Map.of();
        return RawToolCall.builder()
                .id(call.get("id") instanceof String id ? id : null)
                .name(function.get("name") instanceof String name ? name : null)
                .args(function.get("arguments"))
                .type(ToolCall.KIND)
                .build();
    }

    private static class ToolUseFailedException extends RuntimeException {
        private final String errorBody;

        ToolUseFailedException(String errorBody) {
            super("tool_use_failed");
            this.errorBody = errorBody;
        }

        String getErrorBody() {
            return errorBody;
        }
    }
}
