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
import java.util.Optional;

/**
 * Structural gate for tool calls: only calls with a name, an id and the
 * {@code tool_call} discriminator survive. Rejections are logged, never thrown.
 * Argument-shape checks against a tool's schema happen later, in
 * {@link ToolArgumentValidator}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ToolCallValidator {

    private final ObjectMapper objectMapper;

    public List<ToolCall> validate(List<RawToolCall> rawCalls) {
        if (rawCalls == null || rawCalls.isEmpty()) {
            return List.of();
        }
        List<ToolCall> valid = new ArrayList<>(rawCalls.size());
        for (RawToolCall raw : rawCalls) {
            validate(raw).ifPresent(valid::add);
        }
        if (valid.size() < rawCalls.size()) {
            log.warn("Dropped {} of {} tool call(s) during validation", rawCalls.size() - valid.size(), rawCalls.size());
        }
        return valid;
    }

    public Optional<ToolCall> validate(RawToolCall raw) {
        if (raw == null) {
            return Optional.empty();
        }
        if (raw.getName() == null || raw.getName().isBlank()) {
            log.warn("Dropping tool call without a name [id={}]", raw.getId());
            return Optional.empty();
        }
        if (raw.getId() == null || raw.getId().isBlank()) {
            log.warn("Dropping tool call without an id [tool={}]", raw.getName());
            return Optional.empty();
        }
        if (!ToolCall.KIND.equals(raw.getType())) {
            log.warn("Dropping tool call with kind '{}' [tool={}, id={}]", raw.getType(), raw.getName(), raw.getId());
            return Optional.empty();
        }

        return Optional.of(ToolCall.builder()
                .id(raw.getId())
                .toolName(raw.getName())
                .arguments(parseArguments(raw))
                .build());
    }

    private Map<String, Object> parseArguments(RawToolCall raw) {
        Object args = raw.getArgs();
        if (args instanceof String s) {
            if (s.isBlank()) {
                return new LinkedHashMap<>();
            }
            try {
                Map<String, Object> parsed = objectMapper.readValue(s, new TypeReference<>() {});
                return parsed != null ? parsed : new LinkedHashMap<>();
            } catch (JsonProcessingException e) {
                log.warn("Unparseable arguments for [{}], using none: {}", raw.getName(), e.getOriginalMessage());
                return new LinkedHashMap<>();
            }
        }
        if (args instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        if (args != null) {
            log.warn("Arguments for [{}] were a {}, using none", raw.getName(), args.getClass().getSimpleName());
        }
        return new LinkedHashMap<>();
    }
}
