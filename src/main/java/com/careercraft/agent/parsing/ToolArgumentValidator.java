package com.careercraft.agent.parsing;

import com.careercraft.agent.exception.ToolArgumentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks an argument bag against a tool's JSON input schema and repairs what it
 * safely can before the tool sees it.
 *
 * Repairs: strings are trimmed, scalars given for a string field are stringified,
 * numeric strings become numbers, "true"/"false" become booleans, a single value
 * given for an array field is wrapped, enum values match case-insensitively.
 * Keys the schema does not declare are dropped. Anything else is collected as an
 * issue and reported in one {@link ToolArgumentException}.
 */
@Component
@Slf4j
public class ToolArgumentValidator {

    @SuppressWarnings("unchecked")
    public Map<String, Object> validate(String toolName, Map<String, Object> schema, Map<String, Object> args) {
        Map<String, Object> input = args == null ? Map.of() : args;
        Map<String, Object> properties = schema.get("properties") instanceof Map<?, ?> p
                ? (Map<String, Object>) p : Map.of();
        List<String> required = schema.get("required") instanceof List<?> r
                ? r.stream().map(String::valueOf).toList() : List.of();

        List<String> issues = new ArrayList<>();
        Map<String, Object> repaired = new LinkedHashMap<>();

        for (Map.Entry<String, Object> property : properties.entrySet()) {
            String key = property.getKey();
            Map<String, Object> spec = property.getValue() instanceof Map<?, ?> m
                    ? (Map<String, Object>) m : Map.of();
            Object value = input.get(key);

            if (value == null) {
                if (required.contains(key)) {
                    issues.add(key + " is required");
                }
                continue;
            }

            Object coerced = coerce(key, value, spec, issues);
            if (coerced == null) {
                continue;
            }
            if (required.contains(key) && coerced instanceof String s && s.isEmpty()) {
                issues.add(key + " must not be empty");
                continue;
            }
            repaired.put(key, coerced);
        }

        if (!properties.isEmpty()) {
            input.keySet().stream()
                    .filter(k -> !properties.containsKey(k))
                    .forEach(k -> log.debug("Dropping undeclared argument [{}] for tool [{}]", k, toolName));
        } else {
            // No declared properties: nothing to check against
            repaired.putAll(input);
        }

        if (!issues.isEmpty()) {
            log.warn("Tool arguments rejected [tool={}, issues={}]", toolName, issues);
            throw new ToolArgumentException(toolName, issues);
        }
        return repaired;
    }

    @SuppressWarnings("unchecked")
    private Object coerce(String key, Object value, Map<String, Object> spec, List<String> issues) {
        String type = spec.get("type") instanceof String t ? t : null;

        Object result = switch (type == null ? "" : type) {
            case "string" -> toStringValue(key, value, issues);
            case "integer", "number" -> toNumber(key, value, "integer".equals(type), issues);
            case "boolean" -> toBoolean(key, value, issues);
            case "array" -> toArray(key, value, spec.get("items") instanceof Map<?, ?> items
                    ? (Map<String, Object>) items : Map.of(), issues);
            default -> value instanceof String s ? s.trim() : value;
        };

        if (result != null && spec.get("enum") instanceof List<?> allowed) {
            return matchEnum(key, result, allowed, issues);
        }
        return result;
    }

    private Object toStringValue(String key, Object value, List<String> issues) {
        if (value instanceof String s) {
            return s.trim();
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        issues.add(key + " must be a string");
        return null;
    }

    private Object toNumber(String key, Object value, boolean integer, List<String> issues) {
        if (value instanceof Number n) {
            if (!integer) {
                return n;
            }
            double d = n.doubleValue();
            if (d != Math.rint(d)) {
                issues.add(key + " must be a whole number");
                return null;
            }
            return n.longValue();
        }
        if (value instanceof String s) {
            try {
                return integer ? (Object) Long.parseLong(s.trim()) : Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                issues.add(key + " must be a " + (integer ? "whole number" : "number"));
                return null;
            }
        }
        issues.add(key + " must be a number");
        return null;
    }

    private Object toBoolean(String key, Object value, List<String> issues) {
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof String s) {
            String normalized = s.trim().toLowerCase();
            if (normalized.equals("true") || normalized.equals("false")) {
                return Boolean.parseBoolean(normalized);
            }
        }
        issues.add(key + " must be true or false");
        return null;
    }

    private Object toArray(String key, Object value, Map<String, Object> itemSpec, List<String> issues) {
        Collection<?> elements = value instanceof Collection<?> c ? c : List.of(value);
        boolean stringItems = "string".equals(itemSpec.get("type"));

        List<Object> out = new ArrayList<>(elements.size());
        for (Object element : elements) {
            if (element == null) {
                continue;
            }
            if (stringItems) {
                Object s = toStringValue(key + "[]", element, issues);
                if (s != null) {
                    out.add(s);
                }
            } else {
                out.add(element);
            }
        }
        return out;
    }

    private Object matchEnum(String key, Object value, List<?> allowed, List<String> issues) {
        for (Object candidate : allowed) {
            if (candidate.equals(value)) {
                return candidate;
            }
            if (candidate instanceof String c && value instanceof String v && c.equalsIgnoreCase(v)) {
                return candidate;
            }
        }
        issues.add(key + " must be one of " + allowed);
        return null;
    }
}
