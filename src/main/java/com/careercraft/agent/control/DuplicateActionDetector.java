package com.careercraft.agent.control;

import com.careercraft.agent.config.AgentProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Decides whether a requested tool call repeats one that already ran.
 *
 * Content-bearing tools (configured under {@code agent.duplicates.content-tools})
 * are compared by a SHA-256 of their content argument, and only count as a repeat
 * inside the recency window. Every other tool is compared by deep argument
 * equality, regardless of age.
 */
@Component
@Slf4j
public class DuplicateActionDetector {

    /** Numbers compare by value so 5, 5.0 and 5L are the same argument */
    private static final Comparator<JsonNode> NUMERIC_AWARE = (a, b) -> {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        return a.equals(b) ? 0 : 1;
    };

    private final AgentProperties.Duplicates config;
    private final AgentProperties.Results results;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DuplicateActionDetector(AgentProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.config = properties.getDuplicates();
        this.results = properties.getResults();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public DuplicateCheck check(String agentType, String toolName, Map<String, Object> args,
                                List<CompletedAction> completedActions) {
        String contentHash = contentHashFor(toolName, args);
        Instant now = clock.instant();

        // Most recent first, so the age reported is that of the latest repeat
        for (int i = completedActions.size() - 1; i >= 0; i--) {
            CompletedAction previous = completedActions.get(i);
            if (!agentType.equals(previous.getAgentType()) || !toolName.equals(previous.getToolName())) {
                continue;
            }

            Duration age = Duration.between(previous.getTimestamp(), now);

            if (contentHash != null) {
                if (contentHash.equals(previous.getContentHash()) && isRecent(age)) {
                    log.info("Duplicate content detected [agent={}, tool={}, age={}s]",
                            agentType, toolName, age.toSeconds());
                    return DuplicateCheck.duplicateOf(previous, String.format(
                            "This exact %s content was already processed recently (%ds ago)",
                            toolName.replace('_', ' '), age.toSeconds()));
                }
                continue;
            }

            if (sameArguments(args, previous.getArgs())) {
                log.info("Duplicate call detected [agent={}, tool={}, age={}s]",
                        agentType, toolName, age.toSeconds());
                String reason = isRecent(age)
                        ? String.format("This %s was already executed recently (%ds ago)", toolName, age.toSeconds())
                        : String.format("This %s was already executed earlier in this conversation", toolName);
                return DuplicateCheck.duplicateOf(previous, reason);
            }
        }

        return DuplicateCheck.notDuplicate();
    }

    /** Record of a call that just executed, with its result cut to the stored prefix */
    public CompletedAction record(String agentType, String toolName, Map<String, Object> args, String result) {
        return CompletedAction.builder()
                .id(UUID.randomUUID().toString())
                .agentType(agentType)
                .toolName(toolName)
                .args(args == null ? Map.of() : args)
                .result(truncate(result, results.getStoredPrefixLength()))
                .timestamp(clock.instant())
                .contentHash(contentHashFor(toolName, args))
                .build();
    }

    /** Substitute tool output for a skipped call */
    public String skipMessage(String toolName, DuplicateCheck check) {
        String previousResult = check.getPrevious() != null ? check.getPrevious().getResult() : null;
        return "• Skipped " + toolName + ": " + check.getReason()
                + "\n  Previous result: " + preview(previousResult);
    }

    /**
     * Completed actions worth carrying into the next turn: content-tool actions
     * still inside the recency window, or none at all when scoped to a single turn.
     * Lookups and other argument-matched actions stay within the turn that ran them.
     */
    public List<CompletedAction> carryOver(List<CompletedAction> persisted) {
        if (persisted == null || config.getScope() == AgentProperties.Duplicates.Scope.TURN) {
            return List.of();
        }
        Instant now = clock.instant();
        return persisted.stream()
                .filter(a -> a.getContentHash() != null)
                .filter(a -> a.getTimestamp() != null && isRecent(Duration.between(a.getTimestamp(), now)))
                .toList();
    }

    public boolean isContentTool(String toolName) {
        return config.getContentTools().contains(toolName);
    }

    /** Hash of the content argument for content tools; null otherwise or when the argument is missing */
    String contentHashFor(String toolName, Map<String, Object> args) {
        if (!isContentTool(toolName) || args == null) {
            return null;
        }
        Object content = args.get(config.getContentArgument());
        return content == null ? null : ContentHasher.sha256(content.toString());
    }

    private boolean isRecent(Duration age) {
        return age.compareTo(config.getRecencyWindow()) < 0;
    }

    private boolean sameArguments(Map<String, Object> current, Map<String, Object> previous) {
        Map<String, Object> a = current == null ? Map.of() : current;
        Map<String, Object> b = previous == null ? Map.of() : previous;
        try {
            JsonNode left = objectMapper.valueToTree(a);
            JsonNode right = objectMapper.valueToTree(b);
            return left.equals(NUMERIC_AWARE, right);
        } catch (IllegalArgumentException e) {
            log.debug("Falling back to Map.equals for argument comparison: {}", e.getMessage());
            return Objects.equals(a, b);
        }
    }

    private String preview(String result) {
        if (result == null) {
            return "";
        }
        int max = results.getPreviewLength();
        return result.length() <= max ? result : result.substring(0, max) + "...";
    }

    private static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }
}
