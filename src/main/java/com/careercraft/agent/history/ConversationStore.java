package com.careercraft.agent.history;

import com.careercraft.agent.config.AgentProperties;
import com.careercraft.agent.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Redis-backed conversation state between turns.
 *
 * - Key pattern: careercraft:conversation:{conversationId}
 * - Stored as one JSON document (atomic read/write per conversation)
 * - TTL reset on every write, so idle conversations expire
 * - Sliding window: only the last N messages are kept
 *
 * A snapshot that fails to deserialize is treated as absent: the user loses
 * history, not the turn.
 */
@Component
@Slf4j
public class ConversationStore {

    private static final String KEY_PREFIX = "careercraft:conversation:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration ttl;
    private final int maxMessages;

    public ConversationStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Clock clock,
                             AgentProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.ttl = properties.getHistory().getTtl();
        this.maxMessages = properties.getHistory().getMaxMessages();
    }

    public ConversationSnapshot load(String conversationId) {
        String json = redisTemplate.opsForValue().get(buildKey(conversationId));
        if (json == null) {
            log.debug("No stored conversation [conversationId={}]", conversationId);
            return ConversationSnapshot.empty();
        }

        try {
            ConversationSnapshot snapshot = objectMapper.readValue(json, ConversationSnapshot.class);
            log.debug("Loaded conversation [conversationId={}, messages={}, completedActions={}]",
                    conversationId, snapshot.getMessages().size(), snapshot.getCompletedActions().size());
            return snapshot;
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize conversation [conversationId={}], starting fresh", conversationId, e);
            return ConversationSnapshot.empty();
        }
    }

    public void save(String conversationId, ConversationSnapshot snapshot) {
        ConversationSnapshot windowed = ConversationSnapshot.builder()
                .userId(snapshot.getUserId())
                .messages(applyWindow(snapshot.getMessages()))
                .completedActions(snapshot.getCompletedActions())
                .pendingClarification(snapshot.getPendingClarification())
                .updatedAt(clock.instant())
                .build();

        try {
            redisTemplate.opsForValue().set(buildKey(conversationId), objectMapper.writeValueAsString(windowed), ttl);
            log.debug("Saved conversation [conversationId={}, messages={}, ttl={}m]",
                    conversationId, windowed.getMessages().size(), ttl.toMinutes());
        } catch (JsonProcessingException e) {
            // A lost snapshot costs history, not the reply already computed
            log.error("Failed to serialize conversation [conversationId={}]", conversationId, e);
        }
    }

    public void clear(String conversationId) {
        redisTemplate.delete(buildKey(conversationId));
        log.info("Cleared conversation [conversationId={}]", conversationId);
    }

    /**
     * Keeps the leading system message and the last (maxMessages - 1) others.
     * A window never starts with tool results whose requesting assistant
     * message was cut off.
     */
    List<Message> applyWindow(List<Message> messages) {
        if (messages.size() <= maxMessages) {
            return messages;
        }

        List<Message> result = new ArrayList<>();
        List<Message> rest = messages;
        int budget = maxMessages;

        if (messages.get(0).getRole() == Message.Role.system) {
            result.add(messages.get(0));
            rest = messages.subList(1, messages.size());
            budget--;
        }

        int from = Math.max(0, rest.size() - budget);
        while (from < rest.size() && rest.get(from).getRole() == Message.Role.tool) {
            from++;
        }
        result.addAll(rest.subList(from, rest.size()));

        log.debug("Applied sliding window: {} -> {} messages", messages.size(), result.size());
        return result;
    }

    private String buildKey(String conversationId) {
        return KEY_PREFIX + conversationId;
    }
}
