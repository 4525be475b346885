package com.careercraft.agent.history;

import com.careercraft.agent.config.AgentProperties;
import com.careercraft.agent.control.CompletedAction;
import com.careercraft.agent.graph.PendingClarification;
import com.careercraft.agent.model.Message;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConversationStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String KEY = "careercraft:conversation:conv-1";

    @Mock StringRedisTemplate redisTemplate;
    @Mock ValueOperations<String, String> valueOps;

    private ObjectMapper objectMapper;
    private ConversationStore store;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        AgentProperties properties = new AgentProperties();
        properties.getHistory().setMaxMessages(5);
        store = new ConversationStore(redisTemplate, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC), properties);
    }

    @Test
    void load_missingKey_returnsEmptySnapshot() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get(KEY)).thenReturn(null);

        ConversationSnapshot snapshot = store.load("conv-1");

        assertThat(snapshot.getMessages()).isEmpty();
        assertThat(snapshot.getCompletedActions()).isEmpty();
        assertThat(snapshot.getPendingClarification()).isNull();
    }

    @Test
    void load_corruptJson_startsFresh() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get(KEY)).thenReturn("{not json");

        assertThat(store.load("conv-1").getMessages()).isEmpty();
    }

    @Test
    void saveThenLoad_keepsActionsAndClarification() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        ConversationSnapshot snapshot = ConversationSnapshot.builder()
                .userId("u1")
                .messages(new ArrayList<>(List.of(Message.system("sys"), Message.user("hi"))))
                .completedActions(List.of(CompletedAction.builder()
                        .id("a1").agentType("data_manager").toolName("store_work_history")
                        .args(Map.of("companyName", "Acme")).result("Stored").timestamp(NOW).build()))
                .pendingClarification(PendingClarification.builder()
                        .id("p1").question("Which job?").options(List.of("Acme")).round(1).timestamp(NOW).build())
                .build();

        store.save("conv-1", snapshot);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq(KEY), json.capture(), eq(Duration.ofMinutes(60)));
        when(valueOps.get(KEY)).thenReturn(json.getValue());

        ConversationSnapshot loaded = store.load("conv-1");
        assertThat(loaded.getUserId()).isEqualTo("u1");
        assertThat(loaded.getUpdatedAt()).isEqualTo(NOW);
        assertThat(loaded.getMessages()).extracting(Message::text).containsExactly("sys", "hi");
        assertThat(loaded.getCompletedActions()).extracting(CompletedAction::getToolName)
                .containsExactly("store_work_history");
        assertThat(loaded.getPendingClarification().getQuestion()).isEqualTo("Which job?");
    }

    @Test
    void clear_deletesKey() {
        store.clear("conv-1");
        verify(redisTemplate).delete(KEY);
    }

    @Test
    void applyWindow_keepsSystemMessageAndNewestTail() {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system("sys"));
        IntStream.range(0, 8).forEach(i -> messages.add(Message.user("m" + i)));

        List<Message> windowed = store.applyWindow(messages);

        assertThat(windowed).extracting(Message::text).containsExactly("sys", "m4", "m5", "m6", "m7");
    }

    @Test
    void applyWindow_neverStartsWithOrphanedToolResult() {
        List<Message> messages = List.of(
                Message.system("sys"),
                Message.user("u0"),
                Message.assistant("a0"),
                Message.builder().role(Message.Role.tool).toolCallId("c1").content("t1").build(),
                Message.builder().role(Message.Role.tool).toolCallId("c2").content("t2").build(),
                Message.assistant("a1"),
                Message.user("u1"));

        List<Message> windowed = store.applyWindow(messages);

        assertThat(windowed).extracting(Message::text).containsExactly("sys", "a1", "u1");
    }

    @Test
    void applyWindow_shortHistory_isUntouched() {
        List<Message> messages = List.of(Message.system("sys"), Message.user("hi"));
        assertThat(store.applyWindow(messages)).isSameAs(messages);
    }
}
