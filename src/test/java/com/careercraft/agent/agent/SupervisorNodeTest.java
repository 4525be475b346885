package com.careercraft.agent.agent;

import com.careercraft.agent.config.AgentProperties;
import com.careercraft.agent.control.LoopLimitGovernor;
import com.careercraft.agent.control.LoopMetrics;
import com.careercraft.agent.graph.ConversationState;
import com.careercraft.agent.graph.GraphNode;
import com.careercraft.agent.graph.PendingClarification;
import com.careercraft.agent.graph.StatePatch;
import com.careercraft.agent.graph.TurnOutcome;
import com.careercraft.agent.model.LlmResponse;
import com.careercraft.agent.model.Message;
import com.careercraft.agent.model.ToolCall;
import com.careercraft.agent.parsing.ContentNormalizer;
import com.careercraft.agent.parsing.ContentToolCallExtractor;
import com.careercraft.agent.parsing.ToolArgumentValidator;
import com.careercraft.agent.parsing.ToolCallValidator;
import com.careercraft.agent.resilience.OperationTimeouts;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class SupervisorNodeTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private ExecutorService pool;
    private ScriptedLlmClient llm;
    private SupervisorNode supervisor;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        ContentNormalizer normalizer = new ContentNormalizer(objectMapper);
        AgentProperties properties = new AgentProperties();
        pool = Executors.newCachedThreadPool();
        llm = new ScriptedLlmClient();
        supervisor = new SupervisorNode(llm,
                new ToolCallValidator(objectMapper),
                new ContentToolCallExtractor(objectMapper, normalizer),
                normalizer,
                new ToolArgumentValidator(),
                new LoopLimitGovernor(properties),
                new MessagePreparer(),
                new OperationTimeouts(properties, pool),
                Clock.fixed(NOW, ZoneOffset.UTC),
                properties);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void apply_routeCall_sendsToAgentWithAcknowledgment() {
        llm.route("data_manager");

        StatePatch patch = supervisor.apply(state());

        assertThat(patch.getNext()).isEqualTo(GraphNode.DATA_MANAGER);
        assertThat(patch.getOutcome()).isNull();
        Message ack = patch.getMessages().get(0);
        assertThat(ack.text()).isEqualTo(SupervisorNode.ACKNOWLEDGMENT);
        assertThat(ack.getToolCalls()).extracting(ToolCall::getToolName).containsExactly("route_to_agent");
        assertThat(patch.getPromptTokens()).isEqualTo(7);
        assertThat(patch.isClearClarification()).isFalse();
    }

    @Test
    void apply_sendsOwnInstructionsAndBothToolsAtZeroTemperature() {
        llm.text("Hi!");

        supervisor.apply(state());

        ScriptedLlmClient.Request request = llm.requests.get(0);
        assertThat(request.temperature()).isZero();
        assertThat(request.toolNames()).containsExactly("route_to_agent", "request_clarification");
        assertThat(request.messages().get(0).text()).isEqualTo(AgentPrompts.SUPERVISOR);
        assertThat(request.messages()).filteredOn(m -> m.getRole() == Message.Role.system).hasSize(1);
    }

    @Test
    void apply_routeToEndAfterAgentWork_echoesLastToolResult() {
        llm.route("__end__");
        ConversationState state = state(Message.builder()
                .role(Message.Role.tool).toolCallId("c1").content("I've processed your request:\n\n• Stored").build());

        StatePatch patch = supervisor.apply(state);

        assertThat(patch.getNext()).isEqualTo(GraphNode.END);
        assertThat(patch.getOutcome()).isEqualTo(TurnOutcome.COMPLETED);
        assertThat(patch.getMessages().get(0).text()).isEqualTo("I've processed your request:\n\n• Stored");
    }

    @Test
    void apply_routeToEndWithoutContext_usesAcknowledgment() {
        llm.route("END");

        StatePatch patch = supervisor.apply(state());

        assertThat(patch.getMessages().get(0).text()).isEqualTo(SupervisorNode.ACKNOWLEDGMENT);
    }

    @Test
    void apply_invalidDestination_endsWithRoutingError() {
        llm.route("supervisor");

        StatePatch patch = supervisor.apply(state());

        assertThat(patch.getNext()).isEqualTo(GraphNode.END);
        assertThat(patch.getOutcome()).isEqualTo(TurnOutcome.ERROR);
        assertThat(patch.getMessages().get(0).text()).isEqualTo(SupervisorNode.ROUTING_ERROR);
    }

    @Test
    void apply_plainText_isFinalAnswer() {
        llm.text("Your resume looks great.");

        StatePatch patch = supervisor.apply(state());

        assertThat(patch.getNext()).isEqualTo(GraphNode.END);
        assertThat(patch.getOutcome()).isEqualTo(TurnOutcome.COMPLETED);
        assertThat(patch.getMessages().get(0).text()).isEqualTo("Your resume looks great.");
    }

    @Test
    void apply_emptyResponse_asksForMoreDetail() {
        llm.reply(LlmResponse.builder().content("").build());

        StatePatch patch = supervisor.apply(state());

        assertThat(patch.getMessages().get(0).text()).isEqualTo(SupervisorNode.NEED_MORE_DETAIL);
    }

    @Test
    void apply_routeEmbeddedInText_isRecoveredAndTextDropped() {
        llm.text("<function=route_to_agent{\"next\": \"user_profile\"}>");

        StatePatch patch = supervisor.apply(state());

        assertThat(patch.getNext()).isEqualTo(GraphNode.USER_PROFILE);
        assertThat(patch.getMessages().get(0).text()).isEqualTo(SupervisorNode.ACKNOWLEDGMENT);
    }

    @Test
    void apply_routeWhileClarificationPending_clearsIt() {
        llm.route("resume_generator");
        ConversationState state = state().toBuilder().pendingClarification(pending(1)).build();

        StatePatch patch = supervisor.apply(state);

        assertThat(patch.isClearClarification()).isTrue();
    }

    @Test
    void apply_clarificationCall_endsTurnWithNumberedQuestion() {
        llm.call(SupervisorTools.CLARIFY, Map.of(
                "question", "Which document should I write?",
                "options", List.of("Resume", "Cover letter")));

        StatePatch patch = supervisor.apply(state());

        assertThat(patch.getNext()).isEqualTo(GraphNode.END);
        assertThat(patch.getOutcome()).isEqualTo(TurnOutcome.COMPLETED);
        assertThat(patch.getMessages().get(0).text())
                .isEqualTo("Which document should I write?\n1. Resume\n2. Cover letter");
        PendingClarification pending = patch.getPendingClarification();
        assertThat(pending.getRound()).isEqualTo(1);
        assertThat(pending.getTimestamp()).isEqualTo(NOW);
        assertThat(patch.getLoopMetrics().getClarificationRounds()).isEqualTo(1);
    }

    @Test
    void apply_clarificationAtCeiling_stopsAsking() {
        llm.call(SupervisorTools.CLARIFY, Map.of("question", "Again?"));
        ConversationState state = state().toBuilder()
                .pendingClarification(pending(3))
                .loopMetrics(LoopMetrics.builder().clarificationRounds(3).build())
                .build();

        StatePatch patch = supervisor.apply(state);

        assertThat(patch.getOutcome()).isEqualTo(TurnOutcome.LOOP_LIMIT);
        assertThat(patch.isClearClarification()).isTrue();
        assertThat(patch.getMessages().get(0).text()).startsWith("Maximum clarification rounds (3) exceeded");
    }

    @Test
    void apply_clarificationAfterPendingLastRound_stopsAsking() {
        llm.call(SupervisorTools.CLARIFY, Map.of("question", "Again?"));
        ConversationState state = state().toBuilder().pendingClarification(pending(3)).build();

        StatePatch patch = supervisor.apply(state);

        assertThat(state.getLoopMetrics().getClarificationRounds()).isZero();
        assertThat(patch.getOutcome()).isEqualTo(TurnOutcome.LOOP_LIMIT);
        assertThat(patch.getPendingClarification()).isNull();
    }

    @Test
    void apply_clarificationAfterPendingRound_numbersNextRound() {
        llm.call(SupervisorTools.CLARIFY, Map.of("question", "Which job?"));
        ConversationState state = state().toBuilder().pendingClarification(pending(2)).build();

        StatePatch patch = supervisor.apply(state);

        assertThat(patch.getPendingClarification().getRound()).isEqualTo(3);
        assertThat(patch.getOutcome()).isEqualTo(TurnOutcome.COMPLETED);
    }

    @Test
    void apply_clarificationWithoutQuestion_fallsBackToDetailRequest() {
        llm.call(SupervisorTools.CLARIFY, Map.of("options", List.of("a")));

        StatePatch patch = supervisor.apply(state());

        assertThat(patch.getPendingClarification()).isNull();
        assertThat(patch.getMessages().get(0).text()).isEqualTo(SupervisorNode.NEED_MORE_DETAIL);
    }

    @Test
    void apply_modelFailure_endsWithProcessingError() {
        llm.failing(new IllegalStateException("provider down"));

        StatePatch patch = supervisor.apply(state());

        assertThat(patch.getOutcome()).isEqualTo(TurnOutcome.ERROR);
        assertThat(patch.getMessages().get(0).text()).isEqualTo(SupervisorNode.PROCESSING_ERROR);
    }

    private static ConversationState state(Message... extra) {
        List<Message> messages = new ArrayList<>(List.of(
                Message.system("You are CareerCraft"), Message.user("Please store my resume")));
        messages.addAll(List.of(extra));
        return ConversationState.initial("u1", messages, List.of(), null);
    }

    private static PendingClarification pending(int round) {
        return PendingClarification.builder().id("p").question("q").round(round).timestamp(NOW).build();
    }
}
