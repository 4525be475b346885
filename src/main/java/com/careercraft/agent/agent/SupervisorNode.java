package com.careercraft.agent.agent;

import com.careercraft.agent.config.AgentProperties;
import com.careercraft.agent.control.LoopLimitCheck;
import com.careercraft.agent.control.LoopLimitGovernor;
import com.careercraft.agent.exception.ToolArgumentException;
import com.careercraft.agent.graph.ConversationState;
import com.careercraft.agent.graph.GraphNode;
import com.careercraft.agent.graph.NodeFunction;
import com.careercraft.agent.graph.PendingClarification;
import com.careercraft.agent.graph.StatePatch;
import com.careercraft.agent.graph.TurnOutcome;
import com.careercraft.agent.llm.LlmClient;
import com.careercraft.agent.model.LlmResponse;
import com.careercraft.agent.model.Message;
import com.careercraft.agent.model.ToolCall;
import com.careercraft.agent.parsing.ContentNormalizer;
import com.careercraft.agent.parsing.ContentToolCallExtractor;
import com.careercraft.agent.parsing.NormalizedContent;
import com.careercraft.agent.parsing.ToolArgumentValidator;
import com.careercraft.agent.parsing.ToolCallValidator;
import com.careercraft.agent.resilience.OperationTimeouts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Hub of the turn graph. Asks the model where the conversation goes next and
 * turns the answer into a routing decision, a clarification question, or the
 * final reply.
 *
 * Precedence: a valid routing call wins, then a clarification request, then
 * plain text as the final answer, then a canned request for more detail.
 */
@Component
@Slf4j
public class SupervisorNode implements NodeFunction {

    static final String ACKNOWLEDGMENT = "I understand your request.";
    static final String NEED_MORE_DETAIL =
            "I apologize, but I don't have enough information to help with that specific request. "
                    + "Could you provide more details about what you're looking for?";
    static final String ROUTING_ERROR =
            "I encountered an error with my routing decision. Let me try to help you directly.";
    static final String PROCESSING_ERROR =
            "I encountered an error while processing your request. Please try again.";

    private final LlmClient llmClient;
    private final ToolCallValidator callValidator;
    private final ContentToolCallExtractor extractor;
    private final ContentNormalizer normalizer;
    private final ToolArgumentValidator argumentValidator;
    private final LoopLimitGovernor governor;
    private final MessagePreparer preparer;
    private final OperationTimeouts timeouts;
    private final Clock clock;
    private final double temperature;

    public SupervisorNode(LlmClient llmClient,
                          ToolCallValidator callValidator,
                          ContentToolCallExtractor extractor,
                          ContentNormalizer normalizer,
                          ToolArgumentValidator argumentValidator,
                          LoopLimitGovernor governor,
                          MessagePreparer preparer,
                          OperationTimeouts timeouts,
                          Clock clock,
                          AgentProperties properties) {
        this.llmClient = llmClient;
        this.callValidator = callValidator;
        this.extractor = extractor;
        this.normalizer = normalizer;
        this.argumentValidator = argumentValidator;
        this.governor = governor;
        this.preparer = preparer;
        this.timeouts = timeouts;
        this.clock = clock;
        this.temperature = properties.getModel().getSupervisorTemperature();
    }

    @Override
    public StatePatch apply(ConversationState state) {
        LlmResponse response;
        try {
            List<Message> prompt = preparer.prepare(AgentPrompts.SUPERVISOR, state.getMessages());
            response = timeouts.model(() -> llmClient.chat(prompt, SupervisorTools.definitions(), temperature));
        } catch (Exception e) {
            log.error("Supervisor model call failed [userId={}, messages={}, {}]",
                    state.getUserId(), state.getMessages().size(), state.getLoopMetrics().summary(), e);
            return StatePatch.terminal(Message.assistant(PROCESSING_ERROR), TurnOutcome.ERROR);
        }

        StatePatch decision;
        try {
            decision = decide(state, response);
        } catch (RuntimeException e) {
            log.error("Supervisor could not interpret the model response [userId={}]", state.getUserId(), e);
            decision = StatePatch.terminal(Message.assistant(PROCESSING_ERROR), TurnOutcome.ERROR);
        }

        return decision.toBuilder()
                .promptTokens(response.getPromptTokens())
                .completionTokens(response.getCompletionTokens())
                .build();
    }

    private StatePatch decide(ConversationState state, LlmResponse response) {
        List<ToolCall> calls = callValidator.validate(response.getToolCalls());
        boolean recovered = false;
        if (calls.isEmpty()) {
            calls = callValidator.validate(extractor.extract(response.getContent()));
            recovered = !calls.isEmpty();
        }
        // Text that only carried an embedded call is not an answer
        NormalizedContent content = recovered ? NormalizedContent.empty() : normalizer.normalize(response.getContent());

        Optional<ToolCall> route = find(calls, SupervisorTools.ROUTE);
        if (route.isPresent()) {
            return route(state, route.get(), content);
        }

        Optional<ToolCall> clarify = find(calls, SupervisorTools.CLARIFY);
        if (clarify.isPresent()) {
            return clarify(state, clarify.get(), content);
        }

        if (!content.isBlank()) {
            log.info("Supervisor answered directly [userId={}]", state.getUserId());
            return StatePatch.terminal(content.toAssistantMessage(), TurnOutcome.COMPLETED);
        }

        if (!calls.isEmpty()) {
            log.warn("Supervisor called no usable tool [calls={}]", calls.stream().map(ToolCall::getToolName).toList());
        } else {
            log.info("Supervisor returned neither a routing call nor text [userId={}]", state.getUserId());
        }
        return StatePatch.terminal(Message.assistant(NEED_MORE_DETAIL), TurnOutcome.COMPLETED);
    }

    private StatePatch route(ConversationState state, ToolCall call, NormalizedContent content) {
        Object requested = call.getArguments() != null ? call.getArguments().get("next") : null;
        Optional<GraphNode> destination = GraphNode.fromWireName(requested == null ? null : requested.toString())
                .filter(node -> node != GraphNode.SUPERVISOR);

        if (destination.isEmpty()) {
            log.warn("Supervisor routed to unknown destination [next={}]", requested);
            return StatePatch.terminal(Message.assistant(ROUTING_ERROR), TurnOutcome.ERROR);
        }

        GraphNode next = destination.get();
        if (next == GraphNode.END) {
            log.info("Supervisor ended the turn [userId={}, {}]", state.getUserId(), state.getLoopMetrics().summary());
            return StatePatch.terminal(closingMessage(state, content), TurnOutcome.COMPLETED);
        }

        log.info("Supervisor routed to {} [userId={}]", next.wireName(), state.getUserId());
        Message acknowledgment = Message.builder()
                .role(Message.Role.assistant)
                .content(content.isBlank() ? ACKNOWLEDGMENT : content.asText())
                .toolCalls(List.of(call))
                .build();

        return StatePatch.builder()
                .messages(List.of(acknowledgment))
                .next(next)
                .clearClarification(state.getPendingClarification() != null)
                .build();
    }

    /**
     * When the model ends the turn without text, the latest agent output
     * becomes the reply so the user sees what was done.
     */
    private Message closingMessage(ConversationState state, NormalizedContent content) {
        if (!content.isBlank()) {
            return content.toAssistantMessage();
        }
        Message last = state.lastMessage();
        if (last != null && last.getRole() == Message.Role.tool && !last.text().isBlank()) {
            return Message.assistant(last.text());
        }
        return Message.assistant(ACKNOWLEDGMENT);
    }

    private StatePatch clarify(ConversationState state, ToolCall call, NormalizedContent content) {
        int priorRounds = priorClarificationRounds(state);
        LoopLimitCheck ceiling = governor.clarificationCheck(
                state.getLoopMetrics().toBuilder().clarificationRounds(priorRounds).build(),
                GraphNode.SUPERVISOR.wireName());
        if (ceiling.isExceeded()) {
            return StatePatch.terminal(Message.assistant(ceiling.message()), TurnOutcome.LOOP_LIMIT)
                    .toBuilder()
                    .clearClarification(true)
                    .build();
        }

        Map<String, Object> args;
        try {
            args = argumentValidator.validate(SupervisorTools.CLARIFY, SupervisorTools.CLARIFY_SCHEMA,
                    call.getArguments());
        } catch (ToolArgumentException e) {
            Message fallback = content.isBlank() ? Message.assistant(NEED_MORE_DETAIL) : content.toAssistantMessage();
            return StatePatch.terminal(fallback, TurnOutcome.COMPLETED);
        }

        String question = (String) args.get("question");
        @SuppressWarnings("unchecked")
        List<String> options = (List<String>) args.getOrDefault("options", List.of());

        PendingClarification pending = PendingClarification.builder()
                .id(UUID.randomUUID().toString())
                .question(question)
                .options(List.copyOf(options))
                .round(priorRounds + 1)
                .timestamp(clock.instant())
                .build();

        log.info("Supervisor asked for clarification [userId={}, round={}]", state.getUserId(), pending.getRound());

        return StatePatch.terminal(Message.assistant(render(pending)), TurnOutcome.COMPLETED)
                .toBuilder()
                .pendingClarification(pending)
                .loopMetrics(governor.afterClarification(state.getLoopMetrics()))
                .build();
    }

    /**
     * Consecutive rounds asked so far: the unanswered question from an earlier
     * turn carries its round, questions asked in this turn are counted in the metrics.
     */
    private static int priorClarificationRounds(ConversationState state) {
        PendingClarification pending = state.getPendingClarification();
        int carried = pending != null ? pending.getRound() : 0;
        return Math.max(carried, state.getLoopMetrics().getClarificationRounds());
    }

    static String render(PendingClarification clarification) {
        StringBuilder text = new StringBuilder(clarification.getQuestion());
        List<String> options = clarification.getOptions();
        for (int i = 0; i < options.size(); i++) {
            text.append('\n').append(i + 1).append(". ").append(options.get(i));
        }
        return text.toString();
    }

    private static Optional<ToolCall> find(List<ToolCall> calls, String name) {
        return calls.stream().filter(c -> name.equals(c.getToolName())).findFirst();
    }
}
