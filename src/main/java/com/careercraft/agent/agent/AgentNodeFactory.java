package com.careercraft.agent.agent;

import com.careercraft.agent.agent.processor.ProcessingContext;
import com.careercraft.agent.agent.processor.ToolResultProcessor;
import com.careercraft.agent.config.AgentProperties;
import com.careercraft.agent.control.LoopLimitCheck;
import com.careercraft.agent.control.LoopLimitGovernor;
import com.careercraft.agent.exception.AgentErrorMessages;
import com.careercraft.agent.exception.MissingUserIdException;
import com.careercraft.agent.exception.OperationTimeoutException;
import com.careercraft.agent.graph.ConversationState;
import com.careercraft.agent.graph.GraphNode;
import com.careercraft.agent.graph.NodeFunction;
import com.careercraft.agent.graph.StatePatch;
import com.careercraft.agent.graph.TurnOutcome;
import com.careercraft.agent.llm.LlmClient;
import com.careercraft.agent.model.LlmResponse;
import com.careercraft.agent.model.Message;
import com.careercraft.agent.model.ToolCall;
import com.careercraft.agent.parsing.ContentNormalizer;
import com.careercraft.agent.parsing.ContentToolCallExtractor;
import com.careercraft.agent.parsing.NormalizedContent;
import com.careercraft.agent.parsing.ToolCallValidator;
import com.careercraft.agent.resilience.OperationTimeouts;
import com.careercraft.agent.tool.AgentTool;
import com.careercraft.agent.tool.ToolCallExecutor;
import com.careercraft.agent.tool.ToolCallOutcome;
import com.careercraft.agent.tool.ToolExecutionReport;
import com.careercraft.agent.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the node function for any specialized agent from its {@link AgentRoleConfig}.
 *
 * Per entry: governor check, user-id precondition, one model call with the
 * role's tools bound, then either a direct reply or a batch of tool calls
 * executed in order. Every path routes back to the supervisor except a
 * governor block and a missing user id, which end the turn.
 */
@Component
@Slf4j
public class AgentNodeFactory {

    static final String EMPTY_REPLY =
            "I processed your request but couldn't generate a proper response. Let me hand this back to the supervisor.";

    private final LlmClient llmClient;
    private final ToolRegistry toolRegistry;
    private final ToolCallExecutor executor;
    private final ToolCallValidator callValidator;
    private final ContentToolCallExtractor extractor;
    private final ContentNormalizer normalizer;
    private final LoopLimitGovernor governor;
    private final MessagePreparer preparer;
    private final OperationTimeouts timeouts;
    private final double temperature;

    public AgentNodeFactory(LlmClient llmClient,
                            ToolRegistry toolRegistry,
                            ToolCallExecutor executor,
                            ToolCallValidator callValidator,
                            ContentToolCallExtractor extractor,
                            ContentNormalizer normalizer,
                            LoopLimitGovernor governor,
                            MessagePreparer preparer,
                            OperationTimeouts timeouts,
                            AgentProperties properties) {
        this.llmClient = llmClient;
        this.toolRegistry = toolRegistry;
        this.executor = executor;
        this.callValidator = callValidator;
        this.extractor = extractor;
        this.normalizer = normalizer;
        this.governor = governor;
        this.preparer = preparer;
        this.timeouts = timeouts;
        this.temperature = properties.getModel().getAgentTemperature();
    }

    public NodeFunction create(AgentRoleConfig config) {
        toolRegistry.requireAll(config.getToolNames());
        return new AgentNode(config);
    }

    private final class AgentNode implements NodeFunction {

        private final AgentRoleConfig config;
        private final String agentType;

        private AgentNode(AgentRoleConfig config) {
            this.config = config;
            this.agentType = config.agentType();
        }

        @Override
        public StatePatch apply(ConversationState state) {
            LoopLimitCheck limit = governor.check(state.getLoopMetrics(), agentType);
            if (limit.isExceeded()) {
                return StatePatch.terminal(Message.assistant(limit.message()), TurnOutcome.LOOP_LIMIT)
                        .toBuilder()
                        .clearClarification(limit.getCeiling() == LoopLimitCheck.Ceiling.CLARIFICATION_ROUNDS)
                        .build();
            }

            try {
                if (config.isRequiresUserId() && !state.hasUserId()) {
                    throw new MissingUserIdException(agentType);
                }
                return run(state);

            } catch (MissingUserIdException e) {
                log.warn("Agent {} refused to run: {}", agentType, e.getMessage());
                return StatePatch.terminal(Message.assistant(AgentErrorMessages.forException(e)),
                        TurnOutcome.VALIDATION_FAILED);
            } catch (OperationTimeoutException e) {
                log.error("Agent {} timed out [userId={}, operation={}]", agentType, state.getUserId(), e.getOperation());
                return StatePatch.terminal(Message.assistant(AgentErrorMessages.forException(e)), TurnOutcome.ERROR);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return backToSupervisor(state, AgentErrorMessages.forException(e));
            } catch (Exception e) {
                log.error("Agent {} failed [userId={}, messages={}, {}]", agentType, state.getUserId(),
                        state.getMessages().size(), state.getLoopMetrics().summary(), e);
                return backToSupervisor(state, AgentErrorMessages.forException(e));
            }
        }

        private StatePatch run(ConversationState state) throws Exception {
            List<AgentTool> tools = toolRegistry.toolsFor(state.getUserId(), config.getToolNames());
            List<Message> prompt = preparer.prepare(config.getSystemMessage(), state.getMessages());

            log.info("Agent {} invoked [userId={}, tools={}, {}]", agentType, state.getUserId(),
                    config.getToolNames(), state.getLoopMetrics().summary());

            LlmResponse response = timeouts.model(
                    () -> llmClient.chat(prompt, toolRegistry.definitions(tools), temperature));

            List<ToolCall> calls = callValidator.validate(response.getToolCalls());
            boolean recovered = false;
            if (calls.isEmpty()) {
                calls = callValidator.validate(extractor.extract(response.getContent()));
                recovered = !calls.isEmpty();
                if (recovered) {
                    log.info("Agent {} recovered {} tool call(s) from content", agentType, calls.size());
                }
            }
            NormalizedContent content = recovered ? NormalizedContent.empty() : normalizer.normalize(response.getContent());

            StatePatch patch = calls.isEmpty()
                    ? directReply(state, content)
                    : toolBatch(state, tools, calls, content);

            return patch.toBuilder()
                    .promptTokens(response.getPromptTokens())
                    .completionTokens(response.getCompletionTokens())
                    .build();
        }

        private StatePatch directReply(ConversationState state, NormalizedContent content) {
            Message reply = content.isBlank() ? Message.assistant(EMPTY_REPLY) : content.toAssistantMessage();
            return StatePatch.builder()
                    .messages(List.of(reply))
                    .next(GraphNode.SUPERVISOR)
                    .loopMetrics(governor.afterAgentRun(state.getLoopMetrics(), agentType, 0))
                    .build();
        }

        private StatePatch toolBatch(ConversationState state, List<AgentTool> tools, List<ToolCall> calls,
                                     NormalizedContent content) {
            ToolExecutionReport report = executor.execute(agentType, calls, tools, state.getCompletedActions());

            List<Message> messages = new ArrayList<>(calls.size() + 1);
            messages.add(Message.builder()
                    .role(Message.Role.assistant)
                    .content(content.isBlank() ? null : content.asText())
                    .toolCalls(List.copyOf(calls))
                    .build());
            messages.addAll(resultMessages(state, calls, report, content));

            log.info("Agent {} ran tool batch [requested={}, attempted={}, completed={}]", agentType,
                    calls.size(), report.attemptedCount(), report.completedActions().size());

            return StatePatch.builder()
                    .messages(messages)
                    .next(GraphNode.SUPERVISOR)
                    .completedActions(report.completedActions())
                    .loopMetrics(governor.afterAgentRun(state.getLoopMetrics(), agentType, report.attemptedCount()))
                    .build();
        }

        private List<Message> resultMessages(ConversationState state, List<ToolCall> calls,
                                             ToolExecutionReport report, NormalizedContent content) {
            if (config.resultProcessor().isPresent()) {
                ToolResultProcessor processor = config.resultProcessor().get();
                try {
                    String summary = processor.process(ProcessingContext.builder()
                            .agentType(agentType)
                            .userId(state.getUserId())
                            .outcomes(report.outcomes())
                            .responseText(content.asText())
                            .priorActions(state.getCompletedActions())
                            .build());
                    // One consolidated result, answering the first call of the batch
                    return List.of(Message.toolResult(calls.get(0), summary));
                } catch (RuntimeException e) {
                    log.warn("Result processor for {} failed, falling back to per-tool messages: {}",
                            agentType, e.getMessage(), e);
                }
            }

            List<Message> perTool = new ArrayList<>(report.outcomes().size());
            for (ToolCallOutcome outcome : report.outcomes()) {
                perTool.add(Message.toolResult(outcome.getCall(), outcome.getOutput()));
            }
            return perTool;
        }

        private StatePatch backToSupervisor(ConversationState state, String text) {
            return StatePatch.builder()
                    .messages(List.of(Message.assistant(text)))
                    .next(GraphNode.SUPERVISOR)
                    .loopMetrics(governor.afterAgentRun(state.getLoopMetrics(), agentType, 0))
                    .build();
        }
    }
}
