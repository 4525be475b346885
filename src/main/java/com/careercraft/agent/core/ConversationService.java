package com.careercraft.agent.core;

import com.careercraft.agent.control.CompletedAction;
import com.careercraft.agent.control.DuplicateActionDetector;
import com.careercraft.agent.graph.ConversationState;
import com.careercraft.agent.graph.GraphRouter;
import com.careercraft.agent.graph.TurnResult;
import com.careercraft.agent.history.ConversationSnapshot;
import com.careercraft.agent.history.ConversationStore;
import com.careercraft.agent.model.ChatMessage;
import com.careercraft.agent.model.Message;
import com.careercraft.agent.model.TurnRequest;
import com.careercraft.agent.model.TurnResponse;
import com.careercraft.agent.observability.TraceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs one conversational turn end to end.
 *
 * Per-turn flow:
 * 1. Resolve the conversation and rehydrate its snapshot (Redis)
 * 2. Build the message list from the request or from history + new input
 * 3. Carry recent completed actions and any pending clarification forward
 * 4. Run the supervisor graph until it terminates
 * 5. Persist the updated snapshot
 * 6. Async: persist the turn trace
 */
@Service
@Slf4j
public class ConversationService {

    private final GraphRouter router;
    private final ConversationStore conversationStore;
    private final TurnInputConverter inputConverter;
    private final DuplicateActionDetector duplicateDetector;
    private final TraceService traceService;
    private final Clock clock;

    public ConversationService(GraphRouter router,
                               ConversationStore conversationStore,
                               TurnInputConverter inputConverter,
                               DuplicateActionDetector duplicateDetector,
                               TraceService traceService,
                               Clock clock) {
        this.router = router;
        this.conversationStore = conversationStore;
        this.inputConverter = inputConverter;
        this.duplicateDetector = duplicateDetector;
        this.traceService = traceService;
        this.clock = clock;
    }

    public TurnResponse run(TurnRequest request) {
        String conversationId = resolveConversationId(request.getConversationId());
        long start = clock.millis();

        log.info("Turn started [conversationId={}, userId={}, suppliedMessages={}]", conversationId,
                request.getUserId(), request.getMessages() != null ? request.getMessages().size() : 0);

        // Conversion errors are caller errors and surface as 400 before any state is touched
        List<Message> supplied = hasSuppliedHistory(request) ? inputConverter.convert(request.getMessages()) : null;

        TurnResult result = null;
        List<CompletedAction> newActions = List.of();
        String userId = request.getUserId();
        Throwable error = null;

        try {
            ConversationSnapshot snapshot = conversationStore.load(conversationId);
            if (userId == null || userId.isBlank()) {
                userId = snapshot.getUserId();
            }

            List<Message> messages = supplied != null ? supplied : continueHistory(snapshot, request.getInput());
            List<CompletedAction> carried = duplicateDetector.carryOver(snapshot.getCompletedActions());

            result = router.run(ConversationState.initial(userId, messages, carried,
                    snapshot.getPendingClarification()));

            ConversationState finalState = result.getFinalState();
            List<CompletedAction> allActions = finalState.getCompletedActions();
            newActions = allActions.subList(Math.min(carried.size(), allActions.size()), allActions.size());

            conversationStore.save(conversationId, ConversationSnapshot.builder()
                    .userId(userId)
                    .messages(new ArrayList<>(finalState.getMessages()))
                    .completedActions(new ArrayList<>(duplicateDetector.carryOver(allActions)))
                    .pendingClarification(finalState.getPendingClarification())
                    .build());

        } catch (RuntimeException e) {
            log.error("Turn failed [conversationId={}]", conversationId, e);
            error = e;
            throw e;
        } finally {
            // Always persist trace, even on error
            traceService.persistTrace(conversationId, userId, inputText(request), result, newActions,
                    clock.millis() - start, error);
        }

        TurnResponse response = TurnResponse.builder()
                .conversationId(conversationId)
                .finalMessage(result.finalMessage())
                .messages(result.getFinalState().getMessages().stream().map(ChatMessage::from).toList())
                .nodesVisited(result.getNodesVisited())
                .toolCallsExecuted(result.getFinalState().getLoopMetrics().totalToolCalls())
                .terminatedBy(result.getOutcome())
                .build();

        log.info("Turn complete [conversationId={}, outcome={}, nodes={}, toolCalls={}, latency={}ms]",
                conversationId, response.getTerminatedBy(), response.getNodesVisited(),
                response.getToolCallsExecuted(), clock.millis() - start);

        return response;
    }

    public void clear(String conversationId) {
        conversationStore.clear(conversationId);
    }

    private List<Message> continueHistory(ConversationSnapshot snapshot, String input) {
        List<Message> messages = new ArrayList<>(snapshot.getMessages());
        messages.add(Message.user(input));
        return inputConverter.withSystemMessage(messages);
    }

    private static boolean hasSuppliedHistory(TurnRequest request) {
        return request.getMessages() != null && !request.getMessages().isEmpty();
    }

    /** The user text that opened this turn, for tracing */
    private static String inputText(TurnRequest request) {
        if (!hasSuppliedHistory(request)) {
            return request.getInput();
        }
        List<ChatMessage> supplied = request.getMessages();
        for (int i = supplied.size() - 1; i >= 0; i--) {
            if (TurnInputConverter.roleOf(supplied.get(i).getRole()) == Message.Role.user) {
                return supplied.get(i).getContent();
            }
        }
        return null;
    }

    private String resolveConversationId(String conversationId) {
        return (conversationId != null && !conversationId.isBlank())
                ? conversationId
                : UUID.randomUUID().toString();
    }
}
