package com.careercraft.agent.observability;

import com.careercraft.agent.control.CompletedAction;
import com.careercraft.agent.graph.TurnOutcome;
import com.careercraft.agent.graph.TurnResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Persists turn traces and exposes analytics.
 *
 * Trace persistence is @Async; it never blocks the reply.
 * Analytics queries are synchronous (called explicitly by the traces endpoint).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceService {

    private static final int PREVIEW_LENGTH = 200;

    private final TurnTraceRepository traceRepository;
    private final Clock clock;

    /**
     * Persist a finished turn asynchronously. {@code result} is null when the
     * turn failed before the graph produced one.
     */
    @Async("traceTaskExecutor")
    public void persistTrace(String conversationId, String userId, String userInput,
                             TurnResult result, List<CompletedAction> newActions,
                             long latencyMs, Throwable error) {
        try {
            TurnTrace.TurnTraceBuilder trace = TurnTrace.builder()
                    .conversationId(conversationId)
                    .userId(userId)
                    .userInput(truncate(userInput, 4000))
                    .totalLatencyMs(latencyMs)
                    .toolCalls(summarize(newActions));

            if (result != null) {
                trace.finalMessage(truncate(result.finalMessage(), 8000))
                        .status(result.getOutcome())
                        .nodesVisited(result.getNodesVisited())
                        .totalToolCalls(result.getFinalState().getLoopMetrics().totalToolCalls())
                        .promptTokens(result.getPromptTokens())
                        .completionTokens(result.getCompletionTokens())
                        .totalTokens(result.getPromptTokens() + result.getCompletionTokens());
            } else {
                trace.status(TurnOutcome.ERROR);
            }
            if (error != null) {
                trace.status(TurnOutcome.ERROR).errorMessage(truncate(error.getMessage(), 2000));
            }

            TurnTrace saved = traceRepository.save(trace.build());
            log.info("Trace persisted [conversationId={}, status={}, latency={}ms, tokens={}]",
                    conversationId, saved.getStatus(), latencyMs, saved.getTotalTokens());

        } catch (Exception e) {
            // Trace persistence must never crash the app
            log.error("Failed to persist turn trace for conversation={}", conversationId, e);
        }
    }

    public List<TurnTrace> getTracesForUser(String userId) {
        return traceRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    public List<TurnTrace> getTracesForConversation(String conversationId) {
        return traceRepository.findByConversationIdOrderByCreatedAtDesc(conversationId);
    }

    /**
     * Summary analytics for a user: avg latency, token usage last 24h, status breakdown.
     */
    public Map<String, Object> getAnalytics(String userId) {
        Instant since24h = clock.instant().minus(24, ChronoUnit.HOURS);

        Double avgLatency = traceRepository.avgLatencyForUser(userId);
        Long tokensLast24h = traceRepository.totalTokensUsedSince(userId, since24h);
        Map<String, Long> statuses = traceRepository.statusBreakdownForUser(userId).stream()
                .collect(Collectors.toMap(
                        c -> String.valueOf(c.id()),
                        TurnTraceRepository.StatusCount::count,
                        Long::sum,
                        LinkedHashMap::new));

        return Map.of(
                "userId", userId,
                "avgLatencyMs", avgLatency != null ? Math.round(avgLatency) : 0,
                "totalTokensLast24h", tokensLast24h != null ? tokensLast24h : 0,
                "statusBreakdown", statuses
        );
    }

    private List<TurnTrace.ToolCallSummary> summarize(List<CompletedAction> actions) {
        if (actions == null) {
            return List.of();
        }
        return actions.stream()
                .map(a -> new TurnTrace.ToolCallSummary(a.getAgentType(), a.getToolName(),
                        truncate(a.getResult(), PREVIEW_LENGTH)))
                .toList();
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...[truncated]";
    }
}
