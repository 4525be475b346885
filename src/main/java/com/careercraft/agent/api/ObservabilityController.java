package com.careercraft.agent.api;

import com.careercraft.agent.observability.TraceService;
import com.careercraft.agent.observability.TurnTrace;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for turn traces and analytics.
 *
 * GET /api/v1/traces/{userId}                        all turn traces for a user
 * GET /api/v1/traces/conversation/{conversationId}   traces for one conversation
 * GET /api/v1/traces/{userId}/analytics              aggregated stats (latency, tokens, status)
 */
@RestController
@RequestMapping("/api/v1/traces")
@RequiredArgsConstructor
public class ObservabilityController {

    private final TraceService traceService;

    @GetMapping("/{userId}")
    public ResponseEntity<List<TurnTrace>> getTraces(@PathVariable String userId) {
        return ResponseEntity.ok(traceService.getTracesForUser(userId));
    }

    @GetMapping("/conversation/{conversationId}")
    public ResponseEntity<List<TurnTrace>> getConversationTraces(@PathVariable String conversationId) {
        return ResponseEntity.ok(traceService.getTracesForConversation(conversationId));
    }

    @GetMapping("/{userId}/analytics")
    public ResponseEntity<Map<String, Object>> getAnalytics(@PathVariable String userId) {
        return ResponseEntity.ok(traceService.getAnalytics(userId));
    }
}
