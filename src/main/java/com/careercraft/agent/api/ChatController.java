package com.careercraft.agent.api;

import com.careercraft.agent.core.ConversationService;
import com.careercraft.agent.model.TurnRequest;
import com.careercraft.agent.model.TurnResponse;
import com.careercraft.agent.resilience.IdempotencyService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Conversation endpoint with idempotency support.
 *
 * POST   /api/v1/chat/turn
 *   Optional header: Idempotency-Key: <uuid>
 *   If provided, repeated requests within 24h return the cached response;
 *   a repeat that arrives while the first is still running gets 409.
 *
 * DELETE /api/v1/chat/{conversationId}   drop stored history
 * GET    /api/v1/chat/health
 */
@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final ConversationService conversationService;
    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;

    @PostMapping("/turn")
    public ResponseEntity<TurnResponse> turn(
            @Valid @RequestBody TurnRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        log.info("Turn request [conversationId={}, userId={}, idempotencyKey={}]",
                request.getConversationId(), request.getUserId(), idempotencyKey);

        boolean idempotent = idempotencyKey != null && !idempotencyKey.isBlank();
        if (idempotent) {
            var cached = idempotencyService.getCachedResponse(idempotencyKey);
            if (cached.isPresent()) {
                try {
                    TurnResponse cachedResponse = objectMapper.readValue(cached.get(), TurnResponse.class);
                    log.info("Returning cached response for idempotency key={}", idempotencyKey);
                    return ResponseEntity.ok(cachedResponse);
                } catch (JsonProcessingException e) {
                    log.warn("Failed to deserialize cached response, proceeding fresh", e);
                    idempotencyService.releaseKey(idempotencyKey);
                }
            }
            if (!idempotencyService.claimKey(idempotencyKey)) {
                log.warn("Rejecting concurrent repeat of idempotency key={}", idempotencyKey);
                return ResponseEntity.status(HttpStatus.CONFLICT).build();
            }
        }

        TurnResponse response;
        try {
            response = conversationService.run(request);
        } catch (RuntimeException e) {
            // On error, release the key so the client can retry
            if (idempotent) {
                idempotencyService.releaseKey(idempotencyKey);
            }
            throw e;
        }

        if (idempotent) {
            try {
                idempotencyService.storeResponse(idempotencyKey, objectMapper.writeValueAsString(response));
            } catch (JsonProcessingException e) {
                log.warn("Failed to cache idempotency response", e);
                idempotencyService.releaseKey(idempotencyKey);
            }
        }

        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{conversationId}")
    public ResponseEntity<Void> clear(@PathVariable String conversationId) {
        conversationService.clear(conversationId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
