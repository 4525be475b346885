package com.careercraft.agent.api;

import com.careercraft.agent.core.ConversationService;
import com.careercraft.agent.graph.TurnOutcome;
import com.careercraft.agent.model.TurnRequest;
import com.careercraft.agent.model.TurnResponse;
import com.careercraft.agent.resilience.IdempotencyService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatControllerTest {

    @Mock ConversationService conversationService;
    @Mock IdempotencyService idempotencyService;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ChatController controller;

    private final TurnRequest request = TurnRequest.builder().userId("u1").input("hi").build();
    private final TurnResponse response = TurnResponse.builder()
            .conversationId("conv-1")
            .finalMessage("Hello!")
            .nodesVisited(List.of("supervisor"))
            .terminatedBy(TurnOutcome.COMPLETED)
            .build();

    @BeforeEach
    void setUp() {
        controller = new ChatController(conversationService, idempotencyService, objectMapper);
    }

    @Test
    void turn_withoutKey_runsWithoutCaching() {
        when(conversationService.run(request)).thenReturn(response);

        ResponseEntity<TurnResponse> result = controller.turn(request, null);

        assertThat(result.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(result.getBody()).isEqualTo(response);
        verifyNoInteractions(idempotencyService);
    }

    @Test
    void turn_cachedKey_returnsStoredResponseWithoutRunning() throws Exception {
        when(idempotencyService.getCachedResponse("k1"))
                .thenReturn(Optional.of(objectMapper.writeValueAsString(response)));

        ResponseEntity<TurnResponse> result = controller.turn(request, "k1");

        assertThat(result.getBody().getFinalMessage()).isEqualTo("Hello!");
        verifyNoInteractions(conversationService);
    }

    @Test
    void turn_newKey_claimsRunsAndStores() {
        when(idempotencyService.getCachedResponse("k1")).thenReturn(Optional.empty());
        when(idempotencyService.claimKey("k1")).thenReturn(true);
        when(conversationService.run(request)).thenReturn(response);

        controller.turn(request, "k1");

        verify(idempotencyService).storeResponse(eq("k1"), anyString());
    }

    @Test
    void turn_keyHeldByRunningTurn_isConflict() {
        when(idempotencyService.getCachedResponse("k1")).thenReturn(Optional.empty());
        when(idempotencyService.claimKey("k1")).thenReturn(false);

        ResponseEntity<TurnResponse> result = controller.turn(request, "k1");

        assertThat(result.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        verifyNoInteractions(conversationService);
    }

    @Test
    void turn_failure_releasesKeyForRetry() {
        when(idempotencyService.getCachedResponse("k1")).thenReturn(Optional.empty());
        when(idempotencyService.claimKey("k1")).thenReturn(true);
        when(conversationService.run(any())).thenThrow(new IllegalStateException("redis down"));

        assertThatThrownBy(() -> controller.turn(request, "k1")).isInstanceOf(IllegalStateException.class);

        verify(idempotencyService).releaseKey("k1");
        verify(idempotencyService, never()).storeResponse(any(), any());
    }

    @Test
    void clear_returnsNoContent() {
        assertThat(controller.clear("conv-1").getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
        verify(conversationService).clear("conv-1");
    }
}
