package com.careercraft.agent.graph;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * The single outstanding clarification question asked by the supervisor.
 * Replaced wholesale when a new one is issued.
 */
@Value
@Builder
@Jacksonized
public class PendingClarification {

    String id;
    String question;
    @Builder.Default
    List<String> options = List.of();
    /** 1-based count of consecutive clarification rounds this question belongs to */
    int round;
    Instant timestamp;
}
