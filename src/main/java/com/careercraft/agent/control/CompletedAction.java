package com.careercraft.agent.control;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Record of one executed tool call. Immutable once created.
 *
 * The id is random and plays no part in duplicate detection, which compares
 * (agentType, toolName) plus either contentHash or args.
 */
@Value
@Builder
@Jacksonized
public class CompletedAction {

    String id;
    String agentType;
    String toolName;
    Map<String, Object> args;
    /** Bounded prefix of the tool output */
    String result;
    Instant timestamp;
    /** Only set for content-bearing tools */
    String contentHash;
}
