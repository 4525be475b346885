package com.careercraft.agent.graph;

/**
 * Why a turn reached the terminal state.
 */
public enum TurnOutcome {
    /** The supervisor ended the turn (final answer, clarification or canned reply) */
    COMPLETED,
    /** The loop-limit governor blocked an agent */
    LOOP_LIMIT,
    /** A role that needs a user id ran without one */
    VALIDATION_FAILED,
    /** The router's per-turn node budget ran out */
    STEP_LIMIT,
    /** A node caught an unexpected failure and degraded to an apology */
    ERROR
}
