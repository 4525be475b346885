package com.careercraft.agent.graph;

/**
 * A unit of the turn state machine: consumes the running state, returns a partial update.
 * Implementations are expected to catch their own failures and degrade to a message.
 */
@FunctionalInterface
public interface NodeFunction {

    StatePatch apply(ConversationState state);
}
