package com.careercraft.agent.graph;

import com.careercraft.agent.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Star-topology state machine for one turn.
 *
 * <pre>
 *   start → supervisor
 *   supervisor → any agent | END      (per the supervisor's routing signal)
 *   agent → supervisor                 (unless the agent's patch ends the turn)
 * </pre>
 *
 * Agents end the turn themselves only when the loop-limit governor blocks them
 * or their user-id precondition fails. Everything else funnels back through
 * the supervisor, which is the only fan-out point. A hard step cap stops a turn
 * that keeps cycling anyway.
 */
@Slf4j
public class GraphRouter {

    static final String STEP_LIMIT_MESSAGE =
            "I wasn't able to finish this request within the allowed number of steps. "
                    + "Please try breaking it down into smaller, more specific requests.";
    static final String SUPERVISOR_FAILURE_MESSAGE =
            "I apologize, but I encountered an error while processing your request. Please try again.";
    static final String AGENT_FAILURE_MESSAGE =
            "I encountered an unexpected error while working on that. Let me hand this back to the supervisor.";

    private final Map<GraphNode, NodeFunction> nodes;
    private final int maxSteps;

    public GraphRouter(Map<GraphNode, NodeFunction> nodes, int maxSteps) {
        if (!nodes.containsKey(GraphNode.SUPERVISOR)) {
            throw new IllegalArgumentException("A supervisor node is required");
        }
        if (nodes.containsKey(GraphNode.END)) {
            throw new IllegalArgumentException("END is a sentinel, not a node");
        }
        this.nodes = new EnumMap<>(nodes);
        this.maxSteps = maxSteps;
        log.info("Graph wired [nodes={}, maxSteps={}]", this.nodes.keySet(), maxSteps);
    }

    public TurnResult run(ConversationState initial) {
        ConversationState state = initial.toBuilder().next(GraphNode.SUPERVISOR).build();
        GraphNode current = GraphNode.SUPERVISOR;
        List<String> visited = new ArrayList<>();
        int promptTokens = 0;
        int completionTokens = 0;

        while (current != GraphNode.END) {
            if (visited.size() >= maxSteps) {
                log.warn("Turn hit step limit ({}) [userId={}, visited={}]", maxSteps, state.getUserId(), visited);
                state = StateReducer.merge(state,
                        StatePatch.terminal(Message.assistant(STEP_LIMIT_MESSAGE), TurnOutcome.STEP_LIMIT));
                break;
            }

            NodeFunction node = nodes.get(current);
            if (node == null) {
                log.error("No node registered for [{}], ending turn", current.wireName());
                state = StateReducer.merge(state,
                        StatePatch.terminal(Message.assistant(SUPERVISOR_FAILURE_MESSAGE), TurnOutcome.ERROR));
                break;
            }

            StatePatch patch = invoke(current, node, state);
            visited.add(current.wireName());
            promptTokens += patch.getPromptTokens();
            completionTokens += patch.getCompletionTokens();

            GraphNode target = nextAfter(current, patch);
            state = StateReducer.merge(state, patch).toBuilder().next(target).build();

            log.debug("Transition {} -> {} [step={}, {}]", current.wireName(), target.wireName(),
                    visited.size(), state.getLoopMetrics().summary());
            current = target;
        }

        TurnOutcome outcome = state.getOutcome() != null ? state.getOutcome() : TurnOutcome.COMPLETED;
        ConversationState finalState = state.toBuilder().next(GraphNode.END).outcome(outcome).build();

        log.info("Turn finished [outcome={}, steps={}, {}]", outcome, visited.size(),
                finalState.getLoopMetrics().summary());

        return TurnResult.builder()
                .finalState(finalState)
                .nodesVisited(List.copyOf(visited))
                .outcome(outcome)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }

    /**
     * Last-resort boundary. Nodes catch their own failures; anything that still
     * escapes is logged and turned into an apology here.
     */
    private StatePatch invoke(GraphNode current, NodeFunction node, ConversationState state) {
        try {
            StatePatch patch = node.apply(state);
            return patch != null ? patch : StatePatch.builder().build();
        } catch (RuntimeException e) {
            log.error("Node [{}] threw [userId={}]", current.wireName(), state.getUserId(), e);
            if (current == GraphNode.SUPERVISOR) {
                return StatePatch.terminal(Message.assistant(SUPERVISOR_FAILURE_MESSAGE), TurnOutcome.ERROR);
            }
            return StatePatch.builder()
                    .messages(List.of(Message.assistant(AGENT_FAILURE_MESSAGE)))
                    .next(GraphNode.SUPERVISOR)
                    .build();
        }
    }

    private GraphNode nextAfter(GraphNode current, StatePatch patch) {
        GraphNode requested = patch.getNext();

        if (current == GraphNode.SUPERVISOR) {
            if (requested == null || requested == GraphNode.SUPERVISOR) {
                return GraphNode.END;
            }
            return requested;
        }

        return requested == GraphNode.END ? GraphNode.END : GraphNode.SUPERVISOR;
    }
}
