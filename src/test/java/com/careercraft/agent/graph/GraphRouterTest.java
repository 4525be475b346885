package com.careercraft.agent.graph;

import com.careercraft.agent.model.Message;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphRouterTest {

    @Test
    void run_supervisorEndsImmediately_visitsOnlySupervisor() {
        GraphRouter router = router(Map.of(GraphNode.SUPERVISOR,
                state -> StatePatch.terminal(Message.assistant("Hello!"), TurnOutcome.COMPLETED)));

        TurnResult result = router.run(initial());

        assertThat(result.getNodesVisited()).containsExactly("supervisor");
        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.COMPLETED);
        assertThat(result.finalMessage()).isEqualTo("Hello!");
        assertThat(result.getFinalState().getNext()).isEqualTo(GraphNode.END);
    }

    @Test
    void run_agentAlwaysReturnsToSupervisor() {
        AtomicInteger supervisorCalls = new AtomicInteger();
        Map<GraphNode, NodeFunction> nodes = new EnumMap<>(GraphNode.class);
        nodes.put(GraphNode.SUPERVISOR, state -> supervisorCalls.getAndIncrement() == 0
                ? StatePatch.builder().next(GraphNode.DATA_MANAGER).build()
                : StatePatch.terminal(Message.assistant("Done"), TurnOutcome.COMPLETED));
        // Requests another agent; the router ignores it
        nodes.put(GraphNode.DATA_MANAGER, state -> StatePatch.builder()
                .messages(List.of(Message.assistant("stored")))
                .next(GraphNode.RESUME_GENERATOR)
                .promptTokens(10)
                .completionTokens(5)
                .build());

        TurnResult result = router(nodes).run(initial());

        assertThat(result.getNodesVisited()).containsExactly("supervisor", "data_manager", "supervisor");
        assertThat(result.getPromptTokens()).isEqualTo(10);
        assertThat(result.getCompletionTokens()).isEqualTo(5);
        assertThat(result.finalMessage()).isEqualTo("Done");
    }

    @Test
    void run_agentTerminalPatch_endsTurnWithoutSupervisor() {
        Map<GraphNode, NodeFunction> nodes = new EnumMap<>(GraphNode.class);
        nodes.put(GraphNode.SUPERVISOR, state -> StatePatch.builder().next(GraphNode.USER_PROFILE).build());
        nodes.put(GraphNode.USER_PROFILE,
                state -> StatePatch.terminal(Message.assistant("limit"), TurnOutcome.LOOP_LIMIT));

        TurnResult result = router(nodes).run(initial());

        assertThat(result.getNodesVisited()).containsExactly("supervisor", "user_profile");
        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.LOOP_LIMIT);
    }

    @Test
    void run_supervisorWithoutRoutingSignal_ends() {
        GraphRouter router = router(Map.of(GraphNode.SUPERVISOR,
                state -> StatePatch.builder().messages(List.of(Message.assistant("hm"))).build()));

        TurnResult result = router.run(initial());

        assertThat(result.getNodesVisited()).containsExactly("supervisor");
        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.COMPLETED);
    }

    @Test
    void run_endlessCycle_stopsAtStepCap() {
        Map<GraphNode, NodeFunction> nodes = new EnumMap<>(GraphNode.class);
        nodes.put(GraphNode.SUPERVISOR, state -> StatePatch.builder().next(GraphNode.DATA_MANAGER).build());
        nodes.put(GraphNode.DATA_MANAGER, state -> StatePatch.builder().next(GraphNode.SUPERVISOR).build());

        TurnResult result = new GraphRouter(nodes, 6).run(initial());

        assertThat(result.getNodesVisited()).hasSize(6);
        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.STEP_LIMIT);
        assertThat(result.finalMessage()).isEqualTo(GraphRouter.STEP_LIMIT_MESSAGE);
    }

    @Test
    void run_throwingAgent_degradesAndReturnsToSupervisor() {
        List<String> seenBySupervisor = new ArrayList<>();
        AtomicInteger supervisorCalls = new AtomicInteger();
        Map<GraphNode, NodeFunction> nodes = new EnumMap<>(GraphNode.class);
        nodes.put(GraphNode.SUPERVISOR, state -> {
            seenBySupervisor.add(state.lastMessage().text());
            return supervisorCalls.getAndIncrement() == 0
                    ? StatePatch.builder().next(GraphNode.JOB_POSTING_MANAGER).build()
                    : StatePatch.terminal(Message.assistant("sorry"), TurnOutcome.COMPLETED);
        });
        nodes.put(GraphNode.JOB_POSTING_MANAGER, state -> {
            throw new IllegalStateException("boom");
        });

        TurnResult result = router(nodes).run(initial());

        assertThat(result.getNodesVisited()).containsExactly("supervisor", "job_posting_manager", "supervisor");
        assertThat(seenBySupervisor).last().isEqualTo(GraphRouter.AGENT_FAILURE_MESSAGE);
    }

    @Test
    void run_throwingSupervisor_endsWithError() {
        GraphRouter router = router(Map.of(GraphNode.SUPERVISOR, state -> {
            throw new IllegalStateException("boom");
        }));

        TurnResult result = router.run(initial());

        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.ERROR);
        assertThat(result.finalMessage()).isEqualTo(GraphRouter.SUPERVISOR_FAILURE_MESSAGE);
    }

    @Test
    void run_routeToUnregisteredAgent_endsWithError() {
        GraphRouter router = router(Map.of(GraphNode.SUPERVISOR,
                state -> StatePatch.builder().next(GraphNode.COVER_LETTER_GENERATOR).build()));

        TurnResult result = router.run(initial());

        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.ERROR);
        assertThat(result.getNodesVisited()).containsExactly("supervisor");
    }

    @Test
    void constructor_requiresSupervisor() {
        assertThatThrownBy(() -> new GraphRouter(Map.of(GraphNode.DATA_MANAGER, state -> null), 10))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static GraphRouter router(Map<GraphNode, NodeFunction> nodes) {
        return new GraphRouter(nodes, 25);
    }

    private static ConversationState initial() {
        return ConversationState.initial("u1", List.of(Message.system("sys"), Message.user("hi")), List.of(), null);
    }
}
