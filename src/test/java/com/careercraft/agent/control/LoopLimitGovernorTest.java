package com.careercraft.agent.control;

import com.careercraft.agent.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LoopLimitGovernorTest {

    private LoopLimitGovernor governor;

    @BeforeEach
    void setUp() {
        governor = new LoopLimitGovernor(new AgentProperties());
    }

    @Test
    void check_freshMetrics_isWithinLimits() {
        assertThat(governor.check(LoopMetrics.empty(), "data_manager").isExceeded()).isFalse();
    }

    @Test
    void check_tooManySwitches_blocksFirst() {
        LoopMetrics metrics = LoopMetrics.builder()
                .agentSwitches(10)
                .toolCallsPerAgent(Map.of("data_manager", 9))
                .build();

        LoopLimitCheck check = governor.check(metrics, "data_manager");

        assertThat(check.isExceeded()).isTrue();
        assertThat(check.getCeiling()).isEqualTo(LoopLimitCheck.Ceiling.AGENT_SWITCHES);
        assertThat(check.message())
                .isEqualTo("Maximum agent switches (10) exceeded. " + LoopLimitGovernor.SWITCHES_SUGGESTION);
    }

    @Test
    void check_toolCallCeilingIsPerAgent() {
        LoopMetrics metrics = LoopMetrics.builder().toolCallsPerAgent(Map.of("data_manager", 5)).build();

        assertThat(governor.check(metrics, "data_manager").getReason())
                .isEqualTo("Maximum tool calls for data_manager (5) exceeded");
        assertThat(governor.check(metrics, "user_profile").isExceeded()).isFalse();
    }

    @Test
    void check_clarificationCeiling_blocksAgentsToo() {
        LoopMetrics metrics = LoopMetrics.builder().clarificationRounds(3).build();

        LoopLimitCheck check = governor.check(metrics, "resume_generator");

        assertThat(check.getCeiling()).isEqualTo(LoopLimitCheck.Ceiling.CLARIFICATION_ROUNDS);
        assertThat(check.message()).endsWith(LoopLimitGovernor.CLARIFICATION_SUGGESTION);
    }

    @Test
    void afterAgentRun_firstAgent_isNotASwitch() {
        LoopMetricsPatch patch = governor.afterAgentRun(LoopMetrics.empty(), "data_manager", 2);

        assertThat(patch.getAgentSwitches()).isZero();
        assertThat(patch.getToolCallDeltas()).containsEntry("data_manager", 2);
        assertThat(patch.getLastAgentType()).isEqualTo("data_manager");
    }

    @Test
    void afterAgentRun_differentAgent_countsSwitch() {
        LoopMetrics metrics = LoopMetrics.builder().agentSwitches(1).lastAgentType("data_manager").build();

        LoopMetricsPatch patch = governor.afterAgentRun(metrics, "user_profile", 0);

        assertThat(patch.getAgentSwitches()).isEqualTo(2);
        assertThat(patch.getToolCallDeltas()).isEmpty();
    }

    @Test
    void afterAgentRun_sameAgentAgain_isNotASwitch() {
        LoopMetrics metrics = LoopMetrics.builder().agentSwitches(1).lastAgentType("data_manager").build();

        assertThat(governor.afterAgentRun(metrics, "data_manager", 1).getAgentSwitches()).isEqualTo(1);
    }

    @Test
    void afterClarification_incrementsRounds() {
        LoopMetrics metrics = LoopMetrics.builder().clarificationRounds(1).build();
        assertThat(governor.afterClarification(metrics).getClarificationRounds()).isEqualTo(2);
    }

    @Test
    void summary_formatsAllCounters() {
        LoopMetrics metrics = LoopMetrics.builder()
                .agentSwitches(2)
                .toolCallsPerAgent(Map.of("a", 1, "b", 3))
                .clarificationRounds(1)
                .build();

        assertThat(metrics.summary())
                .isEqualTo("Agent switches: 2, Total tool calls: 4, Clarification rounds: 1, Last agent: none");
    }
}
