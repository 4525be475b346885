package com.careercraft.agent.control;

import com.careercraft.agent.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Enforces the per-turn ceilings that keep the supervisor/agent cycle finite.
 *
 * Checked on every agent entry, before any model call. Counters are only
 * advanced after an agent has run, through {@link #afterAgentRun}.
 */
@Component
@Slf4j
public class LoopLimitGovernor {

    static final String SWITCHES_SUGGESTION =
            "Consider breaking down your request into smaller, more specific tasks.";
    static final String TOOL_CALLS_SUGGESTION =
            "The agent has made many attempts. Please try rephrasing your request or provide more specific information.";
    static final String CLARIFICATION_SUGGESTION =
            "Too many clarification attempts. Please provide a more direct request.";

    private final AgentProperties.LoopLimits limits;

    public LoopLimitGovernor(AgentProperties properties) {
        this.limits = properties.getLoopLimits();
    }

    /**
     * Checks all three counters for the agent about to run, in order:
     * agent switches, tool calls of that agent, clarification rounds.
     */
    public LoopLimitCheck check(LoopMetrics metrics, String agentType) {
        if (metrics.getAgentSwitches() >= limits.getMaxAgentSwitches()) {
            return blocked(LoopLimitCheck.exceeded(LoopLimitCheck.Ceiling.AGENT_SWITCHES,
                    String.format("Maximum agent switches (%d) exceeded", limits.getMaxAgentSwitches()),
                    SWITCHES_SUGGESTION), agentType, metrics);
        }

        if (metrics.toolCallsFor(agentType) >= limits.getMaxToolCallsPerAgent()) {
            return blocked(LoopLimitCheck.exceeded(LoopLimitCheck.Ceiling.TOOL_CALLS_PER_AGENT,
                    String.format("Maximum tool calls for %s (%d) exceeded", agentType, limits.getMaxToolCallsPerAgent()),
                    TOOL_CALLS_SUGGESTION), agentType, metrics);
        }

        return clarificationCheck(metrics, agentType);
    }

    /** Clarification ceiling alone; the supervisor consults it before asking again */
    public LoopLimitCheck clarificationCheck(LoopMetrics metrics, String nodeName) {
        if (metrics.getClarificationRounds() >= limits.getMaxClarificationRounds()) {
            return blocked(LoopLimitCheck.exceeded(LoopLimitCheck.Ceiling.CLARIFICATION_ROUNDS,
                    String.format("Maximum clarification rounds (%d) exceeded", limits.getMaxClarificationRounds()),
                    CLARIFICATION_SUGGESTION), nodeName, metrics);
        }
        return LoopLimitCheck.withinLimits();
    }

    /**
     * Counter update after an agent ran: a switch is counted when a different
     * agent ran before it in this turn, and the agent's tool-call count grows by
     * the number of calls it actually executed.
     */
    public LoopMetricsPatch afterAgentRun(LoopMetrics metrics, String agentType, int executedToolCalls) {
        String last = metrics.getLastAgentType();
        boolean switched = last != null && !last.equals(agentType);

        return LoopMetricsPatch.builder()
                .agentSwitches(metrics.getAgentSwitches() + (switched ? 1 : 0))
                .toolCallDeltas(executedToolCalls > 0 ? Map.of(agentType, executedToolCalls) : Map.of())
                .lastAgentType(agentType)
                .build();
    }

    /** Counter update after the supervisor issued a clarification question */
    public LoopMetricsPatch afterClarification(LoopMetrics metrics) {
        return LoopMetricsPatch.builder()
                .clarificationRounds(metrics.getClarificationRounds() + 1)
                .build();
    }

    private LoopLimitCheck blocked(LoopLimitCheck check, String nodeName, LoopMetrics metrics) {
        log.warn("Loop limit hit [node={}, ceiling={}, {}]", nodeName, check.getCeiling(), metrics.summary());
        return check;
    }
}
