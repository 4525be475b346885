package com.careercraft.agent.tool;

import com.careercraft.agent.control.CompletedAction;

import java.util.List;
import java.util.Objects;

/**
 * Outcomes of one batch of tool calls, in request order.
 */
public record ToolExecutionReport(List<ToolCallOutcome> outcomes) {

    public ToolExecutionReport {
        outcomes = List.copyOf(outcomes);
    }

    /** Calls that ran, successfully or not; duplicates and rejections excluded */
    public int attemptedCount() {
        return (int) outcomes.stream().filter(ToolCallOutcome::wasAttempted).count();
    }

    /** Completed actions in execution order */
    public List<CompletedAction> completedActions() {
        return outcomes.stream()
                .map(ToolCallOutcome::getCompletedAction)
                .filter(Objects::nonNull)
                .toList();
    }

    public boolean anyExecuted() {
        return outcomes.stream().anyMatch(o -> o.getStatus() == ToolCallOutcome.Status.EXECUTED);
    }
}
