package com.careercraft.agent.tool;

import com.careercraft.agent.control.CompletedAction;
import com.careercraft.agent.control.DuplicateActionDetector;
import com.careercraft.agent.control.DuplicateCheck;
import com.careercraft.agent.exception.ToolArgumentException;
import com.careercraft.agent.model.ToolCall;
import com.careercraft.agent.parsing.ToolArgumentValidator;
import com.careercraft.agent.resilience.OperationTimeouts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs an agent's validated tool calls one at a time, in the order the model
 * returned them, so a completed action recorded for one call is visible to the
 * duplicate check of the next.
 *
 * Per call: resolve the tool, repair its arguments, check for a duplicate,
 * execute under the tool time budget. Every failure is isolated to its call and
 * reported as that call's output; nothing here throws.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ToolCallExecutor {

    private final DuplicateActionDetector duplicateDetector;
    private final ToolArgumentValidator argumentValidator;
    private final OperationTimeouts timeouts;

    public ToolExecutionReport execute(String agentType,
                                       List<ToolCall> calls,
                                       List<AgentTool> tools,
                                       List<CompletedAction> priorActions) {
        List<CompletedAction> seen = new ArrayList<>(priorActions);
        List<ToolCallOutcome> outcomes = new ArrayList<>(calls.size());

        for (ToolCall call : calls) {
            ToolCallOutcome outcome = executeOne(agentType, call, tools, seen);
            if (outcome.getCompletedAction() != null) {
                seen.add(outcome.getCompletedAction());
            }
            outcomes.add(outcome);
        }

        return new ToolExecutionReport(outcomes);
    }

    private ToolCallOutcome executeOne(String agentType, ToolCall call, List<AgentTool> tools,
                                       List<CompletedAction> seen) {
        String toolName = call.getToolName();

        AgentTool tool = tools.stream()
                .filter(t -> t.getName().equals(toolName))
                .findFirst()
                .orElse(null);
        if (tool == null) {
            log.warn("Tool {} not found for {} [available={}]", toolName, agentType,
                    tools.stream().map(AgentTool::getName).toList());
            return outcome(call, ToolCallOutcome.Status.UNKNOWN_TOOL, "Error: Tool " + toolName + " not found");
        }

        Map<String, Object> args;
        try {
            args = argumentValidator.validate(toolName, tool.getInputSchema(), call.getArguments());
        } catch (ToolArgumentException e) {
            return outcome(call, ToolCallOutcome.Status.REJECTED, errorText(toolName, e));
        }

        DuplicateCheck duplicate = duplicateDetector.check(agentType, toolName, args, seen);
        if (duplicate.isDuplicate()) {
            return outcome(call, ToolCallOutcome.Status.SKIPPED_DUPLICATE,
                    duplicateDetector.skipMessage(toolName, duplicate));
        }

        log.info("Executing tool {} [agent={}, args={}]", toolName, agentType, args.keySet());
        long start = System.currentTimeMillis();
        try {
            String result = timeouts.tool(toolName, () -> tool.execute(args));
            String output = result != null ? result : "";
            log.info("Tool {} executed successfully [agent={}, resultLength={}, latency={}ms]",
                    toolName, agentType, output.length(), System.currentTimeMillis() - start);

            return ToolCallOutcome.builder()
                    .call(call)
                    .status(ToolCallOutcome.Status.EXECUTED)
                    .output(output)
                    .effectiveArguments(args)
                    .completedAction(duplicateDetector.record(agentType, toolName, args, output))
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(call, args, errorText(toolName, e));
        } catch (Exception e) {
            log.error("Error executing tool {} [agent={}, args={}]", toolName, agentType, args.keySet(), e);
            return failed(call, args, errorText(toolName, e));
        }
    }

    private static String errorText(String toolName, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return "Error executing " + toolName + ": " + message;
    }

    private static ToolCallOutcome outcome(ToolCall call, ToolCallOutcome.Status status, String output) {
        return ToolCallOutcome.builder().call(call).status(status).output(output).build();
    }

    private static ToolCallOutcome failed(ToolCall call, Map<String, Object> args, String output) {
        return ToolCallOutcome.builder()
                .call(call)
                .status(ToolCallOutcome.Status.FAILED)
                .output(output)
                .effectiveArguments(args)
                .build();
    }
}
