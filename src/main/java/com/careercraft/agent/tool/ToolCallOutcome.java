package com.careercraft.agent.tool;

import com.careercraft.agent.control.CompletedAction;
import com.careercraft.agent.model.ToolCall;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * What happened to one requested tool call.
 */
@Value
@Builder
public class ToolCallOutcome {

    public enum Status {
        /** The tool ran and returned a result */
        EXECUTED,
        /** The tool ran and threw, or ran past its time budget */
        FAILED,
        /** Arguments did not match the tool's schema; the tool never ran */
        REJECTED,
        /** The agent has no tool by this name */
        UNKNOWN_TOOL,
        /** Repeat of a completed action; the previous result is reported instead */
        SKIPPED_DUPLICATE
    }

    ToolCall call;
    Status status;

    /** Text of the tool-role message for this call */
    String output;

    /** Set only for {@link Status#EXECUTED} */
    CompletedAction completedAction;

    /** Repaired arguments the tool actually received, when it ran */
    Map<String, Object> effectiveArguments;

    /** Counts toward the per-agent tool-call ceiling */
    public boolean wasAttempted() {
        return status == Status.EXECUTED || status == Status.FAILED;
    }
}
