package com.careercraft.agent.agent.processor;

import com.careercraft.agent.control.CompletedAction;
import com.careercraft.agent.tool.ToolCallOutcome;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ProcessingContext {

    String agentType;
    String userId;

    /** One outcome per validated call, in request order */
    List<ToolCallOutcome> outcomes;

    /** Cleaned text the model sent alongside its tool calls; may be empty */
    String responseText;

    /** Completed actions from before this batch ran */
    List<CompletedAction> priorActions;

    public boolean anyExecuted() {
        return outcomes.stream().anyMatch(o -> o.getStatus() == ToolCallOutcome.Status.EXECUTED);
    }

    public boolean hasResponseText() {
        return responseText != null && !responseText.isBlank();
    }
}
