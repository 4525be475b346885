package com.careercraft.agent.agent.processor;

import com.careercraft.agent.tool.ToolCallOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Summary for the read-only profile role: one JSON section per lookup.
 */
@Component
@RequiredArgsConstructor
public class UserProfileResultProcessor implements ToolResultProcessor {

    static final String HEADER = "Here's the information from your profile:\n\n";

    private final ProfileDataFormatter formatter;

    @Override
    public String process(ProcessingContext context) {
        StringBuilder summary = new StringBuilder(HEADER);

        for (ToolCallOutcome outcome : context.getOutcomes()) {
            if (outcome.getStatus() != ToolCallOutcome.Status.EXECUTED) {
                summary.append(outcome.getOutput()).append("\n\n");
                continue;
            }
            Object dataType = outcome.getEffectiveArguments().get("dataType");
            summary.append("## ").append(formatter.dataTypeHeading(dataType == null ? null : dataType.toString()))
                    .append(" ##\n\n")
                    .append(formatter.jsonBlock(outcome.getOutput()))
                    .append("\n\n");
        }

        return summary.toString().stripTrailing();
    }
}
