package com.careercraft.agent.agent.processor;

import com.careercraft.agent.tool.ToolCallOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Summary for the data manager: one bullet per stored item, formatted profile
 * data for lookups, and the parse report for resumes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DataManagerResultProcessor implements ToolResultProcessor {

    static final String HEADER = "I've processed your request:\n\n";

    private final ProfileDataFormatter formatter;

    @Override
    public String process(ProcessingContext context) {
        StringBuilder summary = new StringBuilder(HEADER);

        for (ToolCallOutcome outcome : context.getOutcomes()) {
            if (outcome.getStatus() != ToolCallOutcome.Status.EXECUTED) {
                summary.append(outcome.getOutput()).append('\n');
                continue;
            }
            Map<String, Object> args = outcome.getEffectiveArguments();
            switch (outcome.getCall().getToolName()) {
                case "store_user_preference" -> summary.append(String.format("• Stored preference for %s: %s\n",
                        args.get("category"), args.get("preference")));
                case "store_work_history" -> summary.append(String.format("• Stored work history: %s at %s\n",
                        args.get("jobTitle"), args.get("companyName")));
                case "get_user_profile" -> summary.append(profileSection(args, outcome.getOutput())).append('\n');
                default -> summary.append(outcome.getOutput()).append('\n');
            }
        }

        if (context.hasResponseText()) {
            summary.append('\n').append(context.getResponseText());
        }
        return summary.toString().stripTrailing();
    }

    private String profileSection(Map<String, Object> args, String output) {
        Object dataType = args.get("dataType");
        if ("skills".equals(dataType)) {
            try {
                return formatter.formatSkills(output);
            } catch (JsonProcessingException e) {
                log.warn("Skills result was not a skills array, showing it raw: {}", e.getOriginalMessage());
            }
        }
        return "• Retrieved " + dataType + " data:\n\n" + formatter.jsonBlock(output) + "\n";
    }
}
