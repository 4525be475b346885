package com.careercraft.agent.agent.processor;

import com.careercraft.agent.tool.ToolCallOutcome;
import org.springframework.stereotype.Component;

/**
 * Summary for the job posting manager. The header says "processed" only when
 * at least one tool actually ran in this batch.
 */
@Component
public class JobPostingResultProcessor implements ToolResultProcessor {

    static final String PROCESSED_HEADER = "I've processed your job posting request:\n\n";
    static final String REVIEWED_HEADER = "I reviewed your job posting request:\n\n";

    @Override
    public String process(ProcessingContext context) {
        StringBuilder body = new StringBuilder();

        for (ToolCallOutcome outcome : context.getOutcomes()) {
            if (outcome.getStatus() != ToolCallOutcome.Status.EXECUTED) {
                body.append(outcome.getOutput()).append('\n');
                continue;
            }
            String result = outcome.getOutput();
            switch (outcome.getCall().getToolName()) {
                case "find_job_postings" -> body.append("• Found job postings:\n").append(result).append('\n');
                case "compare_skills_to_job" -> body.append("• Skill comparison analysis:\n").append(result).append('\n');
                case "get_user_profile" -> body.append("• Retrieved user profile data:\n").append(result).append('\n');
                default -> body.append(result).append('\n');
            }
        }

        if (context.hasResponseText()) {
            body.append('\n').append(context.getResponseText());
        }

        String header = context.anyExecuted() ? PROCESSED_HEADER : REVIEWED_HEADER;
        return (header + body).stripTrailing();
    }
}
