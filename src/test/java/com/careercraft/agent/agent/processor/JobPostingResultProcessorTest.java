package com.careercraft.agent.agent.processor;

import com.careercraft.agent.tool.ToolCallOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.careercraft.agent.agent.processor.DataManagerResultProcessorTest.call;
import static com.careercraft.agent.agent.processor.DataManagerResultProcessorTest.executed;
import static org.assertj.core.api.Assertions.assertThat;

class JobPostingResultProcessorTest {

    private final JobPostingResultProcessor processor = new JobPostingResultProcessor();

    @Test
    void process_executedCalls_useProcessedHeaderAndLabels() {
        String summary = processor.process(context(List.of(
                executed("find_job_postings", Map.of(), "- [p1] Engineer at Acme"),
                executed("compare_skills_to_job", Map.of(), "{\"overallScore\":80}")), ""));

        assertThat(summary).isEqualTo(JobPostingResultProcessor.PROCESSED_HEADER
                + "• Found job postings:\n- [p1] Engineer at Acme\n"
                + "• Skill comparison analysis:\n{\"overallScore\":80}");
    }

    @Test
    void process_nothingExecuted_usesReviewedHeader() {
        ToolCallOutcome skipped = ToolCallOutcome.builder()
                .call(call("parse_and_store_job_posting"))
                .status(ToolCallOutcome.Status.SKIPPED_DUPLICATE)
                .output("• Skipped parse_and_store_job_posting: already processed")
                .build();

        String summary = processor.process(context(List.of(skipped), "Already stored."));

        assertThat(summary).startsWith(JobPostingResultProcessor.REVIEWED_HEADER)
                .endsWith("\n\nAlready stored.");
    }

    @Test
    void process_storedPosting_isAppendedRaw() {
        String summary = processor.process(context(List.of(
                executed("parse_and_store_job_posting", Map.of(), "Stored job posting [id=p9]: Engineer at Acme")), ""));

        assertThat(summary).endsWith("Stored job posting [id=p9]: Engineer at Acme");
    }

    private static ProcessingContext context(List<ToolCallOutcome> outcomes, String text) {
        return ProcessingContext.builder()
                .agentType("job_posting_manager")
                .outcomes(outcomes)
                .responseText(text)
                .priorActions(List.of())
                .build();
    }
}
