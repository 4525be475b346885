package com.careercraft.agent.agent.processor;

import com.careercraft.agent.tool.ToolCallOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.careercraft.agent.agent.processor.DataManagerResultProcessorTest.call;
import static com.careercraft.agent.agent.processor.DataManagerResultProcessorTest.executed;
import static org.assertj.core.api.Assertions.assertThat;

class UserProfileResultProcessorTest {

    private final UserProfileResultProcessor processor =
            new UserProfileResultProcessor(new ProfileDataFormatter(new ObjectMapper()));

    @Test
    void process_eachLookupGetsHeadingAndJsonBlock() {
        String summary = processor.process(ProcessingContext.builder()
                .outcomes(List.of(
                        executed("get_user_profile", Map.of("dataType", "work_history"), "[]"),
                        ToolCallOutcome.builder()
                                .call(call("get_user_profile"))
                                .status(ToolCallOutcome.Status.REJECTED)
                                .output("Error executing get_user_profile: dataType must be one of [...]")
                                .build()))
                .priorActions(List.of())
                .build());

        assertThat(summary).isEqualTo(UserProfileResultProcessor.HEADER
                + "## WORK HISTORY ##\n\n```json\n[]\n```\n\n"
                + "Error executing get_user_profile: dataType must be one of [...]");
    }
}
