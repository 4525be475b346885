package com.careercraft.agent.agent;

import com.careercraft.agent.agent.processor.DataManagerResultProcessor;
import com.careercraft.agent.agent.processor.JobPostingResultProcessor;
import com.careercraft.agent.agent.processor.UserProfileResultProcessor;
import com.careercraft.agent.graph.GraphNode;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * The five specialized agents: instructions, tool subset and optional result processor.
 */
@Configuration
public class AgentRoles {

    @Bean
    public AgentRoleConfig dataManagerRole(DataManagerResultProcessor processor) {
        return AgentRoleConfig.builder()
                .role(GraphNode.DATA_MANAGER)
                .systemMessage(AgentPrompts.DATA_MANAGER)
                .toolNames(List.of("store_user_preference", "store_work_history",
                        "get_user_profile", "parse_and_store_resume"))
                .resultProcessor(processor)
                .build();
    }

    @Bean
    public AgentRoleConfig resumeGeneratorRole() {
        return AgentRoleConfig.builder()
                .role(GraphNode.RESUME_GENERATOR)
                .systemMessage(AgentPrompts.RESUME_GENERATOR)
                .toolNames(List.of("get_user_profile", "generate_resume"))
                .build();
    }

    @Bean
    public AgentRoleConfig coverLetterGeneratorRole() {
        return AgentRoleConfig.builder()
                .role(GraphNode.COVER_LETTER_GENERATOR)
                .systemMessage(AgentPrompts.COVER_LETTER_GENERATOR)
                .toolNames(List.of("get_user_profile", "find_job_postings", "generate_cover_letter"))
                .build();
    }

    @Bean
    public AgentRoleConfig userProfileRole(UserProfileResultProcessor processor) {
        return AgentRoleConfig.builder()
                .role(GraphNode.USER_PROFILE)
                .systemMessage(AgentPrompts.USER_PROFILE)
                .toolNames(List.of("get_user_profile"))
                .resultProcessor(processor)
                .build();
    }

    @Bean
    public AgentRoleConfig jobPostingManagerRole(JobPostingResultProcessor processor) {
        return AgentRoleConfig.builder()
                .role(GraphNode.JOB_POSTING_MANAGER)
                .systemMessage(AgentPrompts.JOB_POSTING_MANAGER)
                .toolNames(List.of("parse_and_store_job_posting", "find_job_postings",
                        "compare_skills_to_job", "get_user_profile"))
                .resultProcessor(processor)
                .build();
    }
}
