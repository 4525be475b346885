package com.careercraft.agent.tool.impl;

import com.careercraft.agent.profile.JobPosting;
import com.careercraft.agent.profile.JobPostingTextParser;
import com.careercraft.agent.profile.ProfileService;
import com.careercraft.agent.tool.CareerTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Stores a pasted job posting together with the requirements parsed out of it.
 * Registered as a content tool, like {@link ParseAndStoreResumeTool}.
 */
@Component
@RequiredArgsConstructor
public class ParseAndStoreJobPostingTool implements CareerTool {

    private final JobPostingTextParser parser;
    private final ProfileService profileService;

    @Override
    public String getName() {
        return "parse_and_store_job_posting";
    }

    @Override
    public String getDescription() {
        return """
                Parse the full text of a job posting the user pasted and store it,
                extracting the title, company, location, required skills and nice-to-have skills.
                Pass the posting text exactly as the user provided it.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "content", Map.of(
                                "type", "string",
                                "description", "The complete job posting text"
                        )
                ),
                "required", List.of("content")
        );
    }

    @Override
    public String execute(String userId, Map<String, Object> arguments) {
        String content = (String) arguments.get("content");
        JobPosting saved = profileService.storeJobPosting(userId, content, parser.parse(content));

        return String.format("Stored job posting [id=%s]: %s%s%s\nRequired skills: %s\nBonus skills: %s",
                saved.getId(),
                saved.getTitle(),
                saved.getCompany() != null ? " at " + saved.getCompany() : "",
                saved.getLocation() != null ? " (" + saved.getLocation() + ")" : "",
                saved.getRequiredSkills().isEmpty() ? "none listed" : String.join("; ", saved.getRequiredSkills()),
                saved.getBonusSkills().isEmpty() ? "none listed" : String.join("; ", saved.getBonusSkills()));
    }
}
