package com.careercraft.agent.tool.impl;

import com.careercraft.agent.profile.CareerProfile;
import com.careercraft.agent.profile.ProfileService;
import com.careercraft.agent.tool.CareerTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Adds one role to the user's work history.
 */
@Component
@RequiredArgsConstructor
public class StoreWorkHistoryTool implements CareerTool {

    private final ProfileService profileService;

    @Override
    public String getName() {
        return "store_work_history";
    }

    @Override
    public String getDescription() {
        return """
                Store a role in the user's work history.
                Use this when the user describes a job they hold or held: title, company, dates,
                what they were responsible for and what they achieved there.
                Storing the same title and company again replaces the earlier entry.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "jobTitle", Map.of("type", "string", "description", "Job title"),
                        "companyName", Map.of("type", "string", "description", "Employer name"),
                        "startDate", Map.of("type", "string", "description", "Start date in YYYY-MM-DD format"),
                        "endDate", Map.of("type", "string",
                                "description", "End date in YYYY-MM-DD format, or 'present' for current positions"),
                        "responsibilities", Map.of("type", "array", "items", Map.of("type", "string"),
                                "description", "Main responsibilities in the role"),
                        "achievements", Map.of("type", "array", "items", Map.of("type", "string"),
                                "description", "Notable achievements in the role")
                ),
                "required", List.of("jobTitle", "companyName")
        );
    }

    @Override
    @SuppressWarnings("unchecked")
    public String execute(String userId, Map<String, Object> arguments) {
        CareerProfile.WorkHistoryEntry entry = CareerProfile.WorkHistoryEntry.builder()
                .jobTitle((String) arguments.get("jobTitle"))
                .companyName((String) arguments.get("companyName"))
                .startDate((String) arguments.get("startDate"))
                .endDate((String) arguments.get("endDate"))
                .responsibilities(new ArrayList<>((List<String>) arguments.getOrDefault("responsibilities", List.of())))
                .achievements(new ArrayList<>((List<String>) arguments.getOrDefault("achievements", List.of())))
                .build();

        profileService.addWorkHistory(userId, entry);
        return String.format("Successfully stored work history: %s at %s",
                entry.getJobTitle(), entry.getCompanyName());
    }
}
