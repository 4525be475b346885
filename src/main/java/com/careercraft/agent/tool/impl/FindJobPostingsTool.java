package com.careercraft.agent.tool.impl;

import com.careercraft.agent.profile.JobPosting;
import com.careercraft.agent.profile.ProfileService;
import com.careercraft.agent.tool.CareerTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Lists the user's stored job postings, newest first, optionally filtered by
 * title or company.
 */
@Component
@RequiredArgsConstructor
public class FindJobPostingsTool implements CareerTool {

    static final int DEFAULT_LIMIT = 10;
    static final int MAX_LIMIT = 50;

    private final ProfileService profileService;

    @Override
    public String getName() {
        return "find_job_postings";
    }

    @Override
    public String getDescription() {
        return """
                Find job postings the user has stored.
                Optionally filter by a word from the job title or company name.
                Returns each posting's ID, which other tools accept as jobPostingId.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "query", Map.of(
                                "type", "string",
                                "description", "Text to match against job title or company (optional)"
                        ),
                        "limit", Map.of(
                                "type", "integer",
                                "description", "Maximum number of postings to return (default 10, max 50)"
                        )
                )
        );
    }

    @Override
    public String execute(String userId, Map<String, Object> arguments) {
        String query = (String) arguments.get("query");
        int limit = arguments.get("limit") instanceof Number n
                ? Math.max(1, Math.min(n.intValue(), MAX_LIMIT))
                : DEFAULT_LIMIT;

        List<JobPosting> postings = profileService.findPostings(userId, query, limit);
        if (postings.isEmpty()) {
            return query == null || query.isBlank()
                    ? "No job postings stored yet."
                    : "No job postings found matching: " + query;
        }

        StringBuilder sb = new StringBuilder();
        for (JobPosting p : postings) {
            sb.append("- [").append(p.getId()).append("] ").append(p.getTitle());
            if (p.getCompany() != null) {
                sb.append(" at ").append(p.getCompany());
            }
            if (p.getLocation() != null) {
                sb.append(" (").append(p.getLocation()).append(')');
            }
            sb.append('\n');
        }
        return sb.toString().stripTrailing();
    }
}
