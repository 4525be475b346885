package com.careercraft.agent.tool.impl;

import com.careercraft.agent.profile.CareerProfile;
import com.careercraft.agent.profile.JobPosting;
import com.careercraft.agent.profile.ProfileService;
import com.careercraft.agent.tool.CareerTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores the user's skills against a stored posting's requirements.
 *
 * A requirement counts as met when it mentions one of the user's skills by
 * name. The score is the share of required skills met; bonus skills only feed
 * the report.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CompareSkillsToJobTool implements CareerTool {

    private final ProfileService profileService;
    private final ObjectMapper objectMapper;

    @Override
    public String getName() {
        return "compare_skills_to_job";
    }

    @Override
    public String getDescription() {
        return """
                Compare the user's skills against a stored job posting's requirements and report
                which requirements are met, which are missing, and an overall fit score.
                Identify the posting by jobPostingId, or by job title and/or company.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "jobPostingId", Map.of("type", "string", "description", "ID of the job posting to compare against"),
                        "jobTitle", Map.of("type", "string", "description", "Title of the posting, when the ID is unknown"),
                        "company", Map.of("type", "string", "description", "Company of the posting, when the ID is unknown")
                )
        );
    }

    @Override
    public String execute(String userId, Map<String, Object> arguments) throws Exception {
        JobPosting posting = resolvePosting(userId, arguments);
        CareerProfile profile = profileService.getOrCreate(userId);
        List<String> skills = profile.getSkills().stream()
                .map(CareerProfile.Skill::getName)
                .filter(n -> n != null && !n.isBlank())
                .toList();

        List<String> met = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String requirement : posting.getRequiredSkills()) {
            (mentionsAny(requirement, skills) ? met : missing).add(requirement);
        }
        List<String> bonusMet = posting.getBonusSkills().stream()
                .filter(b -> mentionsAny(b, skills))
                .toList();

        int total = posting.getRequiredSkills().size();
        int score = total == 0 ? 0 : Math.round(100f * met.size() / total);

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("jobPosting", Map.of(
                "id", posting.getId(),
                "title", String.valueOf(posting.getTitle()),
                "company", String.valueOf(posting.getCompany())));
        report.put("overallScore", score);
        report.put("requirementsMet", met);
        report.put("requirementsMissing", missing);
        report.put("bonusSkillsMet", bonusMet);
        report.put("overallFit", fitLabel(score, total));

        log.info("Compared skills to job [userId={}, postingId={}, score={}]", userId, posting.getId(), score);
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
    }

    private JobPosting resolvePosting(String userId, Map<String, Object> arguments) {
        String id = (String) arguments.get("jobPostingId");
        if (id != null) {
            return profileService.findPosting(userId, id)
                    .orElseThrow(() -> new IllegalArgumentException("Job posting " + id + " not found"));
        }

        String title = (String) arguments.get("jobTitle");
        String company = (String) arguments.get("company");
        if (title == null && company == null) {
            throw new IllegalArgumentException(
                    "Please provide either a job posting ID, job title, or company name to identify the job posting");
        }
        String query = title != null ? title : company;
        return profileService.findPostings(userId, query, FindJobPostingsTool.MAX_LIMIT).stream()
                .filter(p -> company == null || containsIgnoreCase(p.getCompany(), company))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No job posting matches the specified criteria"));
    }

    private static boolean mentionsAny(String requirement, List<String> skills) {
        return skills.stream().anyMatch(skill -> containsIgnoreCase(requirement, skill));
    }

    private static boolean containsIgnoreCase(String text, String part) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(part.toLowerCase(Locale.ROOT));
    }

    private static String fitLabel(int score, int requirements) {
        if (requirements == 0) {
            return "No explicit requirements found in the posting";
        }
        if (score >= 80) {
            return "Excellent match - Strong candidate";
        }
        if (score >= 60) {
            return "Good match - Suitable candidate";
        }
        if (score >= 40) {
            return "Moderate fit - Some skill development needed";
        }
        return "Lower compatibility - Consider improving key skills";
    }
}
