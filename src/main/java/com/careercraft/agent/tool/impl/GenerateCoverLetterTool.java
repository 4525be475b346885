package com.careercraft.agent.tool.impl;

import com.careercraft.agent.profile.CareerDocument;
import com.careercraft.agent.profile.CareerProfile;
import com.careercraft.agent.profile.JobPosting;
import com.careercraft.agent.profile.ProfileService;
import com.careercraft.agent.tool.CareerTool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Drafts a cover letter from the profile, aimed at a stored posting or at a
 * company and title given directly.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GenerateCoverLetterTool implements CareerTool {

    private final ProfileService profileService;

    @Override
    public String getName() {
        return "generate_cover_letter";
    }

    @Override
    public String getDescription() {
        return """
                Draft a cover letter based on the user's profile.
                Target it either at a stored job posting (jobPostingId, from find_job_postings)
                or at a company and job title the user names.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "jobPostingId", Map.of("type", "string", "description", "ID of a stored job posting"),
                        "companyName", Map.of("type", "string", "description", "Company the letter is addressed to"),
                        "jobTitle", Map.of("type", "string", "description", "Position being applied for"),
                        "tone", Map.of(
                                "type", "string",
                                "enum", List.of("Formal", "Conversational", "Enthusiastic", "Professional"),
                                "description", "Tone of the letter"
                        )
                )
        );
    }

    @Override
    public String execute(String userId, Map<String, Object> arguments) {
        String jobPostingId = (String) arguments.get("jobPostingId");
        String company = (String) arguments.get("companyName");
        String title = (String) arguments.get("jobTitle");
        String tone = (String) arguments.getOrDefault("tone", "Professional");
        List<String> requirements = List.of();

        if (jobPostingId != null) {
            JobPosting posting = profileService.findPosting(userId, jobPostingId)
                    .orElseThrow(() -> new IllegalArgumentException("Job posting " + jobPostingId + " not found"));
            company = company != null ? company : posting.getCompany();
            title = title != null ? title : posting.getTitle();
            requirements = posting.getRequiredSkills();
        }
        if (company == null && title == null) {
            throw new IllegalArgumentException("Provide a jobPostingId, or a companyName and jobTitle");
        }

        CareerProfile profile = profileService.getOrCreate(userId);
        String letter = compose(profile, company, title, tone, requirements);

        CareerDocument saved = profileService.saveDocument(userId, CareerDocument.Type.COVER_LETTER,
                "Cover letter" + (company != null ? " for " + company : ""), letter, jobPostingId);
        log.info("Drafted cover letter [userId={}, company={}, tone={}]", userId, company, tone);
        return String.format("Generated %s cover letter [documentId=%s]\n\n%s", tone, saved.getId(), letter);
    }

    private static String compose(CareerProfile profile, String company, String title, String tone,
                                  List<String> requirements) {
        String greeting = "Conversational".equals(tone) ? "Hi " : "Dear ";
        String role = title != null ? "the " + title + " position" : "an open position";
        String at = company != null ? " at " + company : "";

        StringBuilder letter = new StringBuilder()
                .append(greeting).append(company != null ? company : "Hiring Manager").append(" team,\n\n")
                .append("Enthusiastic".equals(tone) ? "I am thrilled to apply for " : "I am writing to apply for ")
                .append(role).append(at).append(".\n");

        if (!profile.getWorkHistory().isEmpty()) {
            CareerProfile.WorkHistoryEntry latest = profile.getWorkHistory().get(profile.getWorkHistory().size() - 1);
            letter.append("\nIn my role as ").append(latest.getJobTitle())
                    .append(" at ").append(latest.getCompanyName());
            if (!latest.getAchievements().isEmpty()) {
                letter.append(", I ").append(lowerFirst(latest.getAchievements().get(0)));
            }
            letter.append(".\n");
        }

        List<String> matched = profile.getSkills().stream()
                .map(CareerProfile.Skill::getName)
                .filter(skill -> requirements.isEmpty()
                        || requirements.stream().anyMatch(r -> r.toLowerCase().contains(skill.toLowerCase())))
                .limit(5)
                .toList();
        if (!matched.isEmpty()) {
            letter.append("\nI bring experience with ")
                    .append(matched.stream().collect(Collectors.joining(", ")))
                    .append(".\n");
        }

        letter.append("\nThank you for your consideration.\n\nSincerely,\n");
        return letter.toString();
    }

    private static String lowerFirst(String s) {
        return s.isEmpty() ? s : Character.toLowerCase(s.charAt(0)) + s.substring(1);
    }
}
