package com.careercraft.agent.tool.impl;

import com.careercraft.agent.profile.CareerDocument;
import com.careercraft.agent.profile.CareerProfile;
import com.careercraft.agent.profile.ProfileService;
import com.careercraft.agent.tool.CareerTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Renders the stored profile as a Markdown resume and saves it as a document.
 */
@Component
@RequiredArgsConstructor
public class GenerateResumeTool implements CareerTool {

    static final List<String> DEFAULT_SECTIONS = List.of("experience", "education", "skills", "achievements");

    private final ProfileService profileService;

    @Override
    public String getName() {
        return "generate_resume";
    }

    @Override
    public String getDescription() {
        return """
                Generate a formatted resume from the user's stored profile and save it.
                Sections can be chosen from: experience, education, skills, achievements.
                Returns the resume text. If the profile is empty, ask the user for their background first.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "style", Map.of(
                                "type", "string",
                                "enum", List.of("Modern", "Traditional", "Creative", "Minimal"),
                                "description", "Visual style of the resume"
                        ),
                        "sections", Map.of(
                                "type", "array",
                                "items", Map.of("type", "string"),
                                "description", "Sections to include, in order"
                        )
                )
        );
    }

    @Override
    @SuppressWarnings("unchecked")
    public String execute(String userId, Map<String, Object> arguments) {
        String style = (String) arguments.getOrDefault("style", "Modern");
        List<String> sections = (List<String>) arguments.getOrDefault("sections", DEFAULT_SECTIONS);
        if (sections.isEmpty()) {
            sections = DEFAULT_SECTIONS;
        }

        CareerProfile profile = profileService.getOrCreate(userId);
        if (profile.getWorkHistory().isEmpty() && profile.getSkills().isEmpty()
                && profile.getEducation().isEmpty()) {
            return "The profile has no work history, education or skills yet, so there is nothing to build a resume from.";
        }

        StringBuilder resume = new StringBuilder("# Resume\n");
        for (String section : sections) {
            switch (section.strip().toLowerCase()) {
                case "experience", "work_history" -> appendExperience(resume, profile);
                case "education" -> appendEducation(resume, profile);
                case "skills" -> appendSkills(resume, profile);
                case "achievements" -> appendList(resume, "Achievements", profile.getAchievements());
                default -> {
                    // Unknown section names are ignored
                }
            }
        }

        CareerDocument saved = profileService.saveDocument(userId, CareerDocument.Type.RESUME,
                style + " resume", resume.toString(), null);
        return String.format("Generated %s resume [documentId=%s]\n\n%s", style, saved.getId(), resume);
    }

    private static void appendExperience(StringBuilder out, CareerProfile profile) {
        if (profile.getWorkHistory().isEmpty()) {
            return;
        }
        out.append("\n## Experience\n");
        for (CareerProfile.WorkHistoryEntry job : profile.getWorkHistory()) {
            out.append("\n### ").append(job.getJobTitle()).append(" | ").append(job.getCompanyName());
            if (job.getStartDate() != null) {
                out.append(" (").append(job.getStartDate()).append(" - ")
                        .append(job.getEndDate() != null ? job.getEndDate() : "present").append(')');
            }
            out.append('\n');
            job.getResponsibilities().forEach(r -> out.append("- ").append(r).append('\n'));
            job.getAchievements().forEach(a -> out.append("- ").append(a).append('\n'));
        }
    }

    private static void appendEducation(StringBuilder out, CareerProfile profile) {
        if (profile.getEducation().isEmpty()) {
            return;
        }
        out.append("\n## Education\n");
        for (CareerProfile.Education edu : profile.getEducation()) {
            out.append("- ");
            if (edu.getDegree() != null) {
                out.append(edu.getDegree()).append(", ");
            }
            out.append(edu.getInstitution());
            if (edu.getEndDate() != null) {
                out.append(" (").append(edu.getEndDate()).append(')');
            }
            out.append('\n');
        }
    }

    private static void appendSkills(StringBuilder out, CareerProfile profile) {
        appendList(out, "Skills", profile.getSkills().stream().map(CareerProfile.Skill::getName).toList());
    }

    private static void appendList(StringBuilder out, String heading, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        out.append("\n## ").append(heading).append('\n');
        items.forEach(i -> out.append("- ").append(i).append('\n'));
    }
}
