package com.careercraft.agent.agent.processor;

import com.careercraft.agent.profile.CareerProfile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Markdown renderings of profile data returned by {@code get_user_profile}.
 */
@Component
@RequiredArgsConstructor
public class ProfileDataFormatter {

    static final String NO_SKILLS =
            "No skills found in your profile yet. You can add skills by describing your work experience or uploading a resume.";

    private static final List<CareerProfile.Proficiency> LEVEL_ORDER = List.of(
            CareerProfile.Proficiency.EXPERT,
            CareerProfile.Proficiency.ADVANCED,
            CareerProfile.Proficiency.INTERMEDIATE,
            CareerProfile.Proficiency.BEGINNER);

    private final ObjectMapper objectMapper;

    /**
     * Skills grouped by proficiency, strongest first.
     *
     * @throws JsonProcessingException if {@code skillsJson} is not a skills array
     */
    public String formatSkills(String skillsJson) throws JsonProcessingException {
        List<CareerProfile.Skill> skills = objectMapper.readValue(skillsJson, new TypeReference<>() {});
        if (skills == null || skills.isEmpty()) {
            return NO_SKILLS;
        }

        Map<CareerProfile.Proficiency, StringBuilder> byLevel = new EnumMap<>(CareerProfile.Proficiency.class);
        StringBuilder unrated = new StringBuilder();
        for (CareerProfile.Skill skill : skills) {
            StringBuilder target = skill.getProficiency() == null
                    ? unrated
                    : byLevel.computeIfAbsent(skill.getProficiency(), p -> new StringBuilder());
            target.append("- **").append(skill.getName()).append("**");
            if (skill.getWorkContext() != null && !skill.getWorkContext().isBlank()) {
                target.append(" _(").append(skill.getWorkContext()).append(")_");
            }
            target.append('\n');
        }

        StringBuilder out = new StringBuilder("## Your Skills\n\n");
        for (CareerProfile.Proficiency level : LEVEL_ORDER) {
            StringBuilder lines = byLevel.get(level);
            if (lines != null) {
                out.append("### ").append(levelLabel(level)).append(" Level\n").append(lines).append('\n');
            }
        }
        if (!unrated.isEmpty()) {
            out.append("### Other Skills\n").append(unrated).append('\n');
        }
        out.append("_Total: ").append(skills.size()).append(" skills in your profile_");
        return out.toString();
    }

    /** Fenced JSON block */
    public String jsonBlock(String json) {
        return "```json\n" + json + "\n```";
    }

    /** {@code work_history} becomes {@code WORK HISTORY} */
    public String dataTypeHeading(String dataType) {
        return dataType == null ? "PROFILE" : dataType.replace('_', ' ').toUpperCase(Locale.ROOT);
    }

    private static String levelLabel(CareerProfile.Proficiency level) {
        String name = level.name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
