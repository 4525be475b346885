package com.careercraft.agent.tool.impl;

import com.careercraft.agent.profile.ProfileService;
import com.careercraft.agent.profile.ResumeTextParser;
import com.careercraft.agent.tool.CareerTool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Parses pasted resume text and merges what it finds into the profile.
 * Registered as a content tool: the same resume text is not processed twice
 * inside the recency window.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ParseAndStoreResumeTool implements CareerTool {

    private final ResumeTextParser parser;
    private final ProfileService profileService;

    @Override
    public String getName() {
        return "parse_and_store_resume";
    }

    @Override
    public String getDescription() {
        return """
                Parse the full text of a resume the user pasted and store its work history,
                education, skills and achievements in their profile.
                Pass the resume text exactly as the user provided it.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "content", Map.of(
                                "type", "string",
                                "description", "The complete resume text"
                        )
                ),
                "required", List.of("content")
        );
    }

    @Override
    public String execute(String userId, Map<String, Object> arguments) {
        String content = (String) arguments.get("content");

        ResumeTextParser.ParsedResume parsed = parser.parse(content);
        if (parsed.isEmpty()) {
            log.warn("Nothing recognisable in resume text [userId={}, length={}]", userId, content.length());
            return "I couldn't find any recognisable sections (Experience, Education, Skills) in that resume text.";
        }

        ProfileService.MergeSummary summary = profileService.mergeParsedResume(userId, parsed);
        return String.format(
                "Resume processed: %d work history entries (%d new), %d education entries, %d skills (%d new), %d achievements.",
                parsed.workHistory().size(), summary.newRoles(), summary.education(),
                parsed.skills().size(), summary.newSkills(), summary.achievements());
    }
}
