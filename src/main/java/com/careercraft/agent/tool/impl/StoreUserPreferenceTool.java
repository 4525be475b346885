package com.careercraft.agent.tool.impl;

import com.careercraft.agent.profile.ProfileService;
import com.careercraft.agent.tool.CareerTool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Persists a writing or presentation preference on the user's profile,
 * keyed by category so a later preference for the same category replaces it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StoreUserPreferenceTool implements CareerTool {

    private final ProfileService profileService;

    @Override
    public String getName() {
        return "store_user_preference";
    }

    @Override
    public String getDescription() {
        return """
                Store a user preference such as grammar style, favourite phrases, or resume style choices.
                Use this when the user states how they want their documents written or presented,
                e.g. "always use British spelling" or "I prefer a one-page resume".
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "category", Map.of(
                                "type", "string",
                                "enum", List.of("grammar", "phrases", "resume_style", "other"),
                                "description", "What the preference applies to"
                        ),
                        "preference", Map.of(
                                "type", "string",
                                "description", "The preference, written as a clear statement"
                        )
                ),
                "required", List.of("category", "preference")
        );
    }

    @Override
    public String execute(String userId, Map<String, Object> arguments) {
        String category = (String) arguments.get("category");
        String preference = (String) arguments.get("preference");

        profileService.storePreference(userId, category, preference);
        return String.format("Successfully stored user preference for %s: %s", category, preference);
    }
}
