package com.careercraft.agent.tool.impl;

import com.careercraft.agent.profile.ProfileService;
import com.careercraft.agent.tool.CareerTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Returns part or all of the stored profile as pretty-printed JSON.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GetUserProfileTool implements CareerTool {

    private final ProfileService profileService;
    private final ObjectMapper objectMapper;

    @Override
    public String getName() {
        return "get_user_profile";
    }

    @Override
    public String getDescription() {
        return """
                Retrieve the user's stored career profile.
                Use this before writing or reviewing anything that depends on the user's background:
                their work history, education, skills, achievements or stated preferences.
                Choose 'all' only when several kinds of data are needed at once.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "dataType", Map.of(
                                "type", "string",
                                "enum", ProfileService.DATA_TYPES,
                                "description", "Which part of the profile to retrieve"
                        )
                ),
                "required", List.of("dataType")
        );
    }

    @Override
    public String execute(String userId, Map<String, Object> arguments) throws Exception {
        String dataType = (String) arguments.get("dataType");
        Object data = profileService.profileData(userId, dataType);
        log.debug("Retrieved profile data [userId={}, dataType={}]", userId, dataType);
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data);
    }
}
