package com.careercraft.agent.tool.impl;

import com.careercraft.agent.profile.CareerDocument;
import com.careercraft.agent.profile.CareerProfile;
import com.careercraft.agent.profile.ProfileService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerateResumeToolTest {

    @Mock ProfileService profileService;

    @InjectMocks
    GenerateResumeTool tool;

    @Test
    void execute_emptyProfile_explainsInsteadOfSaving() {
        when(profileService.getOrCreate("u1")).thenReturn(CareerProfile.builder().userId("u1").build());

        String result = tool.execute("u1", Map.of());

        assertThat(result).startsWith("The profile has no work history");
        verify(profileService).getOrCreate("u1");
        verifyNoMoreInteractions(profileService);
    }

    @Test
    void execute_requestedSections_renderedInOrderAndSaved() {
        CareerProfile profile = CareerProfile.builder().userId("u1").build();
        profile.getWorkHistory().add(CareerProfile.WorkHistoryEntry.builder()
                .jobTitle("Engineer").companyName("Acme").startDate("2020").build());
        profile.getSkills().add(CareerProfile.Skill.builder().name("Java").build());
        when(profileService.getOrCreate("u1")).thenReturn(profile);
        when(profileService.saveDocument(eq("u1"), eq(CareerDocument.Type.RESUME), anyString(), anyString(), isNull()))
                .thenAnswer(inv -> CareerDocument.builder().id("doc-1").content(inv.getArgument(3)).build());

        String result = tool.execute("u1", Map.of("style", "Classic", "sections", List.of("skills", "experience")));

        assertThat(result).startsWith("Generated Classic resume [documentId=doc-1]");
        assertThat(result.indexOf("## Skills")).isLessThan(result.indexOf("## Experience"));
        assertThat(result).contains("### Engineer | Acme (2020 - present)");
        verify(profileService).saveDocument(eq("u1"), eq(CareerDocument.Type.RESUME), eq("Classic resume"),
                any(), isNull());
    }
}
