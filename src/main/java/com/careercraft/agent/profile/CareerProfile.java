package com.careercraft.agent.profile;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the tools know about one user. One document per user, keyed by user id.
 *
 * Collection: career_profiles
 */
@Document(collection = "career_profiles")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CareerProfile {

    public enum Proficiency { BEGINNER, INTERMEDIATE, ADVANCED, EXPERT }

    @Id
    private String userId;

    @Builder.Default
    private List<WorkHistoryEntry> workHistory = new ArrayList<>();

    @Builder.Default
    private List<Education> education = new ArrayList<>();

    @Builder.Default
    private List<Skill> skills = new ArrayList<>();

    @Builder.Default
    private List<String> achievements = new ArrayList<>();

    /** category → preference */
    @Builder.Default
    private Map<String, String> preferences = new LinkedHashMap<>();

    @LastModifiedDate
    private Instant updatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WorkHistoryEntry {
        private String jobTitle;
        private String companyName;
        private String startDate;
        private String endDate;
        @Builder.Default
        private List<String> responsibilities = new ArrayList<>();
        @Builder.Default
        private List<String> achievements = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Education {
        private String institution;
        private String degree;
        private String fieldOfStudy;
        private String endDate;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Skill {
        private String name;
        private String category;
        private Proficiency proficiency;
        private String workContext;
        private Integer yearsExperience;
    }
}
