package com.careercraft.agent.profile;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A job posting a user pasted in, with the requirements pulled out of it.
 *
 * Collection: job_postings
 */
@Document(collection = "job_postings")
@CompoundIndex(name = "idx_user_date", def = "{'userId': 1, 'createdAt': -1}")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobPosting {

    @Id
    private String id;

    @Indexed
    private String userId;

    private String title;
    private String company;
    private String location;

    private String content;

    @Builder.Default
    private List<String> requiredSkills = new ArrayList<>();

    @Builder.Default
    private List<String> bonusSkills = new ArrayList<>();

    @CreatedDate
    private Instant createdAt;
}
