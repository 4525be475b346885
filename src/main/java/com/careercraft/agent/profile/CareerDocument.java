package com.careercraft.agent.profile;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A generated resume or cover letter.
 *
 * Collection: career_documents
 */
@Document(collection = "career_documents")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CareerDocument {

    public enum Type { RESUME, COVER_LETTER }

    @Id
    private String id;

    @Indexed
    private String userId;

    private Type type;

    /** Set for cover letters written against a stored posting */
    private String jobPostingId;

    private String title;

    private String content;

    @CreatedDate
    private Instant createdAt;
}
