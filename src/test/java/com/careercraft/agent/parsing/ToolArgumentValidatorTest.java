package com.careercraft.agent.parsing;

import com.careercraft.agent.exception.ToolArgumentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolArgumentValidatorTest {

    private static final Map<String, Object> SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "jobTitle", Map.of("type", "string"),
                    "limit", Map.of("type", "integer"),
                    "current", Map.of("type", "boolean"),
                    "achievements", Map.of("type", "array", "items", Map.of("type", "string")),
                    "tone", Map.of("type", "string", "enum", List.of("Professional", "Friendly"))
            ),
            "required", List.of("jobTitle")
    );

    private ToolArgumentValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ToolArgumentValidator();
    }

    @Test
    void validate_repairsCommonShapeMistakes() {
        Map<String, Object> args = new HashMap<>();
        args.put("jobTitle", "  Engineer ");
        args.put("limit", "5");
        args.put("current", "TRUE");
        args.put("achievements", "Shipped v2");
        args.put("tone", "friendly");
        args.put("unexpected", "dropped");

        Map<String, Object> repaired = validator.validate("store_work_history", SCHEMA, args);

        assertThat(repaired)
                .containsEntry("jobTitle", "Engineer")
                .containsEntry("limit", 5L)
                .containsEntry("current", true)
                .containsEntry("achievements", List.of("Shipped v2"))
                .containsEntry("tone", "Friendly")
                .doesNotContainKey("unexpected");
    }

    @Test
    void validate_missingRequired_throwsWithIssue() {
        assertThatThrownBy(() -> validator.validate("store_work_history", SCHEMA, Map.of("limit", 3)))
                .isInstanceOf(ToolArgumentException.class)
                .hasMessageContaining("jobTitle is required");
    }

    @Test
    void validate_blankRequiredString_throws() {
        assertThatThrownBy(() -> validator.validate("store_work_history", SCHEMA, Map.of("jobTitle", "   ")))
                .isInstanceOf(ToolArgumentException.class)
                .hasMessageContaining("jobTitle must not be empty");
    }

    @Test
    void validate_fractionalInteger_isReportedNotTruncated() {
        Map<String, Object> args = Map.of("jobTitle", "Engineer", "limit", 5.7);

        assertThatThrownBy(() -> validator.validate("find_job_postings", SCHEMA, args))
                .isInstanceOf(ToolArgumentException.class)
                .hasMessageContaining("limit must be a whole number");
    }

    @Test
    void validate_wholeValuedDouble_becomesLong() {
        Map<String, Object> repaired = validator.validate("find_job_postings", SCHEMA,
                Map.of("jobTitle", "Engineer", "limit", 5.0));

        assertThat(repaired).containsEntry("limit", 5L);
    }

    @Test
    void validate_badNumberAndEnum_reportsAllIssues() {
        Map<String, Object> args = Map.of("jobTitle", "Engineer", "limit", "many", "tone", "Sarcastic");

        assertThatThrownBy(() -> validator.validate("find_job_postings", SCHEMA, args))
                .isInstanceOf(ToolArgumentException.class)
                .hasMessageContaining("limit must be a whole number")
                .hasMessageContaining("tone must be one of");
    }

    @Test
    void validate_nullArgs_withNoRequiredFields_returnsEmpty() {
        Map<String, Object> schema = Map.of("type", "object", "properties", Map.of("query", Map.of("type", "string")));
        assertThat(validator.validate("find_job_postings", schema, null)).isEmpty();
    }
}
