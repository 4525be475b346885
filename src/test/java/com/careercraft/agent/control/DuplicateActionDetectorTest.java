package com.careercraft.agent.control;

import com.careercraft.agent.config.AgentProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DuplicateActionDetectorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String RESUME = "Jane Doe\nExperience\nEngineer at Acme (2019 - 2023)";

    private AgentProperties properties;
    private DuplicateActionDetector detector;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        detector = new DuplicateActionDetector(properties, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void check_sameContentWithinWindow_isDuplicate() {
        CompletedAction earlier = at(NOW.minusSeconds(60),
                detector.record("data_manager", "parse_and_store_resume", Map.of("content", RESUME), "Resume processed"));

        DuplicateCheck check = detector.check("data_manager", "parse_and_store_resume",
                Map.of("content", RESUME), List.of(earlier));

        assertThat(check.isDuplicate()).isTrue();
        assertThat(check.getReason()).contains("already processed recently (60s ago)");
        assertThat(check.getPrevious()).isSameAs(earlier);
    }

    @Test
    void check_sameContentOutsideWindow_isNotDuplicate() {
        CompletedAction earlier = at(NOW.minus(Duration.ofMinutes(6)),
                detector.record("data_manager", "parse_and_store_resume", Map.of("content", RESUME), "ok"));

        DuplicateCheck check = detector.check("data_manager", "parse_and_store_resume",
                Map.of("content", RESUME), List.of(earlier));

        assertThat(check.isDuplicate()).isFalse();
    }

    @Test
    void check_differentContent_isNotDuplicate() {
        CompletedAction earlier = detector.record("data_manager", "parse_and_store_resume",
                Map.of("content", RESUME), "ok");

        DuplicateCheck check = detector.check("data_manager", "parse_and_store_resume",
                Map.of("content", RESUME + "\nSkills: Java"), List.of(earlier));

        assertThat(check.isDuplicate()).isFalse();
    }

    @Test
    void check_nonContentToolWithEqualArgs_isDuplicateRegardlessOfAge() {
        CompletedAction earlier = at(NOW.minus(Duration.ofHours(2)),
                detector.record("user_profile", "get_user_profile", Map.of("dataType", "skills"), "[]"));

        DuplicateCheck check = detector.check("user_profile", "get_user_profile",
                Map.of("dataType", "skills"), List.of(earlier));

        assertThat(check.isDuplicate()).isTrue();
        assertThat(check.getReason()).contains("earlier in this conversation");
    }

    @Test
    void check_numericArgumentsCompareByValue() {
        CompletedAction earlier = detector.record("job_posting_manager", "find_job_postings",
                Map.of("query", "java", "limit", 5), "none");

        DuplicateCheck check = detector.check("job_posting_manager", "find_job_postings",
                Map.of("query", "java", "limit", 5.0), List.of(earlier));

        assertThat(check.isDuplicate()).isTrue();
    }

    @Test
    void check_sameToolFromDifferentAgent_isNotDuplicate() {
        CompletedAction earlier = detector.record("user_profile", "get_user_profile", Map.of("dataType", "all"), "{}");

        DuplicateCheck check = detector.check("data_manager", "get_user_profile",
                Map.of("dataType", "all"), List.of(earlier));

        assertThat(check.isDuplicate()).isFalse();
    }

    @Test
    void record_truncatesResultAndHashesOnlyContentTools() {
        String longResult = "x".repeat(800);

        CompletedAction content = detector.record("data_manager", "parse_and_store_resume",
                Map.of("content", RESUME), longResult);
        CompletedAction plain = detector.record("user_profile", "get_user_profile", Map.of(), longResult);

        assertThat(content.getResult()).hasSize(500);
        assertThat(content.getContentHash()).isEqualTo(ContentHasher.sha256(RESUME));
        assertThat(content.getTimestamp()).isEqualTo(NOW);
        assertThat(plain.getContentHash()).isNull();
    }

    @Test
    void skipMessage_includesReasonAndPreview() {
        CompletedAction earlier = detector.record("data_manager", "store_user_preference",
                Map.of("category", "grammar"), "Successfully stored user preference for grammar: Oxford comma");
        DuplicateCheck check = detector.check("data_manager", "store_user_preference",
                Map.of("category", "grammar"), List.of(earlier));

        String message = detector.skipMessage("store_user_preference", check);

        assertThat(message)
                .startsWith("• Skipped store_user_preference: This store_user_preference was already executed recently")
                .contains("Previous result: Successfully stored user preference for grammar");
    }

    @Test
    void carryOver_keepsOnlyRecentActions() {
        CompletedAction recent = at(NOW.minusSeconds(30), detector.record("data_manager", "parse_and_store_resume",
                Map.of("content", RESUME), "r"));
        CompletedAction stale = at(NOW.minus(Duration.ofMinutes(10)), detector.record("data_manager",
                "parse_and_store_resume", Map.of("content", RESUME), "r"));

        assertThat(detector.carryOver(List.of(stale, recent))).containsExactly(recent);
        assertThat(detector.carryOver(null)).isEmpty();
    }

    @Test
    void carryOver_lookupAction_staysInItsTurn() {
        CompletedAction lookup = at(NOW.minusSeconds(30), detector.record("user_profile", "get_user_profile",
                Map.of("dataType", "work_history"), "Work history: Acme"));

        List<CompletedAction> carried = detector.carryOver(List.of(lookup));

        assertThat(carried).isEmpty();
        assertThat(detector.check("user_profile", "get_user_profile", Map.of("dataType", "work_history"), carried)
                .isDuplicate()).isFalse();
    }

    @Test
    void carryOver_turnScope_dropsEverything() {
        properties.getDuplicates().setScope(AgentProperties.Duplicates.Scope.TURN);
        CompletedAction recent = detector.record("data_manager", "parse_and_store_resume",
                Map.of("content", RESUME), "r");

        assertThat(detector.carryOver(List.of(recent))).isEmpty();
    }

    private static CompletedAction at(Instant timestamp, CompletedAction action) {
        return CompletedAction.builder()
                .id(action.getId())
                .agentType(action.getAgentType())
                .toolName(action.getToolName())
                .args(action.getArgs())
                .result(action.getResult())
                .contentHash(action.getContentHash())
                .timestamp(timestamp)
                .build();
    }
}
