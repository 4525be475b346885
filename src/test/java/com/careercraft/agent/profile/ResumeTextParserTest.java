package com.careercraft.agent.profile;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResumeTextParserTest {

    private static final String RESUME = """
            Jane Doe
            jane@example.com

            Experience:
            Senior Engineer at Acme Corp (Jan 2020 - Present)
            - Led the payments team
            - Cut checkout latency by 40%
            Developer, Globex (2017 - 2019)
            * Built internal tooling

            Education
            BSc Computer Science, MIT, 2016

            ## Skills ##
            Languages: Java, Kotlin; SQL
            java, Docker

            Awards
            Engineer of the Year 2022
            """;

    private ResumeTextParser parser;

    @BeforeEach
    void setUp() {
        parser = new ResumeTextParser();
    }

    @Test
    void parse_rolesWithDatesAndBullets() {
        ResumeTextParser.ParsedResume parsed = parser.parse(RESUME);

        assertThat(parsed.workHistory()).hasSize(2);
        CareerProfile.WorkHistoryEntry first = parsed.workHistory().get(0);
        assertThat(first.getJobTitle()).isEqualTo("Senior Engineer");
        assertThat(first.getCompanyName()).isEqualTo("Acme Corp");
        assertThat(first.getStartDate()).isEqualTo("Jan 2020");
        assertThat(first.getEndDate()).isEqualTo("Present");
        assertThat(first.getResponsibilities()).containsExactly("Led the payments team", "Cut checkout latency by 40%");

        CareerProfile.WorkHistoryEntry second = parsed.workHistory().get(1);
        assertThat(second.getJobTitle()).isEqualTo("Developer");
        assertThat(second.getCompanyName()).isEqualTo("Globex");
        assertThat(second.getStartDate()).isEqualTo("2017");
        assertThat(second.getEndDate()).isEqualTo("2019");
        assertThat(second.getResponsibilities()).containsExactly("Built internal tooling");
    }

    @Test
    void parse_educationSkillsAndAchievements() {
        ResumeTextParser.ParsedResume parsed = parser.parse(RESUME);

        assertThat(parsed.education()).hasSize(1);
        assertThat(parsed.education().get(0).getDegree()).isEqualTo("BSc Computer Science");
        assertThat(parsed.education().get(0).getInstitution()).isEqualTo("MIT");
        assertThat(parsed.education().get(0).getEndDate()).isEqualTo("2016");

        assertThat(parsed.skills()).containsExactly("Java", "Kotlin", "SQL", "Docker");
        assertThat(parsed.achievements()).containsExactly("Engineer of the Year 2022");
    }

    @Test
    void parse_textWithoutHeadings_isEmpty() {
        assertThat(parser.parse("Just a note about my career goals.").isEmpty()).isTrue();
    }
}
