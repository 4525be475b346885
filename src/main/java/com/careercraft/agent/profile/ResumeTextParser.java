package com.careercraft.agent.profile;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented heuristics that pull work history, education and skills out of
 * a pasted plain-text resume.
 *
 * Sections are recognised by their heading ("Experience", "Education",
 * "Skills", ...). Inside experience, a line shaped like
 * {@code Title at Company (2019 - present)} or {@code Title, Company (2019 - 2021)}
 * opens a new entry and the bullets under it become responsibilities.
 */
@Component
@Slf4j
public class ResumeTextParser {

    private enum Section { NONE, EXPERIENCE, EDUCATION, SKILLS, ACHIEVEMENTS }

    private static final Pattern ROLE_AT = Pattern.compile(
            "^(?<title>[^,()]+?)\\s+(?:at|@)\\s+(?<company>[^,()]+?)\\s*(?:\\((?<dates>[^)]*)\\))?$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern ROLE_COMMA = Pattern.compile(
            "^(?<title>[^,()]+?),\\s*(?<company>[^,()]+?)\\s*\\((?<dates>[^)]*)\\)$");

    private static final Pattern DATE_RANGE = Pattern.compile(
            "(?<start>[\\w./]+(?:\\s\\d{4})?)\\s*[-–]\\s*(?<end>[\\w./]+(?:\\s\\d{4})?)");

    private static final Pattern BULLET = Pattern.compile("^\\s*(?:[-*•·]|\\d+[.)])\\s+");

    public record ParsedResume(List<CareerProfile.WorkHistoryEntry> workHistory,
                               List<CareerProfile.Education> education,
                               List<String> skills,
                               List<String> achievements) {

        public boolean isEmpty() {
            return workHistory.isEmpty() && education.isEmpty() && skills.isEmpty() && achievements.isEmpty();
        }
    }

    public ParsedResume parse(String content) {
        List<CareerProfile.WorkHistoryEntry> work = new ArrayList<>();
        List<CareerProfile.Education> education = new ArrayList<>();
        List<String> skills = new ArrayList<>();
        List<String> achievements = new ArrayList<>();

        Section section = Section.NONE;
        CareerProfile.WorkHistoryEntry current = null;

        for (String rawLine : content.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }

            Section heading = headingOf(line);
            if (heading != null) {
                section = heading;
                current = null;
                continue;
            }

            boolean bullet = BULLET.matcher(line).find();
            String text = BULLET.matcher(line).replaceFirst("").strip();

            switch (section) {
                case EXPERIENCE -> {
                    if (!bullet) {
                        CareerProfile.WorkHistoryEntry entry = parseRole(text);
                        if (entry != null) {
                            work.add(entry);
                            current = entry;
                            continue;
                        }
                    }
                    if (current != null) {
                        current.getResponsibilities().add(text);
                    }
                }
                case EDUCATION -> education.add(parseEducation(text));
                case SKILLS -> splitSkills(text, skills);
                case ACHIEVEMENTS -> achievements.add(text);
                case NONE -> {
                    // Contact details and summary text before the first heading
                }
            }
        }

        log.debug("Parsed resume [workHistory={}, education={}, skills={}, achievements={}]",
                work.size(), education.size(), skills.size(), achievements.size());
        return new ParsedResume(work, education, skills, achievements);
    }

    private static Section headingOf(String line) {
        String h = line.replaceAll("[:#*_=]", "").strip().toLowerCase(Locale.ROOT);
        if (h.length() > 40) {
            return null;
        }
        return switch (h) {
            case "experience", "work experience", "professional experience", "employment", "work history" ->
                    Section.EXPERIENCE;
            case "education", "academic background" -> Section.EDUCATION;
            case "skills", "technical skills", "core skills", "key skills" -> Section.SKILLS;
            case "achievements", "accomplishments", "awards" -> Section.ACHIEVEMENTS;
            default -> null;
        };
    }

    private static CareerProfile.WorkHistoryEntry parseRole(String line) {
        Matcher m = ROLE_AT.matcher(line);
        if (!m.matches()) {
            m = ROLE_COMMA.matcher(line);
            if (!m.matches()) {
                return null;
            }
        }
        CareerProfile.WorkHistoryEntry entry = CareerProfile.WorkHistoryEntry.builder()
                .jobTitle(m.group("title").strip())
                .companyName(m.group("company").strip())
                .build();

        String dates = m.group("dates");
        if (dates != null) {
            Matcher range = DATE_RANGE.matcher(dates);
            if (range.find()) {
                entry.setStartDate(range.group("start"));
                entry.setEndDate(range.group("end"));
            } else {
                entry.setStartDate(dates.strip());
            }
        }
        return entry;
    }

    private static CareerProfile.Education parseEducation(String line) {
        String[] parts = line.split("\\s*[,|]\\s*");
        CareerProfile.Education.EducationBuilder builder = CareerProfile.Education.builder();
        if (parts.length == 1) {
            return builder.institution(parts[0]).build();
        }
        builder.degree(parts[0]).institution(parts[1]);
        if (parts.length > 2) {
            builder.endDate(parts[parts.length - 1]);
        }
        return builder.build();
    }

    private static void splitSkills(String line, List<String> skills) {
        String list = line.contains(":") ? line.substring(line.indexOf(':') + 1) : line;
        for (String skill : list.split("\\s*[,;|]\\s*")) {
            String s = skill.strip();
            if (!s.isEmpty() && skills.stream().noneMatch(s::equalsIgnoreCase)) {
                skills.add(s);
            }
        }
    }
}
