package com.careercraft.agent.profile;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the title, company, location and skill requirements out of a pasted
 * job posting. Labelled lines ("Title:", "Company:", "Location:") win; the first
 * line stands in for the title otherwise. Bullets under a requirements heading
 * are required skills, bullets under a "nice to have" heading are bonus skills.
 */
@Component
public class JobPostingTextParser {

    private enum Section { OTHER, REQUIRED, BONUS }

    private static final Pattern LABELLED = Pattern.compile(
            "^(?<label>job title|title|position|role|company|employer|location)\\s*:\\s*(?<value>.+)$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TITLE_AT_COMPANY = Pattern.compile(
            "^(?<title>.+?)\\s+(?:at|@|-)\\s+(?<company>.+)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern BULLET = Pattern.compile("^\\s*(?:[-*•·]|\\d+[.)])\\s+");

    public record ParsedPosting(String title, String company, String location,
                                List<String> requiredSkills, List<String> bonusSkills) {
    }

    public ParsedPosting parse(String content) {
        String title = null;
        String company = null;
        String location = null;
        String firstLine = null;
        List<String> required = new ArrayList<>();
        List<String> bonus = new ArrayList<>();
        Section section = Section.OTHER;

        for (String rawLine : content.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (firstLine == null) {
                firstLine = line;
            }

            Matcher labelled = LABELLED.matcher(line);
            if (labelled.matches()) {
                String value = labelled.group("value").strip();
                switch (labelled.group("label").toLowerCase(Locale.ROOT)) {
                    case "company", "employer" -> company = value;
                    case "location" -> location = value;
                    default -> title = value;
                }
                continue;
            }

            Section heading = headingOf(line);
            if (heading != null) {
                section = heading;
                continue;
            }

            if (section != Section.OTHER && BULLET.matcher(line).find()) {
                String requirement = BULLET.matcher(line).replaceFirst("").strip();
                (section == Section.REQUIRED ? required : bonus).add(requirement);
            }
        }

        if (title == null && firstLine != null) {
            Matcher m = TITLE_AT_COMPANY.matcher(firstLine);
            if (m.matches()) {
                title = m.group("title").strip();
                if (company == null) {
                    company = m.group("company").strip();
                }
            } else {
                title = firstLine;
            }
        }

        return new ParsedPosting(title, company, location, required, bonus);
    }

    private static Section headingOf(String line) {
        String h = line.replaceAll("[:#*_=]", "").strip().toLowerCase(Locale.ROOT);
        if (h.length() > 40 || BULLET.matcher(line).find()) {
            return null;
        }
        if (h.contains("nice to have") || h.contains("preferred") || h.contains("bonus")) {
            return Section.BONUS;
        }
        if (h.contains("requirement") || h.contains("qualification") || h.contains("must have")
                || h.equals("what you'll need") || h.equals("skills")) {
            return Section.REQUIRED;
        }
        if (h.contains("responsibilit") || h.contains("about") || h.contains("benefit")
                || h.contains("what you'll do")) {
            return Section.OTHER;
        }
        return null;
    }
}
