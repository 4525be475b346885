package com.careercraft.agent.profile;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads and writes the career data the tools operate on.
 *
 * A profile is created lazily the first time anything is stored for a user.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProfileService {

    /** Data types {@code get_user_profile} accepts */
    public static final List<String> DATA_TYPES =
            List.of("work_history", "education", "skills", "achievements", "preferences", "all");

    private final CareerProfileRepository profileRepository;
    private final JobPostingRepository jobPostingRepository;
    private final CareerDocumentRepository documentRepository;

    public CareerProfile getOrCreate(String userId) {
        return profileRepository.findById(userId)
                .orElseGet(() -> CareerProfile.builder().userId(userId).build());
    }

    public CareerProfile storePreference(String userId, String category, String preference) {
        CareerProfile profile = getOrCreate(userId);
        profile.getPreferences().put(category, preference);
        CareerProfile saved = profileRepository.save(profile);
        log.info("Stored preference [userId={}, category={}]", userId, category);
        return saved;
    }

    /**
     * Adds a role, replacing an existing entry for the same title and company.
     */
    public CareerProfile addWorkHistory(String userId, CareerProfile.WorkHistoryEntry entry) {
        CareerProfile profile = getOrCreate(userId);
        profile.getWorkHistory().removeIf(existing -> sameRole(existing, entry));
        profile.getWorkHistory().add(entry);
        CareerProfile saved = profileRepository.save(profile);
        log.info("Stored work history [userId={}, jobTitle={}, company={}]",
                userId, entry.getJobTitle(), entry.getCompanyName());
        return saved;
    }

    /**
     * Folds a parsed resume into the profile. Roles and skills already present
     * are kept; only new ones are added.
     */
    public MergeSummary mergeParsedResume(String userId, ResumeTextParser.ParsedResume parsed) {
        CareerProfile profile = getOrCreate(userId);

        int roles = 0;
        for (CareerProfile.WorkHistoryEntry entry : parsed.workHistory()) {
            if (profile.getWorkHistory().stream().noneMatch(e -> sameRole(e, entry))) {
                profile.getWorkHistory().add(entry);
                roles++;
            }
        }

        int skills = 0;
        for (String name : parsed.skills()) {
            boolean known = profile.getSkills().stream()
                    .anyMatch(s -> s.getName() != null && s.getName().equalsIgnoreCase(name));
            if (!known) {
                profile.getSkills().add(CareerProfile.Skill.builder()
                        .name(name)
                        .proficiency(CareerProfile.Proficiency.INTERMEDIATE)
                        .workContext("From resume")
                        .build());
                skills++;
            }
        }

        profile.getEducation().addAll(parsed.education());
        parsed.achievements().stream()
                .filter(a -> !profile.getAchievements().contains(a))
                .forEach(profile.getAchievements()::add);

        profileRepository.save(profile);
        log.info("Merged resume into profile [userId={}, newRoles={}, newSkills={}, education={}]",
                userId, roles, skills, parsed.education().size());
        return new MergeSummary(roles, skills, parsed.education().size(), parsed.achievements().size());
    }

    /**
     * The slice of the profile named by {@code dataType}, shaped for JSON output.
     *
     * @throws IllegalArgumentException for an unknown data type
     */
    public Object profileData(String userId, String dataType) {
        CareerProfile profile = getOrCreate(userId);
        return switch (dataType) {
            case "work_history" -> profile.getWorkHistory();
            case "education" -> profile.getEducation();
            case "skills" -> profile.getSkills();
            case "achievements" -> profile.getAchievements();
            case "preferences" -> profile.getPreferences();
            case "all" -> {
                Map<String, Object> all = new LinkedHashMap<>();
                all.put("workHistory", profile.getWorkHistory());
                all.put("education", profile.getEducation());
                all.put("skills", profile.getSkills());
                all.put("achievements", profile.getAchievements());
                all.put("preferences", profile.getPreferences());
                yield all;
            }
            default -> throw new IllegalArgumentException(
                    "Unknown data type '" + dataType + "'. Expected one of " + DATA_TYPES);
        };
    }

    public JobPosting storeJobPosting(String userId, String content, JobPostingTextParser.ParsedPosting parsed) {
        JobPosting posting = JobPosting.builder()
                .userId(userId)
                .title(parsed.title())
                .company(parsed.company())
                .location(parsed.location())
                .content(content)
                .requiredSkills(parsed.requiredSkills())
                .bonusSkills(parsed.bonusSkills())
                .build();
        JobPosting saved = jobPostingRepository.save(posting);
        log.info("Stored job posting [id={}, userId={}, title={}, requirements={}]",
                saved.getId(), userId, saved.getTitle(), saved.getRequiredSkills().size());
        return saved;
    }

    public List<JobPosting> findPostings(String userId, String query, int limit) {
        List<JobPosting> postings = query == null || query.isBlank()
                ? jobPostingRepository.findByUserIdOrderByCreatedAtDesc(userId)
                : jobPostingRepository.searchByUser(userId, Pattern.quote(query.strip()));
        log.debug("Found {} job postings [userId={}, query={}]", postings.size(), userId, query);
        return postings.stream().limit(limit).toList();
    }

    public Optional<JobPosting> findPosting(String userId, String jobPostingId) {
        return jobPostingRepository.findByIdAndUserId(jobPostingId, userId);
    }

    public CareerDocument saveDocument(String userId, CareerDocument.Type type, String title,
                                       String content, String jobPostingId) {
        CareerDocument saved = documentRepository.save(CareerDocument.builder()
                .userId(userId)
                .type(type)
                .title(title)
                .content(content)
                .jobPostingId(jobPostingId)
                .build());
        log.info("Saved {} [id={}, userId={}]", type, saved.getId(), userId);
        return saved;
    }

    private static boolean sameRole(CareerProfile.WorkHistoryEntry a, CareerProfile.WorkHistoryEntry b) {
        return normalize(a.getJobTitle()).equals(normalize(b.getJobTitle()))
                && normalize(a.getCompanyName()).equals(normalize(b.getCompanyName()));
    }

    private static String normalize(String s) {
        return s == null ? "" : s.strip().toLowerCase(Locale.ROOT);
    }

    public record MergeSummary(int newRoles, int newSkills, int education, int achievements) {
    }
}
