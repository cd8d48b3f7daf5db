package com.delta.backgrounder.check.task;

import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.EducationEntry;
import com.delta.backgrounder.check.model.ExperienceEntry;
import com.delta.backgrounder.check.model.ProfileProviderName;
import com.delta.backgrounder.check.model.ResumeData;
import com.delta.backgrounder.check.model.TaskDescriptor;
import com.delta.backgrounder.check.model.TaskKind;
import com.delta.backgrounder.check.source.GitHubApiClient;
import com.delta.backgrounder.config.BackgrounderProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Derives the full task set of a run from its subject. No I/O; identical input always
 * yields the same ids in the same order.
 */
@Component
public class TaskDescriptorBuilder {
    public static final String PROFILE_CHOSEN = "linkedin:chosen";
    public static final String PROFILE_SCRAPER = "linkedin:scraper";
    public static final String PROFILE_SERPAPI = "linkedin:serpapi";
    public static final String GOOGLE_MAIN = "google:main";
    public static final String NEWS_MAIN = "news:main";
    public static final String GITHUB_NAME = "github:name";
    public static final String GITHUB_DIRECT = "github:direct";
    public static final String GITHUB_COMPANY = "github:company";
    public static final String GOOGLE_COMPANY_PREFIX = "google:company:";
    public static final String GOOGLE_EDU_PREFIX = "google:edu:";
    public static final String GOOGLE_TERM_PREFIX = "google:term:";
    public static final String NEWS_COMPANY_PREFIX = "news:company:";
    public static final String COMPANY_VERIFY = "company_verify";
    public static final String SOCIAL_MEDIA = "social_media";
    public static final String REFERENCES = "references";
    public static final String PHOTO_SEARCH = "photo_search";

    static final int MAX_PAST_COMPANY_SEARCHES = 3;
    static final int MAX_KEY_TERM_SEARCHES = 3;
    static final int MAX_PAST_COMPANY_NEWS = 2;

    private final BackgrounderProperties properties;

    public TaskDescriptorBuilder(BackgrounderProperties properties) {
        this.properties = properties;
    }

    public Map<String, TaskDescriptor> build(CheckSubject subject) {
        BackgroundCheckRequest request = subject.request();
        ResumeData resume = subject.resume();
        String name = request.name();
        Map<String, TaskDescriptor> tasks = new LinkedHashMap<>();

        addProfileTasks(tasks, chosenProvider(request), subject.knownProfileUrl());

        add(tasks, TaskDescriptor.of(GOOGLE_MAIN, TaskKind.WEB_SEARCH, join(name, request.company(), request.title())));
        add(tasks, TaskDescriptor.of(NEWS_MAIN, TaskKind.NEWS_SEARCH, join(name, request.company())));
        String codeHostQuery = request.location() == null ? name : name + " location:" + request.location();
        add(tasks, TaskDescriptor.of(GITHUB_NAME, TaskKind.CODE_HOST_SEARCH, codeHostQuery));

        if (resume != null) {
            String currentCompany = request.company() != null ? request.company() : resume.company();
            List<String> pastCompanies = pastCompanies(resume, currentCompany);

            for (String company : limit(pastCompanies, MAX_PAST_COMPANY_SEARCHES)) {
                add(tasks, TaskDescriptor.of(GOOGLE_COMPANY_PREFIX + company, TaskKind.WEB_SEARCH,
                    quoted(name) + " " + quoted(company)));
            }
            String school = firstSchool(resume);
            if (school != null) {
                add(tasks, TaskDescriptor.of(GOOGLE_EDU_PREFIX + school, TaskKind.WEB_SEARCH,
                    quoted(name) + " " + quoted(school)));
            }
            List<String> terms = limit(resume.keySearchTerms(), MAX_KEY_TERM_SEARCHES);
            for (int i = 0; i < terms.size(); i++) {
                add(tasks, TaskDescriptor.of(GOOGLE_TERM_PREFIX + i, TaskKind.WEB_SEARCH,
                    quoted(name) + " " + terms.get(i)));
            }
            String username = GitHubApiClient.extractUsername(resume.githubUrl());
            if (username != null) {
                add(tasks, TaskDescriptor.of(GITHUB_DIRECT, TaskKind.CODE_HOST_USER, username));
            }
            if (resume.company() != null) {
                add(tasks, TaskDescriptor.of(GITHUB_COMPANY, TaskKind.CODE_HOST_SEARCH, name + " " + resume.company()));
            }
            for (String company : limit(pastCompanies, MAX_PAST_COMPANY_NEWS)) {
                add(tasks, TaskDescriptor.of(NEWS_COMPANY_PREFIX + company, TaskKind.NEWS_SEARCH, name + " " + company));
            }
            add(tasks, TaskDescriptor.of(COMPANY_VERIFY, TaskKind.COMPANY_VERIFY, null));
        }

        add(tasks, TaskDescriptor.of(SOCIAL_MEDIA, TaskKind.SOCIAL_SCAN, name));
        add(tasks, TaskDescriptor.of(REFERENCES, TaskKind.REFERENCES, null));
        if (subject.photoUrl() != null) {
            add(tasks, TaskDescriptor.of(PHOTO_SEARCH, TaskKind.REVERSE_PHOTO, subject.photoUrl()));
        }
        return tasks;
    }

    public ProfileProviderName chosenProvider(BackgroundCheckRequest request) {
        if (request.provider() != null) {
            return request.provider();
        }
        ProfileProviderName configured = ProfileProviderName.parse(properties.getProfile().getDefaultProvider());
        return configured == null ? ProfileProviderName.SCRAPER : configured;
    }

    private static void addProfileTasks(Map<String, TaskDescriptor> tasks, ProfileProviderName chosen, String knownUrl) {
        add(tasks, TaskDescriptor.profile(PROFILE_CHOSEN, chosen, knownUrl));
        if (chosen != ProfileProviderName.SCRAPER) {
            add(tasks, TaskDescriptor.profile(PROFILE_SCRAPER, ProfileProviderName.SCRAPER, knownUrl));
        }
        if (chosen != ProfileProviderName.SERPAPI) {
            add(tasks, TaskDescriptor.profile(PROFILE_SERPAPI, ProfileProviderName.SERPAPI, knownUrl));
        }
    }

    /**
     * Work-history companies other than the current one, case-insensitively distinct,
     * in the order they first appear.
     */
    static List<String> pastCompanies(ResumeData resume, String currentCompany) {
        String current = currentCompany == null ? "" : currentCompany.trim().toLowerCase(Locale.ROOT);
        Set<String> seen = new HashSet<>();
        List<String> companies = new ArrayList<>();
        for (ExperienceEntry entry : resume.experience()) {
            if (entry.company() == null) {
                continue;
            }
            String company = entry.company().trim();
            String key = company.toLowerCase(Locale.ROOT);
            if (company.isEmpty() || key.equals(current) || !seen.add(key)) {
                continue;
            }
            companies.add(company);
        }
        return companies;
    }

    private static String firstSchool(ResumeData resume) {
        for (EducationEntry entry : resume.education()) {
            if (entry.school() != null && !entry.school().isBlank()) {
                return entry.school().trim();
            }
        }
        return null;
    }

    private static void add(Map<String, TaskDescriptor> tasks, TaskDescriptor descriptor) {
        tasks.putIfAbsent(descriptor.id(), descriptor);
    }

    private static <T> List<T> limit(List<T> values, int max) {
        return values.size() <= max ? values : values.subList(0, max);
    }

    private static String quoted(String value) {
        return "\"" + value + "\"";
    }

    private static String join(String... parts) {
        StringBuilder out = new StringBuilder();
        for (String part : parts) {
            if (part == null) {
                continue;
            }
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(part);
        }
        return out.toString();
    }
}
