package com.delta.backgrounder.check.task;

import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.CodeHostProfilesResult;
import com.delta.backgrounder.check.model.CompanyChecksResult;
import com.delta.backgrounder.check.model.ExperienceEntry;
import com.delta.backgrounder.check.model.GitHubProfile;
import com.delta.backgrounder.check.model.ProfileResult;
import com.delta.backgrounder.check.model.ReferenceContactsResult;
import com.delta.backgrounder.check.model.ResumeData;
import com.delta.backgrounder.check.model.SearchHitsResult;
import com.delta.backgrounder.check.model.SocialProfilesResult;
import com.delta.backgrounder.check.model.SourceResult;
import com.delta.backgrounder.check.model.TaskDescriptor;
import com.delta.backgrounder.check.profile.ProfileProviderRegistry;
import com.delta.backgrounder.check.source.CodeHostClient;
import com.delta.backgrounder.check.source.CompanyVerifier;
import com.delta.backgrounder.check.source.ReferenceDiscoverer;
import com.delta.backgrounder.check.source.ReversePhotoSearcher;
import com.delta.backgrounder.check.source.SocialMediaScanner;
import com.delta.backgrounder.check.source.WebSearchClient;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Turns descriptors into runnable source calls. Each task only sees its own descriptor and
 * the run subject, never another task's result.
 */
@Component
public class SourceTaskBinder {
    private final ProfileProviderRegistry profileProviders;
    private final WebSearchClient webSearch;
    private final CodeHostClient codeHost;
    private final CompanyVerifier companyVerifier;
    private final SocialMediaScanner socialScanner;
    private final ReferenceDiscoverer referenceDiscoverer;
    private final ReversePhotoSearcher photoSearcher;

    public SourceTaskBinder(
        ProfileProviderRegistry profileProviders,
        WebSearchClient webSearch,
        CodeHostClient codeHost,
        CompanyVerifier companyVerifier,
        SocialMediaScanner socialScanner,
        ReferenceDiscoverer referenceDiscoverer,
        ReversePhotoSearcher photoSearcher
    ) {
        this.profileProviders = profileProviders;
        this.webSearch = webSearch;
        this.codeHost = codeHost;
        this.companyVerifier = companyVerifier;
        this.socialScanner = socialScanner;
        this.referenceDiscoverer = referenceDiscoverer;
        this.photoSearcher = photoSearcher;
    }

    public Map<String, Callable<SourceResult>> bindAll(Map<String, TaskDescriptor> descriptors, CheckSubject subject) {
        Map<String, Callable<SourceResult>> tasks = new LinkedHashMap<>();
        for (TaskDescriptor descriptor : descriptors.values()) {
            tasks.put(descriptor.id(), bind(descriptor, subject));
        }
        return tasks;
    }

    public Callable<SourceResult> bind(TaskDescriptor descriptor, CheckSubject subject) {
        BackgroundCheckRequest request = subject.request();
        String query = descriptor.query();
        return switch (descriptor.kind()) {
            case PROFILE -> () -> {
                BackgroundCheckRequest profileRequest = query == null ? request : request.withLinkedinUrl(query);
                return new ProfileResult(profileProviders.get(descriptor.provider()).fetch(profileRequest));
            };
            case WEB_SEARCH -> () -> new SearchHitsResult(webSearch.search(query));
            case NEWS_SEARCH -> () -> new SearchHitsResult(webSearch.searchNews(query));
            case CODE_HOST_SEARCH -> () -> new CodeHostProfilesResult(codeHost.searchUsers(query));
            case CODE_HOST_USER -> () -> {
                GitHubProfile profile = codeHost.getUser(query);
                return new CodeHostProfilesResult(profile == null ? List.of() : List.of(profile));
            };
            case COMPANY_VERIFY -> () -> new CompanyChecksResult(companyVerifier.verifyAll(companiesToVerify(subject.resume())));
            case SOCIAL_SCAN -> () -> new SocialProfilesResult(socialScanner.scan(query == null ? request.name() : query));
            case REFERENCES -> () -> new ReferenceContactsResult(referenceDiscoverer.discover(request, subject.resume()));
            case REVERSE_PHOTO -> () -> photoSearcher.search(query);
        };
    }

    /**
     * Current résumé company followed by work-history companies, case-insensitively distinct.
     */
    static List<String> companiesToVerify(ResumeData resume) {
        List<String> companies = new ArrayList<>();
        if (resume == null) {
            return companies;
        }
        Set<String> seen = new HashSet<>();
        List<String> candidates = new ArrayList<>();
        candidates.add(resume.company());
        for (ExperienceEntry entry : resume.experience()) {
            candidates.add(entry.company());
        }
        for (String candidate : candidates) {
            if (candidate == null || candidate.isBlank()) {
                continue;
            }
            String company = candidate.trim();
            if (seen.add(company.toLowerCase(Locale.ROOT))) {
                companies.add(company);
            }
        }
        return companies;
    }
}
