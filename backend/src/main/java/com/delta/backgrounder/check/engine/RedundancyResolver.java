package com.delta.backgrounder.check.engine;

import com.delta.backgrounder.check.model.AggregatedData;
import com.delta.backgrounder.check.model.CodeHostProfilesResult;
import com.delta.backgrounder.check.model.CompanyCheck;
import com.delta.backgrounder.check.model.CompanyChecksResult;
import com.delta.backgrounder.check.model.GitHubProfile;
import com.delta.backgrounder.check.model.LinkedInProfile;
import com.delta.backgrounder.check.model.PhotoMatch;
import com.delta.backgrounder.check.model.PhotoSearchResult;
import com.delta.backgrounder.check.model.ProfileResult;
import com.delta.backgrounder.check.model.ReferenceContact;
import com.delta.backgrounder.check.model.ReferenceContactsResult;
import com.delta.backgrounder.check.model.ResumeData;
import com.delta.backgrounder.check.model.SearchHit;
import com.delta.backgrounder.check.model.SearchHitsResult;
import com.delta.backgrounder.check.model.SocialProfile;
import com.delta.backgrounder.check.model.SocialProfilesResult;
import com.delta.backgrounder.check.model.SourceResult;
import com.delta.backgrounder.check.model.TaskDescriptor;
import com.delta.backgrounder.check.model.TaskOutcome;
import com.delta.backgrounder.check.source.ProfileDomains;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Merges per-task outcomes into one {@link AggregatedData}. Single-valued categories keep
 * the best-scoring candidate, multi-valued categories keep the first occurrence of each
 * identity key in task order.
 */
@Component
public class RedundancyResolver {
    private static final Logger log = LoggerFactory.getLogger(RedundancyResolver.class);

    /**
     * Completeness score of a profile candidate. Null scores -1 so it never wins.
     */
    public static int score(LinkedInProfile profile) {
        if (profile == null) {
            return -1;
        }
        int score = 0;
        if (profile.name() != null) {
            score += 1;
        }
        if (profile.headline() != null) {
            score += 1;
        }
        if (profile.summary() != null) {
            score += 2;
        }
        if (profile.location() != null) {
            score += 1;
        }
        score += profile.experience().size() * 3;
        score += profile.education().size() * 2;
        score += profile.skills().size();
        return score;
    }

    /**
     * Highest-scoring non-null candidate; on a tie the earliest one stays.
     */
    public static LinkedInProfile selectBest(List<LinkedInProfile> candidates) {
        LinkedInProfile best = null;
        int bestScore = -1;
        for (LinkedInProfile candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            int score = score(candidate);
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        return best;
    }

    public AggregatedData resolve(Map<String, TaskDescriptor> descriptors, Map<String, TaskOutcome> outcomes, ResumeData resume) {
        List<LinkedInProfile> profileCandidates = new ArrayList<>();
        List<String> profileProviders = new ArrayList<>();
        List<SearchHit> webHits = new ArrayList<>();
        List<SearchHit> newsHits = new ArrayList<>();
        Set<String> seenHitUrls = new HashSet<>();
        List<GitHubProfile> codeHostProfiles = new ArrayList<>();
        Set<String> seenUsernames = new HashSet<>();
        List<CompanyCheck> companyChecks = new ArrayList<>();
        Set<String> seenCompanies = new HashSet<>();
        List<SocialProfile> socialProfiles = new ArrayList<>();
        Set<String> seenSocialUrls = new HashSet<>();
        List<SocialProfile> photoDerivedProfiles = new ArrayList<>();
        List<PhotoMatch> photoMatches = new ArrayList<>();
        Set<String> seenPhotoUrls = new HashSet<>();
        List<ReferenceContact> referenceContacts = new ArrayList<>();
        Set<String> seenReferences = new HashSet<>();

        for (TaskDescriptor descriptor : descriptors.values()) {
            TaskOutcome outcome = outcomes.get(descriptor.id());
            if (outcome == null || !outcome.isSuccessful() || outcome.result() == null) {
                continue;
            }
            SourceResult result = outcome.result();
            switch (descriptor.kind()) {
                case PROFILE -> {
                    LinkedInProfile profile = ((ProfileResult) result).profile();
                    if (profile != null) {
                        profileCandidates.add(profile);
                        profileProviders.add(descriptor.provider().displayName());
                    }
                }
                case WEB_SEARCH -> {
                    String provenance = "google (" + idSuffix(descriptor.id()) + ")";
                    for (SearchHit hit : ((SearchHitsResult) result).hits()) {
                        if (hit.url() == null || ProfileDomains.isProfileUrl(hit.url()) || !seenHitUrls.add(hit.url())) {
                            continue;
                        }
                        webHits.add(hit.withSource(provenance));
                    }
                }
                case NEWS_SEARCH -> {
                    for (SearchHit hit : ((SearchHitsResult) result).hits()) {
                        if (hit.url() != null && seenHitUrls.add(hit.url())) {
                            newsHits.add(hit);
                        }
                    }
                }
                case CODE_HOST_SEARCH, CODE_HOST_USER -> {
                    for (GitHubProfile profile : ((CodeHostProfilesResult) result).profiles()) {
                        if (profile.username() != null && seenUsernames.add(profile.username().toLowerCase(Locale.ROOT))) {
                            codeHostProfiles.add(profile);
                        }
                    }
                }
                case COMPANY_VERIFY -> {
                    for (CompanyCheck check : ((CompanyChecksResult) result).checks()) {
                        if (check.name() != null && seenCompanies.add(check.name().toLowerCase(Locale.ROOT))) {
                            companyChecks.add(check);
                        }
                    }
                }
                case SOCIAL_SCAN -> {
                    for (SocialProfile profile : ((SocialProfilesResult) result).profiles()) {
                        if (profile.url() != null && seenSocialUrls.add(profile.url())) {
                            socialProfiles.add(profile);
                        }
                    }
                }
                case REFERENCES -> {
                    for (ReferenceContact contact : ((ReferenceContactsResult) result).contacts()) {
                        if (seenReferences.add(referenceKey(contact))) {
                            referenceContacts.add(contact);
                        }
                    }
                }
                case REVERSE_PHOTO -> {
                    PhotoSearchResult photo = (PhotoSearchResult) result;
                    for (PhotoMatch match : photo.visualMatches()) {
                        if (match.url() != null && seenPhotoUrls.add(match.url())) {
                            photoMatches.add(match);
                        }
                    }
                    photoDerivedProfiles.addAll(photo.derivedProfiles());
                }
            }
        }

        for (SocialProfile profile : photoDerivedProfiles) {
            if (profile.url() != null && seenSocialUrls.add(profile.url())) {
                socialProfiles.add(profile);
            }
        }

        LinkedInProfile selected = selectBest(profileCandidates);
        log.info(
            "Merged run data: profileCandidates={}, web={}, news={}, codeHost={}, companies={}, social={}, photo={}, references={}",
            profileCandidates.size(),
            webHits.size(),
            newsHits.size(),
            codeHostProfiles.size(),
            companyChecks.size(),
            socialProfiles.size(),
            photoMatches.size(),
            referenceContacts.size()
        );
        return new AggregatedData(
            selected,
            profileProviders,
            codeHostProfiles,
            resume,
            companyChecks,
            socialProfiles,
            photoMatches,
            referenceContacts,
            webHits,
            newsHits,
            null
        );
    }

    private static String idSuffix(String taskId) {
        int colon = taskId.indexOf(':');
        return colon < 0 ? taskId : taskId.substring(colon + 1);
    }

    private static String referenceKey(ReferenceContact contact) {
        if (contact.linkedinUrl() != null && !contact.linkedinUrl().isBlank()) {
            return "url:" + contact.linkedinUrl();
        }
        String name = contact.name() == null ? "" : contact.name().toLowerCase(Locale.ROOT);
        String company = contact.company() == null ? "" : contact.company().toLowerCase(Locale.ROOT);
        return "name:" + name + "|" + company;
    }
}
