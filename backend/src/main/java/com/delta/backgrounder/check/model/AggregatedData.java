package com.delta.backgrounder.check.model;

import java.util.List;

/**
 * Merged snapshot of one run. {@code linkedinProviders} lists the display names of the
 * providers that produced a profile candidate, in task order.
 */
public record AggregatedData(
    LinkedInProfile linkedin,
    List<String> linkedinProviders,
    List<GitHubProfile> githubProfiles,
    ResumeData resume,
    List<CompanyCheck> companyChecks,
    List<SocialProfile> socialProfiles,
    List<PhotoMatch> photoMatches,
    List<ReferenceContact> referenceContacts,
    List<SearchHit> searchResults,
    List<SearchHit> newsArticles,
    String rawContext
) {
    public AggregatedData {
        linkedinProviders = ModelLists.copy(linkedinProviders);
        githubProfiles = ModelLists.copy(githubProfiles);
        companyChecks = ModelLists.copy(companyChecks);
        socialProfiles = ModelLists.copy(socialProfiles);
        photoMatches = ModelLists.copy(photoMatches);
        referenceContacts = ModelLists.copy(referenceContacts);
        searchResults = ModelLists.copy(searchResults);
        newsArticles = ModelLists.copy(newsArticles);
        rawContext = rawContext == null ? "" : rawContext;
    }

    public AggregatedData withRawContext(String context) {
        return new AggregatedData(
            linkedin,
            linkedinProviders,
            githubProfiles,
            resume,
            companyChecks,
            socialProfiles,
            photoMatches,
            referenceContacts,
            searchResults,
            newsArticles,
            context
        );
    }
}
