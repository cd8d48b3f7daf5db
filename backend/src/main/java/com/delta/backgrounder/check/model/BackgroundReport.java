package com.delta.backgrounder.check.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

public record BackgroundReport(
    String name,
    Instant generatedAt,
    LinkedInProfile linkedinProfile,
    List<GitHubProfile> githubProfiles,
    ResumeData resumeData,
    List<CompanyCheck> companyChecks,
    List<SocialProfile> socialProfiles,
    List<PhotoMatch> photoMatches,
    List<ReferenceContact> referenceContacts,
    IdentityVerification identityVerification,
    BackgroundVerdict verdict,
    String summary,
    String professionalBackground,
    List<String> keyHighlights,
    List<SearchHit> newsMentions,
    List<String> sourcesUsed,
    String providerUsed,
    String confidenceNote
) implements RunEvent {
    public BackgroundReport {
        githubProfiles = ModelLists.copy(githubProfiles);
        companyChecks = ModelLists.copy(companyChecks);
        socialProfiles = ModelLists.copy(socialProfiles);
        photoMatches = ModelLists.copy(photoMatches);
        referenceContacts = ModelLists.copy(referenceContacts);
        keyHighlights = ModelLists.copy(keyHighlights);
        newsMentions = ModelLists.copy(newsMentions);
        sourcesUsed = ModelLists.copy(sourcesUsed);
        confidenceNote = confidenceNote == null ? "" : confidenceNote;
    }

    @Override
    @JsonIgnore
    public String eventName() {
        return "result";
    }
}
