package com.delta.backgrounder.check.model;

import java.util.List;

public record ResumeData(
    String name,
    String email,
    String phone,
    String location,
    String title,
    String company,
    String linkedinUrl,
    String githubUrl,
    String website,
    List<String> skills,
    List<ExperienceEntry> experience,
    List<EducationEntry> education,
    List<String> certifications,
    List<String> keySearchTerms,
    String rawText
) {
    public ResumeData {
        name = ModelLists.blankToNull(name);
        location = ModelLists.blankToNull(location);
        title = ModelLists.blankToNull(title);
        company = ModelLists.blankToNull(company);
        linkedinUrl = ModelLists.blankToNull(linkedinUrl);
        githubUrl = ModelLists.blankToNull(githubUrl);
        website = ModelLists.blankToNull(website);
        skills = ModelLists.copyText(skills);
        experience = ModelLists.copy(experience);
        education = ModelLists.copy(education);
        certifications = ModelLists.copyText(certifications);
        keySearchTerms = ModelLists.copyText(keySearchTerms);
    }

    /**
     * Résumé whose structured extraction failed: only the text survives.
     */
    public static ResumeData rawOnly(String rawText) {
        return new ResumeData(
            null, null, null, null, null, null, null, null, null,
            List.of(), List.of(), List.of(), List.of(), List.of(),
            rawText
        );
    }
}
