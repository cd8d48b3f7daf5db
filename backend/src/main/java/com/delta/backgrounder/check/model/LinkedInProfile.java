package com.delta.backgrounder.check.model;

import java.util.List;

public record LinkedInProfile(
    String url,
    String name,
    String headline,
    String location,
    String summary,
    List<ExperienceEntry> experience,
    List<EducationEntry> education,
    List<String> skills,
    List<String> certifications,
    String rawText
) {
    public LinkedInProfile {
        name = ModelLists.blankToNull(name);
        headline = ModelLists.blankToNull(headline);
        location = ModelLists.blankToNull(location);
        summary = ModelLists.blankToNull(summary);
        experience = ModelLists.copy(experience);
        education = ModelLists.copy(education);
        skills = ModelLists.copyText(skills);
        certifications = ModelLists.copyText(certifications);
        rawText = ModelLists.blankToNull(rawText);
    }

    public static LinkedInProfile minimal(String url, String name, String headline, String location, String rawText) {
        return new LinkedInProfile(url, name, headline, location, null, List.of(), List.of(), List.of(), List.of(), rawText);
    }
}
