package com.delta.backgrounder.check.model;

/**
 * Subject of a background check. Only {@code name} is required.
 */
public record BackgroundCheckRequest(
    String name,
    String company,
    String location,
    String title,
    String linkedinUrl,
    ProfileProviderName provider
) {
    public BackgroundCheckRequest {
        name = ModelLists.blankToNull(name);
        if (name == null) {
            throw new IllegalArgumentException("name is required");
        }
        company = ModelLists.blankToNull(company);
        location = ModelLists.blankToNull(location);
        title = ModelLists.blankToNull(title);
        linkedinUrl = ModelLists.blankToNull(linkedinUrl);
    }

    public static BackgroundCheckRequest of(String name) {
        return new BackgroundCheckRequest(name, null, null, null, null, null);
    }

    /**
     * Copy where résumé fields only fill values the caller left empty.
     */
    public BackgroundCheckRequest withResumeDefaults(ResumeData resume) {
        if (resume == null) {
            return this;
        }
        return new BackgroundCheckRequest(
            name,
            company != null ? company : resume.company(),
            location != null ? location : resume.location(),
            title != null ? title : resume.title(),
            linkedinUrl != null ? linkedinUrl : resume.linkedinUrl(),
            provider
        );
    }

    public BackgroundCheckRequest withLinkedinUrl(String url) {
        return new BackgroundCheckRequest(name, company, location, title, url, provider);
    }

    public String firstName() {
        return name.split("\\s+")[0];
    }

    public String lastName() {
        String[] parts = name.split("\\s+");
        return parts.length > 1 ? parts[parts.length - 1] : "";
    }
}
