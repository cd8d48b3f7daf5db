package com.delta.backgrounder.check.model;

public record ExperienceEntry(
    String title,
    String company,
    String duration,
    String description
) {
    public ExperienceEntry {
        title = ModelLists.blankToNull(title);
        company = ModelLists.blankToNull(company);
        duration = ModelLists.blankToNull(duration);
        description = ModelLists.blankToNull(description);
    }
}
