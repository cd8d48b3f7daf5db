package com.delta.backgrounder.check.model;

public record ReferenceContact(
    String name,
    String title,
    String company,
    String linkedinUrl,
    ReferenceCategory category,
    String snippet
) {
    public ReferenceContact {
        title = title == null ? "" : title;
        company = company == null ? "" : company;
        snippet = snippet == null ? "" : snippet;
    }
}
