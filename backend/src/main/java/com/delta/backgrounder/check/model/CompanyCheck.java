package com.delta.backgrounder.check.model;

public record CompanyCheck(
    String name,
    boolean verified,
    String evidenceUrl,
    String description
) {
    public CompanyCheck {
        description = description == null ? "" : description;
    }
}
