package com.delta.backgrounder.check.model;

public record RepoSummary(
    String name,
    String description,
    int stars,
    String language,
    String url
) {}
