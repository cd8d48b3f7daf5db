package com.delta.backgrounder.check.model;

public record SocialProfile(
    String platform,
    String url,
    String username,
    String snippet
) {
    public SocialProfile {
        snippet = snippet == null ? "" : snippet;
    }
}
