package com.delta.backgrounder.check.model;

public record SearchHit(
    String title,
    String url,
    String snippet,
    String source
) {
    public SearchHit {
        title = title == null ? "" : title;
        snippet = snippet == null ? "" : snippet;
        source = source == null ? "" : source;
    }

    public SearchHit withSource(String newSource) {
        return new SearchHit(title, url, snippet, newSource);
    }
}
