package com.delta.backgrounder.check.model;

public record PhotoMatch(
    String url,
    String title,
    String source,
    String thumbnail,
    String platform
) {
    public PhotoMatch {
        title = title == null ? "" : title;
        source = source == null ? "" : source;
        thumbnail = thumbnail == null ? "" : thumbnail;
    }
}
