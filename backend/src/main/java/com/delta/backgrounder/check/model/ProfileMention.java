package com.delta.backgrounder.check.model;

public record ProfileMention(
    String source,
    String name,
    String description
) {}
