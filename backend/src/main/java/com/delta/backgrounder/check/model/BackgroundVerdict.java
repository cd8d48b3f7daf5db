package com.delta.backgrounder.check.model;

import java.util.List;

/**
 * Overall assessment. {@code rating} is one of clean, caution or red_flags; {@code score} is 0-100.
 */
public record BackgroundVerdict(
    String rating,
    int score,
    String summary,
    List<String> resumeVsOnline,
    List<String> redFlags,
    List<String> greenFlags,
    List<String> recommendations
) {
    public BackgroundVerdict {
        rating = rating == null ? "" : rating;
        score = Math.max(0, Math.min(100, score));
        summary = summary == null ? "" : summary;
        resumeVsOnline = ModelLists.copyText(resumeVsOnline);
        redFlags = ModelLists.copyText(redFlags);
        greenFlags = ModelLists.copyText(greenFlags);
        recommendations = ModelLists.copyText(recommendations);
    }
}
