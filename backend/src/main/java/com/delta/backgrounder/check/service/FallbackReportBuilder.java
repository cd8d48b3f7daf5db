package com.delta.backgrounder.check.service;

import com.delta.backgrounder.check.model.AggregatedData;
import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.ReportNarrative;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Narrative used when the report generator is unavailable: counts of what was collected and
 * the start of the rendered context.
 */
@Component
public class FallbackReportBuilder {
    static final int BACKGROUND_CHARS = 2000;

    public ReportNarrative build(BackgroundCheckRequest request, AggregatedData data) {
        String context = data.rawContext();
        String background = context.length() <= BACKGROUND_CHARS ? context : context.substring(0, BACKGROUND_CHARS);

        List<String> highlights = new ArrayList<>();
        highlights.add("LinkedIn profile: " + (data.linkedin() != null ? "found" : "not found"));
        highlights.add("GitHub profiles: " + data.githubProfiles().size() + " found");
        highlights.add("Google results: " + data.searchResults().size() + " found");
        highlights.add("News articles: " + data.newsArticles().size() + " found");
        if (data.resume() != null) {
            highlights.add("Companies checked: " + data.companyChecks().size());
        }
        highlights.add("Social profiles: " + data.socialProfiles().size() + " found");
        highlights.add("Reference contacts: " + data.referenceContacts().size() + " found");
        if (!data.photoMatches().isEmpty()) {
            highlights.add("Photo matches: " + data.photoMatches().size() + " found");
        }

        return new ReportNarrative(
            "Background data collected for " + request.name() + " but report generation failed.",
            background,
            highlights,
            null,
            null
        );
    }
}
