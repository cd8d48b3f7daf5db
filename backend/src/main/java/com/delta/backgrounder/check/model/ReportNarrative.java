package com.delta.backgrounder.check.model;

import java.util.List;

/**
 * What the report generator contributes on top of the collected data.
 */
public record ReportNarrative(
    String summary,
    String professionalBackground,
    List<String> keyHighlights,
    IdentityVerification identityVerification,
    BackgroundVerdict verdict
) {
    public ReportNarrative {
        summary = summary == null ? "" : summary;
        professionalBackground = professionalBackground == null ? "" : professionalBackground;
        keyHighlights = ModelLists.copyText(keyHighlights);
    }
}
