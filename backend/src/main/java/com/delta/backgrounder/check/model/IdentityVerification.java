package com.delta.backgrounder.check.model;

import java.util.List;

public record IdentityVerification(
    String confidence,
    String reasoning,
    boolean multiplePeopleDetected,
    List<ProfileMention> profilesFound,
    List<String> crossReferenceNotes
) {
    public IdentityVerification {
        confidence = confidence == null ? "" : confidence;
        reasoning = reasoning == null ? "" : reasoning;
        profilesFound = ModelLists.copy(profilesFound);
        crossReferenceNotes = ModelLists.copyText(crossReferenceNotes);
    }
}
