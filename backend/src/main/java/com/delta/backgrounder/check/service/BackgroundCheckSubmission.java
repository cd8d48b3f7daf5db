package com.delta.backgrounder.check.service;

import com.delta.backgrounder.check.model.BackgroundCheckRequest;

import java.util.Objects;

/**
 * A check as submitted by a client, before the résumé is parsed or the photo uploaded.
 */
public record BackgroundCheckSubmission(
    BackgroundCheckRequest request,
    byte[] resumeBytes,
    String resumeFilename,
    String resumeContentType,
    byte[] photoBytes,
    String photoUrl
) {
    public BackgroundCheckSubmission {
        Objects.requireNonNull(request, "request");
        if (photoUrl != null && photoUrl.isBlank()) {
            photoUrl = null;
        }
    }

    public static BackgroundCheckSubmission of(BackgroundCheckRequest request) {
        return new BackgroundCheckSubmission(request, null, null, null, null, null);
    }

    public boolean hasResume() {
        return resumeBytes != null && resumeBytes.length > 0;
    }

    public boolean hasPhotoFile() {
        return photoBytes != null && photoBytes.length > 0;
    }
}
