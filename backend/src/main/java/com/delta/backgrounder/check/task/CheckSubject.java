package com.delta.backgrounder.check.task;

import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.ResumeData;

import java.util.Objects;

/**
 * Everything a run knows about its subject before any source is queried.
 * {@code resume} and {@code photoUrl} are optional.
 */
public record CheckSubject(
    BackgroundCheckRequest request,
    ResumeData resume,
    String photoUrl
) {
    public CheckSubject {
        Objects.requireNonNull(request, "request");
        if (photoUrl != null && photoUrl.isBlank()) {
            photoUrl = null;
        }
    }

    public static CheckSubject of(BackgroundCheckRequest request) {
        return new CheckSubject(request, null, null);
    }

    /**
     * Profile URL from the request, else from the résumé.
     */
    public String knownProfileUrl() {
        if (request.linkedinUrl() != null) {
            return request.linkedinUrl();
        }
        return resume == null ? null : resume.linkedinUrl();
    }
}
