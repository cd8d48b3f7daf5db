package com.delta.backgrounder.check.model;

public record ProfileResult(LinkedInProfile profile) implements SourceResult {

    public static ProfileResult empty() {
        return new ProfileResult(null);
    }

    public boolean isPresent() {
        return profile != null;
    }

    @Override
    public String detail() {
        if (profile == null) {
            return null;
        }
        return profile.name() != null ? profile.name() : "Profile found";
    }
}
