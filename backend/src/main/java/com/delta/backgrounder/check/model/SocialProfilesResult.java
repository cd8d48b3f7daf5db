package com.delta.backgrounder.check.model;

import java.util.List;

public record SocialProfilesResult(List<SocialProfile> profiles) implements SourceResult {
    public SocialProfilesResult {
        profiles = ModelLists.copy(profiles);
    }

    @Override
    public String detail() {
        return SourceResult.countFound(profiles.size());
    }
}
