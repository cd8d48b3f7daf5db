package com.delta.backgrounder.check.model;

import java.util.List;

public record CodeHostProfilesResult(List<GitHubProfile> profiles) implements SourceResult {
    public CodeHostProfilesResult {
        profiles = ModelLists.copy(profiles);
    }

    @Override
    public String detail() {
        return SourceResult.countFound(profiles.size());
    }
}
