package com.delta.backgrounder.check.model;

import java.util.List;

public record PhotoSearchResult(
    List<PhotoMatch> visualMatches,
    List<SocialProfile> derivedProfiles
) implements SourceResult {
    public PhotoSearchResult {
        visualMatches = ModelLists.copy(visualMatches);
        derivedProfiles = ModelLists.copy(derivedProfiles);
    }

    public static PhotoSearchResult empty() {
        return new PhotoSearchResult(List.of(), List.of());
    }

    @Override
    public String detail() {
        return SourceResult.countFound(visualMatches.size());
    }
}
