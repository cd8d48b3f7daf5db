package com.delta.backgrounder.check.model;

import java.util.List;

public record GitHubProfile(
    String username,
    String url,
    String name,
    String bio,
    String company,
    String location,
    String blog,
    int publicRepos,
    int followers,
    int following,
    List<RepoSummary> topRepos
) {
    public GitHubProfile {
        topRepos = ModelLists.copy(topRepos);
    }
}
