package com.delta.backgrounder.check.source;

import com.delta.backgrounder.check.model.GitHubProfile;

import java.util.List;

public interface CodeHostClient {

    List<GitHubProfile> searchUsers(String query);

    /**
     * Exact-username lookup; null when the user does not exist.
     */
    GitHubProfile getUser(String username);
}
