package com.delta.backgrounder.check.source;

import com.delta.backgrounder.check.http.SourceFetchException;
import com.delta.backgrounder.check.http.SourceHttpClient;
import com.delta.backgrounder.check.model.GitHubProfile;
import com.delta.backgrounder.check.model.HttpFetchResult;
import com.delta.backgrounder.check.model.RepoSummary;
import com.delta.backgrounder.config.BackgrounderProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class GitHubApiClient implements CodeHostClient {
    private static final Logger log = LoggerFactory.getLogger(GitHubApiClient.class);
    private static final String ACCEPT = "application/vnd.github+json";
    private static final Pattern USERNAME_IN_URL = Pattern.compile("github\\.com/([a-zA-Z0-9_-]+)/?$");

    private final SourceHttpClient httpClient;
    private final BackgrounderProperties properties;
    private final ObjectMapper objectMapper;

    public GitHubApiClient(SourceHttpClient httpClient, BackgrounderProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Username from a profile URL such as {@code https://github.com/octocat/}; null for repo or other URLs.
     */
    public static String extractUsername(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        Matcher matcher = USERNAME_IN_URL.matcher(trimmed);
        return matcher.find() ? matcher.group(1) : null;
    }

    @Override
    public List<GitHubProfile> searchUsers(String query) {
        BackgrounderProperties.Github github = properties.getGithub();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("q", query);
        params.put("per_page", github.getSearchLimit());
        String url = SourceHttpClient.withQuery(github.getApiBaseUrl() + "/search/users", params);
        HttpFetchResult result = httpClient.get(url, ACCEPT, headers());
        if (!result.isSuccessful()) {
            log.warn("GitHub search failed for '{}': status={} error={}", query, result.statusCode(), result.errorCode());
            throw SourceFetchException.from("github", result);
        }

        List<GitHubProfile> profiles = new ArrayList<>();
        int fetched = 0;
        for (JsonNode item : readJson(result).path("items")) {
            if (fetched++ >= github.getSearchLimit()) {
                break;
            }
            String login = item.path("login").asText("");
            if (login.isEmpty()) {
                continue;
            }
            GitHubProfile profile = getUser(login);
            if (profile != null) {
                profiles.add(profile);
            }
        }
        return profiles;
    }

    @Override
    public GitHubProfile getUser(String username) {
        if (username == null || username.isBlank()) {
            return null;
        }
        String base = properties.getGithub().getApiBaseUrl() + "/users/" + URLEncoder.encode(username, StandardCharsets.UTF_8);
        HttpFetchResult result = httpClient.get(base, ACCEPT, headers());
        if (result.statusCode() == 404) {
            return null;
        }
        if (!result.isSuccessful()) {
            throw SourceFetchException.from("github", result);
        }
        JsonNode user = readJson(result);
        return new GitHubProfile(
            user.path("login").asText(""),
            user.path("html_url").asText(""),
            textOrNull(user, "name"),
            textOrNull(user, "bio"),
            textOrNull(user, "company"),
            textOrNull(user, "location"),
            textOrNull(user, "blog"),
            user.path("public_repos").asInt(0),
            user.path("followers").asInt(0),
            user.path("following").asInt(0),
            topRepos(base)
        );
    }

    private List<RepoSummary> topRepos(String userUrl) {
        int limit = properties.getGithub().getTopRepos();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("sort", "stars");
        params.put("per_page", limit);
        HttpFetchResult result = httpClient.get(SourceHttpClient.withQuery(userUrl + "/repos", params), ACCEPT, headers());
        if (!result.isSuccessful()) {
            log.debug("GitHub repo listing failed for {}: status={}", userUrl, result.statusCode());
            return List.of();
        }
        List<RepoSummary> repos = new ArrayList<>();
        JsonNode root;
        try {
            root = readJson(result);
        } catch (SourceFetchException e) {
            return List.of();
        }
        for (JsonNode repo : root) {
            if (repos.size() >= limit) {
                break;
            }
            repos.add(new RepoSummary(
                repo.path("name").asText(""),
                repo.path("description").asText(""),
                repo.path("stargazers_count").asInt(0),
                textOrNull(repo, "language"),
                repo.path("html_url").asText("")
            ));
        }
        return repos;
    }

    private Map<String, String> headers() {
        String token = properties.getGithub().getToken();
        if (token == null || token.isBlank()) {
            return Map.of();
        }
        return Map.of("Authorization", "Bearer " + token.trim());
    }

    private JsonNode readJson(HttpFetchResult result) {
        try {
            return objectMapper.readTree(result.body() == null ? "{}" : result.body());
        } catch (JsonProcessingException e) {
            throw new SourceFetchException("github", result.statusCode(), "invalid_json", e.getOriginalMessage());
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isNull() || value.isMissingNode()) {
            return null;
        }
        String text = value.asText("");
        return text.isBlank() ? null : text;
    }
}
