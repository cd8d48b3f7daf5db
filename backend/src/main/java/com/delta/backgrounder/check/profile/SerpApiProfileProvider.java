package com.delta.backgrounder.check.profile;

import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.LinkedInProfile;
import com.delta.backgrounder.check.model.ProfileProviderName;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Search-engine-backed profile: built from the search result's title and snippet, or from
 * the URL slug alone when the URL is already known.
 */
@Service
public class SerpApiProfileProvider implements ProfileProvider {
    private static final Pattern PROFILE_SLUG = Pattern.compile("linkedin\\.com/in/([^/?#]+)");
    private static final int RESULTS_PER_QUERY = 5;

    private final ProfileSearch profileSearch;

    public SerpApiProfileProvider(ProfileSearch profileSearch) {
        this.profileSearch = profileSearch;
    }

    @Override
    public ProfileProviderName name() {
        return ProfileProviderName.SERPAPI;
    }

    @Override
    public LinkedInProfile fetch(BackgroundCheckRequest request) {
        if (request.linkedinUrl() != null) {
            return fromUrl(request.linkedinUrl());
        }
        return profileSearch.findProfileHit(request, RESULTS_PER_QUERY)
            .map(this::fromSearchHit)
            .orElse(null);
    }

    static LinkedInProfile fromUrl(String url) {
        Matcher matcher = PROFILE_SLUG.matcher(url);
        if (!matcher.find()) {
            return null;
        }
        return LinkedInProfile.minimal(url, titleCase(matcher.group(1).replace('-', ' ')), null, null, null);
    }

    private LinkedInProfile fromSearchHit(JsonNode hit) {
        String title = hit.path("title").asText("");
        String snippet = hit.path("snippet").asText("");
        String[] parts = title.split(" - ");
        String name = parts[0].trim();
        String headline = parts.length > 1 ? parts[1].trim() : "";
        if (headline.isEmpty()) {
            headline = snippet.length() > 200 ? snippet.substring(0, 200) : snippet;
        }
        return LinkedInProfile.minimal(hit.path("link").asText(""), name, headline, null, snippet);
    }

    private static String titleCase(String value) {
        StringBuilder out = new StringBuilder(value.length());
        boolean startOfWord = true;
        for (char c : value.toCharArray()) {
            if (Character.isLetter(c)) {
                out.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                out.append(c);
                startOfWord = true;
            }
        }
        return out.toString();
    }
}
