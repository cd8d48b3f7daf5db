package com.delta.backgrounder.check.profile;

import com.delta.backgrounder.check.http.SourceFetchException;
import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.source.ProfileDomains;
import com.delta.backgrounder.check.source.SerpApiClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds a profile page for a subject through site-restricted web search, trying the most
 * specific query first and widening until a result mentions the subject's first name.
 */
@Component
public class ProfileSearch {
    private static final Logger log = LoggerFactory.getLogger(ProfileSearch.class);
    private static final String SITE_SCOPE = "site:linkedin.com/in/ ";

    private final SerpApiClient serpApi;

    public ProfileSearch(SerpApiClient serpApi) {
        this.serpApi = serpApi;
    }

    public boolean isAvailable() {
        return serpApi.isConfigured();
    }

    static List<String> discoveryQueries(BackgroundCheckRequest request) {
        List<String> parts = new ArrayList<>();
        parts.add(request.name());
        if (request.company() != null) {
            parts.add(request.company());
        }
        if (request.title() != null) {
            parts.add(request.title());
        }
        if (request.location() != null) {
            parts.add(request.location());
        }
        parts.add("LinkedIn");

        List<String> queries = new ArrayList<>();
        queries.add(String.join(" ", parts));
        if (request.company() != null) {
            queries.add(request.name() + " " + request.company());
        }
        queries.add("\"" + request.name() + "\"");
        return queries;
    }

    /**
     * First search result that is a profile page whose title mentions the subject.
     */
    public Optional<JsonNode> findProfileHit(BackgroundCheckRequest request, int resultsPerQuery) {
        if (!serpApi.isConfigured()) {
            return Optional.empty();
        }
        String firstName = request.firstName().toLowerCase(Locale.ROOT);
        for (String query : discoveryQueries(request)) {
            JsonNode data;
            try {
                data = serpApi.google(SITE_SCOPE + query, resultsPerQuery);
            } catch (SourceFetchException e) {
                log.debug("Profile discovery query failed: {}", e.getMessage());
                continue;
            }
            for (JsonNode item : data.path("organic_results")) {
                String url = item.path("link").asText("");
                String title = item.path("title").asText("");
                if (ProfileDomains.isPersonProfileUrl(url) && title.toLowerCase(Locale.ROOT).contains(firstName)) {
                    return Optional.of(item);
                }
            }
        }
        return Optional.empty();
    }
}
