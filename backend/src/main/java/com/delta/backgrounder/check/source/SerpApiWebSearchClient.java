package com.delta.backgrounder.check.source;

import com.delta.backgrounder.check.model.SearchHit;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class SerpApiWebSearchClient implements WebSearchClient {
    private static final Logger log = LoggerFactory.getLogger(SerpApiWebSearchClient.class);
    private static final int REQUESTED_RESULTS = 10;

    private final SerpApiClient serpApi;

    public SerpApiWebSearchClient(SerpApiClient serpApi) {
        this.serpApi = serpApi;
    }

    @Override
    public List<SearchHit> search(String query) {
        if (!serpApi.isConfigured()) {
            log.debug("SerpAPI key not configured, skipping web search for '{}'", query);
            return List.of();
        }
        JsonNode data = serpApi.google(query, REQUESTED_RESULTS);
        List<SearchHit> hits = new ArrayList<>();
        for (JsonNode item : data.path("organic_results")) {
            String url = SerpApiClient.text(item, "link");
            if (ProfileDomains.isProfileUrl(url)) {
                continue;
            }
            hits.add(new SearchHit(SerpApiClient.text(item, "title"), url, SerpApiClient.text(item, "snippet"), "google"));
            if (hits.size() >= serpApi.maxResults()) {
                break;
            }
        }
        return hits;
    }

    @Override
    public List<SearchHit> searchNews(String query) {
        if (!serpApi.isConfigured()) {
            log.debug("SerpAPI key not configured, skipping news search for '{}'", query);
            return List.of();
        }
        JsonNode data = serpApi.googleNews(query, REQUESTED_RESULTS);
        List<SearchHit> hits = new ArrayList<>();
        for (JsonNode item : data.path("news_results")) {
            hits.add(new SearchHit(
                SerpApiClient.text(item, "title"),
                SerpApiClient.text(item, "link"),
                SerpApiClient.text(item, "snippet"),
                "news"
            ));
            if (hits.size() >= serpApi.maxResults()) {
                break;
            }
        }
        return hits;
    }
}
