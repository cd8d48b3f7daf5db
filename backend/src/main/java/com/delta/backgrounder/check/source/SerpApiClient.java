package com.delta.backgrounder.check.source;

import com.delta.backgrounder.check.http.SourceFetchException;
import com.delta.backgrounder.check.http.SourceHttpClient;
import com.delta.backgrounder.check.model.HttpFetchResult;
import com.delta.backgrounder.config.BackgrounderProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thin wrapper over the SerpAPI search endpoint shared by every search-backed source.
 */
@Component
public class SerpApiClient {
    private final SourceHttpClient httpClient;
    private final BackgrounderProperties properties;
    private final ObjectMapper objectMapper;

    public SerpApiClient(SourceHttpClient httpClient, BackgrounderProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public boolean isConfigured() {
        return properties.getSerpapi().isConfigured();
    }

    public int maxResults() {
        return properties.getSerpapi().getMaxResults();
    }

    public JsonNode google(String query, int num) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("engine", "google");
        params.put("q", query);
        params.put("num", num);
        return search(params);
    }

    public JsonNode googleNews(String query, int num) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("engine", "google");
        params.put("q", query);
        params.put("tbm", "nws");
        params.put("num", num);
        return search(params);
    }

    public JsonNode googleLens(String imageUrl) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("engine", "google_lens");
        params.put("url", imageUrl);
        return search(params);
    }

    /**
     * Runs one search and returns the parsed body.
     *
     * @throws SourceFetchException on a non-success status or an unparseable body
     */
    public JsonNode search(Map<String, Object> params) {
        Map<String, Object> withKey = new LinkedHashMap<>(params);
        withKey.put("api_key", properties.getSerpapi().getApiKey());
        String url = SourceHttpClient.withQuery(properties.getSerpapi().getBaseUrl(), withKey);
        HttpFetchResult result = httpClient.get(url, "application/json");
        if (!result.isSuccessful()) {
            throw SourceFetchException.from("serpapi", result);
        }
        try {
            return objectMapper.readTree(result.body() == null ? "{}" : result.body());
        } catch (JsonProcessingException e) {
            throw new SourceFetchException("serpapi", result.statusCode(), "invalid_json", e.getOriginalMessage());
        }
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() ? value.asText("") : "";
    }

    static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max);
    }
}
