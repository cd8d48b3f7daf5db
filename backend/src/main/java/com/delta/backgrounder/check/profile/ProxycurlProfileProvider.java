package com.delta.backgrounder.check.profile;

import com.delta.backgrounder.check.http.SourceFetchException;
import com.delta.backgrounder.check.http.SourceHttpClient;
import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.EducationEntry;
import com.delta.backgrounder.check.model.ExperienceEntry;
import com.delta.backgrounder.check.model.HttpFetchResult;
import com.delta.backgrounder.check.model.LinkedInProfile;
import com.delta.backgrounder.check.model.ProfileProviderName;
import com.delta.backgrounder.config.BackgrounderProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class ProxycurlProfileProvider implements ProfileProvider {
    private static final Logger log = LoggerFactory.getLogger(ProxycurlProfileProvider.class);

    private final SourceHttpClient httpClient;
    private final BackgrounderProperties properties;
    private final ObjectMapper objectMapper;

    public ProxycurlProfileProvider(SourceHttpClient httpClient, BackgrounderProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public ProfileProviderName name() {
        return ProfileProviderName.PROXYCURL;
    }

    @Override
    public LinkedInProfile fetch(BackgroundCheckRequest request) {
        if (!properties.getProxycurl().isConfigured()) {
            log.debug("Proxycurl API key not configured");
            return null;
        }
        String url = request.linkedinUrl() != null ? request.linkedinUrl() : resolveUrl(request);
        if (url == null) {
            return null;
        }
        HttpFetchResult result = httpClient.get(
            SourceHttpClient.withQuery(properties.getProxycurl().getBaseUrl() + "/v2/linkedin", Map.of("url", url)),
            "application/json",
            authHeaders()
        );
        if (!result.isSuccessful()) {
            log.warn("Proxycurl returned status={} error={}", result.statusCode(), result.errorCode());
            throw SourceFetchException.from("proxycurl", result);
        }
        JsonNode data = readJson(result);

        List<ExperienceEntry> experience = new ArrayList<>();
        for (JsonNode exp : data.path("experiences")) {
            String start = exp.path("starts_at").path("year").asText("");
            JsonNode endYear = exp.path("ends_at").path("year");
            String end = endYear.isMissingNode() || endYear.isNull() ? "Present" : endYear.asText();
            experience.add(new ExperienceEntry(
                ProfileJson.text(exp, "title"),
                ProfileJson.text(exp, "company"),
                start + " - " + end,
                ProfileJson.text(exp, "description")
            ));
        }
        List<EducationEntry> education = new ArrayList<>();
        for (JsonNode edu : data.path("education")) {
            education.add(new EducationEntry(
                ProfileJson.text(edu, "school"),
                ProfileJson.text(edu, "degree_name"),
                ProfileJson.text(edu, "field_of_study")
            ));
        }
        return new LinkedInProfile(
            url,
            ProfileJson.text(data, "full_name"),
            ProfileJson.text(data, "headline"),
            ProfileJson.text(data, "city", "country_full_name"),
            ProfileJson.text(data, "summary"),
            experience,
            education,
            ProfileJson.names(data.path("skills")),
            ProfileJson.names(data.path("certifications")),
            null
        );
    }

    private String resolveUrl(BackgroundCheckRequest request) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("first_name", request.firstName());
        String[] parts = request.name().split("\\s+", 2);
        params.put("last_name", parts.length > 1 ? parts[1] : "");
        params.put("current_company_name", request.company());
        params.put("country", request.location());
        HttpFetchResult result = httpClient.get(
            SourceHttpClient.withQuery(properties.getProxycurl().getBaseUrl() + "/search/person", params),
            "application/json",
            authHeaders()
        );
        if (!result.isSuccessful()) {
            log.debug("Proxycurl person search returned status={}", result.statusCode());
            return null;
        }
        JsonNode first = readJson(result).path("results").path(0);
        return ProfileJson.text(first, "linkedin_profile_url");
    }

    private Map<String, String> authHeaders() {
        return Map.of("Authorization", "Bearer " + properties.getProxycurl().getApiKey());
    }

    private JsonNode readJson(HttpFetchResult result) {
        try {
            return objectMapper.readTree(result.body() == null ? "{}" : result.body());
        } catch (JsonProcessingException e) {
            throw new SourceFetchException("proxycurl", result.statusCode(), "invalid_json", e.getOriginalMessage());
        }
    }
}
