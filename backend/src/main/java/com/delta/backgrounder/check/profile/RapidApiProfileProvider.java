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
import java.util.List;
import java.util.Map;

/**
 * Profile data API reached through RapidAPI. Only works with a known profile URL.
 */
@Service
public class RapidApiProfileProvider implements ProfileProvider {
    private static final Logger log = LoggerFactory.getLogger(RapidApiProfileProvider.class);

    private final SourceHttpClient httpClient;
    private final BackgrounderProperties properties;
    private final ObjectMapper objectMapper;

    public RapidApiProfileProvider(SourceHttpClient httpClient, BackgrounderProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public ProfileProviderName name() {
        return ProfileProviderName.RAPIDAPI;
    }

    @Override
    public LinkedInProfile fetch(BackgroundCheckRequest request) {
        String url = request.linkedinUrl();
        if (url == null) {
            log.warn("RapidAPI provider requires a profile URL");
            return null;
        }
        BackgrounderProperties.Rapidapi rapidapi = properties.getRapidapi();
        if (!rapidapi.isConfigured()) {
            log.debug("RapidAPI key not configured");
            return null;
        }
        String trimmed = url;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        String username = trimmed.substring(trimmed.lastIndexOf('/') + 1);

        HttpFetchResult result = httpClient.get(
            SourceHttpClient.withQuery(rapidapi.getBaseUrl(), Map.of("username", username)),
            "application/json",
            Map.of("X-RapidAPI-Key", rapidapi.getApiKey(), "X-RapidAPI-Host", rapidapi.getHost())
        );
        if (!result.isSuccessful()) {
            log.warn("RapidAPI returned status={} error={}", result.statusCode(), result.errorCode());
            throw SourceFetchException.from("rapidapi", result);
        }
        JsonNode data;
        try {
            data = objectMapper.readTree(result.body() == null ? "{}" : result.body());
        } catch (JsonProcessingException e) {
            throw new SourceFetchException("rapidapi", result.statusCode(), "invalid_json", e.getOriginalMessage());
        }

        List<ExperienceEntry> experience = new ArrayList<>();
        for (JsonNode exp : ProfileJson.array(data, "position", "experiences")) {
            experience.add(new ExperienceEntry(
                ProfileJson.text(exp, "title"),
                ProfileJson.text(exp, "companyName", "company"),
                ProfileJson.text(exp, "duration", "dateRange"),
                ProfileJson.text(exp, "description")
            ));
        }
        List<EducationEntry> education = new ArrayList<>();
        for (JsonNode edu : ProfileJson.array(data, "educations", "education")) {
            education.add(new EducationEntry(
                ProfileJson.text(edu, "schoolName", "school"),
                ProfileJson.text(edu, "degreeName", "degree"),
                ProfileJson.text(edu, "fieldOfStudy")
            ));
        }
        String location = ProfileJson.text(data, "location");
        if (location == null) {
            location = ProfileJson.text(data.path("geo"), "full");
        }
        return new LinkedInProfile(
            url,
            ProfileJson.text(data, "full_name", "fullName"),
            ProfileJson.text(data, "headline"),
            location,
            ProfileJson.text(data, "summary", "about"),
            experience,
            education,
            ProfileJson.names(data.path("skills")),
            List.of(),
            null
        );
    }
}
