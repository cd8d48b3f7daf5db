package com.delta.backgrounder.check.source;

import com.delta.backgrounder.check.http.SourceHttpClient;
import com.delta.backgrounder.check.model.HttpFetchResult;
import com.delta.backgrounder.config.BackgrounderProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Service
public class ImgBbPhotoUploader implements PhotoUploader {
    private static final Logger log = LoggerFactory.getLogger(ImgBbPhotoUploader.class);

    private final SourceHttpClient httpClient;
    private final BackgrounderProperties properties;
    private final ObjectMapper objectMapper;

    public ImgBbPhotoUploader(SourceHttpClient httpClient, BackgrounderProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<String> upload(byte[] image) {
        BackgrounderProperties.Imgbb imgbb = properties.getImgbb();
        if (!imgbb.isConfigured()) {
            log.warn("No ImgBB API key configured for photo upload");
            return Optional.empty();
        }
        if (image == null || image.length == 0) {
            return Optional.empty();
        }
        Map<String, String> form = new LinkedHashMap<>();
        form.put("key", imgbb.getApiKey());
        form.put("image", Base64.getEncoder().encodeToString(image));
        form.put("expiration", String.valueOf(imgbb.getExpirationSeconds()));
        HttpFetchResult result = httpClient.postForm(imgbb.getUploadUrl(), form, Map.of());
        if (!result.isSuccessful()) {
            log.error("ImgBB upload failed: status={} error={}", result.statusCode(), result.errorCode());
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(result.body());
            String url = root.path("data").path("url").asText("");
            if (url.isEmpty()) {
                log.warn("ImgBB response carried no image URL");
                return Optional.empty();
            }
            log.info("Photo uploaded to ImgBB: {}", url);
            return Optional.of(url);
        } catch (JsonProcessingException e) {
            log.warn("ImgBB response was not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
