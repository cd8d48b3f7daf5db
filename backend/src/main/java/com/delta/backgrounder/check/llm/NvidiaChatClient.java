package com.delta.backgrounder.check.llm;

import com.delta.backgrounder.check.http.SourceHttpClient;
import com.delta.backgrounder.check.model.HttpFetchResult;
import com.delta.backgrounder.config.BackgrounderProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * OpenAI-compatible chat completions endpoint, always asking for a JSON object answer.
 */
@Component
public class NvidiaChatClient {
    private static final Logger log = LoggerFactory.getLogger(NvidiaChatClient.class);

    private final SourceHttpClient httpClient;
    private final BackgrounderProperties properties;
    private final ObjectMapper objectMapper;

    public NvidiaChatClient(SourceHttpClient httpClient, BackgrounderProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public boolean isConfigured() {
        return properties.getNvidia().isConfigured();
    }

    /**
     * Returns the assistant message content.
     *
     * @throws ChatCompletionException when the call fails or the envelope has no content
     */
    public String complete(String systemPrompt, String userMessage, double temperature, int maxTokens) {
        BackgrounderProperties.Nvidia nvidia = properties.getNvidia();
        if (!nvidia.isConfigured()) {
            throw new ChatCompletionException("NVIDIA API key not configured");
        }
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", nvidia.getModel());
        ArrayNode messages = payload.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userMessage);
        payload.put("temperature", temperature);
        payload.put("max_tokens", maxTokens);
        payload.putObject("response_format").put("type", "json_object");

        HttpFetchResult result;
        try {
            result = httpClient.postJson(
                nvidia.getBaseUrl() + "/chat/completions",
                objectMapper.writeValueAsString(payload),
                Map.of("Authorization", "Bearer " + nvidia.getApiKey())
            );
        } catch (JsonProcessingException e) {
            throw new ChatCompletionException("Could not encode chat payload", e);
        }
        if (!result.isSuccessful()) {
            String body = result.body() == null ? "" : result.body();
            log.error(
                "NVIDIA API error status={} error={} body={}",
                result.statusCode(),
                result.errorCode(),
                body.length() > 500 ? body.substring(0, 500) : body
            );
            throw new ChatCompletionException("Chat completion failed with status " + result.statusCode());
        }
        try {
            JsonNode content = objectMapper.readTree(result.body()).path("choices").path(0).path("message").path("content");
            if (!content.isTextual()) {
                throw new ChatCompletionException("Chat completion response had no message content");
            }
            return content.asText();
        } catch (JsonProcessingException e) {
            throw new ChatCompletionException("Chat completion response was not JSON", e);
        }
    }
}
