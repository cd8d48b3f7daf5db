package com.delta.backgrounder.check.llm;

import com.delta.backgrounder.check.model.AggregatedData;
import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.BackgroundVerdict;
import com.delta.backgrounder.check.model.IdentityVerification;
import com.delta.backgrounder.check.model.ProfileMention;
import com.delta.backgrounder.check.model.ReportNarrative;
import com.delta.backgrounder.config.BackgrounderProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class NvidiaReportGenerator implements ReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(NvidiaReportGenerator.class);

    static final String SYSTEM_PROMPT = """
        You are a professional background research analyst and due-diligence investigator. \
        Given data about a person collected from their resume, LinkedIn, GitHub, Google search, news articles, \
        company checks, social platforms, reverse photo search and reference discovery, produce a structured \
        background report WITH a verdict on whether their background checks out.

        IMPORTANT: The data may contain information about MULTIPLE different people with the same name. \
        You must carefully analyze whether all the data points refer to the same individual or different people.

        You MUST respond with valid JSON containing exactly these keys:

        - "summary": A 2-4 sentence executive summary of who this person is.
        - "professional_background": A 2-3 paragraph narrative of their career trajectory, expertise, and notable positions.
        - "key_highlights": A list of 3-7 bullet points (strings) covering the most important facts.

        - "identity_verification": An object with these keys:
          - "confidence": One of "high", "medium", or "low".
          - "reasoning": 1-3 sentences explaining why.
          - "multiple_people_detected": boolean.
          - "profiles_found": List of objects with "source", "name", "description".
          - "cross_reference_notes": List of strings noting matches or mismatches across sources.

        - "verdict": An object with these keys:
          - "rating": One of "clean", "caution", or "red_flags".
          - "score": Integer 0-100. 80-100 clean, 50-79 caution, 0-49 red flags.
          - "summary": 2-3 sentence overall verdict explaining the rating.
          - "resume_vs_online": List of strings comparing resume claims to what was found online, \
        each prefixed VERIFIED, UNVERIFIED or CONTRADICTED.
          - "red_flags": List of strings describing any red flags found, or an empty list.
          - "green_flags": List of strings describing positive signals, or an empty list.
          - "recommendations": List of strings suggesting next steps for verification.

        Be factual and objective. Do not invent information. If data is sparse, note it as a limitation. \
        Base the verdict ONLY on what the data shows.""";

    private final NvidiaChatClient chatClient;
    private final BackgrounderProperties properties;
    private final ObjectMapper objectMapper;

    public NvidiaReportGenerator(NvidiaChatClient chatClient, BackgrounderProperties properties, ObjectMapper objectMapper) {
        this.chatClient = chatClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public ReportNarrative summarize(BackgroundCheckRequest request, AggregatedData aggregated) {
        String content;
        try {
            content = chatClient.complete(
                SYSTEM_PROMPT,
                userMessage(request, aggregated),
                properties.getNvidia().getReportTemperature(),
                properties.getNvidia().getReportMaxTokens()
            );
        } catch (ChatCompletionException e) {
            throw new ReportGenerationException(e.getMessage(), e);
        }
        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            log.warn("Report generator returned non-JSON output: {}", content.length() > 300 ? content.substring(0, 300) : content);
            throw new ReportGenerationException("Report output was not valid JSON", e);
        }
        if (!parsed.isObject()) {
            throw new ReportGenerationException("Report output was not a JSON object");
        }
        return new ReportNarrative(
            parsed.path("summary").asText(""),
            parsed.path("professional_background").asText(""),
            strings(parsed.path("key_highlights")),
            identity(parsed.path("identity_verification")),
            verdict(parsed.path("verdict"))
        );
    }

    String userMessage(BackgroundCheckRequest request, AggregatedData aggregated) {
        StringBuilder message = new StringBuilder();
        message.append("Generate a background report and verdict for: ").append(request.name()).append('\n');
        if (request.company() != null) {
            message.append("Company context: ").append(request.company()).append('\n');
        }
        if (request.title() != null) {
            message.append("Title context: ").append(request.title()).append('\n');
        }
        if (request.location() != null) {
            message.append("Location context: ").append(request.location()).append('\n');
        }
        String context = aggregated.rawContext();
        int max = properties.getNvidia().getContextMaxChars();
        if (context.length() > max) {
            context = context.substring(0, max);
        }
        message.append("\n--- Collected Data ---\n").append(context).append("\n--- End Data ---");
        return message.toString();
    }

    private static IdentityVerification identity(JsonNode node) {
        if (!node.isObject()) {
            return null;
        }
        List<ProfileMention> mentions = new ArrayList<>();
        for (JsonNode item : node.path("profiles_found")) {
            mentions.add(new ProfileMention(
                item.path("source").asText(""),
                item.path("name").asText(""),
                item.path("description").asText("")
            ));
        }
        return new IdentityVerification(
            node.path("confidence").asText(""),
            node.path("reasoning").asText(""),
            node.path("multiple_people_detected").asBoolean(false),
            mentions,
            strings(node.path("cross_reference_notes"))
        );
    }

    private static BackgroundVerdict verdict(JsonNode node) {
        if (!node.isObject()) {
            return null;
        }
        return new BackgroundVerdict(
            node.path("rating").asText(""),
            node.path("score").asInt(0),
            node.path("summary").asText(""),
            strings(node.path("resume_vs_online")),
            strings(node.path("red_flags")),
            strings(node.path("green_flags")),
            strings(node.path("recommendations"))
        );
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isValueNode()) {
                    values.add(item.asText(""));
                }
            }
        }
        return values;
    }
}
