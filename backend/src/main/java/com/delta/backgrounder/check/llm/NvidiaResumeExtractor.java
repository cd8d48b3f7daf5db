package com.delta.backgrounder.check.llm;

import com.delta.backgrounder.check.model.EducationEntry;
import com.delta.backgrounder.check.model.ExperienceEntry;
import com.delta.backgrounder.check.model.ResumeData;
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
public class NvidiaResumeExtractor implements ResumeExtractor {
    private static final Logger log = LoggerFactory.getLogger(NvidiaResumeExtractor.class);
    private static final int MAX_INPUT_CHARS = 8000;
    private static final int MAX_KEPT_CHARS = 5000;

    static final String EXTRACT_PROMPT = """
        You are a resume parsing expert. Extract structured information from the following resume text.

        You MUST respond with valid JSON containing these keys:
        - "name": Full name of the person (string, or null if not found)
        - "email": Email address (string, or null)
        - "phone": Phone number (string, or null)
        - "location": City/state/country (string, or null)
        - "title": Current or most recent job title (string, or null)
        - "company": Current or most recent company (string, or null)
        - "linkedin_url": LinkedIn profile URL if mentioned (string, or null)
        - "github_url": GitHub profile URL if mentioned (string, or null)
        - "website": Personal website if mentioned (string, or null)
        - "skills": List of technical and professional skills (list of strings)
        - "experience": List of objects with "title", "company", "duration", "description" keys
        - "education": List of objects with "school", "degree", "field" keys
        - "certifications": List of strings
        - "key_search_terms": List of 5-10 unique search terms that would help verify this person's background \
        (e.g. specific project names, publication titles, unique company+role combos, conference talks, awards). \
        These should be specific enough to distinguish this person from others with the same name.

        Extract ONLY what is explicitly stated. Do not invent information.""";

    private final NvidiaChatClient chatClient;
    private final BackgrounderProperties properties;
    private final ObjectMapper objectMapper;

    public NvidiaResumeExtractor(NvidiaChatClient chatClient, BackgrounderProperties properties, ObjectMapper objectMapper) {
        this.chatClient = chatClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public ResumeData extract(String rawText) {
        String text = rawText == null ? "" : rawText;
        String kept = truncate(text, MAX_KEPT_CHARS);
        String content;
        try {
            content = chatClient.complete(
                EXTRACT_PROMPT,
                "Resume text:\n\n" + truncate(text, MAX_INPUT_CHARS),
                properties.getNvidia().getResumeTemperature(),
                properties.getNvidia().getResumeMaxTokens()
            );
        } catch (ChatCompletionException e) {
            log.warn("Resume extraction failed: {}", e.getMessage());
            return ResumeData.rawOnly(kept);
        }
        try {
            JsonNode parsed = objectMapper.readTree(content);
            if (!parsed.isObject()) {
                log.warn("Resume extraction returned a non-object JSON value");
                return ResumeData.rawOnly(kept);
            }
            return new ResumeData(
                text(parsed, "name"),
                text(parsed, "email"),
                text(parsed, "phone"),
                text(parsed, "location"),
                text(parsed, "title"),
                text(parsed, "company"),
                text(parsed, "linkedin_url"),
                text(parsed, "github_url"),
                text(parsed, "website"),
                strings(parsed.path("skills")),
                experience(parsed.path("experience")),
                education(parsed.path("education")),
                strings(parsed.path("certifications")),
                strings(parsed.path("key_search_terms")),
                kept
            );
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse resume extraction output: {}", e.getOriginalMessage());
            return ResumeData.rawOnly(kept);
        }
    }

    private static List<ExperienceEntry> experience(JsonNode node) {
        List<ExperienceEntry> entries = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isObject()) {
                entries.add(new ExperienceEntry(
                    text(item, "title"),
                    text(item, "company"),
                    text(item, "duration"),
                    text(item, "description")
                ));
            }
        }
        return entries;
    }

    private static List<EducationEntry> education(JsonNode node) {
        List<EducationEntry> entries = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isObject()) {
                entries.add(new EducationEntry(text(item, "school"), text(item, "degree"), text(item, "field")));
            }
        }
        return entries;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isValueNode() && !item.isNull()) {
                values.add(item.asText());
            }
        }
        return values;
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
