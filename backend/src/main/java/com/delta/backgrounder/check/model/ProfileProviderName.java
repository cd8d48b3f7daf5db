package com.delta.backgrounder.check.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProfileProviderName {
    SERPAPI("serpapi", "SerpAPI"),
    SCRAPER("scraper", "Scraper"),
    PROXYCURL("proxycurl", "Proxycurl"),
    RAPIDAPI("rapidapi", "RapidAPI");

    private final String key;
    private final String displayName;

    ProfileProviderName(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Lenient lookup of user input. Returns null for blank or unknown values.
     */
    public static ProfileProviderName parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("playwright") || normalized.equals("browser")) {
            return SCRAPER;
        }
        for (ProfileProviderName candidate : values()) {
            if (candidate.key.equals(normalized) || candidate.name().equalsIgnoreCase(normalized)) {
                return candidate;
            }
        }
        return null;
    }
}
