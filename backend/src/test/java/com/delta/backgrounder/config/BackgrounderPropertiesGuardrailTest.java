package com.delta.backgrounder.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackgrounderPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToBrowserDefault() {
        BackgrounderProperties properties = new BackgrounderProperties();
        properties.getHttp().setUserAgent("   ");
        assertTrue(properties.getHttp().getUserAgent().startsWith("Mozilla/5.0"));
    }

    @Test
    void limitsAreClamped() {
        BackgrounderProperties properties = new BackgrounderProperties();
        properties.getHttp().setGlobalConcurrency(0);
        properties.getHttp().setRequestTimeoutSeconds(-5);
        properties.getNvidia().setContextMaxChars(10);
        properties.getSocial().setRetryThreshold(-1);
        properties.getStream().setTimeoutMs(5);
        assertEquals(1, properties.getHttp().getGlobalConcurrency());
        assertEquals(1, properties.getHttp().getRequestTimeoutSeconds());
        assertEquals(1000, properties.getNvidia().getContextMaxChars());
        assertEquals(0, properties.getSocial().getRetryThreshold());
        assertEquals(1_000L, properties.getStream().getTimeoutMs());
    }

    @Test
    void blankDefaultProviderMeansScraper() {
        BackgrounderProperties properties = new BackgrounderProperties();
        properties.getProfile().setDefaultProvider(" ");
        assertEquals("scraper", properties.getProfile().getDefaultProvider());
    }

    @Test
    void keysCountOnlyWhenNonBlank() {
        BackgrounderProperties properties = new BackgrounderProperties();
        assertFalse(properties.getSerpapi().isConfigured());
        properties.getSerpapi().setApiKey("key");
        assertTrue(properties.getSerpapi().isConfigured());
        properties.getNvidia().setApiKey("\t");
        assertFalse(properties.getNvidia().isConfigured());
    }
}
