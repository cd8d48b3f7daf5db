package com.delta.backgrounder.check.source;

import com.delta.backgrounder.check.http.SourceFetchException;
import com.delta.backgrounder.check.model.SocialProfile;
import com.delta.backgrounder.config.BackgrounderProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SerpApiSocialMediaScannerTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private SerpApiClient serpApi;

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private BackgrounderProperties properties;
    private SerpApiSocialMediaScanner scanner;

    @BeforeEach
    void setUp() {
        properties = new BackgrounderProperties();
        scanner = new SerpApiSocialMediaScanner(serpApi, properties, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void sparseFirstPassTriggersPlatformRetries() {
        when(serpApi.isConfigured()).thenReturn(true);
        when(serpApi.google(anyString(), anyInt())).thenAnswer(invocation -> {
            String query = invocation.getArgument(0);
            if (query.startsWith("(") && query.contains("site:twitter.com")) {
                return json("""
                    {"organic_results": [
                      {"title": "Jane Doe (@janedoe)", "link": "https://twitter.com/janedoe", "snippet": "Engineer"},
                      {"title": "Somebody else", "link": "https://x.com/other", "snippet": "unrelated"},
                      {"title": "Jane Doe blog", "link": "https://janedoe.example.com", "snippet": ""}
                    ]}
                    """);
            }
            if (query.equals("site:twitter.com Jane Doe")) {
                return json("{\"organic_results\": [{\"title\": \"Jane Doe\", \"link\": \"https://twitter.com/janedoe\"}]}");
            }
            if (query.equals("site:medium.com Jane Doe")) {
                return json("{\"organic_results\": [{\"title\": \"Jane Doe - Medium\", \"link\": \"https://medium.com/@janedoe\"}]}");
            }
            if (query.equals("site:youtube.com Jane Doe")) {
                throw new SourceFetchException("serpapi", 503, "http_503", "unavailable");
            }
            return json("{}");
        });

        List<SocialProfile> profiles = scanner.scan("Jane Doe");

        assertThat(profiles).extracting(SocialProfile::platform).containsExactly("Twitter/X", "Medium");
        assertThat(profiles.get(0).username()).isEqualTo("janedoe");
        assertThat(profiles.get(0).snippet()).isEqualTo("Engineer");
        assertThat(profiles.get(1).username()).isEqualTo("@janedoe");
        assertThat(profiles.get(1).snippet()).isEqualTo("Jane Doe - Medium");
    }

    @Test
    void enoughFirstPassResultsSkipRetries() {
        properties.getSocial().setRetryThreshold(0);
        when(serpApi.isConfigured()).thenReturn(true);
        when(serpApi.google(anyString(), anyInt())).thenAnswer(invocation -> json("{}"));

        assertThat(scanner.scan("Jane Doe")).isEmpty();

        verify(serpApi, never()).google(startsWith("site:"), anyInt());
    }

    @Test
    void unconfiguredScannerReturnsNothing() {
        when(serpApi.isConfigured()).thenReturn(false);

        assertThat(scanner.scan("Jane Doe")).isEmpty();
        verify(serpApi, never()).google(anyString(), anyInt());
    }

    private static JsonNode json(String body) throws Exception {
        return MAPPER.readTree(body);
    }
}
