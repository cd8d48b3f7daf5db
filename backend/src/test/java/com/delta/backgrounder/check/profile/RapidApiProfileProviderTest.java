package com.delta.backgrounder.check.profile;

import com.delta.backgrounder.check.http.SourceFetchException;
import com.delta.backgrounder.check.http.SourceHttpClient;
import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.LinkedInProfile;
import com.delta.backgrounder.config.BackgrounderProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RapidApiProfileProviderTest {
    private MockWebServer server;
    private ExecutorService executor;
    private BackgrounderProperties properties;
    private RapidApiProfileProvider provider;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        properties = new BackgrounderProperties();
        properties.getHttp().setRequestTimeoutSeconds(5);
        properties.getRapidapi().setApiKey("rapid-key");
        properties.getRapidapi().setBaseUrl(server.url("/rapid/").toString());
        executor = Executors.newFixedThreadPool(2);
        provider = new RapidApiProfileProvider(new SourceHttpClient(properties, executor), properties, new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void mapsProfileForKnownUrl() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("""
            {
              "fullName": "Jane Doe",
              "headline": "Staff Engineer at Acme",
              "geo": {"full": "Austin, Texas"},
              "summary": "Builds data platforms.",
              "position": [
                {"title": "Staff Engineer", "companyName": "Acme", "dateRange": "2020 - Present"}
              ],
              "educations": [{"schoolName": "State University", "degreeName": "BSc", "fieldOfStudy": "CS"}],
              "skills": [{"name": "Java"}, {"name": ""}, {"name": "Kafka"}]
            }
            """));
        BackgroundCheckRequest request = BackgroundCheckRequest.of("Jane Doe").withLinkedinUrl("https://www.linkedin.com/in/janedoe/");

        LinkedInProfile profile = provider.fetch(request);

        assertThat(profile.name()).isEqualTo("Jane Doe");
        assertThat(profile.location()).isEqualTo("Austin, Texas");
        assertThat(profile.summary()).isEqualTo("Builds data platforms.");
        assertThat(profile.experience()).singleElement().satisfies(e -> {
            assertThat(e.company()).isEqualTo("Acme");
            assertThat(e.duration()).isEqualTo("2020 - Present");
        });
        assertThat(profile.education().get(0).field()).isEqualTo("CS");
        assertThat(profile.skills()).containsExactly("Java", "Kafka");

        RecordedRequest recorded = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(recorded.getPath()).isEqualTo("/rapid/?username=janedoe");
        assertThat(recorded.getHeader("X-RapidAPI-Key")).isEqualTo("rapid-key");
        assertThat(recorded.getHeader("X-RapidAPI-Host")).isEqualTo("linkedin-data-api.p.rapidapi.com");
    }

    @Test
    void requiresProfileUrl() {
        assertThat(provider.fetch(BackgroundCheckRequest.of("Jane Doe"))).isNull();
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void rateLimitIsASourceFailure() {
        server.enqueue(new MockResponse().setResponseCode(429));
        BackgroundCheckRequest request = BackgroundCheckRequest.of("Jane Doe").withLinkedinUrl("https://www.linkedin.com/in/janedoe");

        assertThatThrownBy(() -> provider.fetch(request))
            .isInstanceOfSatisfying(SourceFetchException.class, e -> assertThat(e.getErrorCode()).isEqualTo("http_429"));
    }
}
