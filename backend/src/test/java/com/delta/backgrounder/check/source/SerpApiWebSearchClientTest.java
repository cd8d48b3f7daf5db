package com.delta.backgrounder.check.source;

import com.delta.backgrounder.check.http.SourceFetchException;
import com.delta.backgrounder.check.http.SourceHttpClient;
import com.delta.backgrounder.check.model.SearchHit;
import com.delta.backgrounder.config.BackgrounderProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SerpApiWebSearchClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private BackgrounderProperties properties;
    private SerpApiWebSearchClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        properties = new BackgrounderProperties();
        properties.getHttp().setRequestTimeoutSeconds(5);
        properties.getSerpapi().setApiKey("test-key");
        properties.getSerpapi().setBaseUrl(server.url("/search.json").toString());
        properties.getSerpapi().setMaxResults(2);
        executor = Executors.newFixedThreadPool(2);
        SourceHttpClient httpClient = new SourceHttpClient(properties, executor);
        client = new SerpApiWebSearchClient(new SerpApiClient(httpClient, properties, new ObjectMapper()));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void webSearchDropsProfileDomainAndCapsResults() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("""
            {"organic_results": [
              {"title": "Jane Doe | LinkedIn", "link": "https://www.linkedin.com/in/janedoe", "snippet": "profile"},
              {"title": "Jane at Acme", "link": "https://acme.example.com/team", "snippet": "Engineering lead"},
              {"title": "Talk by Jane", "link": "https://conf.example.com/talks/1"},
              {"title": "Third", "link": "https://other.example.com/"}
            ]}
            """));

        List<SearchHit> hits = client.search("Jane Doe Acme");

        assertThat(hits).extracting(SearchHit::url)
            .containsExactly("https://acme.example.com/team", "https://conf.example.com/talks/1");
        assertThat(hits.get(0).source()).isEqualTo("google");
        assertThat(hits.get(1).snippet()).isEmpty();
        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request.getPath()).contains("engine=google", "q=Jane+Doe+Acme", "api_key=test-key");
        assertThat(request.getPath()).doesNotContain("tbm=");
    }

    @Test
    void newsSearchUsesNewsVertical() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("""
            {"news_results": [
              {"title": "Acme hires Jane", "link": "https://news.example.com/a", "snippet": "story"}
            ]}
            """));

        List<SearchHit> hits = client.searchNews("Jane Doe");

        assertThat(hits).containsExactly(new SearchHit("Acme hires Jane", "https://news.example.com/a", "story", "news"));
        assertThat(server.takeRequest(5, TimeUnit.SECONDS).getPath()).contains("tbm=nws");
    }

    @Test
    void missingKeyYieldsNoResultsWithoutCallingOut() {
        properties.getSerpapi().setApiKey(" ");

        assertThat(client.search("Jane Doe")).isEmpty();
        assertThat(client.searchNews("Jane Doe")).isEmpty();
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void upstreamErrorsSurfaceAsSourceFailures() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("rate limited"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>oops</html>"));

        assertThatThrownBy(() -> client.search("Jane Doe"))
            .isInstanceOfSatisfying(SourceFetchException.class, e -> assertThat(e.getErrorCode()).isEqualTo("http_429"));
        assertThatThrownBy(() -> client.search("Jane Doe"))
            .isInstanceOfSatisfying(SourceFetchException.class, e -> assertThat(e.getErrorCode()).isEqualTo("invalid_json"));
    }
}
