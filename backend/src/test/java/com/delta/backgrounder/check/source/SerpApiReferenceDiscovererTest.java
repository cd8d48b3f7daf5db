package com.delta.backgrounder.check.source;

import com.delta.backgrounder.check.http.SourceHttpClient;
import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.ReferenceCategory;
import com.delta.backgrounder.check.model.ReferenceContact;
import com.delta.backgrounder.config.BackgrounderProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class SerpApiReferenceDiscovererTest {
    private MockWebServer server;
    private ExecutorService httpExecutor;
    private ExecutorService sourceExecutor;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (httpExecutor != null) {
            httpExecutor.shutdownNow();
        }
        if (sourceExecutor != null) {
            sourceExecutor.shutdownNow();
        }
    }

    @Test
    void splitsProfileTitleIntoNameAndRole() {
        assertThat(SerpApiReferenceDiscoverer.parseProfileTitle("Jane Roe - Senior Manager - Acme | LinkedIn"))
            .containsExactly("Jane Roe", "Senior Manager");
        assertThat(SerpApiReferenceDiscoverer.parseProfileTitle("Bob Smith | LinkedIn"))
            .containsExactly("Bob Smith", "");
        assertThat(SerpApiReferenceDiscoverer.parseProfileTitle(" | LinkedIn"))
            .containsExactly("", "");
        assertThat(SerpApiReferenceDiscoverer.parseProfileTitle(null))
            .containsExactly("", "");
    }

    @Test
    void mapsTitleToDepartmentKeywords() {
        assertThat(SerpApiReferenceDiscoverer.departmentKeywords("Senior Software Engineer"))
            .isEqualTo("Engineer OR Developer OR Software");
        assertThat(SerpApiReferenceDiscoverer.departmentKeywords("Head of Product")).isEqualTo("Product OR PM");
        assertThat(SerpApiReferenceDiscoverer.departmentKeywords("Chef")).isNull();
        assertThat(SerpApiReferenceDiscoverer.departmentKeywords("")).isNull();
    }

    @Test
    void findsColleaguesAndSkipsTheSubjectAndNonProfiles() throws Exception {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return new MockResponse().setResponseCode(200).setBody("""
                    {"organic_results": [
                      {"title": "Bob Smith - HR Business Partner - Acme | LinkedIn",
                       "link": "https://www.linkedin.com/in/bobsmith", "snippet": "People team"},
                      {"title": "Jane Doe - Engineer | LinkedIn", "link": "https://www.linkedin.com/in/janedoe"},
                      {"title": "Acme careers", "link": "https://acme.example.com/careers"}
                    ]}
                    """);
            }
        });
        server.start();
        BackgrounderProperties properties = new BackgrounderProperties();
        properties.getHttp().setRequestTimeoutSeconds(5);
        properties.getSerpapi().setApiKey("k");
        properties.getSerpapi().setBaseUrl(server.url("/search.json").toString());
        httpExecutor = Executors.newFixedThreadPool(2);
        sourceExecutor = Executors.newCachedThreadPool();
        SerpApiClient serpApi = new SerpApiClient(new SourceHttpClient(properties, httpExecutor), properties, new ObjectMapper());
        SerpApiReferenceDiscoverer discoverer = new SerpApiReferenceDiscoverer(serpApi, properties, sourceExecutor);

        List<ReferenceContact> contacts = discoverer.discover(
            new BackgroundCheckRequest("Jane Doe", "Acme", null, null, null, null), null);

        assertThat(contacts).hasSize(1);
        ReferenceContact contact = contacts.get(0);
        assertThat(contact.name()).isEqualTo("Bob Smith");
        assertThat(contact.title()).isEqualTo("HR Business Partner");
        assertThat(contact.company()).isEqualTo("Acme");
        assertThat(contact.category()).isEqualTo(ReferenceCategory.HR);
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void noEmployerMeansNoLookups() {
        BackgrounderProperties properties = new BackgrounderProperties();
        properties.getSerpapi().setApiKey("k");
        httpExecutor = Executors.newFixedThreadPool(1);
        sourceExecutor = Executors.newCachedThreadPool();
        SerpApiClient serpApi = new SerpApiClient(new SourceHttpClient(properties, httpExecutor), properties, new ObjectMapper());

        assertThat(new SerpApiReferenceDiscoverer(serpApi, properties, sourceExecutor)
            .discover(BackgroundCheckRequest.of("Jane Doe"), null)).isEmpty();
    }
}
