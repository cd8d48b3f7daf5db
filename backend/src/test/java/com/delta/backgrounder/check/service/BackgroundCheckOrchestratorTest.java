package com.delta.backgrounder.check.service;

import com.delta.backgrounder.check.engine.ContextAssembler;
import com.delta.backgrounder.check.engine.RedundancyResolver;
import com.delta.backgrounder.check.engine.SourceTaskExecutor;
import com.delta.backgrounder.check.http.SourceFetchException;
import com.delta.backgrounder.check.llm.ReportGenerationException;
import com.delta.backgrounder.check.llm.ReportGenerator;
import com.delta.backgrounder.check.model.AggregatedData;
import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.BackgroundReport;
import com.delta.backgrounder.check.model.BackgroundVerdict;
import com.delta.backgrounder.check.model.ExperienceEntry;
import com.delta.backgrounder.check.model.LinkedInProfile;
import com.delta.backgrounder.check.model.ProfileProviderName;
import com.delta.backgrounder.check.model.ProgressEvent;
import com.delta.backgrounder.check.model.ProgressPhase;
import com.delta.backgrounder.check.model.ReportNarrative;
import com.delta.backgrounder.check.model.RunEvent;
import com.delta.backgrounder.check.model.SearchHit;
import com.delta.backgrounder.check.model.TaskState;
import com.delta.backgrounder.check.profile.ProfileProvider;
import com.delta.backgrounder.check.profile.ProfileProviderRegistry;
import com.delta.backgrounder.check.source.CodeHostClient;
import com.delta.backgrounder.check.source.CompanyVerifier;
import com.delta.backgrounder.check.source.ReferenceDiscoverer;
import com.delta.backgrounder.check.source.ReversePhotoSearcher;
import com.delta.backgrounder.check.source.SocialMediaScanner;
import com.delta.backgrounder.check.source.WebSearchClient;
import com.delta.backgrounder.check.task.CheckSubject;
import com.delta.backgrounder.check.task.SourceTaskBinder;
import com.delta.backgrounder.check.task.TaskDescriptorBuilder;
import com.delta.backgrounder.config.BackgrounderProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BackgroundCheckOrchestratorTest {

    @Mock
    private ProfileProvider scraperProvider;
    @Mock
    private ProfileProvider serpApiProvider;
    @Mock
    private WebSearchClient webSearch;
    @Mock
    private CodeHostClient codeHost;
    @Mock
    private CompanyVerifier companyVerifier;
    @Mock
    private SocialMediaScanner socialScanner;
    @Mock
    private ReferenceDiscoverer referenceDiscoverer;
    @Mock
    private ReversePhotoSearcher photoSearcher;
    @Mock
    private ReportGenerator reportGenerator;

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private BackgroundCheckOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        when(scraperProvider.name()).thenReturn(ProfileProviderName.SCRAPER);
        when(serpApiProvider.name()).thenReturn(ProfileProviderName.SERPAPI);
        BackgrounderProperties properties = new BackgrounderProperties();
        SourceTaskBinder binder = new SourceTaskBinder(
            new ProfileProviderRegistry(List.of(scraperProvider, serpApiProvider)),
            webSearch,
            codeHost,
            companyVerifier,
            socialScanner,
            referenceDiscoverer,
            photoSearcher
        );
        orchestrator = new BackgroundCheckOrchestrator(
            new TaskDescriptorBuilder(properties),
            binder,
            new SourceTaskExecutor(executor),
            new RedundancyResolver(),
            new ContextAssembler(),
            reportGenerator,
            new FallbackReportBuilder()
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void emptySourcesAndFailingGeneratorStillProduceFallbackReport() {
        when(reportGenerator.summarize(any(), any())).thenThrow(new ReportGenerationException("no key"));

        BackgroundReport report = orchestrator.run(CheckSubject.of(BackgroundCheckRequest.of("Jane Doe")));

        assertThat(report.name()).isEqualTo("Jane Doe");
        assertThat(report.sourcesUsed()).isEmpty();
        assertThat(report.linkedinProfile()).isNull();
        assertThat(report.confidenceNote()).isEqualTo("No profile found. Report is based on web search results only.");
        assertThat(report.summary()).isEqualTo("Background data collected for Jane Doe but report generation failed.");
        assertThat(report.keyHighlights()).contains("LinkedIn profile: not found", "Google results: 0 found");
        assertThat(report.providerUsed()).isEqualTo("Scraper");
        assertThat(report.verdict()).isNull();
    }

    @Test
    void richestProfileWinsAndGeneratorNarrativeIsUsed() {
        LinkedInProfile detailed = new LinkedInProfile(
            "https://www.linkedin.com/in/jane", "Jane Doe", null, null, null,
            List.of(
                new ExperienceEntry("Engineer", "Acme", null, null),
                new ExperienceEntry("Engineer", "Globex", null, null),
                new ExperienceEntry("Intern", "Initech", null, null)
            ),
            List.of(), List.of(), List.of(), null);
        LinkedInProfile summaryOnly = new LinkedInProfile(
            "https://www.linkedin.com/in/jane", "Jane Doe", "Engineer", null, "A long career summary",
            List.of(), List.of(), List.of(), List.of(), null);
        when(scraperProvider.fetch(any())).thenReturn(summaryOnly);
        when(serpApiProvider.fetch(any())).thenReturn(detailed);
        BackgroundVerdict verdict = new BackgroundVerdict("clean", 88, "Checks out", List.of(), List.of(), List.of(), List.of());
        when(reportGenerator.summarize(any(), any())).thenReturn(
            new ReportNarrative("Jane is an engineer.", "Background", List.of("Acme"), null, verdict));

        BackgroundReport report = orchestrator.run(CheckSubject.of(BackgroundCheckRequest.of("Jane Doe")));

        assertThat(report.linkedinProfile()).isSameAs(detailed);
        assertThat(report.providerUsed()).isEqualTo("Scraper + SerpAPI");
        assertThat(report.sourcesUsed()).containsExactly("LinkedIn (Scraper + SerpAPI)");
        assertThat(report.summary()).isEqualTo("Jane is an engineer.");
        assertThat(report.verdict().score()).isEqualTo(88);
        assertThat(report.confidenceNote()).isEmpty();
    }

    @Test
    void streamingRunReportsEveryTaskOnceAndEndsWithReport() {
        when(webSearch.search(anyString())).thenThrow(new SourceFetchException("serpapi", 503, "http_503", "unavailable"));
        when(webSearch.searchNews(eq("Jane Doe"))).thenReturn(
            List.of(new SearchHit("Jane hired", "https://news.example.com/1", "story", "news")));
        when(reportGenerator.summarize(any(BackgroundCheckRequest.class), any(AggregatedData.class)))
            .thenThrow(new ReportGenerationException("bad json"));

        List<RunEvent> events = Collections.synchronizedList(new ArrayList<>());
        BackgroundReport report = orchestrator.runStreaming(
            CheckSubject.of(BackgroundCheckRequest.of("Jane Doe")), events::add);

        List<ProgressEvent> progress = events.stream()
            .filter(ProgressEvent.class::isInstance)
            .map(ProgressEvent.class::cast)
            .toList();
        long announced = progress.stream().filter(e -> e.phase() == ProgressPhase.SEARCH_START).count();
        long finished = progress.stream().filter(e -> e.phase() == ProgressPhase.TASK_DONE).count();
        assertThat(announced).isEqualTo(7);
        assertThat(finished).isEqualTo(announced);
        assertThat(progress).filteredOn(e -> "google:main".equals(e.taskId()) && e.phase() == ProgressPhase.TASK_DONE)
            .singleElement()
            .extracting(ProgressEvent::state)
            .isEqualTo(TaskState.ERROR);
        assertThat(progress).filteredOn(e -> "news:main".equals(e.taskId()) && e.phase() == ProgressPhase.TASK_DONE)
            .singleElement()
            .extracting(ProgressEvent::detail)
            .isEqualTo("1 results");
        assertThat(events.get(events.size() - 2)).isInstanceOfSatisfying(ProgressEvent.class,
            e -> assertThat(e.phase()).isEqualTo(ProgressPhase.ANALYZING));
        assertThat(events.get(events.size() - 1)).isSameAs(report);
        assertThat(report.newsMentions()).extracting(SearchHit::url).containsExactly("https://news.example.com/1");
        assertThat(report.sourcesUsed()).containsExactly("News (1 articles)");
    }

    @Test
    void slowProfileStillRendersAheadOfFasterSources() {
        LinkedInProfile profile = new LinkedInProfile(
            "https://www.linkedin.com/in/jane", "Jane Doe", "Engineer", null, null,
            List.of(new ExperienceEntry("Engineer", "Acme", null, null)),
            List.of(), List.of(), List.of(), null);
        when(scraperProvider.fetch(any())).thenAnswer(invocation -> {
            Thread.sleep(200);
            return profile;
        });
        when(webSearch.search(anyString())).thenReturn(
            List.of(new SearchHit("Jane Doe talk", "https://conf.example.com/jane", "keynote", "google")));
        when(webSearch.searchNews(anyString())).thenReturn(
            List.of(new SearchHit("Jane hired", "https://news.example.com/1", "story", "news")));
        ArgumentCaptor<AggregatedData> aggregated = ArgumentCaptor.forClass(AggregatedData.class);
        when(reportGenerator.summarize(any(), aggregated.capture()))
            .thenReturn(new ReportNarrative("Jane is an engineer.", "", List.of(), null, null));

        List<RunEvent> events = Collections.synchronizedList(new ArrayList<>());
        BackgroundReport report = orchestrator.runStreaming(
            CheckSubject.of(BackgroundCheckRequest.of("Jane Doe")), events::add);

        List<String> finishOrder = events.stream()
            .filter(ProgressEvent.class::isInstance)
            .map(ProgressEvent.class::cast)
            .filter(e -> e.phase() == ProgressPhase.TASK_DONE)
            .map(ProgressEvent::taskId)
            .toList();
        assertThat(finishOrder.get(finishOrder.size() - 1)).isEqualTo(TaskDescriptorBuilder.PROFILE_CHOSEN);

        String context = aggregated.getValue().rawContext();
        int profileAt = context.indexOf("[SOURCE: LinkedIn]");
        int webAt = context.indexOf("Jane Doe talk");
        int newsAt = context.indexOf("[news] Jane hired");
        assertThat(profileAt).isGreaterThanOrEqualTo(0);
        assertThat(webAt).isGreaterThan(profileAt);
        assertThat(newsAt).isGreaterThan(webAt);
        assertThat(report.sourcesUsed()).containsExactly(
            "LinkedIn (Scraper)", "Google (1 results)", "News (1 articles)");
    }
}
