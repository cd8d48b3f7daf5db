package com.delta.backgrounder.check.service;

import com.delta.backgrounder.check.engine.RunEventChannel;
import com.delta.backgrounder.check.llm.ResumeExtractor;
import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.BackgroundReport;
import com.delta.backgrounder.check.model.ExperienceEntry;
import com.delta.backgrounder.check.model.ProgressEvent;
import com.delta.backgrounder.check.model.ProgressPhase;
import com.delta.backgrounder.check.model.ResumeData;
import com.delta.backgrounder.check.model.RunEvent;
import com.delta.backgrounder.check.model.TaskState;
import com.delta.backgrounder.check.resume.ResumeParseException;
import com.delta.backgrounder.check.resume.ResumeTextParser;
import com.delta.backgrounder.check.source.PhotoUploader;
import com.delta.backgrounder.check.task.CheckSubject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BackgroundCheckServiceTest {

    @Mock
    private BackgroundCheckOrchestrator orchestrator;
    @Mock
    private ResumeTextParser resumeTextParser;
    @Mock
    private ResumeExtractor resumeExtractor;
    @Mock
    private PhotoUploader photoUploader;

    private final ExecutorService runExecutor = Executors.newSingleThreadExecutor();
    private BackgroundCheckService service;

    @BeforeEach
    void setUp() {
        service = new BackgroundCheckService(orchestrator, resumeTextParser, resumeExtractor, photoUploader, runExecutor);
    }

    @AfterEach
    void tearDown() {
        runExecutor.shutdownNow();
    }

    @Test
    void parsedResumeFillsOnlyMissingRequestFields() {
        byte[] bytes = "resume".getBytes(StandardCharsets.UTF_8);
        when(resumeTextParser.extractText(bytes, "cv.txt", "text/plain")).thenReturn("resume");
        when(resumeExtractor.extract("resume")).thenReturn(new ResumeData(
            "Jane Doe", null, null, "Austin", "Engineer", "Globex", "https://www.linkedin.com/in/jane", null, null,
            List.of("Java", "Go"),
            List.of(new ExperienceEntry("Engineer", "Globex", null, null)),
            List.of(), List.of(), List.of(), "resume"));
        BackgroundCheckRequest request = new BackgroundCheckRequest("Jane Doe", "Acme", null, null, null, null);
        List<RunEvent> events = new ArrayList<>();

        CheckSubject subject = service.intake(
            new BackgroundCheckSubmission(request, bytes, "cv.txt", "text/plain", null, null), events::add);

        assertThat(subject.request().company()).isEqualTo("Acme");
        assertThat(subject.request().title()).isEqualTo("Engineer");
        assertThat(subject.request().location()).isEqualTo("Austin");
        assertThat(subject.request().linkedinUrl()).isEqualTo("https://www.linkedin.com/in/jane");
        assertThat(subject.resume()).isNotNull();
        assertThat(events).hasSize(2);
        ProgressEvent done = (ProgressEvent) events.get(1);
        assertThat(done.phase()).isEqualTo(ProgressPhase.RESUME_PARSE);
        assertThat(done.state()).isEqualTo(TaskState.DONE);
        assertThat(done.detail()).isEqualTo("2 skills, 1 roles extracted");
    }

    @Test
    void unreadableResumeReportsErrorAndContinuesWithoutIt() {
        byte[] bytes = new byte[] {1, 2, 3};
        when(resumeTextParser.extractText(bytes, "cv.docx", null))
            .thenThrow(new ResumeParseException("Unsupported resume format: cv.docx"));
        List<RunEvent> events = new ArrayList<>();

        CheckSubject subject = service.intake(
            new BackgroundCheckSubmission(BackgroundCheckRequest.of("Jane Doe"), bytes, "cv.docx", null, null, null),
            events::add);

        assertThat(subject.resume()).isNull();
        ProgressEvent error = (ProgressEvent) events.get(1);
        assertThat(error.state()).isEqualTo(TaskState.ERROR);
        assertThat(error.label()).isEqualTo("Could not parse resume");
        verifyNoInteractions(resumeExtractor);
    }

    @Test
    void uploadedPhotoBecomesThePhotoReference() {
        byte[] photo = new byte[] {9, 9};
        when(photoUploader.upload(photo)).thenReturn(Optional.of("https://i.ibb.co/x.jpg"));
        List<RunEvent> events = new ArrayList<>();

        CheckSubject subject = service.intake(
            new BackgroundCheckSubmission(BackgroundCheckRequest.of("Jane Doe"), null, null, null, photo, null),
            events::add);

        assertThat(subject.photoUrl()).isEqualTo("https://i.ibb.co/x.jpg");
        assertThat(events).extracting(e -> ((ProgressEvent) e).phase())
            .containsExactly(ProgressPhase.PHOTO_UPLOAD, ProgressPhase.PHOTO_UPLOAD);
    }

    @Test
    void pastedPhotoUrlSkipsUpload() {
        CheckSubject subject = service.intake(
            new BackgroundCheckSubmission(BackgroundCheckRequest.of("Jane Doe"), null, null, null, new byte[] {1}, "https://img.example/p.jpg"),
            event -> {
            });

        assertThat(subject.photoUrl()).isEqualTo("https://img.example/p.jpg");
        verifyNoInteractions(photoUploader);
    }

    @Test
    void startedRunClosesChannelAfterReport() {
        BackgroundReport report = new BackgroundReport(
            "Jane Doe", Instant.now(), null, null, null, null, null, null, null, null, null,
            "summary", "", null, null, null, "Scraper", null);
        when(orchestrator.runStreaming(any(), any())).thenAnswer(invocation -> {
            java.util.function.Consumer<RunEvent> sink = invocation.getArgument(1);
            sink.accept(report);
            return report;
        });

        RunEventChannel channel = service.start(BackgroundCheckSubmission.of(BackgroundCheckRequest.of("Jane Doe")));
        List<RunEvent> received = new ArrayList<>();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        channel.drain(received::add, failure::set);

        assertThat(received).containsExactly(report);
        assertThat(failure.get()).isNull();
    }

    @Test
    void catastrophicFailureFailsTheChannel() {
        when(orchestrator.runStreaming(any(), any())).thenThrow(new IllegalStateException("executor gone"));

        RunEventChannel channel = service.start(BackgroundCheckSubmission.of(BackgroundCheckRequest.of("Jane Doe")));
        AtomicReference<Throwable> failure = new AtomicReference<>();
        channel.drain(event -> {
        }, failure::set);

        assertThat(failure.get()).isInstanceOf(BackgroundCheckFailedException.class)
            .hasRootCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void errorOnRunThreadStillEndsTheChannel() {
        when(orchestrator.runStreaming(any(), any())).thenThrow(new StackOverflowError("deep"));

        RunEventChannel channel = service.start(BackgroundCheckSubmission.of(BackgroundCheckRequest.of("Jane Doe")));
        AtomicReference<Throwable> failure = new AtomicReference<>();
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> channel.drain(event -> {
        }, failure::set));

        assertThat(channel.isEnded()).isTrue();
        assertThat(failure.get()).isInstanceOf(BackgroundCheckFailedException.class)
            .hasRootCauseInstanceOf(StackOverflowError.class);
    }

    @Test
    void syncRunWrapsUnexpectedFailures() {
        when(orchestrator.run(any())).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> service.runSync(BackgroundCheckRequest.of("Jane Doe")))
            .isInstanceOf(BackgroundCheckFailedException.class);
    }
}
