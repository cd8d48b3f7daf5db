package com.delta.backgrounder.check.service;

import com.delta.backgrounder.check.engine.RunEventChannel;
import com.delta.backgrounder.check.llm.ResumeExtractor;
import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.BackgroundReport;
import com.delta.backgrounder.check.model.ProgressEvent;
import com.delta.backgrounder.check.model.ProgressPhase;
import com.delta.backgrounder.check.model.ResumeData;
import com.delta.backgrounder.check.model.RunEvent;
import com.delta.backgrounder.check.model.TaskState;
import com.delta.backgrounder.check.resume.ResumeParseException;
import com.delta.backgrounder.check.resume.ResumeTextParser;
import com.delta.backgrounder.check.source.PhotoUploader;
import com.delta.backgrounder.check.task.CheckSubject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

@Service
public class BackgroundCheckService {
    private static final Logger log = LoggerFactory.getLogger(BackgroundCheckService.class);

    private final BackgroundCheckOrchestrator orchestrator;
    private final ResumeTextParser resumeTextParser;
    private final ResumeExtractor resumeExtractor;
    private final PhotoUploader photoUploader;
    private final ExecutorService runExecutor;

    public BackgroundCheckService(
        BackgroundCheckOrchestrator orchestrator,
        ResumeTextParser resumeTextParser,
        ResumeExtractor resumeExtractor,
        PhotoUploader photoUploader,
        @Qualifier("runExecutor") ExecutorService runExecutor
    ) {
        this.orchestrator = orchestrator;
        this.resumeTextParser = resumeTextParser;
        this.resumeExtractor = resumeExtractor;
        this.photoUploader = photoUploader;
        this.runExecutor = runExecutor;
    }

    /**
     * Starts a streaming check in the background and returns the channel its events arrive on.
     */
    public RunEventChannel start(BackgroundCheckSubmission submission) {
        RunEventChannel channel = new RunEventChannel();
        try {
            runExecutor.execute(() -> runInto(submission, channel));
        } catch (RejectedExecutionException e) {
            log.error("Could not start background check for {}", submission.request().name(), e);
            channel.fail(e);
        }
        return channel;
    }

    public BackgroundReport runSync(BackgroundCheckRequest request) {
        try {
            return orchestrator.run(CheckSubject.of(request));
        } catch (RuntimeException e) {
            throw new BackgroundCheckFailedException("Background check failed for " + request.name(), e);
        }
    }

    void runInto(BackgroundCheckSubmission submission, RunEventChannel channel) {
        try {
            CheckSubject subject = intake(submission, channel::publish);
            orchestrator.runStreaming(subject, channel::publish);
            channel.close();
        } catch (RuntimeException e) {
            log.error("Background check failed for {}", submission.request().name(), e);
            channel.fail(new BackgroundCheckFailedException("Background check failed for " + submission.request().name(), e));
        } catch (Error e) {
            log.error("Background check aborted for {}", submission.request().name(), e);
            channel.fail(new BackgroundCheckFailedException("Background check aborted for " + submission.request().name(), e));
            throw e;
        }
    }

    /**
     * Parses the résumé and uploads the photo, reporting both phases to {@code sink}.
     */
    CheckSubject intake(BackgroundCheckSubmission submission, Consumer<RunEvent> sink) {
        BackgroundCheckRequest request = submission.request();
        ResumeData resume = null;
        if (submission.hasResume()) {
            sink.accept(ProgressEvent.phase(ProgressPhase.RESUME_PARSE, "Parsing resume...", TaskState.RUNNING, null));
            try {
                String text = resumeTextParser.extractText(
                    submission.resumeBytes(),
                    submission.resumeFilename(),
                    submission.resumeContentType()
                );
                resume = resumeExtractor.extract(text);
                request = request.withResumeDefaults(resume);
                sink.accept(ProgressEvent.phase(
                    ProgressPhase.RESUME_PARSE,
                    "Resume parsed",
                    TaskState.DONE,
                    resume.skills().size() + " skills, " + resume.experience().size() + " roles extracted"
                ));
            } catch (ResumeParseException e) {
                log.warn("Could not parse resume {}: {}", submission.resumeFilename(), e.getMessage());
                sink.accept(ProgressEvent.phase(ProgressPhase.RESUME_PARSE, "Could not parse resume", TaskState.ERROR, e.getMessage()));
            }
        }

        String photoUrl = submission.photoUrl();
        if (photoUrl == null && submission.hasPhotoFile()) {
            sink.accept(ProgressEvent.phase(ProgressPhase.PHOTO_UPLOAD, "Uploading photo...", TaskState.RUNNING, null));
            Optional<String> uploaded = photoUploader.upload(submission.photoBytes());
            if (uploaded.isPresent()) {
                photoUrl = uploaded.get();
                sink.accept(ProgressEvent.phase(ProgressPhase.PHOTO_UPLOAD, "Photo uploaded", TaskState.DONE, "Ready for reverse search"));
            } else {
                sink.accept(ProgressEvent.phase(ProgressPhase.PHOTO_UPLOAD, "Photo upload failed", TaskState.ERROR, null));
            }
        }
        return new CheckSubject(request, resume, photoUrl);
    }
}
