package com.delta.backgrounder.check.api;

import com.delta.backgrounder.check.engine.RunEventChannel;
import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.BackgroundReport;
import com.delta.backgrounder.check.model.ProfileProviderName;
import com.delta.backgrounder.check.model.RunEvent;
import com.delta.backgrounder.check.service.BackgroundCheckService;
import com.delta.backgrounder.check.service.BackgroundCheckSubmission;
import com.delta.backgrounder.config.BackgrounderProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.PAYLOAD_TOO_LARGE;

@RestController
@RequestMapping("/api/v1")
public class BackgroundCheckController {
    private static final Logger log = LoggerFactory.getLogger(BackgroundCheckController.class);

    private final BackgroundCheckService backgroundCheckService;
    private final BackgrounderProperties properties;
    private final ExecutorService runExecutor;

    public BackgroundCheckController(
        BackgroundCheckService backgroundCheckService,
        BackgrounderProperties properties,
        @Qualifier("runExecutor") ExecutorService runExecutor
    ) {
        this.backgroundCheckService = backgroundCheckService;
        this.properties = properties;
        this.runExecutor = runExecutor;
    }

    @PostMapping(path = "/check", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter check(
        @RequestParam(name = "name") String name,
        @RequestParam(name = "company", required = false) String company,
        @RequestParam(name = "location", required = false) String location,
        @RequestParam(name = "title", required = false) String title,
        @RequestParam(name = "linkedin_url", required = false) String linkedinUrl,
        @RequestParam(name = "photo_url", required = false) String photoUrl,
        @RequestParam(name = "provider", required = false) String provider,
        @RequestParam(name = "resume", required = false) MultipartFile resume,
        @RequestParam(name = "photo", required = false) MultipartFile photo
    ) {
        BackgroundCheckRequest request = new BackgroundCheckRequest(
            name,
            company,
            location,
            title,
            linkedinUrl,
            ProfileProviderName.parse(provider)
        );
        byte[] resumeBytes = read(resume, properties.getUpload().getMaxResumeBytes(), "Resume file");
        byte[] photoBytes = read(photo, properties.getUpload().getMaxPhotoBytes(), "Photo");
        BackgroundCheckSubmission submission = new BackgroundCheckSubmission(
            request,
            resumeBytes,
            resume == null ? null : resume.getOriginalFilename(),
            resume == null ? null : resume.getContentType(),
            photoBytes,
            photoUrl == null ? null : photoUrl.trim()
        );

        SseEmitter emitter = new SseEmitter(properties.getStream().getTimeoutMs());
        RunEventChannel channel = backgroundCheckService.start(submission);
        runExecutor.execute(() -> relay(channel, emitter));
        return emitter;
    }

    @PostMapping("/check/sync")
    public BackgroundReport checkSync(@RequestBody(required = false) BackgroundCheckApiRequest body) {
        if (body == null) {
            throw new ResponseStatusException(BAD_REQUEST, "Request body is required");
        }
        return backgroundCheckService.runSync(body.toRequest());
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    private static byte[] read(MultipartFile file, long maxBytes, String what) {
        if (file == null || file.isEmpty()) {
            return null;
        }
        if (file.getSize() > maxBytes) {
            throw new ResponseStatusException(PAYLOAD_TOO_LARGE, what + " too large (max " + maxBytes / (1024 * 1024) + "MB)");
        }
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new ResponseStatusException(BAD_REQUEST, "Could not read " + what.toLowerCase(), e);
        }
    }

    void relay(RunEventChannel channel, SseEmitter emitter) {
        AtomicReference<Throwable> failure = new AtomicReference<>();
        try {
            channel.drain(event -> send(emitter, event), failure::set);
        } catch (UncheckedIOException e) {
            log.info("Background check stream closed by client: {}", e.getMessage());
            emitter.completeWithError(e);
            return;
        }
        if (failure.get() != null) {
            emitter.completeWithError(failure.get());
        } else {
            emitter.complete();
        }
    }

    private static void send(SseEmitter emitter, RunEvent event) {
        try {
            emitter.send(SseEmitter.event().name(event.eventName()).data(event, MediaType.APPLICATION_JSON));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
