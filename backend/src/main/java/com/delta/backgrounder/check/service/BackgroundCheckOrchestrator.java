package com.delta.backgrounder.check.service;

import com.delta.backgrounder.check.engine.ContextAssembler;
import com.delta.backgrounder.check.engine.RedundancyResolver;
import com.delta.backgrounder.check.engine.RunProgressTracker;
import com.delta.backgrounder.check.engine.SourceTaskExecutor;
import com.delta.backgrounder.check.llm.ReportGenerationException;
import com.delta.backgrounder.check.llm.ReportGenerator;
import com.delta.backgrounder.check.model.AggregatedData;
import com.delta.backgrounder.check.model.AssembledContext;
import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.BackgroundReport;
import com.delta.backgrounder.check.model.ReportNarrative;
import com.delta.backgrounder.check.model.RunEvent;
import com.delta.backgrounder.check.model.SourceResult;
import com.delta.backgrounder.check.model.TaskDescriptor;
import com.delta.backgrounder.check.model.TaskOutcome;
import com.delta.backgrounder.check.task.CheckSubject;
import com.delta.backgrounder.check.task.SourceTaskBinder;
import com.delta.backgrounder.check.task.TaskDescriptorBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Consumer;

/**
 * One background check from subject to report: build tasks, fan out, merge, render the
 * context, summarize. Collect-all and streaming runs share this path.
 */
@Service
public class BackgroundCheckOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BackgroundCheckOrchestrator.class);

    private final TaskDescriptorBuilder taskDescriptorBuilder;
    private final SourceTaskBinder sourceTaskBinder;
    private final SourceTaskExecutor sourceTaskExecutor;
    private final RedundancyResolver redundancyResolver;
    private final ContextAssembler contextAssembler;
    private final ReportGenerator reportGenerator;
    private final FallbackReportBuilder fallbackReportBuilder;

    public BackgroundCheckOrchestrator(
        TaskDescriptorBuilder taskDescriptorBuilder,
        SourceTaskBinder sourceTaskBinder,
        SourceTaskExecutor sourceTaskExecutor,
        RedundancyResolver redundancyResolver,
        ContextAssembler contextAssembler,
        ReportGenerator reportGenerator,
        FallbackReportBuilder fallbackReportBuilder
    ) {
        this.taskDescriptorBuilder = taskDescriptorBuilder;
        this.sourceTaskBinder = sourceTaskBinder;
        this.sourceTaskExecutor = sourceTaskExecutor;
        this.redundancyResolver = redundancyResolver;
        this.contextAssembler = contextAssembler;
        this.reportGenerator = reportGenerator;
        this.fallbackReportBuilder = fallbackReportBuilder;
    }

    public BackgroundReport run(CheckSubject subject) {
        return execute(subject, null);
    }

    /**
     * Runs the check, sending progress events and finally the report to {@code sink}.
     */
    public BackgroundReport runStreaming(CheckSubject subject, Consumer<RunEvent> sink) {
        return execute(subject, new RunProgressTracker(sink));
    }

    private BackgroundReport execute(CheckSubject subject, RunProgressTracker tracker) {
        BackgroundCheckRequest request = subject.request();
        Map<String, TaskDescriptor> descriptors = taskDescriptorBuilder.build(subject);
        Map<String, Callable<SourceResult>> tasks = sourceTaskBinder.bindAll(descriptors, subject);
        log.info("Launching {} source tasks for {}", tasks.size(), request.name());

        Map<String, TaskOutcome> outcomes;
        if (tracker == null) {
            outcomes = sourceTaskExecutor.collectAll(tasks);
        } else {
            tracker.announce(tasks.keySet());
            outcomes = sourceTaskExecutor.stream(tasks, tracker::taskDone);
            tracker.analyzing();
        }
        long failed = outcomes.values().stream().filter(outcome -> !outcome.isSuccessful()).count();
        log.info("Source tasks finished for {}: total={}, failed={}", request.name(), outcomes.size(), failed);

        AggregatedData merged = redundancyResolver.resolve(descriptors, outcomes, subject.resume());
        AssembledContext context = contextAssembler.assemble(merged);
        AggregatedData aggregated = merged.withRawContext(context.contextText());

        ReportNarrative narrative;
        try {
            narrative = reportGenerator.summarize(request, aggregated);
        } catch (ReportGenerationException e) {
            log.warn("Report generation failed for {}, using fallback narrative: {}", request.name(), e.getMessage());
            narrative = fallbackReportBuilder.build(request, aggregated);
        }

        String providerUsed = aggregated.linkedinProviders().isEmpty()
            ? taskDescriptorBuilder.chosenProvider(request).displayName()
            : String.join(" + ", aggregated.linkedinProviders());

        BackgroundReport report = new BackgroundReport(
            request.name(),
            Instant.now(),
            aggregated.linkedin(),
            aggregated.githubProfiles(),
            aggregated.resume(),
            aggregated.companyChecks(),
            aggregated.socialProfiles(),
            aggregated.photoMatches(),
            aggregated.referenceContacts(),
            narrative.identityVerification(),
            narrative.verdict(),
            narrative.summary(),
            narrative.professionalBackground(),
            narrative.keyHighlights(),
            aggregated.newsArticles(),
            context.sourcesUsed(),
            providerUsed,
            context.confidenceNote()
        );
        if (tracker != null) {
            tracker.complete(report);
        }
        return report;
    }
}
