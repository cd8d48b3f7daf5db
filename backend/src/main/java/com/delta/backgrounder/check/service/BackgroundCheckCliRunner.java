package com.delta.backgrounder.check.service;

import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.BackgroundReport;
import com.delta.backgrounder.check.model.ProfileProviderName;
import com.delta.backgrounder.check.task.CheckSubject;
import com.delta.backgrounder.config.BackgrounderProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class BackgroundCheckCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(BackgroundCheckCliRunner.class);

    private final BackgrounderProperties properties;
    private final BackgroundCheckOrchestrator orchestrator;
    private final ConfigurableApplicationContext applicationContext;

    public BackgroundCheckCliRunner(
        BackgrounderProperties properties,
        BackgroundCheckOrchestrator orchestrator,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestrator = orchestrator;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        BackgrounderProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        BackgroundCheckRequest request = new BackgroundCheckRequest(
            cli.getName(),
            cli.getCompany(),
            cli.getLocation(),
            cli.getTitle(),
            cli.getLinkedinUrl(),
            ProfileProviderName.parse(cli.getProvider())
        );

        BackgroundReport report = orchestrator.run(CheckSubject.of(request));
        log.info("Background check for {} completed, provider={}", report.name(), report.providerUsed());
        log.info("Sources: {}", report.sourcesUsed());
        if (!report.confidenceNote().isEmpty()) {
            log.info("Note: {}", report.confidenceNote());
        }
        log.info("Summary: {}", report.summary());
        if (report.verdict() != null) {
            log.info("Verdict: {} (score {})", report.verdict().rating(), report.verdict().score());
        }
        for (String highlight : report.keyHighlights()) {
            log.info("Highlight: {}", highlight);
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
