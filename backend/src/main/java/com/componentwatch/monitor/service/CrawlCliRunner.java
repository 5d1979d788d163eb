package com.componentwatch.monitor.service;

import com.componentwatch.config.WatchProperties;
import com.componentwatch.monitor.digest.DigestService;
import com.componentwatch.monitor.model.DigestSendResult;
import com.componentwatch.monitor.model.RunPhase;
import com.componentwatch.monitor.model.RunReport;
import com.componentwatch.monitor.model.RunStatusSnapshot;
import com.componentwatch.monitor.model.TargetResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final WatchProperties properties;
    private final CrawlRunService crawlRunService;
    private final DigestService digestService;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        WatchProperties properties,
        CrawlRunService crawlRunService,
        DigestService digestService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.crawlRunService = crawlRunService;
        this.digestService = digestService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        RunStatusSnapshot status = crawlRunService.runNow();
        RunReport report = status.lastReport();
        boolean succeeded = status.phase() == RunPhase.SUCCEEDED && report != null;
        if (succeeded) {
            log.info(
                "Crawl completed in {}: successful={}, failed={}, alerts={}",
                report.executionTime(),
                report.successful(),
                report.failed(),
                report.totalAlerts()
            );
            for (TargetResult result : report.results()) {
                log.info(
                    "Summary {}: status={}, alerts={}, error={}",
                    result.target(),
                    result.status().label(),
                    result.alertsCount(),
                    result.error()
                );
            }
        } else {
            log.error("Crawl run did not complete: {}", status.error());
        }

        if (succeeded && properties.getCli().isSendDigest()) {
            try {
                DigestSendResult sent = digestService.sendLatestDigest();
                log.info("Digest delivered with status {} ({} distinct issues)", sent.statusCode(), sent.distinctIssues());
            } catch (RuntimeException e) {
                log.error("Digest delivery failed", e);
                succeeded = false;
            }
        }

        if (properties.getCli().isExitAfterRun()) {
            int code = succeeded ? 0 : 1;
            int exitCode = SpringApplication.exit(applicationContext, () -> code);
            System.exit(exitCode);
        }
    }
}
