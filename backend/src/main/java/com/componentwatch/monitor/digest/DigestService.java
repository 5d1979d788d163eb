package com.componentwatch.monitor.digest;

import com.componentwatch.config.WatchProperties;
import com.componentwatch.monitor.model.Digest;
import com.componentwatch.monitor.model.DigestPreview;
import com.componentwatch.monitor.model.DigestSendResult;
import com.componentwatch.monitor.model.RunReport;
import com.componentwatch.monitor.model.TargetResult;
import com.componentwatch.monitor.notify.WebhookNotifier;
import com.componentwatch.monitor.service.CrawlRunService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class DigestService {
    private static final Logger log = LoggerFactory.getLogger(DigestService.class);

    private final CrawlRunService crawlRunService;
    private final AlertDigestBuilder digestBuilder;
    private final WebhookNotifier notifier;
    private final WatchProperties properties;

    public DigestService(
        CrawlRunService crawlRunService,
        AlertDigestBuilder digestBuilder,
        WebhookNotifier notifier,
        WatchProperties properties
    ) {
        this.crawlRunService = crawlRunService;
        this.digestBuilder = digestBuilder;
        this.notifier = notifier;
        this.properties = properties;
    }

    public DigestSendResult sendLatestDigest() {
        String webhookUrl = properties.getDigest().getWebhookUrl();
        if (webhookUrl == null) {
            throw new DigestNotConfiguredException("watch.digest.webhook-url is not configured");
        }
        Digest digest = buildLatestDigest();
        int statusCode = notifier.send(webhookUrl, digest.message());
        log.info("Digest sent with {} distinct issues", digest.distinctIssues());
        return new DigestSendResult("sent", statusCode, digest.distinctIssues());
    }

    public DigestPreview previewLatestDigest() {
        Digest digest = buildLatestDigest();
        return new DigestPreview(properties.getDigest().getWindowHours(), digest.distinctIssues(), digest.message());
    }

    private Digest buildLatestDigest() {
        RunReport report = crawlRunService.latestReport()
            .orElseThrow(() -> new NoRunReportException("No run report available"));
        int windowHours = properties.getDigest().getWindowHours();
        List<TargetResult> recent = digestBuilder.filterByRecency(report.results(), windowHours);
        log.debug("Digest window {}h keeps {} of {} target results", windowHours, recent.size(), report.results().size());
        return digestBuilder.buildDigest(recent, windowHours);
    }
}
