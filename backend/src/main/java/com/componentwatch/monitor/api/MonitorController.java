package com.componentwatch.monitor.api;

import com.componentwatch.monitor.digest.DigestService;
import com.componentwatch.monitor.digest.NoRunReportException;
import com.componentwatch.monitor.model.AlertPage;
import com.componentwatch.monitor.model.AlertRecord;
import com.componentwatch.monitor.model.AlertStats;
import com.componentwatch.monitor.model.DigestPreview;
import com.componentwatch.monitor.model.DigestSendResult;
import com.componentwatch.monitor.model.HealthResponse;
import com.componentwatch.monitor.model.RunReport;
import com.componentwatch.monitor.model.RunStatusSnapshot;
import com.componentwatch.monitor.persistence.MonitorJdbcRepository;
import com.componentwatch.monitor.service.AlertQueryService;
import com.componentwatch.monitor.service.CrawlRunService;
import com.componentwatch.monitor.targets.InvalidTargetConfigException;
import com.componentwatch.monitor.targets.TargetConfigLoader;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class MonitorController {
    private final CrawlRunService crawlRunService;
    private final AlertQueryService alertQueryService;
    private final DigestService digestService;
    private final TargetConfigLoader targetConfigLoader;
    private final MonitorJdbcRepository repository;

    public MonitorController(
        CrawlRunService crawlRunService,
        AlertQueryService alertQueryService,
        DigestService digestService,
        TargetConfigLoader targetConfigLoader,
        MonitorJdbcRepository repository
    ) {
        this.crawlRunService = crawlRunService;
        this.alertQueryService = alertQueryService;
        this.digestService = digestService;
        this.targetConfigLoader = targetConfigLoader;
        this.repository = repository;
    }

    @PostMapping("/crawl/run")
    public ResponseEntity<RunStatusSnapshot> startCrawl() {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(crawlRunService.startAsync());
    }

    @GetMapping("/crawl/status")
    public RunStatusSnapshot crawlStatus() {
        return crawlRunService.getStatus();
    }

    @GetMapping("/alerts")
    public AlertPage alerts(
        @RequestParam(name = "target", required = false) String target,
        @RequestParam(name = "pageType", required = false) String pageType,
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "startDate", required = false) String startDate,
        @RequestParam(name = "endDate", required = false) String endDate,
        @RequestParam(name = "page", required = false) Integer page,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return alertQueryService.listAlerts(target, pageType, status, startDate, endDate, page, limit);
    }

    @GetMapping("/alerts/stats")
    public AlertStats alertStats() {
        return alertQueryService.stats();
    }

    @GetMapping("/alerts/{id}")
    public AlertRecord alert(@PathVariable("id") long id) {
        return alertQueryService.getAlert(id);
    }

    @DeleteMapping("/alerts")
    public Map<String, Integer> deleteAlerts() {
        return Map.of("deleted", alertQueryService.deleteAll());
    }

    @GetMapping("/report")
    public RunReport latestReport() {
        return crawlRunService.latestReport()
            .orElseThrow(() -> new NoRunReportException("No run report available"));
    }

    @PostMapping("/digest/send")
    public DigestSendResult sendDigest() {
        return digestService.sendLatestDigest();
    }

    @GetMapping("/digest/preview")
    public DigestPreview previewDigest() {
        return digestService.previewLatestDigest();
    }

    @GetMapping("/health")
    public HealthResponse health() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (DataAccessException e) {
            dbConnected = false;
        }
        int targets;
        try {
            targets = targetConfigLoader.load().size();
        } catch (InvalidTargetConfigException e) {
            targets = 0;
        }
        return new HealthResponse(
            dbConnected ? "ok" : "degraded",
            dbConnected,
            targets,
            crawlRunService.getStatus().running()
        );
    }
}
