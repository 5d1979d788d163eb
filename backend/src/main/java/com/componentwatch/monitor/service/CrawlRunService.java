package com.componentwatch.monitor.service;

import com.componentwatch.monitor.model.RunPhase;
import com.componentwatch.monitor.model.RunReport;
import com.componentwatch.monitor.model.RunStatusSnapshot;
import com.componentwatch.monitor.model.StoredRunReport;
import com.componentwatch.monitor.persistence.MonitorJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the crawl run state: IDLE, RUNNING, then SUCCEEDED or FAILED. Only one run may be
 * active; a finished run of either outcome allows a new one.
 */
@Service
public class CrawlRunService {
    private static final Logger log = LoggerFactory.getLogger(CrawlRunService.class);

    private final CrawlOrchestratorService orchestratorService;
    private final MonitorJdbcRepository repository;
    private final ExecutorService crawlRunExecutor;
    private final Clock clock;
    private final Object lifecycleLock = new Object();

    private RunStatusSnapshot state = RunStatusSnapshot.idle();

    public CrawlRunService(
        CrawlOrchestratorService orchestratorService,
        MonitorJdbcRepository repository,
        @Qualifier("crawlRunExecutor") ExecutorService crawlRunExecutor,
        Clock clock
    ) {
        this.orchestratorService = orchestratorService;
        this.repository = repository;
        this.crawlRunExecutor = crawlRunExecutor;
        this.clock = clock;
    }

    public RunStatusSnapshot startAsync() {
        RunStatusSnapshot started = begin();
        try {
            crawlRunExecutor.submit(this::execute);
        } catch (RejectedExecutionException e) {
            log.error("Crawl run could not be scheduled", e);
            finish(RunPhase.FAILED, null, "Crawl run could not be scheduled: " + e.getMessage());
            throw e;
        }
        return started;
    }

    /**
     * Runs a crawl on the calling thread and returns the final state.
     */
    public RunStatusSnapshot runNow() {
        begin();
        execute();
        return getStatus();
    }

    public RunStatusSnapshot getStatus() {
        synchronized (lifecycleLock) {
            return state;
        }
    }

    /**
     * Newest report between the latest stored one and the last report of this process, which
     * may never have reached storage.
     */
    public Optional<RunReport> latestReport() {
        RunReport inMemory = getStatus().lastReport();
        Optional<StoredRunReport> stored;
        try {
            stored = repository.findLatestRunReport();
        } catch (DataAccessException e) {
            log.warn("Unable to load the latest run report, using the in-memory one", e);
            return Optional.ofNullable(inMemory);
        }
        if (stored.isEmpty()) {
            return Optional.ofNullable(inMemory);
        }
        if (inMemory != null && isNewer(inMemory, stored.get())) {
            return Optional.of(inMemory);
        }
        return Optional.of(stored.get().report());
    }

    private static boolean isNewer(RunReport inMemory, StoredRunReport stored) {
        Instant storedEnd = stored.report().endTime() == null ? stored.savedAt() : stored.report().endTime();
        if (inMemory.endTime() == null) {
            return false;
        }
        return storedEnd == null || inMemory.endTime().isAfter(storedEnd);
    }

    private RunStatusSnapshot begin() {
        synchronized (lifecycleLock) {
            if (state.phase().isActive()) {
                throw new ActiveCrawlRunException("A crawl run is already in progress since " + state.startTime());
            }
            state = new RunStatusSnapshot(
                true,
                RunPhase.RUNNING,
                Instant.now(clock),
                null,
                null,
                null,
                state.lastReport()
            );
            return state;
        }
    }

    private void execute() {
        boolean finished = false;
        try {
            RunReport report;
            try {
                report = orchestratorService.run();
            } catch (RuntimeException e) {
                log.error("Crawl run failed", e);
                finish(RunPhase.FAILED, null, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
                finished = true;
                return;
            }
            store(report);
            finish(RunPhase.SUCCEEDED, report, null);
            finished = true;
        } finally {
            if (!finished) {
                // an Error or an unexpected storage failure must not leave the run RUNNING
                finish(RunPhase.FAILED, null, "Crawl run aborted");
            }
        }
    }

    private void store(RunReport report) {
        try {
            long id = repository.insertRunReport(report, Instant.now(clock));
            log.info("Run report {} stored ({} alerts)", id, report.totalAlerts());
        } catch (DataAccessException | IllegalStateException e) {
            log.warn("Unable to store the run report, keeping it in memory only", e);
        }
    }

    private void finish(RunPhase phase, RunReport report, String error) {
        synchronized (lifecycleLock) {
            RunReport lastReport = report == null ? state.lastReport() : report;
            state = new RunStatusSnapshot(
                false,
                phase,
                state.startTime(),
                Instant.now(clock),
                report == null ? null : report.totalAlerts(),
                error,
                lastReport
            );
        }
    }
}
