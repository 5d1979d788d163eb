package com.componentwatch.monitor.service;

import com.componentwatch.config.WatchProperties;
import com.componentwatch.monitor.model.RunReport;
import com.componentwatch.monitor.model.TargetConfig;
import com.componentwatch.monitor.model.TargetResult;
import com.componentwatch.monitor.targets.TargetConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class CrawlOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestratorService.class);

    private final TargetConfigLoader targetConfigLoader;
    private final TargetCrawlService targetCrawlService;
    private final WatchProperties properties;
    private final Clock clock;

    public CrawlOrchestratorService(
        TargetConfigLoader targetConfigLoader,
        TargetCrawlService targetCrawlService,
        WatchProperties properties,
        Clock clock
    ) {
        this.targetConfigLoader = targetConfigLoader;
        this.targetCrawlService = targetCrawlService;
        this.properties = properties;
        this.clock = clock;
    }

    public RunReport run() {
        return run(targetConfigLoader.load());
    }

    /**
     * Runs one crawl job per target on a pool sized for this run. Jobs are joined as they
     * complete; the returned results keep the configuration order.
     */
    public RunReport run(List<TargetConfig> targets) {
        Instant startTime = Instant.now(clock);
        if (targets.isEmpty()) {
            log.warn("No targets configured, nothing to crawl");
            return summarize(startTime, Instant.now(clock), List.of());
        }

        int workers = properties.getCrawl().resolveWorkerCount(targets.size());
        log.info("Crawl run started: targets={}, workers={}", targets.size(), workers);
        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreadFactory());
        TargetResult[] results = new TargetResult[targets.size()];
        try {
            CompletionService<TargetResult> completion = new ExecutorCompletionService<>(pool);
            Map<Future<TargetResult>, Integer> positions = new HashMap<>();
            for (int i = 0; i < targets.size(); i++) {
                TargetConfig target = targets.get(i);
                positions.put(completion.submit(() -> targetCrawlService.crawlTarget(target)), i);
            }

            for (int joined = 0; joined < targets.size(); joined++) {
                Future<TargetResult> future;
                try {
                    future = completion.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Crawl run interrupted after {} of {} targets", joined, targets.size());
                    break;
                }
                int position = positions.get(future);
                results[position] = join(future, targets.get(position));
            }
        } finally {
            pool.shutdownNow();
        }

        for (int i = 0; i < results.length; i++) {
            if (results[i] == null) {
                results[i] = TargetResult.failed(targets.get(i).target(), "interrupted", timestamp());
            }
        }
        RunReport report = summarize(startTime, Instant.now(clock), Arrays.asList(results));
        log.info(
            "Crawl run finished in {}: targets={}, successful={}, failed={}, alerts={}",
            report.executionTime(),
            report.totalTargets(),
            report.successful(),
            report.failed(),
            report.totalAlerts()
        );
        return report;
    }

    private TargetResult join(Future<TargetResult> future, TargetConfig target) {
        try {
            TargetResult result = future.get();
            if (result == null) {
                return TargetResult.failed(target.target(), "crawl job returned no result", timestamp());
            }
            return result;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("[{}] crawl job escaped with an exception", target.target(), cause);
            return TargetResult.failed(target.target(), String.valueOf(cause.getMessage()), timestamp());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TargetResult.failed(target.target(), "interrupted", timestamp());
        }
    }

    private RunReport summarize(Instant startTime, Instant endTime, List<TargetResult> results) {
        int successful = 0;
        int failed = 0;
        int totalAlerts = 0;
        for (TargetResult result : results) {
            if (result.isSuccess()) {
                successful++;
            } else {
                failed++;
            }
            totalAlerts += result.alertsCount();
        }
        return new RunReport(
            formatExecutionTime(Duration.between(startTime, endTime)),
            startTime,
            endTime,
            results.size(),
            successful,
            failed,
            totalAlerts,
            new ArrayList<>(results)
        );
    }

    /**
     * Formats a duration as {@code "<m>m <s>s"}, truncating sub-second precision.
     */
    public static String formatExecutionTime(Duration duration) {
        Duration safe = duration == null || duration.isNegative() ? Duration.ZERO : duration;
        return safe.toMinutes() + "m " + safe.toSecondsPart() + "s";
    }

    private String timestamp() {
        return OffsetDateTime.now(clock).toString();
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("crawl-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
