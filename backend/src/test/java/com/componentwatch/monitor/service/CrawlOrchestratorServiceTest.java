package com.componentwatch.monitor.service;

import com.componentwatch.config.WatchProperties;
import com.componentwatch.monitor.model.Alert;
import com.componentwatch.monitor.model.AlertStatus;
import com.componentwatch.monitor.model.RunReport;
import com.componentwatch.monitor.model.TargetConfig;
import com.componentwatch.monitor.model.TargetResult;
import com.componentwatch.monitor.model.TargetStatus;
import com.componentwatch.monitor.targets.TargetConfigLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrawlOrchestratorServiceTest {

    @Mock
    private TargetConfigLoader targetConfigLoader;
    @Mock
    private TargetCrawlService targetCrawlService;

    @Test
    void failingJobsDoNotAffectSiblings() {
        when(targetCrawlService.crawlTarget(any())).thenAnswer(invocation -> {
            TargetConfig target = invocation.getArgument(0);
            switch (target.target()) {
                case "CL":
                    Thread.sleep(150);
                    return TargetResult.success("CL", List.of(), alerts("CL", 2), "2026-03-10T12:00Z");
                case "PE":
                    throw new IllegalStateException("escaped");
                default:
                    return TargetResult.failed(target.target(), "render crashed", "2026-03-10T12:00Z");
            }
        });
        when(targetConfigLoader.load()).thenReturn(List.of(target("CL"), target("PE"), target("AR")));

        RunReport report = orchestrator(new WatchProperties()).run();

        assertEquals(3, report.totalTargets());
        assertEquals(1, report.successful());
        assertEquals(2, report.failed());
        assertEquals(2, report.totalAlerts());
        assertThat(report.results()).extracting(TargetResult::target).containsExactly("CL", "PE", "AR");
        TargetResult peru = report.results().get(1);
        assertEquals(TargetStatus.FAILED, peru.status());
        assertEquals("escaped", peru.error());
        assertThat(report.executionTime()).matches("\\d+m \\d+s");
        assertThat(report.endTime()).isAfterOrEqualTo(report.startTime());
    }

    @Test
    void singleWorkerStillRunsEveryTarget() {
        WatchProperties properties = new WatchProperties();
        properties.getCrawl().setMaxWorkers(1);
        when(targetCrawlService.crawlTarget(any())).thenAnswer(invocation -> {
            TargetConfig target = invocation.getArgument(0);
            return TargetResult.success(target.target(), List.of(), alerts(target.target(), 1), "2026-03-10T12:00Z");
        });

        RunReport report = orchestrator(properties).run(List.of(target("CL"), target("PE"), target("CO")));

        assertEquals(3, report.successful());
        assertEquals(3, report.totalAlerts());
        assertThat(report.results()).extracting(TargetResult::target).containsExactly("CL", "PE", "CO");
    }

    @Test
    void emptyConfigurationProducesEmptyReport() {
        RunReport report = orchestrator(new WatchProperties()).run(List.of());

        assertEquals(0, report.totalTargets());
        assertEquals(0, report.totalAlerts());
        assertThat(report.results()).isEmpty();
    }

    @Test
    void executionTimeIsTruncatedToWholeSeconds() {
        assertEquals("2m 5s", CrawlOrchestratorService.formatExecutionTime(Duration.ofSeconds(125).plusMillis(900)));
        assertEquals("0m 0s", CrawlOrchestratorService.formatExecutionTime(Duration.ofMillis(999)));
        assertEquals("61m 1s", CrawlOrchestratorService.formatExecutionTime(Duration.ofSeconds(3661)));
    }

    @Test
    void workerCountDefaultsToOnePerTarget() {
        WatchProperties properties = new WatchProperties();
        assertEquals(4, properties.getCrawl().resolveWorkerCount(4));
        assertEquals(1, properties.getCrawl().resolveWorkerCount(0));
        properties.getCrawl().setMaxWorkers(2);
        assertEquals(2, properties.getCrawl().resolveWorkerCount(4));
    }

    private CrawlOrchestratorService orchestrator(WatchProperties properties) {
        return new CrawlOrchestratorService(targetConfigLoader, targetCrawlService, properties, Clock.systemUTC());
    }

    private static TargetConfig target(String name) {
        return new TargetConfig(name, null, List.of());
    }

    private static List<Alert> alerts(String target, int count) {
        Alert alert = new Alert(
            Instant.parse("2026-03-10T12:00:00Z"),
            target,
            "HOME",
            "Banner",
            AlertStatus.MISSING_COMPONENT,
            "Componente 'Banner' no encontrado en HOME"
        );
        return Collections.nCopies(count, alert);
    }
}
