package com.componentwatch.monitor.service;

import com.componentwatch.config.WatchProperties;
import com.componentwatch.monitor.model.TargetConfig;
import com.componentwatch.monitor.persistence.MonitorJdbcRepository;
import com.componentwatch.monitor.targets.InvalidTargetConfigException;
import com.componentwatch.monitor.targets.TargetConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Logs what the process is about to watch so a bad configuration shows up at boot instead of
 * at the first run.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class WatchStartupRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(WatchStartupRunner.class);

    private final TargetConfigLoader targetConfigLoader;
    private final MonitorJdbcRepository repository;
    private final WatchProperties properties;

    public WatchStartupRunner(
        TargetConfigLoader targetConfigLoader,
        MonitorJdbcRepository repository,
        WatchProperties properties
    ) {
        this.targetConfigLoader = targetConfigLoader;
        this.repository = repository;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (DataAccessException e) {
            log.debug("Database reachability check failed", e);
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Database is unreachable, alerts and reports will only be kept in memory");
        }

        try {
            List<TargetConfig> targets = targetConfigLoader.load();
            log.info(
                "Watching {} targets from {}: workers={}, headless={}, digestWindow={}h, webhook={}",
                targets.size(),
                properties.getConfigPath(),
                properties.getCrawl().resolveWorkerCount(targets.size()),
                properties.getRender().isHeadless(),
                properties.getDigest().getWindowHours(),
                properties.getDigest().getWebhookUrl() == null ? "not configured" : "configured"
            );
        } catch (InvalidTargetConfigException e) {
            log.warn("Target configuration is not usable yet: {}", e.getMessage());
        }
    }
}
