package com.componentwatch.monitor.service;

import com.componentwatch.config.WatchProperties;
import com.componentwatch.monitor.model.AlertFilter;
import com.componentwatch.monitor.model.AlertPage;
import com.componentwatch.monitor.model.AlertRecord;
import com.componentwatch.monitor.model.AlertStats;
import com.componentwatch.monitor.model.AlertStatus;
import com.componentwatch.monitor.persistence.MonitorJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

@Service
public class AlertQueryService {
    private static final Logger log = LoggerFactory.getLogger(AlertQueryService.class);

    private final MonitorJdbcRepository repository;
    private final WatchProperties properties;
    private final Clock clock;

    public AlertQueryService(MonitorJdbcRepository repository, WatchProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public AlertPage listAlerts(
        String target,
        String pageType,
        String status,
        String startDate,
        String endDate,
        Integer page,
        Integer limit
    ) {
        AlertFilter filter = new AlertFilter(
            blankToNull(target),
            blankToNull(pageType),
            parseStatus(status),
            parseStart(startDate),
            parseEnd(endDate)
        );
        int safePage = page == null ? 1 : Math.max(1, page);
        int safeLimit = clampLimit(limit);
        long total = repository.countAlerts(filter);
        List<AlertRecord> alerts = repository.findAlerts(filter, (safePage - 1) * safeLimit, safeLimit);
        return new AlertPage(total, safePage, safeLimit, AlertPage.pageCount(total, safeLimit), alerts);
    }

    public AlertStats stats() {
        return repository.alertStats();
    }

    public AlertRecord getAlert(long id) {
        return repository.findAlertById(id).orElseThrow(() -> new AlertNotFoundException(id));
    }

    public int deleteAll() {
        int deleted = repository.deleteAllAlerts();
        log.info("Deleted {} alerts", deleted);
        return deleted;
    }

    int clampLimit(Integer limit) {
        if (limit == null) {
            return properties.getApi().getDefaultAlertLimit();
        }
        return Math.max(1, Math.min(limit, properties.getApi().getMaxAlertLimit()));
    }

    private AlertStatus parseStatus(String raw) {
        String value = blankToNull(raw);
        if (value == null) {
            return null;
        }
        try {
            return AlertStatus.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unknown alert status filter: {}", raw);
            return null;
        }
    }

    Instant parseStart(String raw) {
        String value = blankToNull(raw);
        if (value == null) {
            return null;
        }
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay(clock.getZone()).toInstant();
            }
            return parseDateTime(value);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring invalid startDate filter: {}", raw);
            return null;
        }
    }

    /**
     * A plain date covers the whole day, so the exclusive bound moves to the next midnight.
     */
    Instant parseEnd(String raw) {
        String value = blankToNull(raw);
        if (value == null) {
            return null;
        }
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).plusDays(1).atStartOfDay(clock.getZone()).toInstant();
            }
            return parseDateTime(value).plusNanos(1);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring invalid endDate filter: {}", raw);
            return null;
        }
    }

    private Instant parseDateTime(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(value).atZone(clock.getZone()).toInstant();
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
