package com.componentwatch.monitor.digest;

import com.componentwatch.monitor.model.Digest;
import com.componentwatch.monitor.model.MatchResult;
import com.componentwatch.monitor.model.PageResult;
import com.componentwatch.monitor.model.StrategyOutcome;
import com.componentwatch.monitor.model.TargetResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Builds the chat digest of a run. Each distinct problem of a target is counted once, however
 * many page types it shows up on: a component with declared strategies contributes only its
 * failing strategy names, a component without them contributes its own name when absent.
 */
@Component
public class AlertDigestBuilder {
    static final DateTimeFormatter HEADER_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");
    static final DateTimeFormatter RESULT_TIME = DateTimeFormatter.ofPattern("dd/MM/yyyy - HH:mm");
    static final String BR = "<br>";

    private final Clock clock;

    public AlertDigestBuilder(Clock clock) {
        this.clock = clock;
    }

    public List<TargetResult> filterByRecency(List<TargetResult> results, int hours) {
        Instant cutoff = Instant.now(clock).minus(Duration.ofHours(hours));
        List<TargetResult> recent = new ArrayList<>();
        for (TargetResult result : results) {
            Optional<ZonedDateTime> timestamp = parseTimestamp(result.timestamp());
            if (timestamp.isPresent() && !timestamp.get().toInstant().isBefore(cutoff)) {
                recent.add(result);
            }
        }
        return recent;
    }

    /**
     * Distinct problem labels of one target, each mapped to the sorted page types it occurred on.
     * Labels keep the order in which they were first seen.
     */
    public Map<String, SortedSet<String>> extractIssues(TargetResult result) {
        Map<String, SortedSet<String>> issues = new LinkedHashMap<>();
        if (result.pages() == null) {
            return issues;
        }
        for (PageResult page : result.pages()) {
            if (page.components() == null) {
                continue;
            }
            for (MatchResult component : page.components()) {
                StrategyOutcome outcome = component.strategyOutcome();
                if (outcome != null) {
                    for (String strategy : outcome.failedStrategies()) {
                        issues.computeIfAbsent(strategy, key -> new TreeSet<>()).add(page.pageType());
                    }
                } else if (!component.found()) {
                    issues.computeIfAbsent(component.name(), key -> new TreeSet<>()).add(page.pageType());
                }
            }
        }
        return issues;
    }

    public Digest buildDigest(List<TargetResult> results, int windowHours) {
        List<Map.Entry<TargetResult, Map<String, SortedSet<String>>>> issuesByTarget = new ArrayList<>();
        int distinct = 0;
        for (TargetResult result : results) {
            Map<String, SortedSet<String>> issues = extractIssues(result);
            if (!issues.isEmpty()) {
                issuesByTarget.add(Map.entry(result, issues));
                distinct += issues.size();
            }
        }
        if (distinct == 0) {
            return new Digest(0, "No hay alertas nuevas durante las últimas " + windowHours + " horas.");
        }

        StringBuilder message = new StringBuilder();
        message.append("**ALERTAS - ÚLTIMAS ").append(windowHours).append(" HORAS [")
            .append(LocalDate.now(clock).format(HEADER_DATE)).append("]**").append(BR).append(BR);
        message.append("**Total alertas: ").append(distinct).append("**").append(BR);
        message.append(BR).append("---").append(BR).append(BR);

        for (Map.Entry<TargetResult, Map<String, SortedSet<String>>> entry : issuesByTarget) {
            TargetResult result = entry.getKey();
            Map<String, SortedSet<String>> issues = entry.getValue();
            message.append("**País:** ").append(result.target()).append(BR);
            message.append("**Estado:** ").append(result.status() == null ? "N/A" : result.status().label()).append(BR);
            message.append("**Alertas:** ").append(issues.size()).append(BR);
            message.append("**Fecha/Hora:** ").append(formatTimestamp(result.timestamp())).append(BR);
            message.append(BR).append("**Componentes con conflictos:**").append(BR);
            issues.forEach((label, pageTypes) ->
                message.append("- ").append(label).append(": ").append(String.join(", ", pageTypes)).append(BR)
            );
            message.append(BR);
        }
        return new Digest(distinct, message.toString());
    }

    String formatTimestamp(String timestamp) {
        return parseTimestamp(timestamp).map(value -> value.format(RESULT_TIME)).orElse("N/A");
    }

    /**
     * Accepts an ISO date-time with offset, or a local one read in the clock's zone.
     */
    Optional<ZonedDateTime> parseTimestamp(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return Optional.empty();
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                .parseBest(timestamp.trim(), ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return Optional.of(zoned);
            }
            return Optional.of(((LocalDateTime) parsed).atZone(clock.getZone()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
