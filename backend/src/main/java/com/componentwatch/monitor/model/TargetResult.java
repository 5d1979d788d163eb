package com.componentwatch.monitor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Result of one target crawl job. A failed job carries only {@code error}: no pages and no
 * alerts.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TargetResult(
    String target,
    TargetStatus status,
    int alertsCount,
    List<PageResult> pages,
    List<Alert> alerts,
    String error,
    String timestamp
) {
    public TargetResult {
        pages = pages == null ? null : List.copyOf(pages);
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
    }

    public static TargetResult success(String target, List<PageResult> pages, List<Alert> alerts, String timestamp) {
        return new TargetResult(target, TargetStatus.SUCCESS, alerts.size(), pages, alerts, null, timestamp);
    }

    public static TargetResult failed(String target, String error, String timestamp) {
        return new TargetResult(target, TargetStatus.FAILED, 0, null, List.of(), error, timestamp);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == TargetStatus.SUCCESS;
    }
}
