package com.componentwatch.monitor.model;

import java.time.Instant;
import java.util.List;

public record RunReport(
    String executionTime,
    Instant startTime,
    Instant endTime,
    int totalTargets,
    int successful,
    int failed,
    int totalAlerts,
    List<TargetResult> results
) {
    public RunReport {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
