package com.componentwatch.monitor.model;

import java.time.Instant;

public record RunStatusSnapshot(
    boolean running,
    RunPhase phase,
    Instant startTime,
    Instant endTime,
    Integer alertsCount,
    String error,
    RunReport lastReport
) {
    public static RunStatusSnapshot idle() {
        return new RunStatusSnapshot(false, RunPhase.IDLE, null, null, null, null, null);
    }
}
