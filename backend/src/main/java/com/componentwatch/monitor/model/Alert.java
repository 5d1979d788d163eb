package com.componentwatch.monitor.model;

import java.time.Instant;

public record Alert(
    Instant date,
    String target,
    String pageType,
    String component,
    AlertStatus status,
    String message
) {
}
