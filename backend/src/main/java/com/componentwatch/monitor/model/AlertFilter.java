package com.componentwatch.monitor.model;

import java.time.Instant;

/**
 * Optional alert list filters. {@code null} fields do not constrain the query; {@code to} is
 * exclusive.
 */
public record AlertFilter(
    String target,
    String pageType,
    AlertStatus status,
    Instant from,
    Instant to
) {
    public static AlertFilter none() {
        return new AlertFilter(null, null, null, null, null);
    }
}
