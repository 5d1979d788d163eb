package com.componentwatch.monitor.model;

import java.util.Map;

public record AlertStats(
    long total,
    Map<String, Long> byTarget,
    Map<String, Long> byPageType,
    Map<String, Long> byStatus) {}
