package com.componentwatch.monitor.model;

public record HealthResponse(String status, boolean dbConnected, int configuredTargets, boolean crawlRunning) {}
