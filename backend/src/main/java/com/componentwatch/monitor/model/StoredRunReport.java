package com.componentwatch.monitor.model;

import java.time.Instant;

public record StoredRunReport(long id, Instant savedAt, RunReport report) {}
