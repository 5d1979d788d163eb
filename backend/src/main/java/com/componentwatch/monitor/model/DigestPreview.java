package com.componentwatch.monitor.model;

public record DigestPreview(int windowHours, int distinctIssues, String message) {}
