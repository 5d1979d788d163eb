package com.componentwatch.monitor.model;

public record DigestSendResult(String status, int statusCode, int distinctIssues) {}
