package com.componentwatch.monitor.model;

public record Digest(int distinctIssues, String message) {
    public boolean isEmpty() {
        return distinctIssues == 0;
    }
}
