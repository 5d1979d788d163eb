package com.componentwatch.monitor.model;

public enum StrategyKind {
    TEXT("el"),
    CAROUSEL("carousel");

    private final String labelPrefix;

    StrategyKind(String labelPrefix) {
        this.labelPrefix = labelPrefix;
    }

    public String labelPrefix() {
        return labelPrefix;
    }
}
