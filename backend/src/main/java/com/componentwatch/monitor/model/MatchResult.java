package com.componentwatch.monitor.model;

public record MatchResult(String name, boolean found, ComponentDetails details) {

    public static MatchResult absent(String name) {
        return new MatchResult(name, false, null);
    }

    public StrategyOutcome strategyOutcome() {
        return details == null ? null : details.strategies();
    }
}
