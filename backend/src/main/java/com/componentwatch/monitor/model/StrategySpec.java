package com.componentwatch.monitor.model;

public record StrategySpec(
    String strategyName,
    String textPattern,
    String containerClass
) {
    public boolean hasContainerClass() {
        return containerClass != null && !containerClass.isBlank();
    }
}
