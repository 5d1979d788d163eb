package com.componentwatch.monitor.model;

import java.util.List;

public record ComponentDetails(List<String> elementLabels, StrategyOutcome strategies) {
    public ComponentDetails {
        elementLabels = elementLabels == null ? List.of() : List.copyOf(elementLabels);
    }
}
