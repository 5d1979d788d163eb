package com.componentwatch.monitor.model;

import java.util.List;

public record StrategyDetail(List<String> foundIn) {
    public StrategyDetail {
        foundIn = foundIn == null ? List.of() : List.copyOf(foundIn);
    }
}
