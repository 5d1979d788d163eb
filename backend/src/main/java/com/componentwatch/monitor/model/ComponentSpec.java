package com.componentwatch.monitor.model;

import java.util.List;

public record ComponentSpec(
    String name,
    IdentifierType identifierType,
    String identifierValue,
    StrategyKind strategyKind,
    List<StrategySpec> strategies
) {
    public ComponentSpec {
        strategies = strategies == null ? List.of() : List.copyOf(strategies);
    }

    public static ComponentSpec plain(String name, IdentifierType identifierType, String identifierValue) {
        return new ComponentSpec(name, identifierType, identifierValue, null, List.of());
    }

    public boolean hasStrategies() {
        return strategyKind != null && !strategies.isEmpty();
    }
}
