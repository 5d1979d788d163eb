package com.componentwatch.monitor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of searching a component's strategies inside its matched elements. All maps are keyed
 * by strategy name and keep the strategy declaration order.
 */
public record StrategyOutcome(
    Map<String, Boolean> strategiesFound,
    Map<String, StrategyDetail> strategiesDetails,
    Map<String, List<String>> potentialMatches
) {
    public StrategyOutcome {
        strategiesFound = strategiesFound == null ? Map.of() : copy(strategiesFound);
        strategiesDetails = strategiesDetails == null ? Map.of() : copy(strategiesDetails);
        potentialMatches = potentialMatches == null ? Map.of() : copy(potentialMatches);
    }

    public List<String> failedStrategies() {
        List<String> failed = new ArrayList<>();
        strategiesFound.forEach((name, found) -> {
            if (!Boolean.TRUE.equals(found)) {
                failed.add(name);
            }
        });
        return failed;
    }

    public List<String> candidatesFor(String strategyName) {
        List<String> candidates = potentialMatches.get(strategyName);
        return candidates == null ? List.of() : candidates;
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
