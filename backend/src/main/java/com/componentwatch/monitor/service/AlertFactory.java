package com.componentwatch.monitor.service;

import com.componentwatch.monitor.model.Alert;
import com.componentwatch.monitor.model.AlertStatus;
import com.componentwatch.monitor.model.MatchResult;
import com.componentwatch.monitor.model.StrategyOutcome;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns negative match results into alerts. Pure: no logging, no storage.
 */
public final class AlertFactory {
    static final String NOT_APPLICABLE = "N/A";
    static final int SAMPLE_SIZE = 3;
    static final int SAMPLE_MAX_CHARS = 80;

    private AlertFactory() {
    }

    public static List<Alert> fromMatch(String target, String pageType, MatchResult result, Instant date) {
        if (!result.found()) {
            return List.of(new Alert(
                date,
                target,
                pageType,
                result.name(),
                AlertStatus.MISSING_COMPONENT,
                "Componente '" + result.name() + "' no encontrado en " + pageType
            ));
        }
        StrategyOutcome outcome = result.strategyOutcome();
        if (outcome == null) {
            return List.of();
        }
        List<Alert> alerts = new ArrayList<>();
        for (String strategy : outcome.failedStrategies()) {
            alerts.add(new Alert(
                date,
                target,
                pageType,
                componentLabel(result.name(), strategy),
                AlertStatus.MISSING_COMPONENT,
                strategyMessage(result.name(), strategy, outcome.candidatesFor(strategy))
            ));
        }
        return alerts;
    }

    public static Alert renderError(String target, String pageType, String error, Instant date) {
        return new Alert(date, target, pageType, NOT_APPLICABLE, AlertStatus.ERROR, error);
    }

    public static String componentLabel(String component, String strategy) {
        return component + " - " + strategy;
    }

    static String strategyMessage(String component, String strategy, List<String> candidates) {
        if (candidates.isEmpty()) {
            return "Estrategia '" + strategy + "' no encontrada en componente '" + component + "'";
        }
        return "Se encontraron títulos diferentes para '" + strategy + "': " + sample(candidates)
            + ". Revisar posible cambio de nombre.";
    }

    static String sample(List<String> candidates) {
        List<String> parts = new ArrayList<>(SAMPLE_SIZE);
        for (String candidate : candidates.subList(0, Math.min(SAMPLE_SIZE, candidates.size()))) {
            parts.add(truncate(candidate));
        }
        return String.join("; ", parts);
    }

    static String truncate(String candidate) {
        if (candidate.codePointCount(0, candidate.length()) <= SAMPLE_MAX_CHARS) {
            return candidate;
        }
        return candidate.substring(0, candidate.offsetByCodePoints(0, SAMPLE_MAX_CHARS)) + "...";
    }
}
