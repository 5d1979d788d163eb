package com.componentwatch.monitor.service;

import com.componentwatch.monitor.model.Alert;
import com.componentwatch.monitor.model.AlertStatus;
import com.componentwatch.monitor.model.ComponentDetails;
import com.componentwatch.monitor.model.MatchResult;
import com.componentwatch.monitor.model.StrategyDetail;
import com.componentwatch.monitor.model.StrategyOutcome;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class AlertFactoryTest {
    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    @Test
    void absentComponentYieldsSingleMissingAlert() {
        List<Alert> alerts = AlertFactory.fromMatch("CL", "PDP", MatchResult.absent("Cross Sell"), NOW);

        assertThat(alerts).hasSize(1);
        Alert alert = alerts.get(0);
        assertEquals("Cross Sell", alert.component());
        assertEquals(AlertStatus.MISSING_COMPONENT, alert.status());
        assertEquals("Componente 'Cross Sell' no encontrado en PDP", alert.message());
        assertEquals(NOW, alert.date());
    }

    @Test
    void foundComponentWithoutStrategiesYieldsNothing() {
        assertThat(AlertFactory.fromMatch("CL", "PDP", new MatchResult("Banner", true, null), NOW)).isEmpty();
    }

    @Test
    void failedStrategyWithCandidatesReportsPossibleRename() {
        String longTitle = "x".repeat(95);
        MatchResult result = withStrategies(
            "Home Carousels",
            Map.of("Strategy 1", false),
            Map.of("Strategy 1", List.of("Los más buscados", longTitle, "Novedades", "Cuarto"))
        );

        List<Alert> alerts = AlertFactory.fromMatch("CL", "HOME", result, NOW);

        assertThat(alerts).hasSize(1);
        assertEquals("Home Carousels - Strategy 1", alerts.get(0).component());
        assertEquals(
            "Se encontraron títulos diferentes para 'Strategy 1': Los más buscados; "
                + "x".repeat(80) + "...; Novedades. Revisar posible cambio de nombre.",
            alerts.get(0).message()
        );
    }

    @Test
    void failedStrategyWithoutCandidatesReportsNotFound() {
        MatchResult result = withStrategies(
            "Home Carousels",
            Map.of("Strategy 2", false),
            Map.of("Strategy 2", List.of())
        );

        Alert alert = AlertFactory.fromMatch("CL", "HOME", result, NOW).get(0);

        assertEquals("Estrategia 'Strategy 2' no encontrada en componente 'Home Carousels'", alert.message());
    }

    @Test
    void onlyFailedStrategiesProduceAlertsInDeclarationOrder() {
        Map<String, Boolean> found = new LinkedHashMap<>();
        found.put("Strategy 1", false);
        found.put("Strategy 2", true);
        found.put("Strategy 3", false);
        MatchResult result = withStrategies("Home Carousels", found, Map.of());

        List<Alert> alerts = AlertFactory.fromMatch("CL", "HOME", result, NOW);

        assertThat(alerts).extracting(Alert::component)
            .containsExactly("Home Carousels - Strategy 1", "Home Carousels - Strategy 3");
    }

    @Test
    void renderErrorAlertHasNoComponent() {
        Alert alert = AlertFactory.renderError("CL", "PLP", "Timeout 30000ms exceeded", NOW);

        assertEquals("N/A", alert.component());
        assertEquals(AlertStatus.ERROR, alert.status());
        assertEquals("Timeout 30000ms exceeded", alert.message());
    }

    private static MatchResult withStrategies(
        String name,
        Map<String, Boolean> found,
        Map<String, List<String>> candidates
    ) {
        Map<String, StrategyDetail> details = new LinkedHashMap<>();
        found.keySet().forEach(strategy -> details.put(strategy, new StrategyDetail(List.of())));
        StrategyOutcome outcome = new StrategyOutcome(found, details, candidates);
        return new MatchResult(name, true, new ComponentDetails(List.of("el-1"), outcome));
    }

    @Test
    void longCandidatesAreCutOnCharacterBoundaries() {
        String emoji = "\uD83D\uDED2";
        String candidate = "a".repeat(79) + emoji + "tail";

        String cut = AlertFactory.truncate(candidate);

        assertEquals("a".repeat(79) + emoji + "...", cut);
        assertEquals("b".repeat(80), AlertFactory.truncate("b".repeat(80)));
        assertEquals("c".repeat(80) + "...", AlertFactory.truncate("c".repeat(81)));
    }
}
