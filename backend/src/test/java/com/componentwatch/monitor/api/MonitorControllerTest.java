package com.componentwatch.monitor.api;

import com.componentwatch.monitor.model.Alert;
import com.componentwatch.monitor.model.AlertRecord;
import com.componentwatch.monitor.model.AlertFilter;
import com.componentwatch.monitor.model.AlertStatus;
import com.componentwatch.monitor.persistence.MonitorJdbcRepository;
import com.componentwatch.monitor.render.FixturePageRenderer;
import com.componentwatch.monitor.render.PageRenderer;
import com.componentwatch.monitor.render.RenderException;
import com.componentwatch.monitor.render.RenderSession;
import com.componentwatch.monitor.service.CrawlRunService;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(
    properties = "spring.datasource.url=jdbc:h2:mem:controller_api;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1"
)
@ActiveProfiles("test")
@Import(MonitorControllerTest.GatedRendererConfig.class)
class MonitorControllerTest {
    private static final CountDownLatch RELEASE = new CountDownLatch(1);

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private CrawlRunService crawlRunService;

    @Autowired
    private MonitorJdbcRepository repository;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void crawlRunLifecycleOverHttp() throws Exception {
        try {
            mockMvc.perform(get("/api/report"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("no_run_report"));

            mockMvc.perform(post("/api/crawl/run"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.phase").value("RUNNING"));

            mockMvc.perform(post("/api/crawl/run"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("active_crawl_run"));

            mockMvc.perform(get("/api/crawl/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true));
        } finally {
            RELEASE.countDown();
        }

        long deadline = System.currentTimeMillis() + 30_000;
        while (crawlRunService.getStatus().running() && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertFalse(crawlRunService.getStatus().running());

        mockMvc.perform(get("/api/crawl/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.phase").value("SUCCEEDED"))
            .andExpect(jsonPath("$.alertsCount").value(3));

        mockMvc.perform(get("/api/report"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalTargets").value(2))
            .andExpect(jsonPath("$.totalAlerts").value(3))
            .andExpect(jsonPath("$.results[0].target").value("CL"))
            .andExpect(jsonPath("$.results[0].status").value("success"))
            .andExpect(jsonPath("$.results[1].target").value("PE"))
            .andExpect(jsonPath("$.results[1].pages[0].error").exists());

        mockMvc.perform(get("/api/digest/preview"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.windowHours").value(24))
            .andExpect(jsonPath("$.distinctIssues").value(3));

        mockMvc.perform(post("/api/digest/send"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("digest_not_configured"));
    }

    @Test
    @Transactional
    void alertsArePagedAndFilteredByTarget() throws Exception {
        String target = "T" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        Instant base = Instant.parse("2026-03-10T12:00:00Z");
        repository.insertAlerts(List.of(
            new Alert(base, target, "PDP", "Cross Sell", AlertStatus.MISSING_COMPONENT, "first"),
            new Alert(base.minusSeconds(60), target, "PDP", "Add To Cart", AlertStatus.MISSING_COMPONENT, "second"),
            new Alert(base.minusSeconds(120), target, "HOME", "N/A", AlertStatus.ERROR, "third")
        ));

        mockMvc.perform(get("/api/alerts").param("target", target).param("limit", "2").param("page", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(3))
            .andExpect(jsonPath("$.page").value(2))
            .andExpect(jsonPath("$.limit").value(2))
            .andExpect(jsonPath("$.pages").value(2))
            .andExpect(jsonPath("$.alerts.length()").value(1))
            .andExpect(jsonPath("$.alerts[0].message").value("third"));

        mockMvc.perform(get("/api/alerts").param("target", target).param("status", "error"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(1));

        mockMvc.perform(get("/api/alerts")
                .param("target", target)
                .param("startDate", "2026-03-10T11:59:00Z")
                .param("endDate", "2026-03-10T12:00:00Z"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(2));

        AlertRecord stored = repository.findAlerts(new AlertFilter(target, null, null, null, null), 0, 1).get(0);
        mockMvc.perform(get("/api/alerts/{id}", stored.id()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.component").value("Cross Sell"))
            .andExpect(jsonPath("$.status").value("MISSING_COMPONENT"));

        mockMvc.perform(get("/api/alerts/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.byTarget." + target).value(3));
    }

    @Test
    void unknownAlertIsNotFound() throws Exception {
        mockMvc.perform(get("/api/alerts/{id}", Long.MAX_VALUE))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("alert_not_found"));
    }

    @Test
    void healthReportsDatabaseAndTargets() throws Exception {
        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(jsonPath("$.dbConnected").value(true))
            .andExpect(jsonPath("$.configuredTargets").value(2));
    }

    @TestConfiguration
    static class GatedRendererConfig {

        @Bean
        @Primary
        PageRenderer gatedPageRenderer() {
            FixturePageRenderer fixtures = new FixturePageRenderer()
                .page("https://www.example.cl/product/456", FixturePageRenderer.fixture("pdp_cl.html"))
                .page("https://www.example.cl/", FixturePageRenderer.fixture("home_cl.html"));
            return target -> {
                RenderSession delegate = fixtures.openSession(target);
                return new RenderSession() {
                    @Override
                    public Document render(String url) throws RenderException {
                        try {
                            if (!RELEASE.await(30, TimeUnit.SECONDS)) {
                                throw new RenderException("Render gate was never opened for " + url);
                            }
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            throw new RenderException("Interrupted waiting for " + url);
                        }
                        return delegate.render(url);
                    }

                    @Override
                    public boolean prime(String setupUrl) {
                        return delegate.prime(setupUrl);
                    }

                    @Override
                    public void close() {
                        delegate.close();
                    }
                };
            };
        }
    }
}
