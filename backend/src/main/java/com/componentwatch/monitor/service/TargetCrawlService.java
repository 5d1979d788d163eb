package com.componentwatch.monitor.service;

import com.componentwatch.config.WatchProperties;
import com.componentwatch.monitor.match.ComponentMatcher;
import com.componentwatch.monitor.model.Alert;
import com.componentwatch.monitor.model.ComponentSpec;
import com.componentwatch.monitor.model.MatchResult;
import com.componentwatch.monitor.model.PageResult;
import com.componentwatch.monitor.model.PageSpec;
import com.componentwatch.monitor.model.TargetConfig;
import com.componentwatch.monitor.model.TargetResult;
import com.componentwatch.monitor.persistence.MonitorJdbcRepository;
import com.componentwatch.monitor.render.PageRenderer;
import com.componentwatch.monitor.render.RenderException;
import com.componentwatch.monitor.render.RenderSession;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Crawls every page type of one target over a single browsing session. A job never throws:
 * page render failures are recorded on the page and anything else fails the whole target.
 */
@Service
public class TargetCrawlService {
    private static final Logger log = LoggerFactory.getLogger(TargetCrawlService.class);

    private final PageRenderer renderer;
    private final ComponentMatcher matcher;
    private final MonitorJdbcRepository repository;
    private final WatchProperties properties;
    private final Clock clock;

    public TargetCrawlService(
        PageRenderer renderer,
        ComponentMatcher matcher,
        MonitorJdbcRepository repository,
        WatchProperties properties,
        Clock clock
    ) {
        this.renderer = renderer;
        this.matcher = matcher;
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public TargetResult crawlTarget(TargetConfig target) {
        String name = target.target();
        log.info("[{}] crawl started ({} page types)", name, target.pages().size());
        try (RenderSession session = renderer.openSession(name)) {
            List<PageResult> pages = new ArrayList<>();
            List<Alert> alerts = new ArrayList<>();
            boolean setupAttempted = false;

            for (PageSpec page : target.pages()) {
                if (!page.hasUrl()) {
                    log.warn("[{}] page type {} has no url_example, skipping", name, page.pageType());
                    continue;
                }
                if (!setupAttempted && (page.setupRequired() || target.hasSetupProductUrl())) {
                    setupAttempted = true;
                    primeSession(session, target);
                }
                crawlPage(session, name, page, pages, alerts);
            }

            persist(name, alerts);
            TargetResult result = TargetResult.success(name, pages, alerts, now());
            log.info("[{}] crawl finished: pages={}, alerts={}", name, pages.size(), alerts.size());
            return result;
        } catch (RuntimeException e) {
            log.error("[{}] crawl failed", name, e);
            return TargetResult.failed(name, describe(e), now());
        }
    }

    private void crawlPage(
        RenderSession session,
        String target,
        PageSpec page,
        List<PageResult> pages,
        List<Alert> alerts
    ) {
        Document document;
        try {
            document = session.render(page.url());
        } catch (RenderException e) {
            log.warn("[{}] {} could not be rendered: {}", target, page.pageType(), e.getMessage());
            pages.add(PageResult.failed(page.pageType(), page.url(), now(), e.getMessage()));
            if (properties.getCrawl().isAlertOnRenderError()) {
                alerts.add(AlertFactory.renderError(target, page.pageType(), e.getMessage(), Instant.now(clock)));
            }
            return;
        }

        Instant checkedAt = Instant.now(clock);
        List<MatchResult> components = new ArrayList<>(page.components().size());
        int before = alerts.size();
        for (ComponentSpec component : page.components()) {
            MatchResult result = matcher.checkComponent(document, component);
            components.add(result);
            alerts.addAll(AlertFactory.fromMatch(target, page.pageType(), result, checkedAt));
        }
        pages.add(PageResult.rendered(page.pageType(), page.url(), now(), components));
        log.info(
            "[{}] {} checked: components={}, alerts={}",
            target,
            page.pageType(),
            components.size(),
            alerts.size() - before
        );
    }

    private void primeSession(RenderSession session, TargetConfig target) {
        if (!target.hasSetupProductUrl()) {
            log.warn("[{}] setup required but no setup_product_url configured", target.target());
            return;
        }
        if (!session.prime(target.setupProductUrl())) {
            log.warn("[{}] session setup did not complete, continuing without it", target.target());
        }
    }

    private void persist(String target, List<Alert> alerts) {
        if (alerts.isEmpty()) {
            return;
        }
        try {
            repository.insertAlerts(alerts);
        } catch (DataAccessException e) {
            log.warn("[{}] unable to store {} alerts, keeping them in the run report only", target, alerts.size(), e);
        }
    }

    private String now() {
        return OffsetDateTime.now(clock).toString();
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
