package com.componentwatch.monitor.render;

import com.componentwatch.config.WatchProperties;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitForSelectorState;
import com.microsoft.playwright.options.WaitUntilState;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@Service
public class PlaywrightPageRenderer implements PageRenderer {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightPageRenderer.class);

    static final List<String> CHROMIUM_ARGS = List.of(
        "--no-sandbox",
        "--ignore-certificate-errors",
        "--disable-dev-shm-usage"
    );
    static final String POPOVER_SELECTOR = "[data-testid=\"coachmark-popover\"]";
    static final String POPOVER_BUTTON_SELECTOR = "[data-testid=\"popover-button\"]";
    static final String ADD_TO_CART_SELECTOR = "button#add-to-cart-button, button#testId-btn-add-to-cart";

    static final String SCROLL_SCRIPT = """
        async ({ step, interval, budget }) => {
          return await new Promise((resolve) => {
            const started = Date.now();
            let total = 0;
            const timer = setInterval(() => {
              const height = document.body.scrollHeight;
              window.scrollBy(0, step);
              total += step;
              if (total >= height) {
                clearInterval(timer);
                resolve(true);
              } else if (Date.now() - started >= budget) {
                clearInterval(timer);
                resolve(false);
              }
            }, interval);
          });
        }
        """;

    private final WatchProperties properties;

    public PlaywrightPageRenderer(WatchProperties properties) {
        this.properties = properties;
    }

    @Override
    public RenderSession openSession(String target) {
        return new PlaywrightRenderSession(target, properties.getRender(), Playwright::create);
    }

    static final class PlaywrightRenderSession implements RenderSession {
        private final String target;
        private final WatchProperties.Render settings;
        private final Supplier<Playwright> playwrightFactory;
        private Playwright playwright;
        private Browser browser;
        private BrowserContext context;
        private Page page;

        PlaywrightRenderSession(String target, WatchProperties.Render settings, Supplier<Playwright> playwrightFactory) {
            this.target = target;
            this.settings = settings;
            this.playwrightFactory = playwrightFactory;
        }

        @Override
        public Document render(String url) throws RenderException {
            try {
                Page current = page();
                current.navigate(
                    url,
                    new Page.NavigateOptions()
                        .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                        .setTimeout(settings.getTimeoutMs())
                );
                scroll(current, url);
                return Jsoup.parse(current.content(), url);
            } catch (PlaywrightException e) {
                throw new RenderException("Unable to render " + url + ": " + e.getMessage(), e);
            }
        }

        @Override
        public boolean prime(String setupUrl) {
            Page current;
            try {
                current = page();
                current.navigate(
                    setupUrl,
                    new Page.NavigateOptions()
                        .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                        .setTimeout(settings.getSetupTimeoutMs())
                );
            } catch (PlaywrightException e) {
                log.warn("[{}] setup navigation to {} failed: {}", target, setupUrl, e.getMessage());
                return false;
            }

            try {
                ElementHandle popover = current.querySelector(POPOVER_SELECTOR);
                ElementHandle button = popover == null ? null : popover.querySelector(POPOVER_BUTTON_SELECTOR);
                if (button != null) {
                    button.click();
                    current.waitForTimeout(settings.getSettleMs());
                } else {
                    log.debug("[{}] no coachmark popover on setup page", target);
                }
            } catch (PlaywrightException e) {
                log.debug("[{}] popover dismissal failed: {}", target, e.getMessage());
            }

            try {
                ElementHandle addToCart = current.waitForSelector(
                    ADD_TO_CART_SELECTOR,
                    new Page.WaitForSelectorOptions()
                        .setState(WaitForSelectorState.VISIBLE)
                        .setTimeout(settings.getAddToCartTimeoutMs())
                );
                if (addToCart == null) {
                    log.warn("[{}] add-to-cart button not found on {}", target, setupUrl);
                    return false;
                }
                addToCart.click();
                current.waitForTimeout(settings.getSettleMs() * 3L);
                log.info("[{}] session primed with a cart item from {}", target, setupUrl);
                return true;
            } catch (PlaywrightException e) {
                log.warn("[{}] add-to-cart during setup failed: {}", target, e.getMessage());
                return false;
            }
        }

        /**
         * Scrolls to the bottom in steps so lazy content loads. The walk is bounded by the render
         * timeout; a page that keeps growing past it fails like a slow navigation.
         */
        private void scroll(Page current, String url) throws RenderException {
            Object reachedBottom;
            try {
                reachedBottom = current.evaluate(
                    SCROLL_SCRIPT,
                    Map.of(
                        "step", settings.getScrollStepPx(),
                        "interval", settings.getScrollIntervalMs(),
                        "budget", settings.getTimeoutMs()
                    )
                );
            } catch (PlaywrightException e) {
                // lazy content may be missing; the snapshot is still matched
                log.warn("[{}] scrolling failed: {}", target, e.getMessage());
                return;
            }
            if (!Boolean.TRUE.equals(reachedBottom)) {
                throw new RenderException("Timeout " + settings.getTimeoutMs() + "ms exceeded scrolling " + url);
            }
            try {
                current.waitForTimeout(settings.getSettleMs());
                current.evaluate("window.scrollTo(0, 0)");
                current.waitForTimeout(settings.getSettleMs() * 2L);
            } catch (PlaywrightException e) {
                log.warn("[{}] returning to the top failed: {}", target, e.getMessage());
            }
        }

        private Page page() {
            if (page != null) {
                return page;
            }
            Playwright created = playwrightFactory.get();
            try {
                Browser launched = created.chromium().launch(
                    new BrowserType.LaunchOptions()
                        .setHeadless(settings.isHeadless())
                        .setArgs(CHROMIUM_ARGS)
                );
                BrowserContext newContext =
                    launched.newContext(new Browser.NewContextOptions().setIgnoreHTTPSErrors(true));
                newContext.setDefaultNavigationTimeout(settings.getTimeoutMs());
                newContext.setDefaultTimeout(settings.getTimeoutMs());
                Page newPage = newContext.newPage();
                playwright = created;
                browser = launched;
                context = newContext;
                page = newPage;
            } catch (PlaywrightException e) {
                try {
                    created.close();
                } catch (PlaywrightException closeError) {
                    e.addSuppressed(closeError);
                }
                throw e;
            }
            log.debug("[{}] browser started (headless={})", target, settings.isHeadless());
            return page;
        }

        @Override
        public void close() {
            if (playwright == null) {
                return;
            }
            try {
                if (context != null) {
                    context.close();
                }
                if (browser != null) {
                    browser.close();
                }
            } catch (PlaywrightException e) {
                log.warn("[{}] browser shutdown reported an error: {}", target, e.getMessage());
            } finally {
                playwright.close();
                playwright = null;
                browser = null;
                context = null;
                page = null;
                log.debug("[{}] browser closed", target);
            }
        }
    }
}
