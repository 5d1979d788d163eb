package com.componentwatch.monitor.render;

import com.componentwatch.config.WatchProperties;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlaywrightRenderSessionTest {
    private static final String URL = "https://www.example.cl/";

    @Mock
    private Playwright playwright;
    @Mock
    private BrowserType chromium;
    @Mock
    private Browser browser;
    @Mock
    private BrowserContext context;
    @Mock
    private Page page;

    private final WatchProperties properties = new WatchProperties();
    private final AtomicInteger driversCreated = new AtomicInteger();

    @Test
    void failedLaunchClosesItsDriverBeforeTheNextAttempt() throws Exception {
        when(playwright.chromium()).thenReturn(chromium);
        when(chromium.launch(any(BrowserType.LaunchOptions.class)))
            .thenThrow(new PlaywrightException("Executable doesn't exist"));
        PlaywrightPageRenderer.PlaywrightRenderSession session = session();

        assertThrows(RenderException.class, () -> session.render(URL));
        assertThrows(RenderException.class, () -> session.render(URL + "product/456"));
        session.close();

        assertEquals(2, driversCreated.get());
        verify(playwright, times(2)).close();
    }

    @Test
    void endlessScrollingFailsTheRender() {
        startBrowser();
        when(page.evaluate(eq(PlaywrightPageRenderer.SCROLL_SCRIPT), any())).thenReturn(false);
        PlaywrightPageRenderer.PlaywrightRenderSession session = session();

        RenderException error = assertThrows(RenderException.class, () -> session.render(URL));
        session.close();

        assertThat(error.getMessage()).isEqualTo("Timeout 30000ms exceeded scrolling " + URL);
        verify(context).close();
        verify(browser).close();
        verify(playwright).close();
    }

    @Test
    void scrolledPageIsSnapshotted() throws Exception {
        startBrowser();
        when(page.evaluate(eq(PlaywrightPageRenderer.SCROLL_SCRIPT), any())).thenReturn(true);
        when(page.content()).thenReturn("<html><body><div id=\"hero-banner\">Hola</div></body></html>");
        PlaywrightPageRenderer.PlaywrightRenderSession session = session();

        Document document = session.render(URL);
        session.render(URL);
        session.close();

        assertEquals("Hola", document.getElementById("hero-banner").text());
        assertEquals(1, driversCreated.get());
    }

    private void startBrowser() {
        when(playwright.chromium()).thenReturn(chromium);
        when(chromium.launch(any(BrowserType.LaunchOptions.class))).thenReturn(browser);
        when(browser.newContext(any(Browser.NewContextOptions.class))).thenReturn(context);
        when(context.newPage()).thenReturn(page);
    }

    private PlaywrightPageRenderer.PlaywrightRenderSession session() {
        return new PlaywrightPageRenderer.PlaywrightRenderSession("CL", properties.getRender(), () -> {
            driversCreated.incrementAndGet();
            return playwright;
        });
    }
}
