package com.componentwatch.monitor.render;

public interface PageRenderer {
    /**
     * Opens a browsing session owned by a single crawl job. Cookies and cart state set while
     * priming survive across the pages rendered through the same session.
     */
    RenderSession openSession(String target);
}
