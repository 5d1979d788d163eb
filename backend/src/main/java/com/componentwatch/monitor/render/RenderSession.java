package com.componentwatch.monitor.render;

import org.jsoup.nodes.Document;

public interface RenderSession extends AutoCloseable {

    Document render(String url) throws RenderException;

    /**
     * Best-effort session priming against a product page. Failures are logged and reported
     * as {@code false}, never thrown.
     */
    boolean prime(String setupUrl);

    @Override
    void close();
}
