package com.componentwatch.monitor.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Outcome of one page type within a target crawl. {@code components} is absent when the page
 * could not be rendered, in which case {@code error} holds the reason.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PageResult(
    String pageType,
    String url,
    String timestamp,
    List<MatchResult> components,
    String error
) {
    public PageResult {
        components = components == null ? null : List.copyOf(components);
    }

    public static PageResult rendered(String pageType, String url, String timestamp, List<MatchResult> components) {
        return new PageResult(pageType, url, timestamp, components, null);
    }

    public static PageResult failed(String pageType, String url, String timestamp, String error) {
        return new PageResult(pageType, url, timestamp, null, error);
    }
}
