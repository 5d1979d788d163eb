package com.componentwatch.monitor.model;

import java.util.List;

public record TargetConfig(
    String target,
    String setupProductUrl,
    List<PageSpec> pages
) {
    public TargetConfig {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    public boolean hasSetupProductUrl() {
        return setupProductUrl != null && !setupProductUrl.isBlank();
    }
}
