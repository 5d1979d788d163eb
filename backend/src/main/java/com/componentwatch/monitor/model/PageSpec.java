package com.componentwatch.monitor.model;

import java.util.List;

public record PageSpec(
    String pageType,
    String url,
    boolean setupRequired,
    List<ComponentSpec> components
) {
    public PageSpec {
        components = components == null ? List.of() : List.copyOf(components);
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }
}
