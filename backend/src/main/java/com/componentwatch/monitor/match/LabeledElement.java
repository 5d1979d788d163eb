package com.componentwatch.monitor.match;

import org.jsoup.nodes.Element;

/**
 * A matched component element with the label it is reported under: its {@code id}, or a
 * positional {@code <prefix>-N} fallback.
 */
public record LabeledElement(String label, Element element) {
}
