package com.componentwatch.monitor.match;

import com.componentwatch.monitor.model.ComponentDetails;
import com.componentwatch.monitor.model.ComponentSpec;
import com.componentwatch.monitor.model.IdentifierType;
import com.componentwatch.monitor.model.MatchResult;
import com.componentwatch.monitor.model.StrategyDetail;
import com.componentwatch.monitor.model.StrategyKind;
import com.componentwatch.monitor.model.StrategyOutcome;
import com.componentwatch.monitor.model.StrategySpec;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Locates configured components in a rendered document and runs their text strategies.
 * Never throws: a blank identifier or a lookup failure is reported as an absent component.
 */
@Component
public class ComponentMatcher {
    private static final Logger log = LoggerFactory.getLogger(ComponentMatcher.class);
    static final List<String> TEST_ID_ATTRIBUTES = List.of("data-testid", "data-test-id");

    public MatchResult checkComponent(Document document, ComponentSpec spec) {
        List<Element> elements;
        try {
            elements = locate(document, spec);
        } catch (RuntimeException e) {
            log.warn("Lookup failed for component '{}' ({} {})", spec.name(), spec.identifierType(), spec.identifierValue(), e);
            return MatchResult.absent(spec.name());
        }
        if (elements.isEmpty()) {
            if (spec.identifierType() == IdentifierType.ID) {
                log.info("Element with id '{}' not found for component '{}'", spec.identifierValue(), spec.name());
            }
            return MatchResult.absent(spec.name());
        }
        if (!spec.hasStrategies()) {
            return new MatchResult(spec.name(), true, null);
        }

        List<LabeledElement> labeled = label(elements, spec.strategyKind());
        StrategyOutcome outcome = findStrategiesInElements(labeled, spec.strategies());
        List<String> labels = labeled.stream().map(LabeledElement::label).toList();
        log.debug(
            "Component '{}' matched {} element(s), failed strategies={}",
            spec.name(),
            labels.size(),
            outcome.failedStrategies()
        );
        return new MatchResult(spec.name(), true, new ComponentDetails(labels, outcome));
    }

    /**
     * Searches every strategy across the labeled elements in order. The first element whose
     * scope contains the pattern satisfies a strategy and later elements are not searched for it.
     * Every non-matching candidate text seen before that is kept as a potential rename.
     */
    public StrategyOutcome findStrategiesInElements(List<LabeledElement> elements, List<StrategySpec> strategies) {
        Map<String, Boolean> found = new LinkedHashMap<>();
        Map<String, List<String>> foundIn = new LinkedHashMap<>();
        Map<String, List<String>> potential = new LinkedHashMap<>();
        for (StrategySpec strategy : strategies) {
            found.put(strategy.strategyName(), false);
            foundIn.put(strategy.strategyName(), new ArrayList<>());
            potential.put(strategy.strategyName(), new ArrayList<>());
        }

        for (LabeledElement labeled : elements) {
            for (StrategySpec strategy : strategies) {
                String name = strategy.strategyName();
                if (found.get(name)) {
                    continue;
                }
                for (Element candidate : scope(labeled.element(), strategy)) {
                    String text = candidate.text().trim();
                    if (TextNormalizer.partialMatch(text, strategy.textPattern())) {
                        found.put(name, true);
                        foundIn.get(name).add(labeled.label());
                        break;
                    }
                    potential.get(name).add(text);
                }
            }
        }

        Map<String, StrategyDetail> details = new LinkedHashMap<>();
        foundIn.forEach((name, labels) -> details.put(name, new StrategyDetail(labels)));
        Map<String, List<String>> candidates = new LinkedHashMap<>();
        potential.forEach((name, texts) -> candidates.put(name, List.copyOf(texts)));
        return new StrategyOutcome(found, details, candidates);
    }

    List<Element> locate(Document document, ComponentSpec spec) {
        String value = spec.identifierValue();
        if (value == null || value.isBlank()) {
            log.warn("Component '{}' has no identifier_value, treating it as absent", spec.name());
            return List.of();
        }
        return switch (spec.identifierType()) {
            case ATTRIBUTE -> findByTestId(document, value.trim());
            case CLASS -> findByAllClasses(document, value);
            case ID -> {
                Element element = document.getElementById(value.trim());
                yield element == null ? List.of() : List.of(element);
            }
        };
    }

    private static List<Element> findByTestId(Document document, String value) {
        for (Element element : document.getAllElements()) {
            for (String attribute : TEST_ID_ATTRIBUTES) {
                if (value.equals(element.attr(attribute))) {
                    return List.of(element);
                }
            }
        }
        return List.of();
    }

    private static List<Element> findByAllClasses(Element root, String classValue) {
        List<String> tokens = classTokens(classValue);
        if (tokens.isEmpty()) {
            return List.of();
        }
        List<Element> matches = new ArrayList<>();
        for (Element element : root.getElementsByClass(tokens.get(0))) {
            if (element.classNames().containsAll(tokens)) {
                matches.add(element);
            }
        }
        return matches;
    }

    private static List<Element> scope(Element element, StrategySpec strategy) {
        if (!strategy.hasContainerClass()) {
            return List.of(element);
        }
        List<String> tokens = classTokens(strategy.containerClass());
        if (tokens.isEmpty()) {
            return List.of(element);
        }
        Elements descendants = element.getElementsByClass(tokens.get(0));
        List<Element> containers = new ArrayList<>();
        for (Element descendant : descendants) {
            if (descendant != element && descendant.classNames().containsAll(tokens)) {
                containers.add(descendant);
            }
        }
        return containers;
    }

    private static List<LabeledElement> label(List<Element> elements, StrategyKind kind) {
        String prefix = kind == null ? StrategyKind.TEXT.labelPrefix() : kind.labelPrefix();
        List<LabeledElement> labeled = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            Element element = elements.get(i);
            String id = element.id();
            String label = id == null || id.isBlank() ? prefix + "-" + (i + 1) : id;
            labeled.add(new LabeledElement(label, element));
        }
        return labeled;
    }

    private static List<String> classTokens(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.trim().split("\\s+"))
            .filter(token -> !token.isBlank())
            .toList();
    }
}
