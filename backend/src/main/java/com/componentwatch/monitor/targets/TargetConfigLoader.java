package com.componentwatch.monitor.targets;

import com.componentwatch.config.WatchProperties;
import com.componentwatch.monitor.model.ComponentSpec;
import com.componentwatch.monitor.model.IdentifierType;
import com.componentwatch.monitor.model.PageSpec;
import com.componentwatch.monitor.model.StrategyKind;
import com.componentwatch.monitor.model.StrategySpec;
import com.componentwatch.monitor.model.TargetConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads the JSON target configuration and validates it into typed records.
 *
 * <pre>
 * { "CL": { "setup_product_url": "...",
 *           "PDP": { "url_example": "...", "setup_required": true, "components": [ ... ] } } }
 * </pre>
 */
@Component
public class TargetConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(TargetConfigLoader.class);
    public static final String SETUP_URL_KEY = "setup_product_url";

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final WatchProperties properties;

    public TargetConfigLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader, WatchProperties properties) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }

    public List<TargetConfig> load() {
        String location = properties.getConfigPath();
        Resource resource = resolve(location);
        if (!resource.exists()) {
            throw new InvalidTargetConfigException("Target configuration not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return parse(objectMapper.readTree(in));
        } catch (JsonProcessingException e) {
            throw new InvalidTargetConfigException("Target configuration is not valid JSON: " + location, e);
        } catch (IOException e) {
            throw new InvalidTargetConfigException("Unable to read target configuration: " + location, e);
        }
    }

    public List<TargetConfig> parse(String json) {
        try {
            return parse(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new InvalidTargetConfigException("Target configuration is not valid JSON", e);
        }
    }

    private List<TargetConfig> parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidTargetConfigException("Target configuration root must be a JSON object");
        }
        List<TargetConfig> targets = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            targets.add(parseTarget(entry.getKey(), entry.getValue()));
        }
        log.debug("Loaded {} targets from configuration", targets.size());
        return targets;
    }

    private TargetConfig parseTarget(String target, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new InvalidTargetConfigException("Target " + target + " must be a JSON object");
        }
        String setupUrl = text(node, SETUP_URL_KEY);
        List<PageSpec> pages = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (SETUP_URL_KEY.equals(entry.getKey())) {
                continue;
            }
            pages.add(parsePage(target, entry.getKey(), entry.getValue()));
        }
        return new TargetConfig(target, setupUrl, pages);
    }

    private PageSpec parsePage(String target, String pageType, JsonNode node) {
        if (node == null || !node.isObject()) {
            // kept so the crawl job can skip it with a warning
            return new PageSpec(pageType, null, false, List.of());
        }
        List<ComponentSpec> components = new ArrayList<>();
        JsonNode componentsNode = node.get("components");
        if (componentsNode != null && !componentsNode.isNull()) {
            if (!componentsNode.isArray()) {
                throw new InvalidTargetConfigException(where(target, pageType) + " components must be an array");
            }
            for (JsonNode componentNode : componentsNode) {
                components.add(parseComponent(target, pageType, componentNode));
            }
        }
        return new PageSpec(
            pageType,
            text(node, "url_example"),
            node.path("setup_required").asBoolean(false),
            components
        );
    }

    private ComponentSpec parseComponent(String target, String pageType, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new InvalidTargetConfigException(where(target, pageType) + " has a component that is not an object");
        }
        String name = text(node, "name");
        if (name == null) {
            throw new InvalidTargetConfigException(where(target, pageType) + " has a component without name");
        }
        String rawType = text(node, "identifier_type");
        IdentifierType identifierType = IdentifierType.fromConfigValue(rawType);
        if (identifierType == null) {
            throw new InvalidTargetConfigException(
                where(target, pageType) + " component '" + name + "' has unsupported identifier_type: " + rawType
            );
        }
        String identifierValue = text(node, "identifier_value");

        StrategyKind kind = null;
        JsonNode strategiesNode = null;
        if (node.hasNonNull("carousel_strategies")) {
            kind = StrategyKind.CAROUSEL;
            strategiesNode = node.get("carousel_strategies");
        } else if (node.hasNonNull("text_strategies")) {
            kind = StrategyKind.TEXT;
            strategiesNode = node.get("text_strategies");
        } else if (node.hasNonNull("strategies")) {
            kind = StrategyKind.TEXT;
            strategiesNode = node.get("strategies");
        }

        List<StrategySpec> strategies = new ArrayList<>();
        if (strategiesNode != null) {
            if (!strategiesNode.isArray()) {
                throw new InvalidTargetConfigException(
                    where(target, pageType) + " component '" + name + "' strategies must be an array"
                );
            }
            for (JsonNode strategyNode : strategiesNode) {
                strategies.add(parseStrategy(target, pageType, name, strategyNode));
            }
        }
        return new ComponentSpec(name, identifierType, identifierValue, kind, strategies);
    }

    private StrategySpec parseStrategy(String target, String pageType, String component, JsonNode node) {
        String strategyName = text(node, "strategy_name");
        String textPattern = text(node, "text_pattern");
        if (strategyName == null || textPattern == null) {
            throw new InvalidTargetConfigException(
                where(target, pageType) + " component '" + component
                    + "' has a strategy without strategy_name or text_pattern"
            );
        }
        return new StrategySpec(strategyName, textPattern, text(node, "container_class"));
    }

    private Resource resolve(String location) {
        if (location.startsWith("classpath:") || location.startsWith("file:")) {
            return resourceLoader.getResource(location);
        }
        return resourceLoader.getResource("file:" + location);
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }

    private static String where(String target, String pageType) {
        return target + "/" + pageType;
    }
}
