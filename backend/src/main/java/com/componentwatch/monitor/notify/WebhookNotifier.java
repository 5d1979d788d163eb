package com.componentwatch.monitor.notify;

import com.componentwatch.config.WatchProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Posts a chat message as {@code {"text": ...}} to an incoming webhook. Never retries.
 */
@Component
public class WebhookNotifier {
    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);

    private final ObjectMapper objectMapper;
    private final WatchProperties properties;
    private final HttpClient client;

    public WebhookNotifier(ObjectMapper objectMapper, WatchProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getDigest().getWebhookTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    public int send(String webhookUrl, String message) {
        URI uri;
        try {
            uri = URI.create(webhookUrl);
        } catch (IllegalArgumentException e) {
            throw new NotifyException("Invalid webhook url", e);
        }
        String body;
        try {
            body = objectMapper.writeValueAsString(Map.of("text", message == null ? "" : message));
        } catch (JsonProcessingException e) {
            throw new NotifyException("Unable to encode webhook payload", e);
        }

        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getDigest().getWebhookTimeoutSeconds()))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new NotifyException("Webhook delivery failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotifyException("Webhook delivery interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.warn("Webhook answered {} for a {} char message", status, body.length());
            throw new NotifyException(status, "Webhook answered with status " + status);
        }
        log.info("Webhook message delivered (status {})", status);
        return status;
    }
}
