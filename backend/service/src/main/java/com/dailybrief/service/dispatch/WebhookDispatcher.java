package com.dailybrief.service.dispatch;

import com.dailybrief.core.model.RunResult;
import com.dailybrief.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Posts a JSON markdown message to a chat-bot webhook that answers with {@code {"errcode": 0, ...}} on
 * success. Subclasses supply the payload shape and the final URL.
 */
public abstract class WebhookDispatcher implements DigestDispatcher {
    private static final Logger LOGGER = Logger.getLogger(WebhookDispatcher.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final HttpClient httpClient;
    private final Duration timeout;
    protected final DigestFormatter formatter;

    protected WebhookDispatcher(HttpClient httpClient, Duration timeout, DigestFormatter formatter) {
        this.httpClient = httpClient;
        this.timeout = timeout;
        this.formatter = formatter;
    }

    protected abstract Map<String, Object> payload(RunResult result);

    protected abstract String targetUrl();

    @Override
    public boolean dispatch(RunResult result) {
        try {
            byte[] body = MAPPER.writeValueAsBytes(payload(result));
            HttpRequest request = HttpRequest.newBuilder(URI.create(targetUrl()))
                    .timeout(timeout)
                    .header("Content-Type", "application/json; charset=utf-8")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                LOGGER.severe(() -> channel() + " webhook returned HTTP " + response.statusCode() + ": " + response.body());
                return false;
            }
            JsonNode reply = MAPPER.readTree(response.body());
            if (reply != null && reply.path("errcode").isInt() && reply.path("errcode").asInt() == 0) {
                LOGGER.info(() -> channel() + " digest delivered with " + result.size() + " items");
                return true;
            }
            LOGGER.severe(() -> channel() + " webhook rejected the digest: " + response.body());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.severe(() -> channel() + " dispatch interrupted");
            return false;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, channel() + " dispatch failed", e);
            return false;
        }
    }
}
