package com.dailybrief.service.summarize;

import com.dailybrief.core.model.NewsItem;
import com.dailybrief.core.util.HtmlUtils;
import com.dailybrief.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Asks an OpenAI-compatible {@code /chat/completions} endpoint for a short summary of each item.
 * Any failure, non-2xx reply or blank answer keeps the extracted summary.
 */
public class ChatCompletionSummaryHook implements SummaryHook {
    private static final Logger LOGGER = Logger.getLogger(ChatCompletionSummaryHook.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final String SYSTEM_PROMPT =
            "You write one- or two-sentence summaries of tech news for a daily briefing. "
                    + "Be factual, keep names and numbers, no preamble.";

    private final HttpClient httpClient;
    private final Duration timeout;
    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final int maxLength;

    public ChatCompletionSummaryHook(
            HttpClient httpClient,
            Duration timeout,
            String endpoint,
            String apiKey,
            String model,
            int maxLength
    ) {
        this.httpClient = httpClient;
        this.timeout = timeout;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.model = model;
        this.maxLength = maxLength;
    }

    @Override
    public String summarize(NewsItem item) {
        String original = item.summaryText();
        try {
            Map<String, Object> body = Map.of(
                    "model", model,
                    "temperature", 0.2,
                    "messages", List.of(
                            Map.of("role", "system", "content", SYSTEM_PROMPT),
                            Map.of("role", "user", "content",
                                    "Title: " + item.title() + "\nSource: " + item.sourceName()
                                            + "\nExcerpt: " + original
                                            + "\n\nSummarize in at most " + maxLength + " characters.")
                    )
            );
            HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(endpoint))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(MAPPER.writeValueAsBytes(body)));
            if (apiKey != null && !apiKey.isBlank()) {
                builder.header("Authorization", "Bearer " + apiKey);
            }
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                LOGGER.warning(() -> "Summarizer returned HTTP " + response.statusCode() + " for " + item.url());
                return original;
            }
            JsonNode content = MAPPER.readTree(response.body()).path("choices").path(0).path("message").path("content");
            String text = content.isTextual() ? HtmlUtils.toPlainText(content.asText()) : "";
            if (text.isBlank()) {
                return original;
            }
            return HtmlUtils.truncate(text, maxLength, text.length() > maxLength ? "..." : "");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return original;
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "Summarizer failed for " + item.url() + ", keeping extracted summary", e);
            return original;
        }
    }
}
