package com.dailybrief.service.dispatch;

import com.dailybrief.core.model.RunResult;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;

/**
 * WeChat Work (WeCom) group robot. The webhook key lives in the URL; no signing.
 */
public class WeComDispatcher extends WebhookDispatcher {
    private final String webhookUrl;

    public WeComDispatcher(HttpClient httpClient, Duration timeout, DigestFormatter formatter, String webhookUrl) {
        super(httpClient, timeout, formatter);
        this.webhookUrl = webhookUrl;
    }

    @Override
    public String channel() {
        return "wecom";
    }

    @Override
    protected Map<String, Object> payload(RunResult result) {
        return Map.of(
                "msgtype", "markdown",
                "markdown", Map.of("content", formatter.render(result))
        );
    }

    @Override
    protected String targetUrl() {
        return webhookUrl;
    }
}
