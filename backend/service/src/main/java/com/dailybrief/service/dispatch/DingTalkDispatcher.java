package com.dailybrief.service.dispatch;

import com.dailybrief.core.model.RunResult;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;

/**
 * DingTalk custom robot. With a secret configured, each request carries {@code timestamp} and
 * {@code sign} query parameters, where sign is Base64(HmacSHA256(secret, timestamp + "\n" + secret)).
 */
public class DingTalkDispatcher extends WebhookDispatcher {
    private final String webhookUrl;
    private final String secret;
    private final Clock clock;

    public DingTalkDispatcher(
            HttpClient httpClient,
            Duration timeout,
            DigestFormatter formatter,
            String webhookUrl,
            String secret,
            Clock clock
    ) {
        super(httpClient, timeout, formatter);
        this.webhookUrl = webhookUrl;
        this.secret = secret == null ? "" : secret;
        this.clock = clock;
    }

    @Override
    public String channel() {
        return "dingtalk";
    }

    @Override
    protected Map<String, Object> payload(RunResult result) {
        return Map.of(
                "msgtype", "markdown",
                "markdown", Map.of(
                        "title", formatter.title(result),
                        "text", formatter.render(result)
                )
        );
    }

    @Override
    protected String targetUrl() {
        if (secret.isBlank()) {
            return webhookUrl;
        }
        long timestamp = clock.millis();
        String separator = webhookUrl.contains("?") ? "&" : "?";
        return webhookUrl + separator + "timestamp=" + timestamp
                + "&sign=" + URLEncoder.encode(sign(timestamp, secret), StandardCharsets.UTF_8);
    }

    static String sign(long timestamp, String secret) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            byte[] signature = mac.doFinal((timestamp + "\n" + secret).getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(signature);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }
}
