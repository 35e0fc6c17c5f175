package com.dailybrief.collectors.config;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Limits that apply to every source in a run. Immutable; shared by reference between fetch workers.
 *
 * <p>{@code feedZone} is the zone assumed for feed dates that carry no offset. Defaults to UTC.
 */
public record FetchSettings(
        Duration lookback,
        int maxEntriesPerSource,
        int summaryMaxLength,
        String summarySuffix,
        int concurrency,
        Duration requestTimeout,
        String userAgent,
        ZoneId feedZone
) {
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) daily-brief/0.1";

    public FetchSettings {
        Objects.requireNonNull(lookback, "lookback is required");
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        if (lookback.isNegative() || lookback.isZero()) {
            throw new IllegalArgumentException("lookback must be positive");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (maxEntriesPerSource < 1) {
            throw new IllegalArgumentException("maxEntriesPerSource must be >= 1");
        }
        if (summaryMaxLength < 1) {
            throw new IllegalArgumentException("summaryMaxLength must be >= 1");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        summarySuffix = summarySuffix == null ? "" : summarySuffix;
        userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
        feedZone = feedZone == null ? ZoneOffset.UTC : feedZone;
    }

    public static FetchSettings defaults() {
        return new FetchSettings(Duration.ofHours(24), 50, 250, "...", 4, Duration.ofSeconds(15), DEFAULT_USER_AGENT, ZoneOffset.UTC);
    }
}
