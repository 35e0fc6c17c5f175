package com.dailybrief.collectors.api;

import com.dailybrief.collectors.config.FetchSettings;
import com.dailybrief.core.bus.EventBus;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.Objects;

public record FetchContext(
        HttpClient httpClient,
        EventBus eventBus,
        Clock clock,
        FetchSettings settings
) {
    public FetchContext {
        Objects.requireNonNull(httpClient, "httpClient is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(settings, "settings is required");
    }
}
