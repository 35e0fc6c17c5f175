package com.dailybrief.core.events;

import java.time.Instant;

public record DigestDispatched(
        Instant timestamp,
        String runLabel,
        String channel,
        int itemCount,
        boolean success
) implements Event {
    @Override
    public String type() {
        return "DigestDispatched";
    }
}
