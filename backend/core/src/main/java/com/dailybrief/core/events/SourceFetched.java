package com.dailybrief.core.events;

import java.time.Instant;

public record SourceFetched(
        Instant timestamp,
        String source,
        String category,
        int entryCount,
        int itemCount,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "SourceFetched";
    }
}
