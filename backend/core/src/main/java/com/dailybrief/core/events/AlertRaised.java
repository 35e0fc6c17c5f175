package com.dailybrief.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * A recoverable failure worth surfacing: a feed that could not be fetched or parsed, a dispatch that was
 * rejected. The run keeps going after an alert unless the controller decides otherwise.
 */
public record AlertRaised(
        Instant timestamp,
        String category,
        String message,
        Map<String, Object> details
) implements Event {
    public AlertRaised {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    @Override
    public String type() {
        return "AlertRaised";
    }
}
