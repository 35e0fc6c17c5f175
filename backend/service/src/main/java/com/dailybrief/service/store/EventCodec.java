package com.dailybrief.service.store;

import com.dailybrief.core.events.Event;
import com.dailybrief.core.util.JsonUtils;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Instant;

/**
 * Journal line format: {@code {"type": ..., "timestamp": ..., "event": {...}}}.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private EventCodec() {
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
        }
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
