package com.dailybrief.core.events;

import com.dailybrief.core.model.RunState;

import java.time.Instant;

public record RunStateChanged(
        Instant timestamp,
        String runLabel,
        RunState from,
        RunState to,
        String reason
) implements Event {
    @Override
    public String type() {
        return "RunStateChanged";
    }
}
