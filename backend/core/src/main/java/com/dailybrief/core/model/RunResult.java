package com.dailybrief.core.model;

import java.util.List;
import java.util.Objects;

public record RunResult(List<NewsItem> items, String runLabel) {
    public RunResult {
        items = items == null ? List.of() : List.copyOf(items);
        Objects.requireNonNull(runLabel, "runLabel is required");
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }
}
