package com.dailybrief.collectors.api;

import com.dailybrief.core.model.NewsItem;
import com.dailybrief.core.model.SourceDescriptor;

import java.util.List;

/**
 * What one source contributed to a run. A failed source always carries an empty item list.
 */
public record SourceFetchResult(
        SourceDescriptor source,
        boolean success,
        List<NewsItem> items,
        int entriesExamined,
        String message
) {
    public SourceFetchResult {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static SourceFetchResult success(SourceDescriptor source, List<NewsItem> items, int entriesExamined) {
        return new SourceFetchResult(source, true, items, entriesExamined, "ok");
    }

    public static SourceFetchResult failure(SourceDescriptor source, String message) {
        return new SourceFetchResult(source, false, List.of(), 0, message);
    }
}
