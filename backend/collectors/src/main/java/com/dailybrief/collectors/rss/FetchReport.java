package com.dailybrief.collectors.rss;

import com.dailybrief.collectors.api.SourceFetchResult;
import com.dailybrief.core.model.NewsItem;

import java.util.List;

/**
 * Per-source results of one coordinated fetch, in source configuration order.
 */
public record FetchReport(List<SourceFetchResult> results) {
    public FetchReport {
        results = results == null ? List.of() : List.copyOf(results);
    }

    /**
     * All items, source by source in configuration order, each source's items in feed order.
     */
    public List<NewsItem> merged() {
        return results.stream()
                .flatMap(result -> result.items().stream())
                .toList();
    }

    public long successCount() {
        return results.stream().filter(SourceFetchResult::success).count();
    }

    public long failureCount() {
        return results.size() - successCount();
    }

    public int itemCount() {
        return results.stream().mapToInt(result -> result.items().size()).sum();
    }
}
