package com.dailybrief.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One candidate article. {@code url} is the only identity: two items with the same url are the same
 * article no matter how title or summary differ between sources.
 */
public record NewsItem(
        String title,
        String summaryText,
        String url,
        String sourceName,
        Instant publishedAt,
        String category,
        double score
) {
    public NewsItem {
        Objects.requireNonNull(title, "title is required");
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(publishedAt, "publishedAt is required");
        if (url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        if (score < 0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("score must be >= 0 but was " + score);
        }
        summaryText = summaryText == null ? "" : summaryText;
        sourceName = sourceName == null ? "" : sourceName;
        category = category == null || category.isBlank() ? SourceDescriptor.DEFAULT_CATEGORY : category;
    }

    public NewsItem withSummaryText(String replacement) {
        return new NewsItem(title, replacement, url, sourceName, publishedAt, category, score);
    }
}
