package com.dailybrief.core.model;

import java.time.Instant;
import java.util.Optional;

/**
 * A parsed feed entry before any filtering. Text fields are never null but may be blank; the two date
 * fields are empty when the feed omitted them or used a format we could not read.
 */
public record FeedEntry(
        String title,
        String link,
        String summary,
        Optional<Instant> published,
        Optional<Instant> updated
) {
    public FeedEntry {
        title = title == null ? "" : title.trim();
        link = link == null ? "" : link.trim();
        summary = summary == null ? "" : summary;
        published = published == null ? Optional.empty() : published;
        updated = updated == null ? Optional.empty() : updated;
    }

    /**
     * Published date, else updated date, else {@code now}. Undated entries count as fresh.
     */
    public Instant effectivePublishedAt(Instant now) {
        return published.or(() -> updated).orElse(now);
    }
}
