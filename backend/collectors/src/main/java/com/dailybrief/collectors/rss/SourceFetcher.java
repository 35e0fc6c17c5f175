package com.dailybrief.collectors.rss;

import com.dailybrief.collectors.api.FetchContext;
import com.dailybrief.collectors.api.SourceFetchResult;
import com.dailybrief.collectors.config.FetchSettings;
import com.dailybrief.collectors.scoring.RelevanceScorer;
import com.dailybrief.core.events.AlertRaised;
import com.dailybrief.core.events.SourceFetched;
import com.dailybrief.core.model.FeedEntry;
import com.dailybrief.core.model.NewsItem;
import com.dailybrief.core.model.SourceDescriptor;
import com.dailybrief.core.util.HashingUtils;
import com.dailybrief.core.util.HtmlUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fetches one feed and turns its fresh, unseen entries into scored {@link NewsItem}s.
 *
 * <p>Never throws for source trouble: transport errors, bad status codes and unparseable documents all
 * come back as a failed {@link SourceFetchResult} with no items, and an {@link AlertRaised} is published.
 * Holds no mutable state, so one instance serves all fetch workers.
 */
public class SourceFetcher {
    private static final Logger LOGGER = Logger.getLogger(SourceFetcher.class.getName());

    private final FetchContext ctx;
    private final RelevanceScorer scorer;

    public SourceFetcher(FetchContext ctx, RelevanceScorer scorer) {
        this.ctx = ctx;
        this.scorer = scorer;
    }

    public SourceFetchResult fetch(SourceDescriptor source, Set<String> seenSnapshot, Instant cutoff) {
        Instant startedAt = ctx.clock().instant();
        LOGGER.info(() -> "Fetching " + source.name() + " (" + source.category() + ")");

        byte[] body;
        try {
            body = download(source);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(source, "fetch interrupted", null);
        } catch (Exception e) {
            return fail(source, "RSS fetch failed for " + source.name() + ": " + rootMessage(e), e);
        }

        FeedParser.ParseOutcome parsed = FeedParser.parse(body, ctx.settings().maxEntriesPerSource(), ctx.settings().feedZone());
        if (parsed.invalid()) {
            return fail(source, "Invalid RSS/Atom XML for source " + source.name() + ": " + parsed.error(), null);
        }

        List<NewsItem> items = toItems(source, parsed.entries(), seenSnapshot, cutoff, ctx.clock().instant());
        long durationMillis = Duration.between(startedAt, ctx.clock().instant()).toMillis();
        ctx.eventBus().publish(new SourceFetched(
                ctx.clock().instant(),
                source.name(),
                source.category(),
                parsed.entries().size(),
                items.size(),
                durationMillis
        ));
        LOGGER.info(() -> "Fetched " + items.size() + " relevant items from " + source.name()
                + " (" + parsed.entries().size() + " entries examined)");
        return SourceFetchResult.success(source, items, parsed.entries().size());
    }

    List<NewsItem> toItems(
            SourceDescriptor source,
            List<FeedEntry> entries,
            Set<String> seenSnapshot,
            Instant cutoff,
            Instant now
    ) {
        FetchSettings settings = ctx.settings();
        List<NewsItem> items = new ArrayList<>();
        for (FeedEntry entry : entries) {
            try {
                Instant publishedAt = entry.effectivePublishedAt(now);
                if (publishedAt.isBefore(cutoff)) {
                    continue;
                }
                String title = HtmlUtils.toPlainText(entry.title());
                if (title.isBlank() || !HtmlUtils.isHttpLink(entry.link())) {
                    continue;
                }
                if (seenSnapshot.contains(HashingUtils.fingerprint(entry.link()))) {
                    continue;
                }
                String summary = HtmlUtils.truncate(
                        HtmlUtils.toPlainText(entry.summary()),
                        settings.summaryMaxLength(),
                        settings.summarySuffix()
                );
                items.add(new NewsItem(
                        title,
                        summary,
                        entry.link(),
                        source.name(),
                        publishedAt,
                        source.category(),
                        scorer.score(title, source.keywords())
                ));
            } catch (RuntimeException e) {
                LOGGER.log(Level.FINE, "Skipping malformed entry from " + source.name(), e);
            }
        }
        return items;
    }

    private byte[] download(SourceDescriptor source) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(source.feedUrl()))
                .GET()
                .timeout(ctx.settings().requestTimeout())
                .header("User-Agent", ctx.settings().userAgent())
                .header("Accept", "application/rss+xml, application/atom+xml, application/xml;q=0.9, */*;q=0.8")
                .build();
        HttpResponse<byte[]> response = ctx.httpClient().send(request, HttpResponse.BodyHandlers.ofByteArray());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("HTTP " + response.statusCode());
        }
        return response.body();
    }

    private SourceFetchResult fail(SourceDescriptor source, String message, Throwable error) {
        LOGGER.warning(message);
        if (error != null) {
            LOGGER.log(Level.FINE, "Fetch failure detail for " + source.name(), error);
        }
        ctx.eventBus().publish(new AlertRaised(
                ctx.clock().instant(),
                "collector",
                message,
                Map.of("source", source.name(), "category", source.category(), "url", source.feedUrl())
        ));
        return SourceFetchResult.failure(source, message);
    }

    static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
