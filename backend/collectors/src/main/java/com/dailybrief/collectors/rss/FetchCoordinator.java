package com.dailybrief.collectors.rss;

import com.dailybrief.collectors.api.FetchContext;
import com.dailybrief.collectors.api.SourceFetchResult;
import com.dailybrief.core.events.AlertRaised;
import com.dailybrief.core.model.SourceDescriptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one {@link SourceFetcher} per source on a fixed-size pool and waits for all of them.
 *
 * <p>Sources beyond the pool size queue. A source that throws or outlives the batch deadline contributes
 * nothing; the others are unaffected. The batch deadline is one request timeout per pool wave plus one
 * extra timeout for parsing, so a slow source delays the batch by at most its own timeout.
 */
public class FetchCoordinator {
    private static final Logger LOGGER = Logger.getLogger(FetchCoordinator.class.getName());

    private final FetchContext ctx;
    private final SourceFetcher fetcher;

    public FetchCoordinator(FetchContext ctx, SourceFetcher fetcher) {
        this.ctx = ctx;
        this.fetcher = fetcher;
    }

    public FetchReport fetchAll(List<SourceDescriptor> sources, Set<String> seenSnapshot) {
        if (sources.isEmpty()) {
            LOGGER.warning("No sources configured");
            return new FetchReport(List.of());
        }
        Set<String> snapshot = Set.copyOf(seenSnapshot);
        Instant cutoff = ctx.clock().instant().minus(ctx.settings().lookback());
        int poolSize = Math.min(ctx.settings().concurrency(), sources.size());

        List<Callable<SourceFetchResult>> tasks = sources.stream()
                .<Callable<SourceFetchResult>>map(source -> () -> fetcher.fetch(source, snapshot, cutoff))
                .toList();

        ExecutorService executor = Executors.newFixedThreadPool(poolSize, new FetchThreadFactory());
        try {
            Duration deadline = batchDeadline(sources.size(), poolSize);
            List<Future<SourceFetchResult>> futures = executor.invokeAll(tasks, deadline.toMillis(), TimeUnit.MILLISECONDS);
            List<SourceFetchResult> results = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(collect(sources.get(i), futures.get(i)));
            }
            FetchReport report = new FetchReport(results);
            LOGGER.info(() -> "Fetched " + report.itemCount() + " items from " + report.successCount() + "/"
                    + sources.size() + " sources");
            return report;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for feed fetches", e);
        } finally {
            executor.shutdownNow();
        }
    }

    Duration batchDeadline(int sourceCount, int poolSize) {
        int waves = (sourceCount + poolSize - 1) / poolSize;
        return ctx.settings().requestTimeout().multipliedBy(waves + 1L);
    }

    private SourceFetchResult collect(SourceDescriptor source, Future<SourceFetchResult> future) {
        try {
            return future.get();
        } catch (CancellationException e) {
            return failed(source, "RSS fetch timed out for " + source.name(), null);
        } catch (ExecutionException e) {
            return failed(source, "RSS fetch crashed for " + source.name() + ": "
                    + SourceFetcher.rootMessage(e), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(source, "RSS fetch interrupted for " + source.name(), null);
        }
    }

    private SourceFetchResult failed(SourceDescriptor source, String message, Throwable error) {
        LOGGER.log(Level.WARNING, message, error);
        ctx.eventBus().publish(new AlertRaised(
                ctx.clock().instant(),
                "collector",
                message,
                Map.of("source", source.name(), "category", source.category(), "url", source.feedUrl())
        ));
        return SourceFetchResult.failure(source, message);
    }

    private static final class FetchThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "feed-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
