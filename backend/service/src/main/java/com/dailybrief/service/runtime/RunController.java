package com.dailybrief.service.runtime;

import com.dailybrief.collectors.rank.RankSelector;
import com.dailybrief.collectors.rss.FetchCoordinator;
import com.dailybrief.collectors.rss.FetchReport;
import com.dailybrief.core.bus.EventBus;
import com.dailybrief.core.events.AlertRaised;
import com.dailybrief.core.events.DigestDispatched;
import com.dailybrief.core.events.RunStateChanged;
import com.dailybrief.core.model.NewsItem;
import com.dailybrief.core.model.RunResult;
import com.dailybrief.core.model.RunState;
import com.dailybrief.core.model.SourceDescriptor;
import com.dailybrief.core.util.HashingUtils;
import com.dailybrief.service.dispatch.DigestDispatcher;
import com.dailybrief.service.store.SeenSet;
import com.dailybrief.service.store.SeenSetStore;
import com.dailybrief.service.summarize.SummaryHook;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives one pipeline run through
 * {@code IDLE -> FETCHING -> SELECTING -> TRANSFORMING -> DISPATCHING -> COMMITTING -> DONE}.
 *
 * <p>A run fails when no source produced an item or when the dispatcher reports failure. The dedup state
 * is written only after a confirmed delivery, so undelivered items stay eligible for the next run. This is
 * the only component that writes files with effect across runs.
 */
public class RunController {
    private static final Logger LOGGER = Logger.getLogger(RunController.class.getName());
    private static final DateTimeFormatter LABEL_FORMAT = DateTimeFormatter.ofPattern("yyyy.MM.dd");

    private final List<SourceDescriptor> sources;
    private final FetchCoordinator coordinator;
    private final RankSelector selector;
    private final SummaryHook summaryHook;
    private final Duration summaryDelay;
    private final Sleeper sleeper;
    private final DigestDispatcher dispatcher;
    private final SeenSetStore seenStore;
    private final EventBus eventBus;
    private final Clock clock;
    private final ZoneId zone;

    public RunController(
            List<SourceDescriptor> sources,
            FetchCoordinator coordinator,
            RankSelector selector,
            SummaryHook summaryHook,
            Duration summaryDelay,
            Sleeper sleeper,
            DigestDispatcher dispatcher,
            SeenSetStore seenStore,
            EventBus eventBus,
            Clock clock,
            ZoneId zone
    ) {
        this.sources = List.copyOf(sources);
        this.coordinator = coordinator;
        this.selector = selector;
        this.summaryHook = summaryHook;
        this.summaryDelay = summaryDelay;
        this.sleeper = sleeper;
        this.dispatcher = dispatcher;
        this.seenStore = seenStore;
        this.eventBus = eventBus;
        this.clock = clock;
        this.zone = zone;
    }

    public RunOutcome run(RunMode mode) {
        Run run = new Run(LABEL_FORMAT.format(clock.instant().atZone(zone)));
        LOGGER.info(() -> "Starting " + mode + " run " + run.label + " over " + sources.size() + " sources");

        run.moveTo(RunState.FETCHING, "fetching " + sources.size() + " sources");
        SeenSet seen = seenStore.load();
        FetchReport report = coordinator.fetchAll(sources, seen.snapshot());
        List<NewsItem> merged = report.merged();
        if (merged.isEmpty()) {
            return run.fail("no fresh items from " + sources.size() + " sources ("
                    + report.failureCount() + " failed)", List.of());
        }

        run.moveTo(RunState.SELECTING, merged.size() + " candidate items");
        List<NewsItem> selected = selector.select(merged);
        LOGGER.info(() -> "Selected " + selected.size() + " of " + merged.size() + " items");

        run.moveTo(RunState.TRANSFORMING, "summarizing " + selected.size() + " items");
        RunResult result = new RunResult(summarize(selected), run.label);

        if (mode == RunMode.DRY_RUN) {
            run.moveTo(RunState.DONE, "dry run, nothing dispatched");
            return new RunOutcome(RunState.DONE, result, "dry run selected " + result.size() + " items");
        }

        run.moveTo(RunState.DISPATCHING, "sending via " + dispatcher.channel());
        boolean delivered = dispatchSafely(result);
        eventBus.publish(new DigestDispatched(clock.instant(), run.label, dispatcher.channel(), result.size(), delivered));
        if (!delivered) {
            return run.fail("dispatch via " + dispatcher.channel() + " failed", result.items());
        }

        run.moveTo(RunState.COMMITTING, "recording " + result.size() + " delivered items");
        for (NewsItem item : result.items()) {
            seen.add(HashingUtils.fingerprint(item.url()));
        }
        try {
            seenStore.flush(seen);
        } catch (IllegalStateException e) {
            LOGGER.log(Level.SEVERE, "Digest was delivered but dedup state could not be saved", e);
            return run.fail("delivered but failed to save dedup state: " + e.getMessage(), result.items());
        }

        run.moveTo(RunState.DONE, "delivered " + result.size() + " items");
        return new RunOutcome(RunState.DONE, result, "delivered " + result.size() + " items");
    }

    private List<NewsItem> summarize(List<NewsItem> selected) {
        List<NewsItem> transformed = new ArrayList<>(selected.size());
        for (int i = 0; i < selected.size(); i++) {
            NewsItem item = selected.get(i);
            if (i > 0 && summaryHook.remote() && !summaryDelay.isZero()) {
                try {
                    sleeper.sleep(summaryDelay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOGGER.warning("Interrupted between summary calls; keeping remaining summaries as extracted");
                    transformed.addAll(selected.subList(i, selected.size()));
                    return transformed;
                }
            }
            transformed.add(item.withSummaryText(summarizeSafely(item)));
        }
        return transformed;
    }

    private String summarizeSafely(NewsItem item) {
        try {
            String replacement = summaryHook.summarize(item);
            return replacement == null || replacement.isBlank() ? item.summaryText() : replacement;
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Summary hook failed for " + item.url(), e);
            return item.summaryText();
        }
    }

    private boolean dispatchSafely(RunResult result) {
        try {
            return dispatcher.dispatch(result);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Dispatcher " + dispatcher.channel() + " threw", e);
            return false;
        }
    }

    private final class Run {
        private final String label;
        private RunState state = RunState.IDLE;

        private Run(String label) {
            this.label = label;
        }

        private void moveTo(RunState next, String reason) {
            RunState previous = state;
            state = next;
            LOGGER.fine(() -> "Run " + label + ": " + previous + " -> " + next + " (" + reason + ")");
            eventBus.publish(new RunStateChanged(clock.instant(), label, previous, next, reason));
        }

        private RunOutcome fail(String reason, List<NewsItem> items) {
            LOGGER.severe(() -> "Run " + label + " failed in " + state + ": " + reason);
            eventBus.publish(new AlertRaised(clock.instant(), "run", reason, Map.of("runLabel", label, "state", state.name())));
            moveTo(RunState.FAILED, reason);
            return new RunOutcome(RunState.FAILED, new RunResult(items, label), reason);
        }
    }
}
