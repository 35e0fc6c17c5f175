package com.dailybrief.service;

import com.dailybrief.collectors.api.FetchContext;
import com.dailybrief.collectors.api.SourceFetchResult;
import com.dailybrief.collectors.rank.RankSelector;
import com.dailybrief.collectors.rss.FetchCoordinator;
import com.dailybrief.collectors.rss.FetchReport;
import com.dailybrief.collectors.rss.SourceFetcher;
import com.dailybrief.collectors.scoring.RelevanceScorer;
import com.dailybrief.core.bus.EventBus;
import com.dailybrief.core.events.RunStateChanged;
import com.dailybrief.core.model.SourceDescriptor;
import com.dailybrief.service.config.ConfigLoader;
import com.dailybrief.service.config.DigestConfig;
import com.dailybrief.service.config.RunSettings;
import com.dailybrief.service.dispatch.DigestDispatcher;
import com.dailybrief.service.dispatch.DigestFormatter;
import com.dailybrief.service.dispatch.DingTalkDispatcher;
import com.dailybrief.service.dispatch.WeComDispatcher;
import com.dailybrief.service.http.HttpClientFactory;
import com.dailybrief.service.runtime.RunController;
import com.dailybrief.service.runtime.RunMode;
import com.dailybrief.service.runtime.RunOutcome;
import com.dailybrief.service.runtime.Sleeper;
import com.dailybrief.service.store.JsonlRunJournal;
import com.dailybrief.service.store.SeenSetStore;
import com.dailybrief.service.summarize.ChatCompletionSummaryHook;
import com.dailybrief.service.summarize.NoopSummaryHook;
import com.dailybrief.service.summarize.SummaryHook;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * One-shot entry point, meant to be started by cron or a CI schedule.
 *
 * <p>Exit codes: 0 when a digest was delivered (or, with {@code --dry-run}, selected); 1 when the run
 * found nothing or delivery failed; 2 for usage, configuration or unexpected errors. {@code --check-config}
 * validates the file, then fetches every source once and returns 1 when none of them works.
 */
public final class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_ERROR = 2;

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    private static final String USAGE = "Usage: daily-brief [config.json] [--dry-run] [--check-config]";

    private Main() {
    }

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args, System.out, System.err, System.getenv(), Clock.systemUTC()));
    }

    static int run(String[] args, PrintStream out, PrintStream err, Map<String, String> env, Clock clock) {
        CliOptions options;
        try {
            options = CliOptions.parse(args, env);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_ERROR;
        }
        if (options.help()) {
            out.println(USAGE);
            return EXIT_OK;
        }

        try {
            DigestConfig config = ConfigLoader.load(options.configPath(), env);
            RunSettings settings = ConfigLoader.settings(config);
            List<SourceDescriptor> sources = ConfigLoader.sources(config);
            HttpClient httpClient = HttpClientFactory.create(Duration.ofSeconds(10), env);
            if (options.checkConfig()) {
                printSources(out, options.configPath(), sources, settings);
                FetchReport report = coordinator(new FetchContext(httpClient, new EventBus(), clock, settings.fetch()), settings)
                        .fetchAll(sources, Set.of());
                return printSourceHealth(out, report);
            }

            EventBus eventBus = new EventBus();
            JsonlRunJournal journal = new JsonlRunJournal(settings.journalFile());
            eventBus.subscribeAll(journal::append);
            eventBus.subscribe(RunStateChanged.class, event -> LOGGER.info(() ->
                    "Run " + event.runLabel() + " " + event.from() + " -> " + event.to() + ": " + event.reason()));

            FetchContext context = new FetchContext(httpClient, eventBus, clock, settings.fetch());
            DigestFormatter formatter = new DigestFormatter();
            RunController controller = new RunController(
                    sources,
                    coordinator(context, settings),
                    new RankSelector(settings.maxNews()),
                    summaryHook(config, httpClient),
                    summaryDelay(config),
                    Sleeper.THREAD,
                    dispatcher(config, httpClient, formatter, clock),
                    new SeenSetStore(settings.seenFile(), clock),
                    eventBus,
                    clock,
                    settings.zone()
            );

            RunOutcome outcome = controller.run(options.dryRun() ? RunMode.DRY_RUN : RunMode.DELIVER);
            if (options.dryRun() && !outcome.result().isEmpty()) {
                out.println(formatter.render(outcome.result()));
            }
            if (outcome.succeeded()) {
                LOGGER.info(() -> "Run finished: " + outcome.message());
                return EXIT_OK;
            }
            err.println("Run failed: " + outcome.message());
            return EXIT_RUN_FAILED;
        } catch (IllegalStateException | IllegalArgumentException e) {
            LOGGER.log(Level.SEVERE, "Run aborted", e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Unexpected failure", e);
            err.println("Unexpected failure: " + e);
            return EXIT_ERROR;
        }
    }

    private static FetchCoordinator coordinator(FetchContext context, RunSettings settings) {
        return new FetchCoordinator(context, new SourceFetcher(context, new RelevanceScorer(settings.scoring())));
    }

    /**
     * Reports each source's fetch outcome. Passes when at least one source answered with a readable feed.
     */
    private static int printSourceHealth(PrintStream out, FetchReport report) {
        out.println("Source check:");
        for (SourceFetchResult result : report.results()) {
            if (result.success()) {
                out.println("  OK   " + result.source().name() + ": " + result.entriesExamined() + " entries, "
                        + result.items().size() + " fresh");
            } else {
                out.println("  FAIL " + result.source().name() + ": " + result.message());
            }
        }
        out.println("Sources working: " + report.successCount() + "/" + report.results().size());
        return report.successCount() > 0 ? EXIT_OK : EXIT_RUN_FAILED;
    }

    static DigestDispatcher dispatcher(DigestConfig config, HttpClient httpClient, DigestFormatter formatter, Clock clock) {
        Duration timeout = Duration.ofSeconds(30);
        if (config.dingtalkWebhook() != null && !config.dingtalkWebhook().isBlank()) {
            return new DingTalkDispatcher(httpClient, timeout, formatter, config.dingtalkWebhook(), config.dingtalkSecret(), clock);
        }
        if (config.wechatWebhook() != null && !config.wechatWebhook().isBlank()) {
            return new WeComDispatcher(httpClient, timeout, formatter, config.wechatWebhook());
        }
        throw new IllegalStateException("No webhook configured: set dingtalk_webhook or wechat_webhook");
    }

    static SummaryHook summaryHook(DigestConfig config, HttpClient httpClient) {
        DigestConfig.SummarizerSection summarizer = config.summarizer();
        if (!summarizer.enabled()) {
            return new NoopSummaryHook();
        }
        if (summarizer.endpoint() == null || summarizer.endpoint().isBlank()) {
            throw new IllegalStateException("summarizer.endpoint is required when the summarizer is enabled");
        }
        return new ChatCompletionSummaryHook(
                httpClient,
                Duration.ofSeconds(30),
                summarizer.endpoint(),
                summarizer.apiKey(),
                summarizer.model() == null ? "gpt-4o-mini" : summarizer.model(),
                summarizer.maxLength() == null ? 120 : summarizer.maxLength()
        );
    }

    private static Duration summaryDelay(DigestConfig config) {
        Long delay = config.summarizer().delayMillis();
        return Duration.ofMillis(delay == null ? 1000 : Math.max(0, delay));
    }

    private static void printSources(PrintStream out, Path configPath, List<SourceDescriptor> sources, RunSettings settings) {
        out.println("Config OK: " + configPath);
        out.println("max_news=" + settings.maxNews() + ", lookback=" + settings.fetch().lookback()
                + ", concurrency=" + settings.fetch().concurrency());
        Map<String, List<SourceDescriptor>> byCategory = new LinkedHashMap<>();
        for (SourceDescriptor source : sources) {
            byCategory.computeIfAbsent(source.category(), ignored -> new ArrayList<>()).add(source);
        }
        byCategory.forEach((category, entries) -> {
            out.println("[" + category + "] " + entries.size() + " sources");
            for (SourceDescriptor source : entries) {
                String keywords = source.keywords().isEmpty() ? "" : " keywords=" + source.keywords();
                out.println("  - " + source.name() + " <" + source.feedUrl() + ">" + keywords);
            }
        });
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not load logging.properties, using JVM defaults", e);
        }
    }

    record CliOptions(Path configPath, boolean dryRun, boolean checkConfig, boolean help) {
        static CliOptions parse(String[] args, Map<String, String> env) {
            Path configPath = null;
            boolean dryRun = false;
            boolean checkConfig = false;
            boolean help = false;
            for (String arg : args) {
                switch (arg) {
                    case "--dry-run" -> dryRun = true;
                    case "--check-config" -> checkConfig = true;
                    case "-h", "--help" -> help = true;
                    default -> {
                        if (arg.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        if (configPath != null) {
                            throw new IllegalArgumentException("Only one config file may be given");
                        }
                        configPath = Path.of(arg);
                    }
                }
            }
            if (configPath == null) {
                configPath = Path.of(env.getOrDefault("DAILY_BRIEF_CONFIG", "config.json"));
            }
            return new CliOptions(configPath, dryRun, checkConfig, help);
        }
    }
}
